package org.gsv.base.util.qml.grammar;

/**
 * A <i>variable</i> is a name whose denotation is fixed by a possibility, via the peg its referent system associates
 * with it.  A variable is bound by a <i>quantification</i>, and because binding is dynamic it stays bound to the right
 * of a conjunction or in the consequent of a conditional.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public final class QmlVariable extends QmlTerm
{

  private final String name;

  QmlVariable(String name)
  {
    this.name = name.intern();
  }

  @Override
  public String getName()
  {
    return name;
  }

  @Override
  public boolean isVariable()
  {
    return true;
  }

  @Override
  public String toString()
  {
    return name;
  }

}
