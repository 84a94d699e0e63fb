package org.gsv.base.util.qml.grammar;

/**
 * A <i>constant</i> is a name whose denotation at each world is fixed by the model.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public final class QmlConstant extends QmlTerm
{

  private final String value;

  QmlConstant(String value)
  {
    this.value = value.intern();
  }

  @Override
  public String getName()
  {
    return value;
  }

  @Override
  public boolean isVariable()
  {
    return false;
  }

  @Override
  public String toString()
  {
    return value;
  }

}
