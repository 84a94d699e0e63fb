package org.gsv.base.util.qml.grammar;

/**
 * An <i>identity</i> is a declaration that two <i>terms</i> denote the same individual.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public final class QmlIdentity extends QmlFormula
{

  private final QmlTerm lhs;
  private final QmlTerm rhs;

  QmlIdentity(QmlTerm lhs, QmlTerm rhs)
  {
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public QmlTerm getLhs()
  {
    return lhs;
  }

  public QmlTerm getRhs()
  {
    return rhs;
  }

  @Override
  public <R, E extends Exception> R accept(QmlVisitor<R, E> visitor) throws E
  {
    return visitor.visitIdentity(this);
  }

  @Override
  public String toString()
  {
    return lhs + " = " + rhs;
  }

}
