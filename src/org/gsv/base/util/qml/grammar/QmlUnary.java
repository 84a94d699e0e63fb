package org.gsv.base.util.qml.grammar;

/**
 * A <i>unary</i> is a negated, necessitated or possibilitated <i>formula</i>.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public final class QmlUnary extends QmlFormula
{

  private final QmlOperator operator;
  private final QmlFormula  scope;

  QmlUnary(QmlOperator operator, QmlFormula scope)
  {
    if (!operator.isUnary())
    {
      throw new IllegalArgumentException(operator + " is not a unary operator");
    }
    this.operator = operator;
    this.scope = scope;
  }

  public QmlOperator getOperator()
  {
    return operator;
  }

  public QmlFormula getScope()
  {
    return scope;
  }

  @Override
  public <R, E extends Exception> R accept(QmlVisitor<R, E> visitor) throws E
  {
    return visitor.visitUnary(this);
  }

  @Override
  public String toString()
  {
    return operator.getSymbol() + scope;
  }

}
