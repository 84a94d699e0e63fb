package org.gsv.base.util.qml.grammar;

/**
 * A <i>binary</i> joins two <i>formulas</i> with a conjunction, disjunction or conditional.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public final class QmlBinary extends QmlFormula
{

  private final QmlOperator operator;
  private final QmlFormula  lhs;
  private final QmlFormula  rhs;

  QmlBinary(QmlOperator operator, QmlFormula lhs, QmlFormula rhs)
  {
    if (operator.isUnary())
    {
      throw new IllegalArgumentException(operator + " is not a binary operator");
    }
    this.operator = operator;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public QmlOperator getOperator()
  {
    return operator;
  }

  public QmlFormula getLhs()
  {
    return lhs;
  }

  public QmlFormula getRhs()
  {
    return rhs;
  }

  @Override
  public <R, E extends Exception> R accept(QmlVisitor<R, E> visitor) throws E
  {
    return visitor.visitBinary(this);
  }

  @Override
  public String toString()
  {
    return "(" + lhs + " " + operator.getSymbol() + " " + rhs + ")";
  }

}
