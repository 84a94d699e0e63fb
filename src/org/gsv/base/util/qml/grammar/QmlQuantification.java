package org.gsv.base.util.qml.grammar;

/**
 * A <i>quantification</i> binds a <i>variable</i> in its scope, existentially or universally.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public final class QmlQuantification extends QmlFormula
{

  private final QmlQuantifier quantifier;
  private final QmlVariable   variable;
  private final QmlFormula    scope;

  QmlQuantification(QmlQuantifier quantifier, QmlVariable variable, QmlFormula scope)
  {
    this.quantifier = quantifier;
    this.variable = variable;
    this.scope = scope;
  }

  public QmlQuantifier getQuantifier()
  {
    return quantifier;
  }

  public QmlVariable getVariable()
  {
    return variable;
  }

  public QmlFormula getScope()
  {
    return scope;
  }

  @Override
  public <R, E extends Exception> R accept(QmlVisitor<R, E> visitor) throws E
  {
    return visitor.visitQuantification(this);
  }

  @Override
  public String toString()
  {
    return quantifier.getSymbol() + variable + " " + scope;
  }

}
