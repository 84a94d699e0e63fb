package org.gsv.base.util.qml.grammar;

/**
 * Sentential operators.  The first three are unary, the rest binary.
 */
public enum QmlOperator
{
  NEGATION("~", true),
  EPISTEMIC_NECESSITY("[]", true),
  EPISTEMIC_POSSIBILITY("<>", true),
  CONJUNCTION("&", false),
  DISJUNCTION("v", false),
  CONDITIONAL("->", false);

  private final String symbol;
  private final boolean unary;

  private QmlOperator(String symbol, boolean unary)
  {
    this.symbol = symbol;
    this.unary = unary;
  }

  public String getSymbol()
  {
    return symbol;
  }

  public boolean isUnary()
  {
    return unary;
  }
}
