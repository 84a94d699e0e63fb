package org.gsv.base.util.qml.grammar;

public enum QmlQuantifier
{
  EXISTENTIAL("E"),
  UNIVERSAL("A");

  private final String symbol;

  private QmlQuantifier(String symbol)
  {
    this.symbol = symbol;
  }

  public String getSymbol()
  {
    return symbol;
  }
}
