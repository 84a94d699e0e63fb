package org.gsv.base.util.exceptions;

/**
 * A variable has no peg in a referent system, i.e. it is used without an antecedent quantifier.
 */
public class UnknownVariableException extends GSVException
{
  private static final long serialVersionUID = 1L;

  private final String variable;

  public UnknownVariableException(String variable)
  {
    super("Referent system does not contain variable " + variable);
    this.variable = variable;
  }

  public String getVariable()
  {
    return variable;
  }
}
