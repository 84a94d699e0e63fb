package org.gsv.base.util.exceptions;

/**
 * The update of an information state with a formula is undefined.
 *
 * Each enclosing formula wraps the failure of its child, so that the message reads as a trail from the formula that
 * was first evaluated down to the one that failed.  {@link #getRootCause()} gives the failure at the bottom of the
 * trail.
 */
public class UpdateException extends GSVException
{
  private static final long serialVersionUID = 1L;

  private final String formula;

  public UpdateException(String formula, GSVException cause)
  {
    super("In evaluating formula " + formula + ":\n" + cause.getMessage(), cause);
    this.formula = formula;
  }

  /**
   * @return the text of the formula whose update failed.
   */
  public String getFormula()
  {
    return formula;
  }

  /**
   * @return the failure that started the chain - an undefined term, predicate or variable.
   */
  public GSVException getRootCause()
  {
    Throwable lCause = getCause();
    while (lCause instanceof UpdateException)
    {
      lCause = lCause.getCause();
    }
    return (GSVException)lCause;
  }
}
