package org.gsv.base.util.exceptions;

/**
 * A semantic relation check was abandoned before reaching a verdict, because its deadline passed, it was cancelled or
 * the checking thread was interrupted.
 */
public class RelationAbortedException extends GSVException
{
  private static final long serialVersionUID = 1L;

  public RelationAbortedException(String message)
  {
    super(message);
  }

  public RelationAbortedException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
