package org.gsv.base.util.exceptions;

/**
 * Abstract class for exceptions that are a result of an update or relation check that cannot be completed.
 */
public abstract class GSVException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected GSVException(String message)
  {
    super(message);
  }

  protected GSVException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
