package org.gsv.base.util.exceptions;

/**
 * A constant has no interpretation in the model at the requested world.
 */
public class UndefinedTermException extends GSVException
{
  private static final long serialVersionUID = 1L;

  private final String term;
  private final int world;

  public UndefinedTermException(String term, int world)
  {
    super("Non-existent term: " + term + " (at w" + world + ")");
    this.term = term;
    this.world = world;
  }

  public String getTerm()
  {
    return term;
  }

  public int getWorld()
  {
    return world;
  }
}
