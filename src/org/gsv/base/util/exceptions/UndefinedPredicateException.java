package org.gsv.base.util.exceptions;

/**
 * A predicate has no interpretation in the model at the requested world.
 */
public class UndefinedPredicateException extends GSVException
{
  private static final long serialVersionUID = 1L;

  private final String predicate;
  private final int world;

  public UndefinedPredicateException(String predicate, int world)
  {
    super("Non-existent predicate: " + predicate + " (at w" + world + ")");
    this.predicate = predicate;
    this.world = world;
  }

  public String getPredicate()
  {
    return predicate;
  }

  public int getWorld()
  {
    return world;
  }
}
