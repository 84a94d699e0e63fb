package org.gsv.base.util.logging;

/**
 * Logger that discards everything.
 */
public final class NullUpdateLogger implements UpdateLogger
{
  public static final NullUpdateLogger INSTANCE = new NullUpdateLogger();

  private NullUpdateLogger()
  {
  }

  /**
   * @return the logger, or the null logger if there isn't one.
   */
  public static UpdateLogger normalize(UpdateLogger xiLogger)
  {
    return (xiLogger == null) ? INSTANCE : xiLogger;
  }

  @Override
  public void log(String message)
  {
  }

  @Override
  public void increaseDepth()
  {
  }

  @Override
  public void decreaseDepth()
  {
  }

  @Override
  public String currentIndent()
  {
    return "";
  }
}
