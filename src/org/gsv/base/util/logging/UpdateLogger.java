package org.gsv.base.util.logging;

/**
 * Sink for the step by step trace of an update.  The evaluator calls increaseDepth() on entering a formula and
 * decreaseDepth() on leaving it, so that implementations can show the nesting.
 */
public interface UpdateLogger
{
  public void log(String message);

  public void increaseDepth();

  public void decreaseDepth();

  /**
   * @return the prefix for multi-line output at the current depth.
   */
  public String currentIndent();
}
