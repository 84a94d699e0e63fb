package org.gsv.base.util.logging;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Update logger that writes the trace to Log4j, indenting each message by the current depth.
 *
 * Not thread-safe.  Use one instance per evaluating thread.
 */
public class Log4jUpdateLogger implements UpdateLogger
{
  private static final String INDENT = "  ";

  private final Logger mLogger;
  private final Level mLevel;
  private int mDepth;

  /**
   * Create a logger that traces to this class's Log4j logger at TRACE level.
   */
  public Log4jUpdateLogger()
  {
    this(LogManager.getLogger(), Level.TRACE);
  }

  /**
   * Create a logger that traces to the specified Log4j logger.
   *
   * @param xiLogger - the Log4j logger.
   * @param xiLevel - the level to log at.
   */
  public Log4jUpdateLogger(Logger xiLogger, Level xiLevel)
  {
    mLogger = xiLogger;
    mLevel = xiLevel;
    mDepth = 0;
  }

  @Override
  public void log(String xiMessage)
  {
    if (mLogger.isEnabled(mLevel))
    {
      mLogger.log(mLevel, currentIndent() + xiMessage);
    }
  }

  @Override
  public void increaseDepth()
  {
    mDepth++;
  }

  @Override
  public void decreaseDepth()
  {
    if (mDepth > 0)
    {
      mDepth--;
    }
  }

  @Override
  public String currentIndent()
  {
    return StringUtils.repeat(INDENT, mDepth);
  }

  /**
   * @return the current nesting depth.
   */
  public int getDepth()
  {
    return mDepth;
  }
}
