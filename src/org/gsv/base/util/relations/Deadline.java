package org.gsv.base.util.relations;

import org.gsv.base.util.exceptions.RelationAbortedException;

/**
 * Point in time after which a relation check is abandoned.  Also acts as a cancellation token: once cancel() has been
 * called from any thread, the deadline counts as passed.
 */
public final class Deadline
{
  private final long mExpiryTime;
  private volatile boolean mCancelled;

  private Deadline(long xiExpiryTime)
  {
    mExpiryTime = xiExpiryTime;
    mCancelled = false;
  }

  /**
   * @return a deadline that never expires (but can still be cancelled).
   */
  public static Deadline none()
  {
    return new Deadline(Long.MAX_VALUE);
  }

  /**
   * @return a deadline the specified number of milliseconds from now, or one that never expires if the interval is
   *         negative.
   *
   * @param xiInterval - the interval, in milliseconds.
   */
  public static Deadline after(long xiInterval)
  {
    if (xiInterval < 0)
    {
      return none();
    }
    return new Deadline(System.currentTimeMillis() + xiInterval);
  }

  /**
   * Cancel the check guarded by this deadline.
   */
  public void cancel()
  {
    mCancelled = true;
  }

  public boolean isCancelled()
  {
    return mCancelled;
  }

  /**
   * @return whether the deadline has passed or been cancelled.
   */
  public boolean hasExpired()
  {
    return mCancelled || (System.currentTimeMillis() >= mExpiryTime);
  }

  /**
   * @return the time left, in milliseconds - 0 once the deadline has passed and Long.MAX_VALUE if there is no limit.
   */
  public long remainingMillis()
  {
    if (mExpiryTime == Long.MAX_VALUE)
    {
      return Long.MAX_VALUE;
    }
    return Math.max(0, mExpiryTime - System.currentTimeMillis());
  }

  /**
   * @throws RelationAbortedException if the deadline has passed or been cancelled.
   */
  public void check() throws RelationAbortedException
  {
    if (mCancelled)
    {
      throw new RelationAbortedException("Relation check cancelled");
    }
    if (System.currentTimeMillis() >= mExpiryTime)
    {
      throw new RelationAbortedException("Relation check exceeded its deadline");
    }
  }
}
