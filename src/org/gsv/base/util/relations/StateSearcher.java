package org.gsv.base.util.relations;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.gsv.base.util.exceptions.GSVException;
import org.gsv.base.util.exceptions.RelationAbortedException;
import org.gsv.base.util.semantics.InformationState;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Searches a list of information states for the first one on which a check gives a target result.
 *
 * With a single thread the states are checked in order on the calling thread.  With more, the checks run on a fixed
 * pool but their results are still consumed in order, so the state found - and the failure reported, if a check fails
 * - are the same as for a sequential search.  Checks that are no longer needed are cancelled.
 */
public class StateSearcher implements AutoCloseable
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * How often, in milliseconds, a waiting search looks at its deadline.
   */
  private static final long POLL_INTERVAL = 50;

  /**
   * A check to apply to a state.  Must not modify the state, and must be safe to run concurrently with itself on other
   * states.
   */
  public interface StateCheck
  {
    public boolean holds(InformationState xiState) throws GSVException;
  }

  private final int mNumThreads;
  private final ExecutorService mExecutor;

  /**
   * Create a searcher.
   *
   * @param xiNumThreads - the number of threads to check states on.  1 (or less) checks on the calling thread.
   */
  public StateSearcher(int xiNumThreads)
  {
    mNumThreads = Math.max(1, xiNumThreads);
    if (mNumThreads > 1)
    {
      mExecutor = Executors.newFixedThreadPool(mNumThreads,
                                               new ThreadFactoryBuilder().setNameFormat("StateSearcher-%d")
                                                                         .setDaemon(true)
                                                                         .build());
      LOGGER.debug("Created state searcher with " + mNumThreads + " threads");
    }
    else
    {
      mExecutor = null;
    }
  }

  public int getNumThreads()
  {
    return mNumThreads;
  }

  /**
   * @return the index of the first state for which the check gives the target result, or -1 if there isn't one.
   *
   * @param xiStates - the states, in the order to consider them.
   * @param xiCheck - the check.
   * @param xiTarget - the result being looked for.
   * @param xiDeadline - the deadline.
   *
   * @throws GSVException if a check fails before the target is found, or the deadline passes.
   */
  public int findFirst(List<InformationState> xiStates,
                       StateCheck xiCheck,
                       boolean xiTarget,
                       Deadline xiDeadline) throws GSVException
  {
    if (mExecutor == null)
    {
      for (int lii = 0; lii < xiStates.size(); lii++)
      {
        xiDeadline.check();
        if (xiCheck.holds(xiStates.get(lii)) == xiTarget)
        {
          return lii;
        }
      }
      return -1;
    }

    List<Future<Boolean>> lFutures = new ArrayList<>(xiStates.size());
    try
    {
      for (final InformationState lState : xiStates)
      {
        lFutures.add(mExecutor.submit(new Callable<Boolean>()
        {
          @Override
          public Boolean call() throws GSVException
          {
            xiDeadline.check();
            return xiCheck.holds(lState);
          }
        }));
      }

      for (int lii = 0; lii < lFutures.size(); lii++)
      {
        if (await(lFutures.get(lii), xiDeadline) == xiTarget)
        {
          return lii;
        }
      }
      return -1;
    }
    finally
    {
      // Anything still queued or running is no longer of interest.
      for (Future<Boolean> lFuture : lFutures)
      {
        lFuture.cancel(true);
      }
    }
  }

  private static boolean await(Future<Boolean> xiFuture, Deadline xiDeadline) throws GSVException
  {
    while (true)
    {
      try
      {
        return xiFuture.get(Math.min(POLL_INTERVAL, xiDeadline.remainingMillis()), TimeUnit.MILLISECONDS);
      }
      catch (TimeoutException lEx)
      {
        xiDeadline.check();
      }
      catch (InterruptedException lEx)
      {
        Thread.currentThread().interrupt();
        throw new RelationAbortedException("Interrupted whilst checking states", lEx);
      }
      catch (ExecutionException lEx)
      {
        Throwable lCause = lEx.getCause();
        if (lCause instanceof GSVException)
        {
          throw (GSVException)lCause;
        }
        if (lCause instanceof RuntimeException)
        {
          throw (RuntimeException)lCause;
        }
        if (lCause instanceof Error)
        {
          throw (Error)lCause;
        }
        throw new IllegalStateException("Unexpected failure checking state", lCause);
      }
    }
  }

  /**
   * Stop the worker threads.
   */
  @Override
  public void close()
  {
    if (mExecutor != null)
    {
      LOGGER.debug("Stopping state searcher");
      mExecutor.shutdownNow();
    }
  }
}
