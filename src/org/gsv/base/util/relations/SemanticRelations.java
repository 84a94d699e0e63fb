package org.gsv.base.util.relations;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.gsv.base.util.config.GSVConfiguration;
import org.gsv.base.util.config.GSVConfiguration.CfgItem;
import org.gsv.base.util.evaluator.Evaluator;
import org.gsv.base.util.evaluator.UpdateEvaluator;
import org.gsv.base.util.exceptions.GSVException;
import org.gsv.base.util.exceptions.UnknownVariableException;
import org.gsv.base.util.exceptions.UpdateException;
import org.gsv.base.util.logging.Log4jUpdateLogger;
import org.gsv.base.util.logging.NullUpdateLogger;
import org.gsv.base.util.logging.UpdateLogger;
import org.gsv.base.util.qml.grammar.QmlFormula;
import org.gsv.base.util.relations.StateSearcher.StateCheck;
import org.gsv.base.util.semantics.InformationState;
import org.gsv.base.util.semantics.Model;
import org.gsv.base.util.semantics.Possibility;

import com.google.common.base.Joiner;

/**
 * Semantic relations defined in terms of updates.
 *
 * The relations on a single state (consistency with a state, allowing, support) just evaluate the formula against that
 * state, tracing to the update logger.  The global relations (consistency, coherence, entailment, equivalence) check
 * every information state definable over the model - one per set of worlds - and so take time exponential in the
 * number of worlds.  Those checks run untraced, possibly on several threads, and are abandoned with a
 * {@link org.gsv.base.util.exceptions.RelationAbortedException} if they outlive their deadline or are cancelled.
 *
 * A failed update aborts a relation with the failure.  The only exception is entailment over every state when
 * SKIP_UNDEFINED_PREMISES is configured: a state on which some premise cannot be applied is then not a counterexample.
 */
public class SemanticRelations implements AutoCloseable
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Key of the thread context entry naming the relation being checked.
   */
  public static final String RELATION_CONTEXT_KEY = "relation";

  private final UpdateLogger mLogger;
  private final Evaluator mTracedEvaluator;
  private final Evaluator mEvaluator;
  private final StateSearcher mSearcher;
  private final long mTimeout;
  private final boolean mSkipUndefinedPremises;

  private volatile Deadline mCurrentDeadline = null;

  /**
   * Create a semantic relations checker configured from {@link GSVConfiguration}.
   */
  public SemanticRelations()
  {
    this(GSVConfiguration.getCfgBool(CfgItem.TRACE_UPDATES) ? new Log4jUpdateLogger() : null);
  }

  /**
   * Create a semantic relations checker that logs to the specified logger, with threads and timeout taken from
   * {@link GSVConfiguration}.
   *
   * @param xiLogger - the logger, or null for none.
   */
  public SemanticRelations(UpdateLogger xiLogger)
  {
    this(xiLogger,
         GSVConfiguration.getCfgInt(CfgItem.RELATION_THREADS),
         GSVConfiguration.getCfgInt(CfgItem.RELATION_TIMEOUT_MS));
  }

  /**
   * Create a semantic relations checker.
   *
   * @param xiLogger - the logger, or null for none.
   * @param xiNumThreads - the number of threads used to check states.  0 or less for one per CPU.
   * @param xiTimeout - the time, in milliseconds, after which a global relation check is abandoned.  -1 for no limit.
   */
  public SemanticRelations(UpdateLogger xiLogger, int xiNumThreads, long xiTimeout)
  {
    mLogger = NullUpdateLogger.normalize(xiLogger);
    mTracedEvaluator = new UpdateEvaluator(mLogger);
    mEvaluator = new UpdateEvaluator();
    mSearcher = new StateSearcher(xiNumThreads > 0 ? xiNumThreads : Runtime.getRuntime().availableProcessors());
    mTimeout = xiTimeout;
    mSkipUndefinedPremises = GSVConfiguration.getCfgBool(CfgItem.SKIP_UNDEFINED_PREMISES);
  }

  //--------------------------------------------------------------------------------------------------------------------
  // Relations on a single state
  //--------------------------------------------------------------------------------------------------------------------

  /**
   * @return whether the formula is consistent with the state - updating the state with it leaves something.
   *
   * @throws UpdateException if the update is undefined.
   */
  public boolean consistent(QmlFormula xiFormula, InformationState xiState, Model xiModel) throws UpdateException
  {
    mLogger.log("Evaluating formula '" + xiFormula + "' for consistency with current information state");
    mLogger.log("Current state is:\n" + xiState);

    boolean lResult;
    try
    {
      lResult = !evaluate(mTracedEvaluator, xiFormula, xiState, xiModel).isEmpty();
    }
    catch (UpdateException lEx)
    {
      throw failed(lEx);
    }
    mLogger.log("Evaluation result: " + verdict(lResult));
    return lResult;
  }

  /**
   * @return whether the state allows the formula.  The same as consistency of the formula with the state.
   *
   * @throws UpdateException if the update is undefined.
   */
  public boolean allows(InformationState xiState, QmlFormula xiFormula, Model xiModel) throws UpdateException
  {
    return consistent(xiFormula, xiState, xiModel);
  }

  /**
   * @return whether the state supports the formula - the formula adds nothing to it, because every possibility of the
   *         state subsists in the update.
   *
   * @throws UpdateException if the update is undefined.
   */
  public boolean supports(InformationState xiState, QmlFormula xiFormula, Model xiModel) throws UpdateException
  {
    mLogger.log("Evaluating formula '" + xiFormula + "' for support by current information state");
    mLogger.log("Current state is:\n" + xiState);

    boolean lResult;
    try
    {
      lResult = supports(mTracedEvaluator, xiState, xiFormula, xiModel);
    }
    catch (UpdateException lEx)
    {
      throw failed(lEx);
    }
    mLogger.log("Evaluation result: " + verdict(lResult));
    return lResult;
  }

  /**
   * @return whether the formula is supported by the state.  The same as {@link #supports}.
   *
   * @throws UpdateException if the update is undefined.
   */
  public boolean isSupportedBy(QmlFormula xiFormula, InformationState xiState, Model xiModel) throws UpdateException
  {
    return supports(xiState, xiFormula, xiModel);
  }

  //--------------------------------------------------------------------------------------------------------------------
  // Relations over every state
  //--------------------------------------------------------------------------------------------------------------------

  /**
   * @return whether the formula is consistent in the model - for every number of worlds from 1 to the number in the
   *         model, some state with that many worlds is consistent with the formula.
   *
   * @throws GSVException if an update is undefined or the check is abandoned.
   */
  public boolean consistent(final QmlFormula xiFormula, final Model xiModel) throws GSVException
  {
    Deadline lDeadline = start("consistent");
    try
    {
      mLogger.log("Evaluating formula '" + xiFormula + "' for consistency");

      StateCheck lIsConsistent = new StateCheck()
      {
        @Override
        public boolean holds(InformationState xiState) throws GSVException
        {
          return !evaluate(mEvaluator, xiFormula, xiState, xiModel).isEmpty();
        }
      };

      for (int k = 1; k <= xiModel.worldCardinality(); k++)
      {
        List<InformationState> lStates = StateSpace.generateSubStates(xiModel.worldCardinality() - 1, k);
        if (mSearcher.findFirst(lStates, lIsConsistent, true, lDeadline) < 0)
        {
          mLogger.log("Formula is inconsistent with every information state of " + k + " worlds");
          return conclude(false);
        }
      }

      return conclude(true);
    }
    catch (GSVException lEx)
    {
      throw failed(lEx);
    }
    finally
    {
      finish();
    }
  }

  /**
   * @return whether the formula is coherent in the model - for every number of worlds from 1 to the number in the
   *         model, some (necessarily non-empty) state with that many worlds supports the formula.
   *
   * @throws GSVException if an update is undefined or the check is abandoned.
   */
  public boolean coherent(final QmlFormula xiFormula, final Model xiModel) throws GSVException
  {
    Deadline lDeadline = start("coherent");
    try
    {
      mLogger.log("Evaluating formula '" + xiFormula + "' for coherence");

      StateCheck lIsCoherent = new StateCheck()
      {
        @Override
        public boolean holds(InformationState xiState) throws GSVException
        {
          return !xiState.isEmpty() && supports(mEvaluator, xiState, xiFormula, xiModel);
        }
      };

      for (int k = 1; k <= xiModel.worldCardinality(); k++)
      {
        List<InformationState> lStates = StateSpace.generateSubStates(xiModel.worldCardinality() - 1, k);
        if (mSearcher.findFirst(lStates, lIsCoherent, true, lDeadline) < 0)
        {
          mLogger.log("Formula is incoherent: no information state of " + k + " worlds supports it");
          return conclude(false);
        }
      }

      return conclude(true);
    }
    catch (GSVException lEx)
    {
      throw failed(lEx);
    }
    finally
    {
      finish();
    }
  }

  /**
   * Logical consequence.  The same as {@link #entailsG}.
   *
   * @throws GSVException if an update is undefined or the check is abandoned.
   */
  public boolean entails(List<QmlFormula> xiPremises, QmlFormula xiConclusion, Model xiModel) throws GSVException
  {
    return entailsG(xiPremises, xiConclusion, xiModel);
  }

  /**
   * @return whether the premises entail the conclusion at the ignorant state - updating the ignorant state with the
   *         premises, in order, gives a state that supports the conclusion.
   *
   * @throws GSVException if the update with a premise or the conclusion is undefined.
   */
  public boolean entails0(List<QmlFormula> xiPremises, QmlFormula xiConclusion, Model xiModel) throws GSVException
  {
    start("entails0");
    try
    {
      mLogger.log("Evaluating entailment relative to the ignorant state\n- Premises: " +
                  Joiner.on(", ").join(xiPremises) + "\n- Conclusion: " + xiConclusion);

      InformationState lState = sequentiallyUpdate(mEvaluator, InformationState.create(xiModel), xiPremises, xiModel);
      boolean lResult = supports(mEvaluator, lState, xiConclusion, xiModel);
      if (!lResult)
      {
        mLogger.log("The ignorant state updated with the premises does not support the conclusion:\n" + lState);
      }
      return conclude(lResult);
    }
    catch (GSVException lEx)
    {
      throw failed(lEx);
    }
    finally
    {
      finish();
    }
  }

  /**
   * @return whether the premises entail the conclusion at every state - for every state, updating it with the premises
   *         in order gives a state that supports the conclusion.
   *
   * @throws GSVException if an update is undefined or the check is abandoned.
   */
  public boolean entailsG(final List<QmlFormula> xiPremises,
                          final QmlFormula xiConclusion,
                          final Model xiModel) throws GSVException
  {
    Deadline lDeadline = start("entailsG");
    try
    {
      mLogger.log("Evaluating entailment relative to every state\n- Premises: " + Joiner.on(", ").join(xiPremises) +
                  "\n- Conclusion: " + xiConclusion);

      StateCheck lIsCounterexample = new StateCheck()
      {
        @Override
        public boolean holds(InformationState xiState) throws GSVException
        {
          InformationState lUpdated;
          try
          {
            lUpdated = sequentiallyUpdate(mEvaluator, xiState, xiPremises, xiModel);
          }
          catch (UpdateException lEx)
          {
            if (mSkipUndefinedPremises)
            {
              return false;
            }
            throw lEx;
          }
          return !supports(mEvaluator, lUpdated, xiConclusion, xiModel);
        }
      };

      return conclude(!findCounterexample(lIsCounterexample, xiModel, lDeadline, "argument"));
    }
    catch (GSVException lEx)
    {
      throw failed(lEx);
    }
    finally
    {
      finish();
    }
  }

  /**
   * @return whether the premises entail the conclusion in the sense of support - every state that supports all the
   *         premises supports the conclusion.  The premises have no dynamic effect on the state at which the conclusion
   *         is checked.
   *
   * @throws GSVException if an update is undefined or the check is abandoned.
   */
  public boolean entailsC(final List<QmlFormula> xiPremises,
                          final QmlFormula xiConclusion,
                          final Model xiModel) throws GSVException
  {
    Deadline lDeadline = start("entailsC");
    try
    {
      mLogger.log("Evaluating entailment as support relative to every state\n- Premises: " +
                  Joiner.on(", ").join(xiPremises) + "\n- Conclusion: " + xiConclusion);

      StateCheck lIsCounterexample = new StateCheck()
      {
        @Override
        public boolean holds(InformationState xiState) throws GSVException
        {
          for (QmlFormula lPremise : xiPremises)
          {
            try
            {
              if (!supports(mEvaluator, xiState, lPremise, xiModel))
              {
                // Doesn't support every premise, so can't be a counterexample.
                return false;
              }
            }
            catch (UpdateException lEx)
            {
              if (mSkipUndefinedPremises)
              {
                return false;
              }
              throw lEx;
            }
          }
          return !supports(mEvaluator, xiState, xiConclusion, xiModel);
        }
      };

      return conclude(!findCounterexample(lIsCounterexample, xiModel, lDeadline, "argument"));
    }
    catch (GSVException lEx)
    {
      throw failed(lEx);
    }
    finally
    {
      finish();
    }
  }

  /**
   * @return whether two formulas are equivalent in the model - for every state, their updates are similar: the same
   *         worlds, with the same variables denoting the same individuals, whatever the pegs.
   *
   * @throws GSVException if an update is undefined or the check is abandoned.
   */
  public boolean equivalent(final QmlFormula xiFormula1,
                            final QmlFormula xiFormula2,
                            final Model xiModel) throws GSVException
  {
    Deadline lDeadline = start("equivalent");
    try
    {
      mLogger.log("Evaluating equivalence between\n- LHS formula: " + xiFormula1 + "\n- RHS formula: " + xiFormula2);

      StateCheck lHasDissimilarUpdates = new StateCheck()
      {
        @Override
        public boolean holds(InformationState xiState) throws GSVException
        {
          InformationState lUpdate1 = evaluate(mEvaluator, xiFormula1, xiState, xiModel);
          InformationState lUpdate2 = evaluate(mEvaluator, xiFormula2, xiState, xiModel);
          return !similar(lUpdate1, lUpdate2);
        }
      };

      return conclude(!findCounterexample(lHasDissimilarUpdates, xiModel, lDeadline, "equivalence"));
    }
    catch (GSVException lEx)
    {
      throw failed(lEx);
    }
    finally
    {
      finish();
    }
  }

  /**
   * Cancel the global relation check in progress, if any.  It fails with a
   * {@link org.gsv.base.util.exceptions.RelationAbortedException}.
   */
  public void cancel()
  {
    Deadline lDeadline = mCurrentDeadline;
    if (lDeadline != null)
    {
      lDeadline.cancel();
    }
  }

  /**
   * Stop the threads used for checking states.
   */
  @Override
  public void close()
  {
    mSearcher.close();
  }

  //--------------------------------------------------------------------------------------------------------------------
  // Implementation
  //--------------------------------------------------------------------------------------------------------------------

  private static InformationState evaluate(Evaluator xiEvaluator,
                                           QmlFormula xiFormula,
                                           InformationState xiState,
                                           Model xiModel) throws UpdateException
  {
    return xiEvaluator.update(xiFormula, xiState, xiModel);
  }

  private static boolean supports(Evaluator xiEvaluator,
                                  InformationState xiState,
                                  QmlFormula xiFormula,
                                  Model xiModel) throws UpdateException
  {
    return InformationState.subsistsIn(xiState, evaluate(xiEvaluator, xiFormula, xiState, xiModel));
  }

  private static InformationState sequentiallyUpdate(Evaluator xiEvaluator,
                                                     InformationState xiState,
                                                     List<QmlFormula> xiFormulas,
                                                     Model xiModel) throws UpdateException
  {
    InformationState lState = xiState;
    for (QmlFormula lFormula : xiFormulas)
    {
      lState = evaluate(xiEvaluator, lFormula, lState, xiModel);
    }
    return lState;
  }

  /**
   * @return whether some state of the model - of any size, smallest first - is a counterexample.
   */
  private boolean findCounterexample(StateCheck xiIsCounterexample,
                                     Model xiModel,
                                     Deadline xiDeadline,
                                     String xiWhat) throws GSVException
  {
    for (int k = 0; k <= xiModel.worldCardinality(); k++)
    {
      List<InformationState> lStates = StateSpace.generateSubStates(xiModel.worldCardinality() - 1, k);
      int lIndex = mSearcher.findFirst(lStates, xiIsCounterexample, true, xiDeadline);
      if (lIndex >= 0)
      {
        mLogger.log("The following information state provides a counterexample to the " + xiWhat + ":\n" +
                    lStates.get(lIndex));
        return true;
      }
    }
    return false;
  }

  /**
   * @return whether every possibility of each state has a similar possibility in the other.
   */
  static boolean similar(InformationState xiS1, InformationState xiS2) throws UnknownVariableException
  {
    return allHaveSimilar(xiS1, xiS2) && allHaveSimilar(xiS2, xiS1);
  }

  private static boolean allHaveSimilar(InformationState xiFrom, InformationState xiIn) throws UnknownVariableException
  {
    for (Possibility lP : xiFrom)
    {
      boolean lFound = false;
      for (Possibility lCandidate : xiIn)
      {
        if (similar(lP, lCandidate))
        {
          lFound = true;
          break;
        }
      }

      if (!lFound)
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return whether two possibilities are similar - the same world, the same variables, and each variable denoting the
   *         same individual.
   */
  static boolean similar(Possibility xiP1, Possibility xiP2) throws UnknownVariableException
  {
    if (xiP1.getWorld() != xiP2.getWorld())
    {
      return false;
    }

    if (!xiP1.getReferentSystem().domain().equals(xiP2.getReferentSystem().domain()))
    {
      return false;
    }

    for (String lVariable : xiP1.getReferentSystem().domain())
    {
      if (xiP1.variableDenotation(lVariable) != xiP2.variableDenotation(lVariable))
      {
        return false;
      }
    }
    return true;
  }

  private Deadline start(String xiRelation)
  {
    ThreadContext.put(RELATION_CONTEXT_KEY, xiRelation);
    Deadline lDeadline = Deadline.after(mTimeout);
    mCurrentDeadline = lDeadline;
    LOGGER.debug("Checking " + xiRelation + " on " + mSearcher.getNumThreads() + " thread(s)");
    return lDeadline;
  }

  private boolean conclude(boolean xiResult)
  {
    mLogger.log("Evaluation result: " + verdict(xiResult));
    LOGGER.debug("Verdict: " + verdict(xiResult));
    return xiResult;
  }

  private <T extends GSVException> T failed(T xiEx)
  {
    mLogger.log("Evaluation failed with the following error:\n" + xiEx.getMessage());
    LOGGER.debug("Relation check failed: " + xiEx.getMessage());
    return xiEx;
  }

  private void finish()
  {
    mCurrentDeadline = null;
    ThreadContext.remove(RELATION_CONTEXT_KEY);
  }

  private static String verdict(boolean xiResult)
  {
    return xiResult ? "True" : "False";
  }
}
