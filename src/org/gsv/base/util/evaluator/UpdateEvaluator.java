package org.gsv.base.util.evaluator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.gsv.base.util.exceptions.GSVException;
import org.gsv.base.util.exceptions.UpdateException;
import org.gsv.base.util.logging.NullUpdateLogger;
import org.gsv.base.util.logging.UpdateLogger;
import org.gsv.base.util.qml.grammar.QmlBinary;
import org.gsv.base.util.qml.grammar.QmlFormula;
import org.gsv.base.util.qml.grammar.QmlIdentity;
import org.gsv.base.util.qml.grammar.QmlPool;
import org.gsv.base.util.qml.grammar.QmlPredication;
import org.gsv.base.util.qml.grammar.QmlQuantification;
import org.gsv.base.util.qml.grammar.QmlTerm;
import org.gsv.base.util.qml.grammar.QmlUnary;
import org.gsv.base.util.qml.grammar.QmlVisitor;
import org.gsv.base.util.semantics.InformationState;
import org.gsv.base.util.semantics.Model;
import org.gsv.base.util.semantics.Possibility;

/**
 * Evaluator implementing the update semantics of Groenendijk, Stokhof and Veltman.
 *
 * <ul>
 * <li>Negation, identity and predication filter the input state, one possibility at a time.
 * <li>Epistemic possibility and necessity are tests: they leave the input state alone or empty it.
 * <li>Conjunction is sequential update.
 * <li>Disjunction keeps the possibilities that subsist in the update with the left disjunct, or in the update with
 *     the right disjunct evaluated after the negation of the left.
 * <li>A conditional keeps a possibility if every one of its descendants in the update with the antecedent subsists in
 *     the update with the consequent.
 * <li>Quantifiers bind their variable to each individual in turn.  The existential merges the results, which is how
 *     it introduces a discourse referent; the universal filters the input.
 * </ul>
 *
 * Every sub-formula is evaluated against its own copy of the state it needs, so no state is ever seen by two branches.
 */
public class UpdateEvaluator implements Evaluator
{
  private final UpdateLogger logger;

  /**
   * Create an evaluator that doesn't trace.
   */
  public UpdateEvaluator()
  {
    this(null);
  }

  /**
   * Create an evaluator that traces to the specified logger.
   *
   * @param logger - the logger, or null for none.
   */
  public UpdateEvaluator(UpdateLogger logger)
  {
    this.logger = NullUpdateLogger.normalize(logger);
  }

  @Override
  public InformationState update(QmlFormula formula, InformationState state, Model model) throws UpdateException
  {
    return visit(formula, state.copy(), model);
  }

  /**
   * Evaluate a formula against a state that the callee is free to modify and return.
   */
  private InformationState visit(QmlFormula formula, InformationState state, Model model) throws UpdateException
  {
    return formula.accept(new UpdateVisitor(state, model));
  }

  private void startLog(String formula, InformationState state)
  {
    logger.log("===> Starting evaluation of " + formula);
    logger.increaseDepth();
    logger.log("Input information state is:\n" + state.toString(logger.currentIndent()));
  }

  private void endLog(String formula, InformationState state)
  {
    logger.log("Finished the evaluation of " + formula);
    logger.log("Output information state is:\n" + state.toString(logger.currentIndent()));
    logger.decreaseDepth();
  }

  /**
   * @return the individual a term denotes in a possibility.
   */
  private static int denotation(QmlTerm term, Possibility p, Model model) throws GSVException
  {
    if (term.isVariable())
    {
      return p.variableDenotation(term.getName());
    }
    return model.termInterpretation(term.getName(), p.getWorld());
  }

  /**
   * Update with a single formula.  Owns its input state.
   */
  private class UpdateVisitor implements QmlVisitor<InformationState, UpdateException>
  {
    private final InformationState input;
    private final Model model;

    UpdateVisitor(InformationState input, Model model)
    {
      this.input = input;
      this.model = model;
    }

    @Override
    public InformationState visitUnary(QmlUnary expr) throws UpdateException
    {
      String formula = expr.toString();
      startLog(formula, input);

      logger.log("Calculating prejacent update");
      InformationState prejacentUpdate;
      try
      {
        prejacentUpdate = visit(expr.getScope(), input.copy(), model);
      }
      catch (UpdateException lEx)
      {
        logger.decreaseDepth();
        throw new UpdateException(formula, lEx);
      }
      logger.log("Returning to evaluation of " + formula);

      switch (expr.getOperator())
      {
        case EPISTEMIC_POSSIBILITY:
          logger.log("Applying test for epistemic possibility");
          if (prejacentUpdate.isEmpty())
          {
            logger.log("Compatibility test failed");
            input.clear();
          }
          else
          {
            logger.log("Compatibility test passed");
          }
          break;

        case EPISTEMIC_NECESSITY:
          logger.log("Applying test for epistemic necessity");
          if (!InformationState.subsistsIn(input, prejacentUpdate))
          {
            logger.log("Support test failed");
            input.clear();
          }
          else
          {
            logger.log("Support test passed");
          }
          break;

        case NEGATION:
          logger.log("Filtering with negation of the prejacent");
          for (Iterator<Possibility> lIter = input.iterator(); lIter.hasNext(); )
          {
            if (InformationState.subsistsIn(lIter.next(), prejacentUpdate))
            {
              lIter.remove();
            }
          }
          break;

        default:
          throw new IllegalStateException("Invalid unary operator " + expr.getOperator() + " in " + formula);
      }

      endLog(formula, input);
      return input;
    }

    @Override
    public InformationState visitBinary(QmlBinary expr) throws UpdateException
    {
      String formula = expr.toString();
      startLog(formula, input);

      try
      {
        switch (expr.getOperator())
        {
          case CONJUNCTION:
            return conjunction(expr, formula);

          case DISJUNCTION:
            disjunction(expr, formula);
            break;

          case CONDITIONAL:
            conditional(expr, formula);
            break;

          default:
            throw new IllegalStateException("Invalid operator for binary formula " + expr.getOperator() + " in " +
                                            formula);
        }
      }
      catch (UpdateException lEx)
      {
        logger.decreaseDepth();
        throw new UpdateException(formula, lEx);
      }

      endLog(formula, input);
      return input;
    }

    private InformationState conjunction(QmlBinary expr, String formula) throws UpdateException
    {
      logger.log("Performing sequential update");
      logger.log("Updating with LHS");
      InformationState lhsUpdate = visit(expr.getLhs(), input, model);
      logger.log("Returning to evaluation of " + formula);

      logger.log("Updating with RHS");
      InformationState rhsUpdate = visit(expr.getRhs(), lhsUpdate, model);

      endLog(formula, rhsUpdate);
      return rhsUpdate;
    }

    private void disjunction(QmlBinary expr, String formula) throws UpdateException
    {
      logger.log("Calculating hypothetical LHS update");
      InformationState hypotheticalLhsUpdate = visit(expr.getLhs(), input.copy(), model);
      logger.log("Returning to evaluation of " + formula);

      logger.log("Starting calculation of hypothetical RHS update");
      logger.log("Assuming negation of LHS");
      InformationState negatedLhsUpdate = visit(QmlPool.negate(expr.getLhs()), input.copy(), model);
      logger.log("Returning to evaluation of " + formula);

      logger.log("Finishing calculation of hypothetical RHS update");
      InformationState hypotheticalRhsUpdate = visit(expr.getRhs(), negatedLhsUpdate, model);

      logger.log("Filtering for disjunction");
      for (Iterator<Possibility> lIter = input.iterator(); lIter.hasNext(); )
      {
        Possibility p = lIter.next();
        // A disjunct that binds a variable leaves only descendants of p behind.
        if (!InformationState.subsistsIn(p, hypotheticalLhsUpdate) &&
            !InformationState.subsistsIn(p, hypotheticalRhsUpdate))
        {
          lIter.remove();
        }
      }
    }

    private void conditional(QmlBinary expr, String formula) throws UpdateException
    {
      logger.log("Calculating hypothetical LHS update");
      InformationState hypotheticalLhsUpdate = visit(expr.getLhs(), input.copy(), model);
      logger.log("Returning to evaluation of " + formula);

      logger.log("Calculating hypothetical RHS update");
      InformationState hypotheticalConsequentUpdate = visit(expr.getRhs(), hypotheticalLhsUpdate.copy(), model);
      logger.log("Returning to evaluation of " + formula);

      logger.log("Filtering for conditional");
      for (Iterator<Possibility> lIter = input.iterator(); lIter.hasNext(); )
      {
        Possibility p = lIter.next();
        if (InformationState.subsistsIn(p, hypotheticalLhsUpdate) &&
            !allDescendantsSubsist(p, hypotheticalLhsUpdate, hypotheticalConsequentUpdate))
        {
          lIter.remove();
        }
      }
    }

    /**
     * @return whether every descendant of p in the antecedent update subsists in the consequent update.
     */
    private boolean allDescendantsSubsist(Possibility p,
                                          InformationState antecedentUpdate,
                                          InformationState consequentUpdate)
    {
      for (Possibility pStar : antecedentUpdate)
      {
        if (InformationState.isDescendantOf(pStar, p, antecedentUpdate) &&
            !InformationState.subsistsIn(pStar, consequentUpdate))
        {
          return false;
        }
      }
      return true;
    }

    @Override
    public InformationState visitQuantification(QmlQuantification expr) throws UpdateException
    {
      String formula = expr.toString();
      String variable = expr.getVariable().getName();
      String scope = expr.getScope().toString();
      startLog(formula, input);

      List<InformationState> hypotheticalUpdates = new ArrayList<>(model.domainCardinality());
      for (int d = 0; d < model.domainCardinality(); d++)
      {
        logger.log("Evaluating " + scope + " with respect to association " + variable + " -> e" + d);
        InformationState variant = InformationState.update(input, variable, d);
        try
        {
          hypotheticalUpdates.add(visit(expr.getScope(), variant, model));
        }
        catch (UpdateException lEx)
        {
          logger.decreaseDepth();
          throw new UpdateException(formula, lEx);
        }
        logger.log("Finished evaluation of " + scope + " with respect to association " + variable + " -> e" + d);
      }

      switch (expr.getQuantifier())
      {
        case EXISTENTIAL:
          InformationState output = input.emptyCopy();
          for (InformationState hypotheticalUpdate : hypotheticalUpdates)
          {
            output.addAll(hypotheticalUpdate);
          }
          endLog(formula, output);
          return output;

        case UNIVERSAL:
          logger.log("Filtering for universal quantification");
          for (Iterator<Possibility> lIter = input.iterator(); lIter.hasNext(); )
          {
            Possibility p = lIter.next();
            for (InformationState hypotheticalUpdate : hypotheticalUpdates)
            {
              if (!InformationState.subsistsIn(p, hypotheticalUpdate))
              {
                lIter.remove();
                break;
              }
            }
          }
          endLog(formula, input);
          return input;

        default:
          throw new IllegalStateException("Invalid quantifier " + expr.getQuantifier() + " in " + formula);
      }
    }

    @Override
    public InformationState visitIdentity(QmlIdentity expr) throws UpdateException
    {
      String formula = expr.toString();
      startLog(formula, input);

      logger.log("Filtering for identity");
      try
      {
        for (Iterator<Possibility> lIter = input.iterator(); lIter.hasNext(); )
        {
          Possibility p = lIter.next();
          if (denotation(expr.getLhs(), p, model) != denotation(expr.getRhs(), p, model))
          {
            lIter.remove();
          }
        }
      }
      catch (GSVException lEx)
      {
        logger.decreaseDepth();
        throw new UpdateException(formula, lEx);
      }

      endLog(formula, input);
      return input;
    }

    @Override
    public InformationState visitPredication(QmlPredication expr) throws UpdateException
    {
      String formula = expr.toString();
      startLog(formula, input);

      logger.log("Filtering for predication");
      try
      {
        for (Iterator<Possibility> lIter = input.iterator(); lIter.hasNext(); )
        {
          Possibility p = lIter.next();

          List<Integer> tuple = new ArrayList<>(expr.arity());
          for (QmlTerm argument : expr.getBody())
          {
            tuple.add(denotation(argument, p, model));
          }

          Set<List<Integer>> extension = model.predicateInterpretation(expr.getPredicate(), p.getWorld());
          if (!extension.contains(tuple))
          {
            lIter.remove();
          }
        }
      }
      catch (GSVException lEx)
      {
        logger.decreaseDepth();
        throw new UpdateException(formula, lEx);
      }

      endLog(formula, input);
      return input;
    }
  }
}
