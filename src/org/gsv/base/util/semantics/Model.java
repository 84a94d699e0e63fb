package org.gsv.base.util.semantics;

import java.util.List;
import java.util.Set;

import org.gsv.base.util.exceptions.UndefinedPredicateException;
import org.gsv.base.util.exceptions.UndefinedTermException;

/**
 * A finite model for Quantified Modal Logic.
 *
 * Worlds are numbered 0 to worldCardinality() - 1 and individuals 0 to domainCardinality() - 1.  A model must not
 * change whilst an update or a semantic relation is being computed against it.
 */
public interface Model
{
  /**
   * @return the number of worlds.
   */
  public int worldCardinality();

  /**
   * @return the number of individuals in the domain.
   */
  public int domainCardinality();

  /**
   * @return the individual denoted by a constant at the given world.
   *
   * @param term - the name of the constant.
   * @param world - the world.
   *
   * @throws UndefinedTermException if the constant is not interpreted at that world.
   */
  public int termInterpretation(String term, int world) throws UndefinedTermException;

  /**
   * @return the extension of a predicate at the given world - the set of tuples of individuals it holds of.
   *
   * @param predicate - the name of the predicate.
   * @param world - the world.
   *
   * @throws UndefinedPredicateException if the predicate is not interpreted at that world.
   */
  public Set<List<Integer>> predicateInterpretation(String predicate, int world) throws UndefinedPredicateException;
}
