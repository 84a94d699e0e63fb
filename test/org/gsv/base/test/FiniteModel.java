package org.gsv.base.test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.gsv.base.util.exceptions.UndefinedPredicateException;
import org.gsv.base.util.exceptions.UndefinedTermException;
import org.gsv.base.util.semantics.Model;

/**
 * In-memory model for tests.  Terms and predicates are undefined until they are given an interpretation.
 */
public class FiniteModel implements Model
{
  private final int mWorlds;
  private final int mDomain;
  private final Map<String, Map<Integer, Integer>> mTerms = new HashMap<>();
  private final Map<String, Map<Integer, Set<List<Integer>>>> mPredicates = new HashMap<>();

  public FiniteModel(int xiWorlds, int xiDomain)
  {
    mWorlds = xiWorlds;
    mDomain = xiDomain;
  }

  /**
   * Interpret a term at a single world.
   */
  public FiniteModel term(String xiTerm, int xiWorld, int xiIndividual)
  {
    Map<Integer, Integer> lInterpretation = mTerms.get(xiTerm);
    if (lInterpretation == null)
    {
      lInterpretation = new HashMap<>();
      mTerms.put(xiTerm, lInterpretation);
    }
    lInterpretation.put(xiWorld, xiIndividual);
    return this;
  }

  /**
   * Interpret a term rigidly - the same individual at every world.
   */
  public FiniteModel rigidTerm(String xiTerm, int xiIndividual)
  {
    for (int lWorld = 0; lWorld < mWorlds; lWorld++)
    {
      term(xiTerm, lWorld, xiIndividual);
    }
    return this;
  }

  /**
   * Define a predicate with an empty extension at every world.
   */
  public FiniteModel predicate(String xiPredicate)
  {
    if (!mPredicates.containsKey(xiPredicate))
    {
      Map<Integer, Set<List<Integer>>> lExtensions = new HashMap<>();
      for (int lWorld = 0; lWorld < mWorlds; lWorld++)
      {
        lExtensions.put(lWorld, new HashSet<List<Integer>>());
      }
      mPredicates.put(xiPredicate, lExtensions);
    }
    return this;
  }

  /**
   * Add a tuple to the extension of a predicate at a world, defining the predicate if necessary.
   */
  public FiniteModel fact(String xiPredicate, int xiWorld, Integer... xiTuple)
  {
    predicate(xiPredicate);
    mPredicates.get(xiPredicate).get(xiWorld).add(Arrays.asList(xiTuple));
    return this;
  }

  @Override
  public int worldCardinality()
  {
    return mWorlds;
  }

  @Override
  public int domainCardinality()
  {
    return mDomain;
  }

  @Override
  public int termInterpretation(String xiTerm, int xiWorld) throws UndefinedTermException
  {
    Map<Integer, Integer> lInterpretation = mTerms.get(xiTerm);
    if ((lInterpretation == null) || !lInterpretation.containsKey(xiWorld))
    {
      throw new UndefinedTermException(xiTerm, xiWorld);
    }
    return lInterpretation.get(xiWorld);
  }

  @Override
  public Set<List<Integer>> predicateInterpretation(String xiPredicate, int xiWorld)
    throws UndefinedPredicateException
  {
    Map<Integer, Set<List<Integer>>> lExtensions = mPredicates.get(xiPredicate);
    if (lExtensions == null)
    {
      throw new UndefinedPredicateException(xiPredicate, xiWorld);
    }
    return lExtensions.get(xiWorld);
  }

  /**
   * @return the model used throughout the tests - worlds w0 and w1, one individual e0 named by the constant "c", and
   *         P true of e0 at w0 only.
   */
  public static FiniteModel example()
  {
    return new FiniteModel(2, 1).rigidTerm("c", 0).fact("P", 0, 0);
  }
}
