package org.gsv.base.util.relations;

import java.util.ArrayList;
import java.util.List;

import org.gsv.base.util.semantics.InformationState;
import org.gsv.base.util.semantics.Possibility;
import org.gsv.base.util.semantics.ReferentSystem;

import com.google.common.math.IntMath;

/**
 * Enumeration of the information states definable over a model - one for every set of worlds, with nothing assigned.
 *
 * There are 2^W such states for a model with W worlds, so every relation that quantifies over them is exponential in
 * the number of worlds.
 */
public final class StateSpace
{
  private StateSpace()
  {
  }

  /**
   * @return every state made up of exactly k of the worlds 0 to n, in lexicographic order of their worlds.
   *
   * @param n - the highest world.
   * @param k - the number of worlds in each state.
   */
  public static List<InformationState> generateSubStates(int n, int k)
  {
    List<InformationState> lResult = new ArrayList<>();

    if (k == 0)
    {
      lResult.add(new InformationState());
      return lResult;
    }

    if (k > n + 1)
    {
      return lResult;
    }

    lResult = new ArrayList<>(IntMath.binomial(n + 1, k));
    backtrack(0, n, k, new ArrayList<Integer>(k), lResult);

    return lResult;
  }

  private static void backtrack(int xiStart, int xiN, int xiK, List<Integer> xiCurrent, List<InformationState> xoResult)
  {
    if (xiCurrent.size() == xiK)
    {
      InformationState lState = new InformationState();
      for (int lWorld : xiCurrent)
      {
        lState.add(new Possibility(ReferentSystem.EMPTY, lWorld));
      }
      xoResult.add(lState);
      return;
    }

    for (int lWorld = xiStart; lWorld <= xiN; lWorld++)
    {
      xiCurrent.add(lWorld);
      backtrack(lWorld + 1, xiN, xiK, xiCurrent, xoResult);
      xiCurrent.remove(xiCurrent.size() - 1);
    }
  }
}
