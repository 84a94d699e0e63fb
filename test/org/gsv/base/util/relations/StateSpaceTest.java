package org.gsv.base.util.relations;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.gsv.base.util.semantics.InformationState;
import org.gsv.base.util.semantics.Possibility;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;
import com.google.common.math.IntMath;

public class StateSpaceTest extends Assert
{
  @Test
  public void testSizeClassCounts()
  {
    for (int n = 0; n < 5; n++)
    {
      int lTotal = 0;
      for (int k = 0; k <= n + 1; k++)
      {
        List<InformationState> lStates = StateSpace.generateSubStates(n, k);
        assertEquals(IntMath.binomial(n + 1, k), lStates.size());

        Set<Set<Integer>> lDistinct = new HashSet<>();
        for (InformationState lState : lStates)
        {
          assertEquals(k, lState.size());
          lDistinct.add(lState.worlds());
          for (Possibility lP : lState)
          {
            assertTrue(lP.getAssignment().isEmpty());
            assertTrue(lP.getReferentSystem().domain().isEmpty());
          }
        }
        assertEquals(lStates.size(), lDistinct.size());
        lTotal += lStates.size();
      }
      assertEquals(1 << (n + 1), lTotal);
    }
  }

  @Test
  public void testLexicographicOrder()
  {
    List<InformationState> lStates = StateSpace.generateSubStates(3, 2);

    assertEquals(ImmutableSet.of(0, 1), lStates.get(0).worlds());
    assertEquals(ImmutableSet.of(0, 2), lStates.get(1).worlds());
    assertEquals(ImmutableSet.of(0, 3), lStates.get(2).worlds());
    assertEquals(ImmutableSet.of(1, 2), lStates.get(3).worlds());
    assertEquals(ImmutableSet.of(2, 3), lStates.get(5).worlds());
  }

  @Test
  public void testEdgeCases()
  {
    List<InformationState> lEmpty = StateSpace.generateSubStates(3, 0);
    assertEquals(1, lEmpty.size());
    assertTrue(lEmpty.get(0).isEmpty());

    assertTrue(StateSpace.generateSubStates(3, 5).isEmpty());

    List<InformationState> lAll = StateSpace.generateSubStates(3, 4);
    assertEquals(1, lAll.size());
    assertEquals(ImmutableSet.of(0, 1, 2, 3), lAll.get(0).worlds());

    // A model with no worlds has just the empty state.
    assertEquals(1, StateSpace.generateSubStates(-1, 0).size());
    assertTrue(StateSpace.generateSubStates(-1, 1).isEmpty());
  }
}
