package org.gsv.base.util.semantics;

import java.util.Iterator;

import org.gsv.base.test.FiniteModel;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableSet;

public class InformationStateTest extends Assert
{
  private final Model model = new FiniteModel(3, 2);

  @Test
  public void testCreate()
  {
    InformationState lState = InformationState.create(model);

    assertEquals(3, lState.size());
    assertEquals(ImmutableSet.of(0, 1, 2), lState.worlds());

    int lExpectedWorld = 0;
    for (Possibility lP : lState)
    {
      assertEquals(lExpectedWorld++, lP.getWorld());
      assertTrue(lP.getAssignment().isEmpty());
      assertEquals(ReferentSystem.EMPTY, lP.getReferentSystem());
    }
  }

  @Test
  public void testCreateEmptyModel()
  {
    assertTrue(InformationState.create(new FiniteModel(0, 1)).isEmpty());
  }

  @Test
  public void testUpdateIsAssignmentMonotone()
  {
    InformationState lState = InformationState.create(model);
    for (int d = 0; d < model.domainCardinality(); d++)
    {
      InformationState lUpdated = InformationState.update(lState, "x", d);
      assertEquals(lState.size(), lUpdated.size());
      assertTrue(lUpdated.isExtensionOf(lState));
      assertFalse(lState.isExtensionOf(lUpdated));

      InformationState lTwice = InformationState.update(lUpdated, "y", 1 - d);
      assertTrue(lTwice.isExtensionOf(lUpdated));
      assertTrue(lTwice.isExtensionOf(lState));
    }

    // Input untouched.
    for (Possibility lP : lState)
    {
      assertTrue(lP.getAssignment().isEmpty());
    }
  }

  @Test
  public void testSubsistence()
  {
    InformationState lState = InformationState.create(model);
    for (Possibility lP : lState)
    {
      assertTrue(InformationState.subsistsIn(lP, lState));
      assertTrue(InformationState.isDescendantOf(lP, lP, lState));
    }
    assertTrue(InformationState.subsistsIn(lState, lState));

    InformationState lUpdated = InformationState.update(lState, "x", 1);
    assertTrue(InformationState.subsistsIn(lState, lUpdated));
    assertFalse(InformationState.subsistsIn(lUpdated, lState));

    Possibility lW0 = new Possibility(ReferentSystem.EMPTY, 0);
    assertTrue(InformationState.isDescendantOf(lW0.update("x", 1), lW0, lUpdated));
    assertFalse(InformationState.isDescendantOf(lW0.update("x", 0), lW0, lUpdated));

    lUpdated.remove(lW0.update("x", 1));
    assertFalse(InformationState.subsistsIn(lW0, lUpdated));
    assertFalse(InformationState.subsistsIn(lState, lUpdated));
    assertTrue(InformationState.subsistsIn(lState, lState));

    // The empty state subsists anywhere.
    assertTrue(InformationState.subsistsIn(new InformationState(), lUpdated));
  }

  @Test
  public void testStructuralMembership()
  {
    InformationState lState = new InformationState(false);
    Possibility lW0 = new Possibility(ReferentSystem.EMPTY, 0);

    assertTrue(lState.add(lW0.update("x", 0)));
    assertTrue(lState.add(lW0.update("x", 1)));
    assertFalse(lState.add(lW0.update("x", 1)));
    assertEquals(2, lState.size());
    assertEquals(ImmutableSet.of(0), lState.worlds());
  }

  @Test
  public void testCollapseByWorld()
  {
    InformationState lState = new InformationState(true);
    Possibility lW0 = new Possibility(ReferentSystem.EMPTY, 0);

    assertTrue(lState.add(lW0.update("x", 0)));
    assertFalse(lState.add(lW0.update("x", 1)));
    assertEquals(1, lState.size());
    assertEquals(lW0.update("x", 0), lState.iterator().next());

    // Copies and updates keep the mode.
    assertTrue(lState.copy().isCollapsedByWorld());
    assertTrue(InformationState.update(lState, "y", 1).isCollapsedByWorld());
    assertFalse(new InformationState(false).emptyCopy().isCollapsedByWorld());
  }

  @Test
  public void testCopyIsIndependent()
  {
    InformationState lState = InformationState.create(model);
    InformationState lCopy = lState.copy();
    assertEquals(lState, lCopy);

    lCopy.clear();
    assertEquals(3, lState.size());
    assertTrue(lCopy.isEmpty());

    InformationState lEmpty = lState.emptyCopy();
    assertTrue(lEmpty.isEmpty());
    lEmpty.addAll(lState);
    assertEquals(lState, lEmpty);
  }

  @Test
  public void testIteratorRemove()
  {
    InformationState lState = InformationState.create(model);
    for (Iterator<Possibility> lIter = lState.iterator(); lIter.hasNext(); )
    {
      if (lIter.next().getWorld() == 1)
      {
        lIter.remove();
      }
    }
    assertEquals(ImmutableSet.of(0, 2), lState.worlds());
    assertFalse(lState.contains(new Possibility(ReferentSystem.EMPTY, 1)));
    assertTrue(lState.contains(new Possibility(ReferentSystem.EMPTY, 2)));
  }

  @Test
  public void testRendering()
  {
    InformationState lState = InformationState.create(new FiniteModel(1, 1));
    assertEquals("--------------------\n" +
                 "[ R-System : { }, Assignment : { }, World : w0 ]\n" +
                 "--------------------",
                 lState.toString());
    assertEquals("  --------------------", new InformationState().toString("  "));
  }
}
