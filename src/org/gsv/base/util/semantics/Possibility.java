package org.gsv.base.util.semantics;

import java.util.Map;

import org.gsv.base.util.exceptions.UnknownVariableException;

import com.google.common.base.Joiner;
import com.google.common.base.Joiner.MapJoiner;
import com.google.common.collect.ImmutableSortedMap;

/**
 * A possibility is a referent system, an assignment of individuals to (some of) its pegs and a world.
 *
 * Possibilities are immutable.  Two possibilities are equal only if all three components are.  The natural order is
 * by world, then by assignment, then by referent system - which is what gives information states a deterministic
 * iteration order.
 */
public final class Possibility implements Comparable<Possibility>
{
  private static final MapJoiner PEG_JOINER = Joiner.on(", peg").withKeyValueSeparator(" -> e");

  private final ReferentSystem referentSystem;
  private final ImmutableSortedMap<Integer, Integer> assignment;
  private final int world;

  /**
   * Create a possibility with an empty assignment.
   *
   * @param referentSystem - the referent system.
   * @param world - the world.
   */
  public Possibility(ReferentSystem referentSystem, int world)
  {
    this(referentSystem, ImmutableSortedMap.<Integer, Integer>of(), world);
  }

  private Possibility(ReferentSystem referentSystem, ImmutableSortedMap<Integer, Integer> assignment, int world)
  {
    this.referentSystem = referentSystem;
    this.assignment = assignment;
    this.world = world;
  }

  public ReferentSystem getReferentSystem()
  {
    return referentSystem;
  }

  /**
   * @return the assignment, from peg to individual.
   */
  public Map<Integer, Integer> getAssignment()
  {
    return assignment;
  }

  public int getWorld()
  {
    return world;
  }

  /**
   * @return a possibility in which the variable is bound to a new peg, and that peg is assigned the individual.  The
   *         new possibility has a referent system of its own.
   *
   * @param variable - the variable.
   * @param individual - the individual.
   */
  public Possibility update(String variable, int individual)
  {
    ReferentSystem extended = referentSystem.bind(variable);

    ImmutableSortedMap<Integer, Integer> newAssignment = ImmutableSortedMap.<Integer, Integer>naturalOrder()
                                                                           .putAll(assignment)
                                                                           .put(extended.getPegs(), individual)
                                                                           .build();

    return new Possibility(extended, newAssignment, world);
  }

  /**
   * @return the individual that the variable denotes in this possibility.
   *
   * @throws UnknownVariableException if the variable has no peg, or its peg has no individual.
   */
  public int variableDenotation(String variable) throws UnknownVariableException
  {
    Integer individual = assignment.get(referentSystem.value(variable));
    if (individual == null)
    {
      // Bound in a referent system that this possibility was built with, but never assigned.
      throw new UnknownVariableException(variable);
    }
    return individual;
  }

  /**
   * @return whether this possibility extends p1 - it has the same world and agrees with p1 on every peg that p1
   *         assigns.
   */
  public boolean isExtensionOf(Possibility p1)
  {
    if (world != p1.world)
    {
      return false;
    }

    for (Map.Entry<Integer, Integer> entry : p1.assignment.entrySet())
    {
      if (!entry.getValue().equals(assignment.get(entry.getKey())))
      {
        return false;
      }
    }

    return true;
  }

  @Override
  public int compareTo(Possibility other)
  {
    if (world != other.world)
    {
      return Integer.compare(world, other.world);
    }

    int lResult = Assignments.compare(assignment, other.assignment);
    if (lResult != 0)
    {
      return lResult;
    }

    return referentSystem.compareTo(other.referentSystem);
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
    {
      return true;
    }
    if (!(other instanceof Possibility))
    {
      return false;
    }
    Possibility that = (Possibility)other;
    return world == that.world && assignment.equals(that.assignment) && referentSystem.equals(that.referentSystem);
  }

  @Override
  public int hashCode()
  {
    return (31 * world + assignment.hashCode()) * 31 + referentSystem.hashCode();
  }

  @Override
  public String toString()
  {
    String assigned = assignment.isEmpty() ? "{ }" : "{ peg" + PEG_JOINER.join(assignment) + " }";
    return "[ R-System : " + referentSystem + ", Assignment : " + assigned + ", World : w" + world + " ]";
  }
}
