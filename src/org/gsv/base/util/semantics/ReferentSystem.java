package org.gsv.base.util.semantics;

import java.util.Map;
import java.util.Set;

import org.gsv.base.util.exceptions.UnknownVariableException;

import com.google.common.base.Joiner;
import com.google.common.base.Joiner.MapJoiner;
import com.google.common.collect.ImmutableSortedMap;

/**
 * A referent system keeps track of which peg (discourse referent) each variable is associated with.
 *
 * Pegs are numbered from 1 in order of allocation, so a system with n pegs has allocated exactly pegs 1 to n.
 * Referent systems are immutable: binding a variable produces a new system, leaving this one - and every possibility
 * that shares it - untouched.
 */
public final class ReferentSystem
{
  /**
   * The referent system with no pegs.
   */
  public static final ReferentSystem EMPTY = new ReferentSystem(0, ImmutableSortedMap.<String, Integer>of());

  private static final MapJoiner VARIABLE_JOINER = Joiner.on(", ").withKeyValueSeparator(" -> peg");

  private final int pegs;
  private final ImmutableSortedMap<String, Integer> variablePegAssociation;

  private ReferentSystem(int pegs, ImmutableSortedMap<String, Integer> variablePegAssociation)
  {
    this.pegs = pegs;
    this.variablePegAssociation = variablePegAssociation;
  }

  /**
   * @return the number of pegs allocated so far.
   */
  public int getPegs()
  {
    return pegs;
  }

  /**
   * @return the variables that have a peg.
   */
  public Set<String> domain()
  {
    return variablePegAssociation.keySet();
  }

  /**
   * @return the peg of the given variable.
   *
   * @throws UnknownVariableException if the variable has never been bound.
   */
  public int value(String variable) throws UnknownVariableException
  {
    Integer peg = variablePegAssociation.get(variable);
    if (peg == null)
    {
      throw new UnknownVariableException(variable);
    }
    return peg;
  }

  /**
   * @return a copy of this system in which the variable is associated with a newly allocated peg.  Any previous
   *         association of the variable is replaced.
   */
  public ReferentSystem bind(String variable)
  {
    int newPeg = pegs + 1;

    ImmutableSortedMap.Builder<String, Integer> builder = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<String, Integer> entry : variablePegAssociation.entrySet())
    {
      if (!entry.getKey().equals(variable))
      {
        builder.put(entry);
      }
    }
    builder.put(variable, newPeg);

    return new ReferentSystem(newPeg, builder.build());
  }

  /**
   * @return whether this system extends r1.  That is the case when
   *         <ul>
   *         <li>it has at least as many pegs as r1,
   *         <li>every variable of r1 is also a variable of this system, and keeps its peg or has been moved to a peg
   *             that is new relative to r1, and
   *         <li>every variable that r1 does not know about has a peg that is new relative to r1.
   *         </ul>
   */
  public boolean isExtensionOf(ReferentSystem r1)
  {
    if (r1.pegs > pegs)
    {
      return false;
    }

    if (!domain().containsAll(r1.domain()))
    {
      return false;
    }

    for (Map.Entry<String, Integer> entry : variablePegAssociation.entrySet())
    {
      int peg = entry.getValue();
      Integer oldPeg = r1.variablePegAssociation.get(entry.getKey());

      if (oldPeg == null || oldPeg != peg)
      {
        // New variable, or a variable that has been re-bound.  Either way it must be on a new peg.
        if (peg < r1.pegs)
        {
          return false;
        }
      }
    }

    return true;
  }

  /**
   * Compare on peg count, then on the variable to peg associations in variable order.
   */
  int compareTo(ReferentSystem other)
  {
    if (pegs != other.pegs)
    {
      return Integer.compare(pegs, other.pegs);
    }

    return Assignments.compare(variablePegAssociation, other.variablePegAssociation);
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
    {
      return true;
    }
    if (!(other instanceof ReferentSystem))
    {
      return false;
    }
    ReferentSystem that = (ReferentSystem)other;
    return pegs == that.pegs && variablePegAssociation.equals(that.variablePegAssociation);
  }

  @Override
  public int hashCode()
  {
    return 31 * pegs + variablePegAssociation.hashCode();
  }

  @Override
  public String toString()
  {
    if (variablePegAssociation.isEmpty())
    {
      return "{ }";
    }
    return "{ " + VARIABLE_JOINER.join(variablePegAssociation) + " }";
  }
}
