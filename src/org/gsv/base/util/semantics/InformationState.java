package org.gsv.base.util.semantics;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Set;
import java.util.TreeSet;

import org.gsv.base.util.config.GSVConfiguration;
import org.gsv.base.util.config.GSVConfiguration.CfgItem;

import com.google.common.collect.ImmutableSortedSet;

/**
 * An information state - a set of possibilities.  This is what formulas update.
 *
 * Iteration is in possibility order (world first).  Membership is structural: two possibilities at the same world
 * with different assignments or referent systems are both kept, unless the state was created in collapse-by-world mode
 * (see {@link CfgItem#COLLAPSE_POSSIBILITIES_BY_WORLD}), in which case the first possibility inserted for a world
 * stands for that world.
 *
 * States are not thread-safe.  The evaluator never shares one between threads.
 */
public final class InformationState implements Iterable<Possibility>
{
  private static final Comparator<Possibility> BY_WORLD = new Comparator<Possibility>()
  {
    @Override
    public int compare(Possibility xiA, Possibility xiB)
    {
      return Integer.compare(xiA.getWorld(), xiB.getWorld());
    }
  };

  private final boolean collapseByWorld;
  private final TreeSet<Possibility> possibilities;

  /**
   * Create an empty state, in the mode given by configuration.
   */
  public InformationState()
  {
    this(GSVConfiguration.getCfgBool(CfgItem.COLLAPSE_POSSIBILITIES_BY_WORLD));
  }

  /**
   * Create an empty state.
   *
   * @param collapseByWorld - whether the state holds at most one possibility per world.
   */
  public InformationState(boolean collapseByWorld)
  {
    this.collapseByWorld = collapseByWorld;
    possibilities = collapseByWorld ? new TreeSet<>(BY_WORLD) : new TreeSet<Possibility>();
  }

  /**
   * @return the ignorant state for a model - one possibility per world, with nothing assigned.  All possibilities
   *         share the empty referent system.
   *
   * @param model - the model.
   */
  public static InformationState create(Model model)
  {
    InformationState state = new InformationState();
    for (int world = 0; world < model.worldCardinality(); world++)
    {
      state.add(new Possibility(ReferentSystem.EMPTY, world));
    }
    return state;
  }

  /**
   * @return a new state in which every possibility of the input has been updated so that the variable is bound to a
   *         new peg holding the individual.  The input is unchanged.
   *
   * @param state - the input state.
   * @param variable - the variable.
   * @param individual - the individual.
   */
  public static InformationState update(InformationState state, String variable, int individual)
  {
    InformationState output = state.emptyCopy();
    for (Possibility p : state.possibilities)
    {
      output.add(p.update(variable, individual));
    }
    return output;
  }

  /**
   * @return whether p2 is a descendant of p1 in s - it is a member of s and extends p1.
   */
  public static boolean isDescendantOf(Possibility p2, Possibility p1, InformationState s)
  {
    return s.contains(p2) && p2.isExtensionOf(p1);
  }

  /**
   * @return whether p subsists in s - some member of s is a descendant of p.
   */
  public static boolean subsistsIn(Possibility p, InformationState s)
  {
    for (Possibility candidate : s.possibilities)
    {
      if (candidate.isExtensionOf(p))
      {
        return true;
      }
    }
    return false;
  }

  /**
   * @return whether s1 subsists in s2 - every possibility of s1 subsists in s2.
   */
  public static boolean subsistsIn(InformationState s1, InformationState s2)
  {
    for (Possibility p : s1.possibilities)
    {
      if (!subsistsIn(p, s2))
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return whether this state extends s1 - every possibility in it extends some possibility of s1.
   */
  public boolean isExtensionOf(InformationState s1)
  {
    for (Possibility p2 : possibilities)
    {
      boolean lFound = false;
      for (Possibility p1 : s1.possibilities)
      {
        if (p2.isExtensionOf(p1))
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
   * @return a copy of this state.  Possibilities are immutable, so they are shared.
   */
  public InformationState copy()
  {
    InformationState lCopy = emptyCopy();
    lCopy.possibilities.addAll(possibilities);
    return lCopy;
  }

  /**
   * @return an empty state in the same mode as this one.
   */
  public InformationState emptyCopy()
  {
    return new InformationState(collapseByWorld);
  }

  /**
   * @return whether the state changed.
   */
  public boolean add(Possibility p)
  {
    return possibilities.add(p);
  }

  /**
   * Add every possibility of another state.
   */
  public void addAll(InformationState other)
  {
    for (Possibility p : other.possibilities)
    {
      possibilities.add(p);
    }
  }

  public boolean contains(Possibility p)
  {
    return possibilities.contains(p);
  }

  public boolean remove(Possibility p)
  {
    return possibilities.remove(p);
  }

  public void clear()
  {
    possibilities.clear();
  }

  public boolean isEmpty()
  {
    return possibilities.isEmpty();
  }

  public int size()
  {
    return possibilities.size();
  }

  public boolean isCollapsedByWorld()
  {
    return collapseByWorld;
  }

  /**
   * @return the worlds that this state leaves open.
   */
  public Set<Integer> worlds()
  {
    ImmutableSortedSet.Builder<Integer> lBuilder = ImmutableSortedSet.naturalOrder();
    for (Possibility p : possibilities)
    {
      lBuilder.add(p.getWorld());
    }
    return lBuilder.build();
  }

  /**
   * Iterate over the possibilities in order.  The iterator supports removal.
   */
  @Override
  public Iterator<Possibility> iterator()
  {
    return possibilities.iterator();
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
    {
      return true;
    }
    if (!(other instanceof InformationState))
    {
      return false;
    }
    InformationState that = (InformationState)other;
    return collapseByWorld == that.collapseByWorld && possibilities.equals(that.possibilities);
  }

  @Override
  public int hashCode()
  {
    return possibilities.hashCode();
  }

  @Override
  public String toString()
  {
    return toString("");
  }

  /**
   * @return a multi-line description, one possibility per line, each line starting with the indent.
   *
   * @param indent - prefix for every line.
   */
  public String toString(String indent)
  {
    StringBuilder sb = new StringBuilder();

    sb.append(indent + "--------------------");
    for (Possibility p : possibilities)
    {
      sb.append("\n" + indent + p);
      sb.append("\n" + indent + "--------------------");
    }

    return sb.toString();
  }
}
