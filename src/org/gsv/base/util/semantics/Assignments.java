package org.gsv.base.util.semantics;

import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;

import com.google.common.collect.ComparisonChain;

/**
 * Ordering of the sorted maps that make up referent systems and assignments.
 */
final class Assignments
{
  private Assignments()
  {
  }

  /**
   * Lexicographic comparison of two sorted maps, entry by entry (key first, then value).  A map that is a strict prefix
   * of the other sorts first.
   */
  static <K extends Comparable<K>> int compare(SortedMap<K, Integer> a, SortedMap<K, Integer> b)
  {
    Iterator<Map.Entry<K, Integer>> lIterA = a.entrySet().iterator();
    Iterator<Map.Entry<K, Integer>> lIterB = b.entrySet().iterator();

    while (lIterA.hasNext() && lIterB.hasNext())
    {
      Map.Entry<K, Integer> lEntryA = lIterA.next();
      Map.Entry<K, Integer> lEntryB = lIterB.next();

      int lResult = ComparisonChain.start()
                                   .compare(lEntryA.getKey(), lEntryB.getKey())
                                   .compare(lEntryA.getValue(), lEntryB.getValue())
                                   .result();
      if (lResult != 0)
      {
        return lResult;
      }
    }

    return Boolean.compare(lIterA.hasNext(), lIterB.hasNext());
  }
}
