package org.tableaux.base.util.lex;

import java.io.Serializable;
import java.util.Arrays;

import com.google.common.collect.ImmutableList;

/**
 * Base class for all items of the term algebra other than operators and quantifiers.
 *
 * Items are immutable.  Equality, hashing and ordering derive from the item's type rank and its sort tuple, which
 * contains numbers only, so the order is total and stable across runs.  Items are created through {@link LexPool},
 * which interns recently built instances.
 */
public abstract class Lexical implements Comparable<Lexical>, Serializable
{
  private static final long serialVersionUID = 1L;

  private transient int[] mSortTuple;
  private transient int   mHashCode;

  /**
   * @return the type of this item.
   */
  public abstract LexType getType();

  /**
   * @return the canonical spec from which an equal item can be rebuilt.
   */
  public abstract ImmutableList<Object> getSpec();

  /**
   * @return the canonical successor of this item.
   *
   * @throws java.util.NoSuchElementException at the edge of the item's domain.
   */
  public abstract Lexical next();

  /**
   * @return the numeric sort tuple, starting with the type rank.
   */
  protected abstract int[] buildSortTuple();

  /**
   * @return the identity of this item: its concrete type name and its spec.
   */
  public ImmutableList<Object> getIdent()
  {
    return ImmutableList.<Object>of(getClass().getSimpleName(), getSpec());
  }

  final int[] sortTuple()
  {
    if (mSortTuple == null)
    {
      mSortTuple = buildSortTuple();
    }
    return mSortTuple;
  }

  /**
   * @return a copy of the sort tuple.
   */
  public int[] getSortTuple()
  {
    return sortTuple().clone();
  }

  /**
   * Compare two items.  Orders by type rank, then element-wise by sort tuple, then by tuple length.
   */
  public static int orderItems(Lexical xiA, Lexical xiB)
  {
    if (xiA == xiB)
    {
      return 0;
    }
    int lCmp = Integer.compare(xiA.getType().getRank(), xiB.getType().getRank());
    if (lCmp != 0)
    {
      return lCmp;
    }
    int[] lA = xiA.sortTuple();
    int[] lB = xiB.sortTuple();
    int lLen = Math.min(lA.length, lB.length);
    for (int lii = 0; lii < lLen; lii++)
    {
      lCmp = Integer.compare(lA[lii], lB[lii]);
      if (lCmp != 0)
      {
        return lCmp;
      }
    }
    return Integer.compare(lA.length, lB.length);
  }

  @Override
  public int compareTo(Lexical xiOther)
  {
    return orderItems(this, xiOther);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof Lexical))
    {
      return false;
    }
    Lexical lOther = (Lexical)xiOther;
    return (getClass() == lOther.getClass()) && (orderItems(this, lOther) == 0);
  }

  @Override
  public int hashCode()
  {
    if (mHashCode == 0)
    {
      mHashCode = 31 * getClass().getSimpleName().hashCode() + Arrays.hashCode(sortTuple());
    }
    return mHashCode;
  }

  /**
   * Substitute the pooled instance on deserialization.
   */
  protected Object readResolve()
  {
    return LexPool.intern(this);
  }
}
