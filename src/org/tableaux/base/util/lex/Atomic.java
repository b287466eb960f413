package org.tableaux.base.util.lex;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An atomic sentence, named by (index, subscript).
 */
public final class Atomic extends Sentence
{
  private static final long serialVersionUID = 1L;

  static final String SYMBOLS = "abcde";

  private final int mIndex;
  private final int mSubscript;

  Atomic(int xiIndex, int xiSubscript)
  {
    CoordsItem.checkCoords(LexType.ATOMIC, xiIndex, xiSubscript);
    mIndex = xiIndex;
    mSubscript = xiSubscript;
  }

  @Override
  public LexType getType()
  {
    return LexType.ATOMIC;
  }

  public int getIndex()
  {
    return mIndex;
  }

  public int getSubscript()
  {
    return mSubscript;
  }

  @Override
  public ImmutableList<Object> getSpec()
  {
    return ImmutableList.<Object>of(mIndex, mSubscript);
  }

  @Override
  protected int[] buildSortTuple()
  {
    return new int[] {LexType.ATOMIC.getRank(), mSubscript, mIndex};
  }

  @Override
  protected void collect(Collector xiCollector)
  {
    xiCollector.mAtomics.add(this);
  }

  @Override
  public Atomic substitute(Parameter xiNew, Parameter xiOld)
  {
    return this;
  }

  public static Atomic first()
  {
    return LexPool.getAtomic(0, 0);
  }

  @Override
  public Atomic next()
  {
    int[] lNext = CoordsItem.nextCoords(LexType.ATOMIC, mIndex, mSubscript);
    return LexPool.getAtomic(lNext[0], lNext[1]);
  }

  /**
   * @return the first xiCount atomics in canonical order.
   */
  public static List<Atomic> gen(int xiCount)
  {
    List<Atomic> lResult = new ArrayList<>(xiCount);
    Atomic lAtomic = first();
    for (int lii = 0; lii < xiCount; lii++)
    {
      lResult.add(lAtomic);
      lAtomic = lAtomic.next();
    }
    return lResult;
  }

  @Override
  public String toString()
  {
    return CoordsItem.render(SYMBOLS, mIndex, mSubscript);
  }
}
