package org.tableaux.base.util.lex;

import com.google.common.collect.ImmutableList;

/**
 * An item named by (index, subscript) coordinates.
 */
public abstract class CoordsItem extends Lexical
{
  private static final long serialVersionUID = 1L;

  protected final int mIndex;
  protected final int mSubscript;

  protected CoordsItem(int xiIndex, int xiSubscript)
  {
    mIndex = xiIndex;
    mSubscript = xiSubscript;
  }

  public int getIndex()
  {
    return mIndex;
  }

  public int getSubscript()
  {
    return mSubscript;
  }

  /**
   * @return the (index, subscript) pair.
   */
  public ImmutableList<Integer> getBiCoords()
  {
    return ImmutableList.of(mIndex, mSubscript);
  }

  @Override
  protected int[] buildSortTuple()
  {
    return new int[] {getType().getRank(), mSubscript, mIndex};
  }

  /**
   * Validate coordinates for the given type.
   *
   * @throws IllegalArgumentException if the subscript is negative or the index is outside [0, max].
   */
  static void checkCoords(LexType xiType, int xiIndex, int xiSubscript)
  {
    if (xiSubscript < 0)
    {
      throw new IllegalArgumentException("Negative subscript " + xiSubscript + " for " + xiType);
    }
    if (xiIndex < 0 || xiIndex > xiType.getMaxIndex())
    {
      throw new IllegalArgumentException("Index " + xiIndex + " out of range 0-" + xiType.getMaxIndex() + " for " +
                                         xiType);
    }
  }

  /**
   * @return the successor coordinates of (index, subscript) for the given type.
   */
  static int[] nextCoords(LexType xiType, int xiIndex, int xiSubscript)
  {
    if (xiIndex < xiType.getMaxIndex())
    {
      return new int[] {xiIndex + 1, xiSubscript};
    }
    return new int[] {0, xiSubscript + 1};
  }

  /**
   * Render the coordinate name from a symbol table, with the subscript as trailing digits.
   */
  static String render(String xiSymbols, int xiIndex, int xiSubscript)
  {
    char lSym = xiSymbols.charAt(xiIndex);
    return (xiSubscript > 0) ? (lSym + Integer.toString(xiSubscript)) : String.valueOf(lSym);
  }
}
