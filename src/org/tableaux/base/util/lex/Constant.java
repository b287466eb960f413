package org.tableaux.base.util.lex;

import java.util.ArrayList;
import java.util.List;

/**
 * A constant parameter.
 */
public final class Constant extends Parameter
{
  private static final long serialVersionUID = 1L;

  static final String SYMBOLS = "mnos";

  Constant(int xiIndex, int xiSubscript)
  {
    super(xiIndex, xiSubscript);
  }

  @Override
  public LexType getType()
  {
    return LexType.CONSTANT;
  }

  @Override
  public boolean isConstant()
  {
    return true;
  }

  public static Constant first()
  {
    return LexPool.getConstant(0, 0);
  }

  @Override
  public Constant next()
  {
    int[] lNext = nextCoords(LexType.CONSTANT, mIndex, mSubscript);
    return LexPool.getConstant(lNext[0], lNext[1]);
  }

  /**
   * @return the first xiCount constants in canonical order.
   */
  public static List<Constant> gen(int xiCount)
  {
    List<Constant> lResult = new ArrayList<>(xiCount);
    Constant lConst = null;
    for (int lii = 0; lii < xiCount; lii++)
    {
      lConst = (lConst == null) ? first() : lConst.next();
      lResult.add(lConst);
    }
    return lResult;
  }

  @Override
  public String toString()
  {
    return render(SYMBOLS, mIndex, mSubscript);
  }
}
