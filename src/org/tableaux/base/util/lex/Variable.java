package org.tableaux.base.util.lex;

import java.util.ArrayList;
import java.util.List;

/**
 * A variable parameter, bound by a quantifier.
 */
public final class Variable extends Parameter
{
  private static final long serialVersionUID = 1L;

  static final String SYMBOLS = "xyzv";

  Variable(int xiIndex, int xiSubscript)
  {
    super(xiIndex, xiSubscript);
  }

  @Override
  public LexType getType()
  {
    return LexType.VARIABLE;
  }

  @Override
  public boolean isConstant()
  {
    return false;
  }

  public static Variable first()
  {
    return LexPool.getVariable(0, 0);
  }

  @Override
  public Variable next()
  {
    int[] lNext = nextCoords(LexType.VARIABLE, mIndex, mSubscript);
    return LexPool.getVariable(lNext[0], lNext[1]);
  }

  /**
   * @return the first xiCount variables in canonical order.
   */
  public static List<Variable> gen(int xiCount)
  {
    List<Variable> lResult = new ArrayList<>(xiCount);
    Variable lVar = null;
    for (int lii = 0; lii < xiCount; lii++)
    {
      lVar = (lVar == null) ? first() : lVar.next();
      lResult.add(lVar);
    }
    return lResult;
  }

  @Override
  public String toString()
  {
    return render(SYMBOLS, mIndex, mSubscript);
  }
}
