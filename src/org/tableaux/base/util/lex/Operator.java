package org.tableaux.base.util.lex;

import java.util.NoSuchElementException;

/**
 * Sentence operators.
 */
public enum Operator
{
  ASSERTION(10, "Assertion", 1, 'T'),
  NEGATION(20, "Negation", 1, 'N'),
  CONJUNCTION(30, "Conjunction", 2, 'K'),
  DISJUNCTION(40, "Disjunction", 2, 'A'),
  MATERIAL_CONDITIONAL(50, "Material Conditional", 2, 'C'),
  MATERIAL_BICONDITIONAL(60, "Material Biconditional", 2, 'E'),
  CONDITIONAL(70, "Conditional", 2, 'U'),
  BICONDITIONAL(80, "Biconditional", 2, 'B'),
  POSSIBILITY(90, "Possibility", 1, 'M'),
  NECESSITY(100, "Necessity", 1, 'L');

  private final int    mOrder;
  private final String mLabel;
  private final int    mArity;
  private final char   mSymbol;

  private Operator(int xiOrder, String xiLabel, int xiArity, char xiSymbol)
  {
    mOrder = xiOrder;
    mLabel = xiLabel;
    mArity = xiArity;
    mSymbol = xiSymbol;
  }

  public int getOrder()
  {
    return mOrder;
  }

  public String getLabel()
  {
    return mLabel;
  }

  public int getArity()
  {
    return mArity;
  }

  /**
   * @return the Polish notation symbol.
   */
  public char getSymbol()
  {
    return mSymbol;
  }

  public boolean isModal()
  {
    return this == POSSIBILITY || this == NECESSITY;
  }

  /**
   * @return the sorting tuple: type rank, then order.
   */
  public int[] sortTuple()
  {
    return new int[] {LexType.OPERATOR.getRank(), mOrder};
  }

  public static Operator first()
  {
    return values()[0];
  }

  /**
   * @return the next operator.
   *
   * @param xiLoop - whether to wrap round to the first operator after the last.
   *
   * @throws NoSuchElementException if this is the last operator and xiLoop is not set.
   */
  public Operator next(boolean xiLoop)
  {
    Operator[] lAll = values();
    int lNext = ordinal() + 1;
    if (lNext < lAll.length)
    {
      return lAll[lNext];
    }
    if (xiLoop)
    {
      return lAll[0];
    }
    throw new NoSuchElementException("No operator after " + this);
  }

  public Operator next()
  {
    return next(false);
  }

  /**
   * Apply the operator to the given operands.
   *
   * @param xiOperands - exactly {@link #getArity()} sentences.
   */
  public Operated apply(Sentence... xiOperands)
  {
    return LexPool.getOperated(this, xiOperands);
  }

  public static Operator forSymbol(char xiSymbol)
  {
    for (Operator lOper : values())
    {
      if (lOper.mSymbol == xiSymbol)
      {
        return lOper;
      }
    }
    return null;
  }
}
