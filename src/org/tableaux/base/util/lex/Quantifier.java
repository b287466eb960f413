package org.tableaux.base.util.lex;

import java.util.NoSuchElementException;

/**
 * Quantifiers.
 */
public enum Quantifier
{
  EXISTENTIAL(0, "Existential", 'S'),
  UNIVERSAL(1, "Universal", 'V');

  private final int    mOrder;
  private final String mLabel;
  private final char   mSymbol;

  private Quantifier(int xiOrder, String xiLabel, char xiSymbol)
  {
    mOrder = xiOrder;
    mLabel = xiLabel;
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

  public char getSymbol()
  {
    return mSymbol;
  }

  public int[] sortTuple()
  {
    return new int[] {LexType.QUANTIFIER.getRank(), mOrder};
  }

  public static Quantifier first()
  {
    return values()[0];
  }

  /**
   * @return the next quantifier.
   *
   * @param xiLoop - whether to wrap round after the last.
   *
   * @throws NoSuchElementException if this is the last quantifier and xiLoop is not set.
   */
  public Quantifier next(boolean xiLoop)
  {
    Quantifier[] lAll = values();
    int lNext = ordinal() + 1;
    if (lNext < lAll.length)
    {
      return lAll[lNext];
    }
    if (xiLoop)
    {
      return lAll[0];
    }
    throw new NoSuchElementException("No quantifier after " + this);
  }

  public Quantifier next()
  {
    return next(false);
  }

  /**
   * Quantify the given sentence over the given variable.
   */
  public Quantified apply(Variable xiVariable, Sentence xiSentence)
  {
    return LexPool.getQuantified(this, xiVariable, xiSentence);
  }

  public static Quantifier forSymbol(char xiSymbol)
  {
    for (Quantifier lQuant : values())
    {
      if (lQuant.mSymbol == xiSymbol)
      {
        return lQuant;
      }
    }
    return null;
  }
}
