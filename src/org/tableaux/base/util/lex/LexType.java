package org.tableaux.base.util.lex;

/**
 * The kinds of lexical item, with the fixed rank that orders items of different kinds against each other.
 */
public enum LexType
{
  PREDICATE(10, 3, "Predicate"),
  CONSTANT(20, 3, "Parameter"),
  VARIABLE(30, 3, "Parameter"),
  QUANTIFIER(33, -1, "Quantifier"),
  OPERATOR(35, -1, "Operator"),
  ATOMIC(40, 4, "Sentence"),
  PREDICATED(50, -1, "Sentence"),
  QUANTIFIED(60, -1, "Sentence"),
  OPERATED(70, -1, "Sentence");

  private final int    mRank;
  private final int    mMaxIndex;
  private final String mRole;

  private LexType(int xiRank, int xiMaxIndex, String xiRole)
  {
    mRank = xiRank;
    mMaxIndex = xiMaxIndex;
    mRole = xiRole;
  }

  public int getRank()
  {
    return mRank;
  }

  /**
   * @return the highest coordinate index for coordinate-named items, or -1 for types without coordinates.
   */
  public int getMaxIndex()
  {
    return mMaxIndex;
  }

  public String getRole()
  {
    return mRole;
  }

  public boolean isSentence()
  {
    return "Sentence".equals(mRole);
  }
}
