package org.tableaux.base.util.lex;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * A quantified sentence.  The bound variable is expected to occur in the inner sentence, which the parser checks;
 * construction from already-validated parts does not.
 */
public final class Quantified extends Sentence
{
  private static final long serialVersionUID = 1L;

  private final Quantifier mQuantifier;
  private final Variable   mVariable;
  private final Sentence   mSentence;

  Quantified(Quantifier xiQuantifier, Variable xiVariable, Sentence xiSentence)
  {
    if (xiQuantifier == null || xiVariable == null || xiSentence == null)
    {
      throw new IllegalArgumentException("Quantified sentence needs quantifier, variable and sentence");
    }
    mQuantifier = xiQuantifier;
    mVariable = xiVariable;
    mSentence = xiSentence;
  }

  @Override
  public LexType getType()
  {
    return LexType.QUANTIFIED;
  }

  @Override
  public Quantifier getQuantifier()
  {
    return mQuantifier;
  }

  public Variable getVariable()
  {
    return mVariable;
  }

  public Sentence getSentence()
  {
    return mSentence;
  }

  /**
   * Instantiate the bound variable with a constant.
   */
  public Sentence unquantify(Constant xiConstant)
  {
    return mSentence.substitute(xiConstant, mVariable);
  }

  @Override
  public ImmutableList<Object> getSpec()
  {
    return ImmutableList.<Object>of(mQuantifier.getLabel(), mVariable.getSpec(), mSentence.getIdent());
  }

  @Override
  protected int[] buildSortTuple()
  {
    return Ints.concat(new int[] {LexType.QUANTIFIED.getRank()},
                       mQuantifier.sortTuple(),
                       mVariable.sortTuple(),
                       mSentence.sortTuple());
  }

  @Override
  protected void collect(Collector xiCollector)
  {
    xiCollector.mQuantifiers.add(mQuantifier);
    xiCollector.mVariables.add(mVariable);
    xiCollector.addAll(mSentence);
  }

  @Override
  public boolean variableOccurs(Variable xiVariable)
  {
    return mVariable.equals(xiVariable) || mSentence.variableOccurs(xiVariable);
  }

  @Override
  public Quantified substitute(Parameter xiNew, Parameter xiOld)
  {
    if (xiNew.equals(xiOld))
    {
      return this;
    }
    Sentence lInner = mSentence.substitute(xiNew, xiOld);
    if (lInner == mSentence)
    {
      return this;
    }
    return LexPool.getQuantified(mQuantifier, mVariable, lInner);
  }

  /**
   * @return the quantifier applied to the first variable over the first unary predicate of that variable.
   */
  public static Quantified first(Quantifier xiQuantifier)
  {
    Variable lVar = Variable.first();
    return LexPool.getQuantified(xiQuantifier, lVar, Predicate.first().apply(lVar));
  }

  public static Quantified first()
  {
    return first(Quantifier.first());
  }

  /**
   * @throws IllegalArgumentException if the successor of the inner sentence no longer binds the variable.
   */
  @Override
  public Quantified next()
  {
    Sentence lInner = mSentence.next();
    if (!lInner.variableOccurs(mVariable))
    {
      throw new IllegalArgumentException("Variable " + mVariable + " no longer occurs in " + lInner);
    }
    return LexPool.getQuantified(mQuantifier, mVariable, lInner);
  }

  @Override
  public String toString()
  {
    return "" + mQuantifier.getSymbol() + mVariable + mSentence;
  }
}
