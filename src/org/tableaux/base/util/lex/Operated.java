package org.tableaux.base.util.lex;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * An operator applied to operand sentences.
 */
public final class Operated extends Sentence
{
  private static final long serialVersionUID = 1L;

  private final Operator                mOperator;
  private final ImmutableList<Sentence> mOperands;

  Operated(Operator xiOperator, Sentence... xiOperands)
  {
    if (xiOperator == null)
    {
      throw new IllegalArgumentException("Missing operator");
    }
    if (xiOperands.length != xiOperator.getArity())
    {
      throw new IllegalArgumentException(xiOperator.getLabel() + " takes " + xiOperator.getArity() +
                                         " operands, got " + xiOperands.length);
    }
    mOperator = xiOperator;
    mOperands = ImmutableList.copyOf(xiOperands);
  }

  @Override
  public LexType getType()
  {
    return LexType.OPERATED;
  }

  @Override
  public Operator getOperator()
  {
    return mOperator;
  }

  public ImmutableList<Sentence> getOperands()
  {
    return mOperands;
  }

  /**
   * @return the first operand.
   */
  public Sentence getLhs()
  {
    return mOperands.get(0);
  }

  /**
   * @return the last operand.
   */
  public Sentence getRhs()
  {
    return mOperands.get(mOperands.size() - 1);
  }

  @Override
  public Sentence negative()
  {
    if (mOperator == Operator.NEGATION)
    {
      return getLhs();
    }
    return negate();
  }

  @Override
  public ImmutableList<Object> getSpec()
  {
    ImmutableList.Builder<Object> lIdents = ImmutableList.builder();
    for (Sentence lOperand : mOperands)
    {
      lIdents.add(lOperand.getIdent());
    }
    return ImmutableList.<Object>of(mOperator.getLabel(), lIdents.build());
  }

  @Override
  protected int[] buildSortTuple()
  {
    int[][] lParts = new int[mOperands.size() + 2][];
    lParts[0] = new int[] {LexType.OPERATED.getRank()};
    lParts[1] = mOperator.sortTuple();
    for (int lii = 0; lii < mOperands.size(); lii++)
    {
      lParts[lii + 2] = mOperands.get(lii).sortTuple();
    }
    return Ints.concat(lParts);
  }

  @Override
  protected void collect(Collector xiCollector)
  {
    xiCollector.mOperators.add(mOperator);
    for (Sentence lOperand : mOperands)
    {
      xiCollector.addAll(lOperand);
    }
  }

  @Override
  public Operated substitute(Parameter xiNew, Parameter xiOld)
  {
    if (xiNew.equals(xiOld))
    {
      return this;
    }
    Sentence[] lOperands = new Sentence[mOperands.size()];
    boolean lChanged = false;
    for (int lii = 0; lii < lOperands.length; lii++)
    {
      lOperands[lii] = mOperands.get(lii).substitute(xiNew, xiOld);
      lChanged |= (lOperands[lii] != mOperands.get(lii));
    }
    return lChanged ? LexPool.getOperated(mOperator, lOperands) : this;
  }

  /**
   * @return the operator applied to the first atomics.
   */
  public static Operated first(Operator xiOperator)
  {
    List<Atomic> lAtomics = Atomic.gen(xiOperator.getArity());
    return LexPool.getOperated(xiOperator, lAtomics.toArray(new Sentence[lAtomics.size()]));
  }

  public static Operated first()
  {
    return first(Operator.first());
  }

  /**
   * @return the same operator with the last operand advanced.
   */
  @Override
  public Operated next()
  {
    Sentence[] lOperands = mOperands.toArray(new Sentence[mOperands.size()]);
    lOperands[lOperands.length - 1] = lOperands[lOperands.length - 1].next();
    return LexPool.getOperated(mOperator, lOperands);
  }

  @Override
  public String toString()
  {
    StringBuilder lBuf = new StringBuilder().append(mOperator.getSymbol());
    for (Sentence lOperand : mOperands)
    {
      lBuf.append(lOperand);
    }
    return lBuf.toString();
  }
}
