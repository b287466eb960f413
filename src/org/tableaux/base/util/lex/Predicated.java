package org.tableaux.base.util.lex;

import java.util.Arrays;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.primitives.Ints;

/**
 * A predicate applied to parameters.
 */
public final class Predicated extends Sentence
{
  private static final long serialVersionUID = 1L;

  private final Predicate                mPredicate;
  private final ImmutableList<Parameter> mParams;

  Predicated(Predicate xiPredicate, Parameter... xiParams)
  {
    if (xiPredicate == null)
    {
      throw new IllegalArgumentException("Missing predicate");
    }
    if (xiParams.length != xiPredicate.getArity())
    {
      throw new IllegalArgumentException("Predicate " + xiPredicate + " has arity " + xiPredicate.getArity() +
                                         " but got " + xiParams.length + " parameters");
    }
    mPredicate = xiPredicate;
    mParams = ImmutableList.copyOf(xiParams);
  }

  @Override
  public LexType getType()
  {
    return LexType.PREDICATED;
  }

  @Override
  public Predicate getPredicate()
  {
    return mPredicate;
  }

  public ImmutableList<Parameter> getParams()
  {
    return mParams;
  }

  /**
   * @return the distinct parameters, sorted.
   */
  public ImmutableSortedSet<Parameter> getParamSet()
  {
    return ImmutableSortedSet.copyOf(mParams);
  }

  public boolean isIdentity()
  {
    return mPredicate.equals(Predicate.System.IDENTITY.get());
  }

  public boolean isExistence()
  {
    return mPredicate.equals(Predicate.System.EXISTENCE.get());
  }

  @Override
  public ImmutableList<Object> getSpec()
  {
    ImmutableList.Builder<Object> lIdents = ImmutableList.builder();
    for (Parameter lParam : mParams)
    {
      lIdents.add(lParam.getIdent());
    }
    return ImmutableList.<Object>of(mPredicate.getSpec(), lIdents.build());
  }

  @Override
  protected int[] buildSortTuple()
  {
    int[][] lParts = new int[mParams.size() + 2][];
    lParts[0] = new int[] {LexType.PREDICATED.getRank()};
    lParts[1] = mPredicate.sortTuple();
    for (int lii = 0; lii < mParams.size(); lii++)
    {
      lParts[lii + 2] = mParams.get(lii).sortTuple();
    }
    return Ints.concat(lParts);
  }

  @Override
  protected void collect(Collector xiCollector)
  {
    xiCollector.mPredicates.add(mPredicate);
    for (Parameter lParam : mParams)
    {
      xiCollector.addParameter(lParam);
    }
  }

  @Override
  public Predicated substitute(Parameter xiNew, Parameter xiOld)
  {
    if (xiNew.equals(xiOld) || !mParams.contains(xiOld))
    {
      return this;
    }
    Parameter[] lParams = new Parameter[mParams.size()];
    for (int lii = 0; lii < lParams.length; lii++)
    {
      Parameter lParam = mParams.get(lii);
      lParams[lii] = lParam.equals(xiOld) ? xiNew : lParam;
    }
    return LexPool.getPredicated(mPredicate, lParams);
  }

  /**
   * @return the given predicate applied to the first constant, repeated to fill its arity.
   */
  public static Predicated first(Predicate xiPredicate)
  {
    Parameter[] lParams = new Parameter[xiPredicate.getArity()];
    Arrays.fill(lParams, Constant.first());
    return LexPool.getPredicated(xiPredicate, lParams);
  }

  public static Predicated first()
  {
    return first(Predicate.first());
  }

  @Override
  public Predicated next()
  {
    return LexPool.getPredicated(mPredicate.next(), mParams.toArray(new Parameter[mParams.size()]));
  }

  @Override
  public String toString()
  {
    StringBuilder lBuf = new StringBuilder(mPredicate.toString());
    for (Parameter lParam : mParams)
    {
      lBuf.append(lParam);
    }
    return lBuf.toString();
  }
}
