package org.tableaux.base.util.lex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

/**
 * A well-formed formula: {@link Atomic}, {@link Predicated}, {@link Quantified} or {@link Operated}.
 *
 * The derived collections (predicates, constants, variables, atomics, operators, quantifiers) are built on first use
 * from those of the immediate sub-sentences and never change afterwards.
 */
public abstract class Sentence extends Lexical
{
  private static final long serialVersionUID = 1L;

  /**
   * Accumulates the derived collections of a sentence.
   */
  protected static final class Collector
  {
    final ImmutableSortedSet.Builder<Predicate> mPredicates  = ImmutableSortedSet.naturalOrder();
    final ImmutableSortedSet.Builder<Constant>  mConstants   = ImmutableSortedSet.naturalOrder();
    final ImmutableSortedSet.Builder<Variable>  mVariables   = ImmutableSortedSet.naturalOrder();
    final ImmutableSortedSet.Builder<Atomic>    mAtomics     = ImmutableSortedSet.naturalOrder();
    final ImmutableList.Builder<Operator>       mOperators   = ImmutableList.builder();
    final ImmutableList.Builder<Quantifier>     mQuantifiers = ImmutableList.builder();

    void addAll(Sentence xiSentence)
    {
      mPredicates.addAll(xiSentence.getPredicates());
      mConstants.addAll(xiSentence.getConstants());
      mVariables.addAll(xiSentence.getVariables());
      mAtomics.addAll(xiSentence.getAtomics());
      mOperators.addAll(xiSentence.getOperators());
      mQuantifiers.addAll(xiSentence.getQuantifiers());
    }

    void addParameter(Parameter xiParam)
    {
      if (xiParam.isConstant())
      {
        mConstants.add((Constant)xiParam);
      }
      else
      {
        mVariables.add((Variable)xiParam);
      }
    }
  }

  private transient ImmutableSortedSet<Predicate> mPredicates;
  private transient ImmutableSortedSet<Constant>  mConstants;
  private transient ImmutableSortedSet<Variable>  mVariables;
  private transient ImmutableSortedSet<Atomic>    mAtomics;
  private transient ImmutableList<Operator>       mOperators;
  private transient ImmutableList<Quantifier>     mQuantifiers;

  /**
   * Add this sentence's own contributions, and those of its sub-sentences, to the collector.
   */
  protected abstract void collect(Collector xiCollector);

  /**
   * @return the recursive substitution of xiNew for every occurrence of xiOld, or this sentence itself if nothing
   * changes.
   */
  public abstract Sentence substitute(Parameter xiNew, Parameter xiOld);

  @Override
  public abstract Sentence next();

  private void derive()
  {
    Collector lCollector = new Collector();
    collect(lCollector);
    mConstants = lCollector.mConstants.build();
    mVariables = lCollector.mVariables.build();
    mAtomics = lCollector.mAtomics.build();
    mOperators = lCollector.mOperators.build();
    mQuantifiers = lCollector.mQuantifiers.build();
    mPredicates = lCollector.mPredicates.build();
  }

  public ImmutableSortedSet<Predicate> getPredicates()
  {
    if (mPredicates == null)
    {
      derive();
    }
    return mPredicates;
  }

  public ImmutableSortedSet<Constant> getConstants()
  {
    if (mPredicates == null)
    {
      derive();
    }
    return mConstants;
  }

  public ImmutableSortedSet<Variable> getVariables()
  {
    if (mPredicates == null)
    {
      derive();
    }
    return mVariables;
  }

  public ImmutableSortedSet<Atomic> getAtomics()
  {
    if (mPredicates == null)
    {
      derive();
    }
    return mAtomics;
  }

  /**
   * @return the operators, in order of occurrence, with repetition.
   */
  public ImmutableList<Operator> getOperators()
  {
    if (mPredicates == null)
    {
      derive();
    }
    return mOperators;
  }

  /**
   * @return the quantifiers, in order of occurrence, with repetition.
   */
  public ImmutableList<Quantifier> getQuantifiers()
  {
    if (mPredicates == null)
    {
      derive();
    }
    return mQuantifiers;
  }

  /**
   * @return whether the variable occurs anywhere in the sentence.
   */
  public boolean variableOccurs(Variable xiVariable)
  {
    return getVariables().contains(xiVariable);
  }

  /**
   * @return the operator of an operated sentence, otherwise null.
   */
  public Operator getOperator()
  {
    return null;
  }

  /**
   * @return the quantifier of a quantified sentence, otherwise null.
   */
  public Quantifier getQuantifier()
  {
    return null;
  }

  /**
   * @return the predicate of a predicated sentence, otherwise null.
   */
  public Predicate getPredicate()
  {
    return null;
  }

  public boolean isNegated()
  {
    return getOperator() == Operator.NEGATION;
  }

  public Operated negate()
  {
    return LexPool.getOperated(Operator.NEGATION, this);
  }

  /**
   * @return the negatum if this is a negation, otherwise the negation of this sentence.
   */
  public Sentence negative()
  {
    return negate();
  }

  public Operated asserted()
  {
    return LexPool.getOperated(Operator.ASSERTION, this);
  }

  public Operated conjoin(Sentence xiOther)
  {
    return LexPool.getOperated(Operator.CONJUNCTION, this, xiOther);
  }

  public Operated disjoin(Sentence xiOther)
  {
    return LexPool.getOperated(Operator.DISJUNCTION, this, xiOther);
  }

  public static Sentence first()
  {
    return Atomic.first();
  }
}
