package org.tableaux.base.proof.filters;

import java.util.Collections;
import java.util.Map;

import org.tableaux.base.proof.Node;
import org.tableaux.base.util.lex.Operated;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Predicate;
import org.tableaux.base.util.lex.Predicated;
import org.tableaux.base.util.lex.Quantified;
import org.tableaux.base.util.lex.Quantifier;
import org.tableaux.base.util.lex.Sentence;

import com.google.common.collect.ImmutableMap;

/**
 * Filter on the shape of a node's sentence: its operator, quantifier or predicate.
 *
 * A negated filter looks through one negation: it examines the negatum, and rejects sentences that are not negations.
 * A filter with none of operator, quantifier or predicate passes every node.
 */
public class SentenceFilter implements NodeFilter
{
  private final Operator   mOperator;
  private final Quantifier mQuantifier;
  private final Predicate  mPredicate;
  private final boolean    mNegated;

  private SentenceFilter(Operator xiOperator, Quantifier xiQuantifier, Predicate xiPredicate, boolean xiNegated)
  {
    mOperator = xiOperator;
    mQuantifier = xiQuantifier;
    mPredicate = xiPredicate;
    mNegated = xiNegated;
  }

  public static SentenceFilter operator(Operator xiOperator, boolean xiNegated)
  {
    return new SentenceFilter(xiOperator, null, null, xiNegated);
  }

  public static SentenceFilter quantifier(Quantifier xiQuantifier, boolean xiNegated)
  {
    return new SentenceFilter(null, xiQuantifier, null, xiNegated);
  }

  public static SentenceFilter predicate(Predicate xiPredicate, boolean xiNegated)
  {
    return new SentenceFilter(null, null, xiPredicate, xiNegated);
  }

  /**
   * @return a filter that passes every node.
   */
  public static SentenceFilter any()
  {
    return new SentenceFilter(null, null, null, false);
  }

  public boolean isNegated()
  {
    return mNegated;
  }

  /**
   * @return the sentence the filter examines: the node's sentence, or for a negated filter its negatum.  Null if
   *         there is none.
   */
  public Sentence getSentence(Node xiNode)
  {
    Sentence lSentence = xiNode.getSentence();
    if (lSentence == null)
    {
      return null;
    }
    if (mNegated)
    {
      if (lSentence.getOperator() == Operator.NEGATION)
      {
        return ((Operated)lSentence).getLhs();
      }
      return null;
    }
    return lSentence;
  }

  @Override
  public boolean test(Node xiNode)
  {
    if (mOperator == null && mQuantifier == null && mPredicate == null)
    {
      return true;
    }
    Sentence lSentence = getSentence(xiNode);
    if (lSentence == null)
    {
      return false;
    }
    if (mOperator != null)
    {
      return lSentence instanceof Operated && lSentence.getOperator() == mOperator;
    }
    if (mQuantifier != null)
    {
      return lSentence instanceof Quantified && lSentence.getQuantifier() == mQuantifier;
    }
    return lSentence instanceof Predicated && mPredicate.equals(lSentence.getPredicate());
  }

  /**
   * @return the least sentence passing the filter, or null if the filter imposes no condition.
   */
  public Sentence exampleSentence()
  {
    Sentence lSentence;
    if (mOperator != null)
    {
      lSentence = Operated.first(mOperator);
    }
    else if (mQuantifier != null)
    {
      lSentence = Quantified.first(mQuantifier);
    }
    else if (mPredicate != null)
    {
      lSentence = Predicated.first(mPredicate);
    }
    else
    {
      return null;
    }
    return mNegated ? lSentence.negate() : lSentence;
  }

  @Override
  public Map<String, Object> example()
  {
    Sentence lSentence = exampleSentence();
    if (lSentence == null)
    {
      return Collections.emptyMap();
    }
    return ImmutableMap.<String, Object>of(Node.SENTENCE, lSentence);
  }

  @Override
  public String toString()
  {
    Object lItem = (mOperator != null) ? mOperator : (mQuantifier != null) ? mQuantifier : mPredicate;
    return "SentenceFilter(" + lItem + (mNegated ? ", negated)" : ")");
  }
}
