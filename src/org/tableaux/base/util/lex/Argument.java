package org.tableaux.base.util.lex;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An argument: a conclusion and zero or more premises, with an optional title.
 *
 * Equality, hashing and ordering are over the sentence sequence (conclusion first) and ignore the title.
 */
public final class Argument implements Comparable<Argument>, Serializable
{
  private static final long serialVersionUID = 1L;

  private final ImmutableList<Sentence> mSeq;
  private final String                  mTitle;

  public Argument(Sentence xiConclusion, List<? extends Sentence> xiPremises, String xiTitle)
  {
    if (xiConclusion == null)
    {
      throw new IllegalArgumentException("Argument requires a conclusion");
    }
    mSeq = ImmutableList.<Sentence>builder().add(xiConclusion).addAll(xiPremises).build();
    mTitle = xiTitle;
  }

  public Argument(Sentence xiConclusion, Sentence... xiPremises)
  {
    this(xiConclusion, Arrays.asList(xiPremises), null);
  }

  public Sentence getConclusion()
  {
    return mSeq.get(0);
  }

  public ImmutableList<Sentence> getPremises()
  {
    return mSeq.subList(1, mSeq.size());
  }

  /**
   * @return the conclusion followed by the premises.
   */
  public ImmutableList<Sentence> getSeq()
  {
    return mSeq;
  }

  public String getTitle()
  {
    return mTitle;
  }

  /**
   * @return a copy of this argument with a different title.
   */
  public Argument withTitle(String xiTitle)
  {
    return new Argument(getConclusion(), getPremises(), xiTitle);
  }

  /**
   * Orders first by the number of sentences, then sentence by sentence.
   */
  @Override
  public int compareTo(Argument xiOther)
  {
    int lCmp = Integer.compare(mSeq.size(), xiOther.mSeq.size());
    for (int lii = 0; lCmp == 0 && lii < mSeq.size(); lii++)
    {
      lCmp = Lexical.orderItems(mSeq.get(lii), xiOther.mSeq.get(lii));
    }
    return lCmp;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof Argument) && mSeq.equals(((Argument)xiOther).mSeq);
  }

  @Override
  public int hashCode()
  {
    return mSeq.hashCode();
  }

  @Override
  public String toString()
  {
    StringBuilder lBuf = new StringBuilder();
    if (mTitle != null)
    {
      lBuf.append(mTitle).append(": ");
    }
    lBuf.append(getPremises()).append(" |- ").append(getConclusion());
    return lBuf.toString();
  }
}
