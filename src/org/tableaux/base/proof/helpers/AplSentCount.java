package org.tableaux.base.proof.helpers;

import java.util.LinkedHashMap;
import java.util.Map;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Target;
import org.tableaux.base.util.lex.Sentence;

/**
 * Counts, per branch, how many times the rule has applied with each target sentence.
 */
public class AplSentCount extends BranchCache<Map<Sentence, Integer>>
{
  public AplSentCount(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  protected Map<Sentence, Integer> newValue()
  {
    return new LinkedHashMap<>();
  }

  @Override
  protected Map<Sentence, Integer> copyValue(Map<Sentence, Integer> xiValue)
  {
    return new LinkedHashMap<>(xiValue);
  }

  public int count(Branch xiBranch, Sentence xiSentence)
  {
    Integer lCount = get(xiBranch).get(xiSentence);
    return (lCount == null) ? 0 : lCount;
  }

  @Override
  public void afterApply(Target xiTarget)
  {
    if (xiTarget.getFlag() == null && !xiTarget.getBranch().isClosed())
    {
      Map<Sentence, Integer> lCounts = get(xiTarget.getBranch());
      lCounts.put(xiTarget.getSentence(), count(xiTarget.getBranch(), xiTarget.getSentence()) + 1);
    }
  }
}
