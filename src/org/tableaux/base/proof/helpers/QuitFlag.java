package org.tableaux.base.proof.helpers;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Target;

/**
 * Tracks, per branch, whether the rule's last application there was a flag (i.e. the rule quit at a bound).
 */
public class QuitFlag extends BranchCache<Boolean>
{
  public QuitFlag(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  protected Boolean newValue()
  {
    return Boolean.FALSE;
  }

  @Override
  protected Boolean copyValue(Boolean xiValue)
  {
    return xiValue;
  }

  public boolean isFlagged(Branch xiBranch)
  {
    return get(xiBranch);
  }

  @Override
  public void afterApply(Target xiTarget)
  {
    if (!xiTarget.getBranch().isClosed())
    {
      mCache.put(xiTarget.getBranch(), xiTarget.getFlag() != null);
    }
  }
}
