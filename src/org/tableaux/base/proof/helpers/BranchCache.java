package org.tableaux.base.proof.helpers;

import java.util.HashMap;
import java.util.Map;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.RuleHelper;

/**
 * Helper that keeps one value per open branch.  A new branch starts with a copy of its parent's value, and a closed
 * branch's value is dropped.
 *
 * @param <V> - the value type.
 */
public abstract class BranchCache<V> extends RuleHelper
{
  protected final Map<Branch, V> mCache = new HashMap<>();

  protected BranchCache(Rule xiRule)
  {
    super(xiRule);
  }

  /**
   * @return the value for a branch with no parent.
   */
  protected abstract V newValue();

  /**
   * @return a copy of a parent's value, for a child branch.
   */
  protected abstract V copyValue(V xiValue);

  /**
   * @return the value for a branch, created if not yet known.
   */
  public V get(Branch xiBranch)
  {
    V lValue = mCache.get(xiBranch);
    if (lValue == null)
    {
      lValue = newValue();
      mCache.put(xiBranch, lValue);
    }
    return lValue;
  }

  @Override
  public void afterBranchAdd(Branch xiBranch)
  {
    Branch lParent = xiBranch.getParent();
    V lParentValue = (lParent == null) ? null : mCache.get(lParent);
    mCache.put(xiBranch, (lParentValue == null) ? newValue() : copyValue(lParentValue));
  }

  @Override
  public void afterBranchClose(Branch xiBranch)
  {
    mCache.remove(xiBranch);
  }
}
