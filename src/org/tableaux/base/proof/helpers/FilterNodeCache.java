package org.tableaux.base.proof.helpers;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;

/**
 * Keeps, per branch, the nodes that pass a filter.
 *
 * Nodes can be released from a branch's set; released nodes are dropped on the next {@link #gc}.
 */
public abstract class FilterNodeCache extends BranchCache<Set<Node>>
{
  private final List<Object[]> mGarbage = new ArrayList<>();

  protected FilterNodeCache(Rule xiRule)
  {
    super(xiRule);
  }

  /**
   * @return whether the node is to be tracked on the branch.
   */
  public abstract boolean filter(Node xiNode, Branch xiBranch);

  /**
   * @return whether ticked nodes are dropped.
   */
  protected abstract boolean isIgnoreTicked();

  @Override
  protected Set<Node> newValue()
  {
    return new LinkedHashSet<>();
  }

  @Override
  protected Set<Node> copyValue(Set<Node> xiValue)
  {
    return new LinkedHashSet<>(xiValue);
  }

  /**
   * Queue a node for removal from a branch's set.
   */
  public void release(Node xiNode, Branch xiBranch)
  {
    mGarbage.add(new Object[] {xiBranch, xiNode});
  }

  /**
   * Drop the released nodes.
   */
  public void gc()
  {
    for (Object[] lEntry : mGarbage)
    {
      Set<Node> lNodes = mCache.get(lEntry[0]);
      if (lNodes != null)
      {
        lNodes.remove(lEntry[1]);
      }
    }
    mGarbage.clear();
  }

  @Override
  public void afterNodeAdd(Node xiNode, Branch xiBranch)
  {
    if (filter(xiNode, xiBranch))
    {
      get(xiBranch).add(xiNode);
    }
  }

  @Override
  public void afterNodeTick(Node xiNode, Branch xiBranch)
  {
    if (isIgnoreTicked())
    {
      get(xiBranch).remove(xiNode);
    }
  }
}
