package org.tableaux.base.proof.helpers;

import java.util.LinkedHashMap;
import java.util.Map;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Target;

/**
 * Counts, per branch, how many times the rule has applied to each node.
 */
public class NodeCount extends BranchCache<Map<Node, Integer>>
{
  public NodeCount(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  protected Map<Node, Integer> newValue()
  {
    return new LinkedHashMap<>();
  }

  @Override
  protected Map<Node, Integer> copyValue(Map<Node, Integer> xiValue)
  {
    return new LinkedHashMap<>(xiValue);
  }

  public int count(Branch xiBranch, Node xiNode)
  {
    Integer lCount = get(xiBranch).get(xiNode);
    return (lCount == null) ? 0 : lCount;
  }

  /**
   * @return the least application count of any node counted on the branch, or 0.
   */
  public int min(Branch xiBranch)
  {
    Map<Node, Integer> lCounts = get(xiBranch);
    if (lCounts.isEmpty())
    {
      return 0;
    }
    int lMin = Integer.MAX_VALUE;
    for (int lCount : lCounts.values())
    {
      lMin = Math.min(lMin, lCount);
    }
    return Math.max(0, lMin);
  }

  /**
   * @return whether no node on the branch has been applied to fewer times than this one.
   */
  public boolean isLeast(Node xiNode, Branch xiBranch)
  {
    return min(xiBranch) >= count(xiBranch, xiNode);
  }

  @Override
  public void afterApply(Target xiTarget)
  {
    if (xiTarget.getFlag() == null && !xiTarget.getBranch().isClosed())
    {
      Node lNode = xiTarget.getNode();
      get(xiTarget.getBranch()).put(lNode, count(xiTarget.getBranch(), lNode) + 1);
    }
  }
}
