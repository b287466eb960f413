package org.tableaux.base.proof.helpers;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Target;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * Records, per branch, the (node, world) pairs the rule has applied to.
 */
public class NodesWorlds extends BranchCache<SetMultimap<Node, Integer>>
{
  public NodesWorlds(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  protected SetMultimap<Node, Integer> newValue()
  {
    return LinkedHashMultimap.create();
  }

  @Override
  protected SetMultimap<Node, Integer> copyValue(SetMultimap<Node, Integer> xiValue)
  {
    return LinkedHashMultimap.create(xiValue);
  }

  public boolean contains(Branch xiBranch, Node xiNode, int xiWorld)
  {
    return get(xiBranch).containsEntry(xiNode, xiWorld);
  }

  @Override
  public void afterApply(Target xiTarget)
  {
    if (xiTarget.getFlag() == null && !xiTarget.getBranch().isClosed())
    {
      get(xiTarget.getBranch()).put(xiTarget.getNode(), xiTarget.getWorld());
    }
  }
}
