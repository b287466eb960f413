package org.tableaux.base.proof.helpers;

import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.RuleHelper;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.rules.ClosingRule;

/**
 * Applies a target's add-groups, and scores targets by how many of their groups would close a branch.
 */
public class AdzHelper extends RuleHelper
{
  public AdzHelper(Rule xiRule)
  {
    super(xiRule);
  }

  /**
   * Apply the target's add-groups.  Each group after the first goes on a new copy of the branch; the first goes on the
   * branch itself.  The target node is ticked on each resulting branch if the rule ticks.
   */
  public void apply(Target xiTarget)
  {
    Branch lBranch = xiTarget.getBranch();
    List<List<Node>> lAdds = xiTarget.getAdds();
    Node lNode = xiTarget.getNode();
    boolean lTick = mRule.isTicking() && lNode != null;

    for (int lii = 1; lii < lAdds.size(); lii++)
    {
      Branch lNew = getTableau().branch(lBranch);
      lNew.extend(lAdds.get(lii));
      if (lTick)
      {
        lNew.tick(lNode);
      }
    }
    lBranch.extend(lAdds.get(0));
    if (lTick)
    {
      lBranch.tick(lNode);
    }
  }

  /**
   * @return the fraction of the target's add-groups that would close the branch.
   */
  public double closureScore(Target xiTarget)
  {
    List<Rule> lClosureRules = getTableau().getRules().getClosureGroup().getRules();
    List<List<Node>> lAdds = xiTarget.getAdds();
    if (lClosureRules.isEmpty() || lAdds == null)
    {
      return 0;
    }

    int lCloseCount = 0;
    for (List<Node> lGroup : lAdds)
    {
      for (Rule lRule : lClosureRules)
      {
        if (((ClosingRule)lRule).nodesWillCloseBranch(lGroup, xiTarget.getBranch()))
        {
          lCloseCount++;
          break;
        }
      }
    }
    return lCloseCount / (double)Math.max(1, lAdds.size());
  }
}
