package org.tableaux.base.proof.rules;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;

/**
 * A rule that closes branches.
 */
public abstract class ClosingRule extends Rule
{
  protected ClosingRule(Tableau xiTableau, String xiName)
  {
    super(xiTableau, xiName);
    mRankOptim = false;
  }

  /**
   * @return whether adding the node would close the branch.
   *
   * @param xiNode - a node, which need not be on the branch.
   * @param xiBranch - the branch.
   */
  public abstract boolean nodeWillCloseBranch(Node xiNode, Branch xiBranch);

  /**
   * @return whether adding any of the nodes would close the branch.
   */
  public boolean nodesWillCloseBranch(Iterable<Node> xiNodes, Branch xiBranch)
  {
    for (Node lNode : xiNodes)
    {
      if (nodeWillCloseBranch(lNode, xiBranch))
      {
        return true;
      }
    }
    return false;
  }

  @Override
  protected void applyTarget(Target xiTarget)
  {
    xiTarget.getBranch().close();
  }
}
