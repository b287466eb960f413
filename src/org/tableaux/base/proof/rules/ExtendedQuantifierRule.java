package org.tableaux.base.proof.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.NodeFilter;
import org.tableaux.base.proof.helpers.NodeConsts;
import org.tableaux.base.proof.helpers.NodeCount;
import org.tableaux.base.util.lex.Constant;

/**
 * A quantifier rule that instantiates with every constant on the branch, or with the first constant if there are
 * none.  The node is never ticked, so the rule fires again as new constants appear.  It shares the constant bound of
 * {@link NarrowQuantifierRule}: once the branch is past it, the rule flags the branch and stops.
 */
public abstract class ExtendedQuantifierRule extends NarrowQuantifierRule
{
  protected final NodeConsts mNodeConsts;
  protected final NodeCount  mNodeCount;

  protected ExtendedQuantifierRule(Tableau xiTableau, String xiName, NodeFilter... xiFilters)
  {
    super(xiTableau, xiName, xiFilters);
    mTicking = false;
    mNodeConsts = new NodeConsts(this);
    mNodeCount = new NodeCount(this);
  }

  @Override
  protected List<Target> quantifierTargets(Node xiNode, Branch xiBranch)
  {
    List<Target> lTargets = new ArrayList<>();
    SortedSet<Constant> lUnapplied = mNodeConsts.unapplied(xiBranch, xiNode);
    if (!xiBranch.getConstants().isEmpty() && lUnapplied.isEmpty())
    {
      return lTargets;
    }

    SortedSet<Constant> lConstants = new TreeSet<>(lUnapplied);
    if (lConstants.isEmpty())
    {
      lConstants.add(Constant.first());
    }
    for (Constant lConstant : lConstants)
    {
      List<Node> lNodes = constantNodes(xiNode, lConstant, xiBranch);
      if (!lUnapplied.isEmpty() || !xiBranch.all(lNodes))
      {
        lTargets.add(new Target(xiBranch).setAdds(lNodes.toArray(new Node[lNodes.size()])).setConstant(lConstant));
      }
    }
    return lTargets;
  }

  /**
   * @return the nodes to add when instantiating the node with a constant.
   */
  protected abstract List<Node> constantNodes(Node xiNode, Constant xiConstant, Branch xiBranch);

  @Override
  public double scoreCandidate(Target xiTarget)
  {
    if (xiTarget.getFlag() != null)
    {
      return 1.0;
    }
    if (mAdz.closureScore(xiTarget) == 1.0)
    {
      return 1.0;
    }
    return 1.0 / (mNodeCount.count(xiTarget.getBranch(), xiTarget.getNode()) + 1);
  }
}
