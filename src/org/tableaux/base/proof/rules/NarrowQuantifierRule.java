package org.tableaux.base.proof.rules;

import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.NodeFilter;
import org.tableaux.base.proof.helpers.MaxConsts;
import org.tableaux.base.proof.helpers.QuitFlag;

/**
 * A quantifier rule that instantiates with a new constant, up to the branch's constant bound.  Past the bound it adds
 * a single quit flag to the branch and stops.
 */
public abstract class NarrowQuantifierRule extends BaseNodeRule
{
  protected final QuitFlag  mQuitFlag;
  protected final MaxConsts mMaxConsts;

  protected NarrowQuantifierRule(Tableau xiTableau, String xiName, NodeFilter... xiFilters)
  {
    super(xiTableau, xiName, xiFilters);
    mQuitFlag = new QuitFlag(this);
    mMaxConsts = new MaxConsts(this);
  }

  @Override
  public List<Target> nodeTargets(Node xiNode, Branch xiBranch)
  {
    if (mMaxConsts.isExceeded(xiBranch, xiNode.getWorld()))
    {
      mFilter.release(xiNode, xiBranch);
      if (mQuitFlag.isFlagged(xiBranch))
      {
        return Collections.emptyList();
      }
      return Collections.singletonList(new Target(xiBranch).setAdds(mMaxConsts.quitFlag(xiBranch))
                                                           .setFlag(Node.QUIT_FLAG));
    }
    return quantifierTargets(xiNode, xiBranch);
  }

  /**
   * @return the targets for a node within the constant bound.
   */
  protected abstract List<Target> quantifierTargets(Node xiNode, Branch xiBranch);

  @Override
  public double scoreCandidate(Target xiTarget)
  {
    return -getTableau().branchingComplexity(xiTarget.getNode());
  }
}
