package org.tableaux.base.logics.rules;

import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.NodeFilter;
import org.tableaux.base.proof.helpers.MaxWorlds;
import org.tableaux.base.proof.helpers.QuitFlag;
import org.tableaux.base.proof.rules.BaseNodeRule;
import org.tableaux.base.util.lex.Operated;
import org.tableaux.base.util.lex.Sentence;

/**
 * A modal operator rule bounded by the branch's projected world count.  Past the bound it adds a single quit flag to
 * the branch and stops.
 */
public abstract class WorldBoundRule extends BaseNodeRule
{
  protected final QuitFlag  mQuitFlag;
  protected final MaxWorlds mMaxWorlds;

  protected WorldBoundRule(Tableau xiTableau, String xiName, NodeFilter... xiFilters)
  {
    super(xiTableau, xiName, xiFilters);
    mQuitFlag = new QuitFlag(this);
    mMaxWorlds = new MaxWorlds(this);
  }

  @Override
  public List<Target> nodeTargets(Node xiNode, Branch xiBranch)
  {
    if (mMaxWorlds.isExceeded(xiBranch))
    {
      mFilter.release(xiNode, xiBranch);
      if (mQuitFlag.isFlagged(xiBranch))
      {
        return Collections.emptyList();
      }
      return Collections.singletonList(new Target(xiBranch).setAdds(mMaxWorlds.quitFlag(xiBranch))
                                                           .setFlag(Node.QUIT_FLAG));
    }
    return modalTargets(xiNode, ((Operated)sentence(xiNode)).getLhs(), xiBranch);
  }

  /**
   * @return the targets for a node within the world bound.
   *
   * @param xiNode - the node.
   * @param xiOperand - the operand of the node's modal operator.
   * @param xiBranch - the branch.
   */
  protected abstract List<Target> modalTargets(Node xiNode, Sentence xiOperand, Branch xiBranch);
}
