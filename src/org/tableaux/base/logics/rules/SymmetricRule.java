package org.tableaux.base.logics.rules;

import java.util.ArrayList;
import java.util.List;

import org.tableaux.base.proof.Access;
import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.ModalFilter;
import org.tableaux.base.proof.helpers.MaxWorlds;
import org.tableaux.base.proof.helpers.WorldIndex;
import org.tableaux.base.proof.rules.BaseNodeRule;

/**
 * Symmetry: from w1 R w2, add w2 R w1.
 */
public class SymmetricRule extends BaseNodeRule
{
  private final MaxWorlds  mMaxWorlds;
  private final WorldIndex mWorldIndex;

  public SymmetricRule(Tableau xiTableau)
  {
    super(xiTableau, "Symmetric", new ModalFilter(null, true));
    mTicking = false;
    mRankOptim = false;
    mMaxWorlds = new MaxWorlds(this);
    mWorldIndex = new WorldIndex(this);
  }

  @Override
  public List<Target> nodeTargets(Node xiNode, Branch xiBranch)
  {
    List<Target> lTargets = new ArrayList<>();
    Access lReversed = Access.forNode(xiNode).reversed();
    if (!mMaxWorlds.isExceeded(xiBranch) && !mWorldIndex.has(xiBranch, lReversed))
    {
      lTargets.add(new Target(xiBranch).setAdds(lReversed.toNode())
                                       .setWorld1(lReversed.getWorld1())
                                       .setWorld2(lReversed.getWorld2()));
    }
    else
    {
      mFilter.release(xiNode, xiBranch);
    }
    return lTargets;
  }
}
