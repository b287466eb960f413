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
 * Reflexivity: every world on the branch sees itself.
 */
public class ReflexiveRule extends BaseNodeRule
{
  private final MaxWorlds  mMaxWorlds;
  private final WorldIndex mWorldIndex;

  public ReflexiveRule(Tableau xiTableau)
  {
    super(xiTableau, "Reflexive", new ModalFilter(true, null));
    mTicking = false;
    mIgnoreTicked = false;
    mRankOptim = false;
    mMaxWorlds = new MaxWorlds(this);
    mWorldIndex = new WorldIndex(this);
  }

  @Override
  public List<Target> nodeTargets(Node xiNode, Branch xiBranch)
  {
    List<Target> lTargets = new ArrayList<>();
    if (!mMaxWorlds.isExceeded(xiBranch))
    {
      for (int lWorld : xiNode.getWorlds())
      {
        if (!mWorldIndex.has(xiBranch, new Access(lWorld, lWorld)))
        {
          lTargets.add(new Target(xiBranch).setAdds(Node.anode(lWorld, lWorld)).setWorld(lWorld));
        }
      }
    }

    // A world stays reflexive, so a node with nothing left to do is done for good.
    if (lTargets.isEmpty())
    {
      mFilter.release(xiNode, xiBranch);
    }
    return lTargets;
  }
}
