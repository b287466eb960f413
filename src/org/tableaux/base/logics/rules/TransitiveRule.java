package org.tableaux.base.logics.rules;

import java.util.ArrayList;
import java.util.Arrays;
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
 * Transitivity: from w1 R w2 and w2 R w3, add w1 R w3.
 */
public class TransitiveRule extends BaseNodeRule
{
  private final MaxWorlds  mMaxWorlds;
  private final WorldIndex mWorldIndex;

  public TransitiveRule(Tableau xiTableau)
  {
    super(xiTableau, "Transitive", new ModalFilter(null, true));
    mTicking = false;
    mMaxWorlds = new MaxWorlds(this);
    mWorldIndex = new WorldIndex(this);
  }

  @Override
  public List<Target> nodeTargets(Node xiNode, Branch xiBranch)
  {
    List<Target> lTargets = new ArrayList<>();
    if (mMaxWorlds.isReached(xiBranch))
    {
      mFilter.release(xiNode, xiBranch);
      return lTargets;
    }

    int lWorld1 = xiNode.getWorld1();
    int lWorld2 = xiNode.getWorld2();
    for (int lWorld3 : mWorldIndex.intransitives(xiBranch, lWorld1, lWorld2))
    {
      Node lVia = mWorldIndex.getNode(xiBranch, new Access(lWorld2, lWorld3));
      Target lTarget = new Target(xiBranch).setAdds(Node.anode(lWorld1, lWorld3))
                                           .setWorld1(lWorld1)
                                           .setWorld2(lWorld3);
      if (lVia != null)
      {
        lTarget.setNodes(xiNode, lVia);
      }
      lTargets.add(lTarget);
    }
    return lTargets;
  }

  @Override
  public double scoreCandidate(Target xiTarget)
  {
    return xiTarget.getWorld2();
  }

  @Override
  public List<Node> exampleNodes()
  {
    return Arrays.asList(Node.anode(0, 1), Node.anode(1, 2));
  }
}
