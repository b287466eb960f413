package org.tableaux.base.logics.rules;

import java.util.ArrayList;
import java.util.List;

import org.tableaux.base.proof.Access;
import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.ModalFilter;
import org.tableaux.base.proof.filters.SentenceFilter;
import org.tableaux.base.proof.helpers.NodeCount;
import org.tableaux.base.proof.helpers.NodesWorlds;
import org.tableaux.base.proof.helpers.WorldIndex;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Sentence;

/**
 * From a necessity at w, add its operand at every world w' with w R w'.  The node is never ticked, since new access
 * nodes may give it new targets.
 */
public class NecessityRule extends WorldBoundRule
{
  private final NodeCount   mNodeCount;
  private final NodesWorlds mNodesWorlds;
  private final WorldIndex  mWorldIndex;

  public NecessityRule(Tableau xiTableau)
  {
    super(xiTableau,
          "Necessity",
          SentenceFilter.operator(Operator.NECESSITY, false),
          new ModalFilter(true, null));
    mTicking = false;
    mNodeCount = new NodeCount(this);
    mNodesWorlds = new NodesWorlds(this);
    mWorldIndex = new WorldIndex(this);
  }

  @Override
  protected List<Target> modalTargets(Node xiNode, Sentence xiOperand, Branch xiBranch)
  {
    List<Target> lTargets = new ArrayList<>();

    // Take turns between necessity nodes.
    if (!mNodeCount.isLeast(xiNode, xiBranch))
    {
      return lTargets;
    }

    int lWorld1 = xiNode.getWorld();
    for (int lWorld2 : mWorldIndex.visible(xiBranch, lWorld1))
    {
      if (mNodesWorlds.contains(xiBranch, xiNode, lWorld2))
      {
        continue;
      }
      Node lAdd = Node.swnode(xiOperand, lWorld2);
      if (xiBranch.has(lAdd.getProps()))
      {
        continue;
      }
      Node lAccess = mWorldIndex.getNode(xiBranch, new Access(lWorld1, lWorld2));
      Target lTarget = new Target(xiBranch).setAdds(lAdd).setSentence(xiOperand).setWorld(lWorld2);
      if (lAccess != null)
      {
        lTarget.setNodes(xiNode, lAccess);
      }
      lTargets.add(lTarget);
    }
    return lTargets;
  }

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
    if (mNodeCount.count(xiTarget.getBranch(), xiTarget.getNode()) == 0)
    {
      return 1.0;
    }
    return -getTableau().branchingComplexity(xiTarget.getNode());
  }

  @Override
  public double groupScore(Target xiTarget)
  {
    if (xiTarget.getCandidateScore() > 0)
    {
      return 1.0;
    }
    return -mNodeCount.count(xiTarget.getBranch(), xiTarget.getNode());
  }

  @Override
  public List<Node> exampleNodes()
  {
    List<Node> lNodes = new ArrayList<>();
    lNodes.add(Node.swnode(Operator.NECESSITY.apply(Sentence.first()), 0));
    lNodes.add(Node.anode(0, 1));
    return lNodes;
  }
}
