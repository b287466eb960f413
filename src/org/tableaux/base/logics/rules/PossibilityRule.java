package org.tableaux.base.logics.rules;

import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.ModalFilter;
import org.tableaux.base.proof.filters.SentenceFilter;
import org.tableaux.base.proof.helpers.AplSentCount;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Sentence;

/**
 * From a possibility at w, add its operand at a new world w' with w R w', and tick the node.
 */
public class PossibilityRule extends WorldBoundRule
{
  private final AplSentCount mSentCount;

  public PossibilityRule(Tableau xiTableau)
  {
    super(xiTableau,
          "Possibility",
          SentenceFilter.operator(Operator.POSSIBILITY, false),
          new ModalFilter(true, null));
    mSentCount = new AplSentCount(this);
  }

  @Override
  protected List<Target> modalTargets(Node xiNode, Sentence xiOperand, Branch xiBranch)
  {
    int lWorld1 = xiNode.getWorld();
    int lWorld2 = xiBranch.newWorld();
    return Collections.singletonList(new Target(xiBranch).setAdds(Node.swnode(xiOperand, lWorld2),
                                                                  Node.anode(lWorld1, lWorld2))
                                                         .setSentence(xiOperand)
                                                         .setWorld1(lWorld1)
                                                         .setWorld2(lWorld2));
  }

  /**
   * Prefer operands not yet applied on the branch, then those with fewer modal operators.
   */
  @Override
  public double scoreCandidate(Target xiTarget)
  {
    if (xiTarget.getFlag() != null)
    {
      return 1.0;
    }
    int lCount = mSentCount.count(xiTarget.getBranch(), xiTarget.getSentence());
    if (lCount == 0)
    {
      return 1.0;
    }
    return -mMaxWorlds.modals(xiTarget.getSentence()) * lCount;
  }

  @Override
  public double groupScore(Target xiTarget)
  {
    if (xiTarget.getCandidateScore() > 0)
    {
      return 1.0;
    }
    return -mSentCount.count(xiTarget.getBranch(), xiTarget.getSentence());
  }
}
