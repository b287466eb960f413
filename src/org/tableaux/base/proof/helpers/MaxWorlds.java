package org.tableaux.base.proof.helpers;

import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.RuleHelper;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Sentence;

/**
 * Projects, once the trunk is built, the most worlds each branch should need: the worlds on the trunk, plus the modal
 * operators in its unticked sentences, plus one.  Branches of a trunk with no projection are unbounded.
 */
public class MaxWorlds extends RuleHelper
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Map<Branch, Integer>   mMax    = new HashMap<>();
  private final Map<Sentence, Integer> mModals = new HashMap<>();

  public MaxWorlds(Rule xiRule)
  {
    super(xiRule);
  }

  /**
   * @return the number of modal operators in the sentence.
   */
  public int modals(Sentence xiSentence)
  {
    Integer lCount = mModals.get(xiSentence);
    if (lCount == null)
    {
      int lModals = 0;
      for (Operator lOperator : xiSentence.getOperators())
      {
        if (lOperator.isModal())
        {
          lModals++;
        }
      }
      lCount = lModals;
      mModals.put(xiSentence, lCount);
    }
    return lCount;
  }

  /**
   * @return the projected maximum for the branch's trunk, or null.
   */
  public Integer getMax(Branch xiBranch)
  {
    return mMax.get(xiBranch.getOrigin());
  }

  public boolean isReached(Branch xiBranch)
  {
    Integer lMax = getMax(xiBranch);
    return lMax != null && xiBranch.getWorlds().size() >= lMax;
  }

  public boolean isExceeded(Branch xiBranch)
  {
    Integer lMax = getMax(xiBranch);
    return lMax != null && xiBranch.getWorlds().size() > lMax;
  }

  /**
   * @return a quit flag node recording the bound.
   */
  public Node quitFlag(Branch xiBranch)
  {
    LOGGER.debug("{} reached its world bound on branch {}", mRule.getName(), xiBranch.getIndex());
    return Node.flagNode(Node.QUIT_FLAG, mRule.getName() + ":MaxWorlds(" + getMax(xiBranch) + ")");
  }

  @Override
  public void afterTrunkBuild(Tableau xiTableau)
  {
    for (Branch lBranch : xiTableau)
    {
      int lMax = 1 + lBranch.getWorlds().size();
      for (Node lNode : lBranch)
      {
        if (lNode.getSentence() != null && !lBranch.isTicked(lNode))
        {
          lMax += modals(lNode.getSentence());
        }
      }
      mMax.put(lBranch.getOrigin(), lMax);
    }
  }
}
