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
import org.tableaux.base.util.lex.Sentence;

/**
 * Projects, once the trunk is built, the most constants each branch should need at any world.
 *
 * The projection for a trunk is its constant count times its quantifier count, plus one.  Attaches a
 * {@link WorldConsts} to the rule if it has none.
 */
public class MaxConsts extends RuleHelper
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Map<Branch, Integer> mMax = new HashMap<>();

  public MaxConsts(Rule xiRule)
  {
    super(xiRule);
    if (!xiRule.hasHelper(WorldConsts.class))
    {
      new WorldConsts(xiRule);
    }
  }

  /**
   * @return the projected maximum for the branch's trunk, or 1 if none was projected.
   */
  public int getMax(Branch xiBranch)
  {
    Integer lMax = mMax.get(xiBranch.getOrigin());
    return (lMax == null) ? 1 : lMax;
  }

  private int count(Branch xiBranch, Integer xiWorld)
  {
    return mRule.getHelper(WorldConsts.class).at(xiBranch, xiWorld).size();
  }

  public boolean isReached(Branch xiBranch, Integer xiWorld)
  {
    return count(xiBranch, xiWorld) >= getMax(xiBranch);
  }

  public boolean isExceeded(Branch xiBranch, Integer xiWorld)
  {
    return count(xiBranch, xiWorld) > getMax(xiBranch);
  }

  /**
   * @return a quit flag node recording the bound.
   */
  public Node quitFlag(Branch xiBranch)
  {
    LOGGER.debug("{} reached its constant bound on branch {}", mRule.getName(), xiBranch.getIndex());
    return Node.flagNode(Node.QUIT_FLAG, mRule.getName() + ":MaxConsts(" + getMax(xiBranch) + ")");
  }

  @Override
  public void afterTrunkBuild(Tableau xiTableau)
  {
    for (Branch lBranch : xiTableau)
    {
      int lQuantifiers = 0;
      for (Node lNode : lBranch)
      {
        Sentence lSentence = lNode.getSentence();
        if (lSentence != null)
        {
          lQuantifiers += lSentence.getQuantifiers().size();
        }
      }
      int lMax = Math.max(1, lBranch.getConstants().size()) * Math.max(1, lQuantifiers) + 1;
      mMax.put(lBranch.getOrigin(), lMax);
    }
  }
}
