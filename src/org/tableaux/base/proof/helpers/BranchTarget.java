package org.tableaux.base.proof.helpers;

import java.util.HashMap;
import java.util.Map;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.RuleHelper;
import org.tableaux.base.proof.Target;

/**
 * Checks each node added to a branch and keeps the first target found for the branch.
 */
public class BranchTarget extends RuleHelper
{
  /**
   * Interface implemented by rules that find targets node by node as nodes arrive.
   */
  public interface Hook
  {
    /**
     * @return the target that the newly added node gives the rule on the branch, or null.
     */
    public Target branchTargetHook(Node xiNode, Branch xiBranch);
  }

  private final Map<Branch, Target> mTargets = new HashMap<>();

  public BranchTarget(Rule xiRule)
  {
    super(xiRule);
    if (!(xiRule instanceof Hook))
    {
      throw new IllegalArgumentException(xiRule.getName() + " has no branch target hook");
    }
  }

  /**
   * @return the target found for the branch, or null.
   */
  public Target get(Branch xiBranch)
  {
    return mTargets.get(xiBranch);
  }

  @Override
  public void afterNodeAdd(Node xiNode, Branch xiBranch)
  {
    if (!mTargets.containsKey(xiBranch))
    {
      Target lTarget = ((Hook)mRule).branchTargetHook(xiNode, xiBranch);
      if (lTarget != null)
      {
        mTargets.put(xiBranch, lTarget);
      }
    }
  }

  @Override
  public void afterBranchClose(Branch xiBranch)
  {
    mTargets.remove(xiBranch);
  }
}
