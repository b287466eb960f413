package org.tableaux.base.proof.rules;

import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.helpers.BranchTarget;

/**
 * A closing rule that looks for its target as each node is added.
 */
public abstract class BaseClosureRule extends ClosingRule implements BranchTarget.Hook
{
  private final BranchTarget mBranchTarget;

  protected BaseClosureRule(Tableau xiTableau, String xiName)
  {
    super(xiTableau, xiName);
    mBranchTarget = new BranchTarget(this);
  }

  @Override
  protected List<Target> getTargets(Branch xiBranch)
  {
    Target lTarget = mBranchTarget.get(xiBranch);
    return (lTarget == null) ? Collections.<Target>emptyList() : Collections.singletonList(lTarget);
  }

  @Override
  public double groupScore(Target xiTarget)
  {
    return 1.0;
  }
}
