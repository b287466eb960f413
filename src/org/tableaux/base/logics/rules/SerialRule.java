package org.tableaux.base.logics.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.StepEntry;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.helpers.AdzHelper;
import org.tableaux.base.proof.helpers.MaxWorlds;
import org.tableaux.base.proof.helpers.UnserialWorlds;
import org.tableaux.base.util.lex.Sentence;

/**
 * Seriality: every world sees some world.  For a world that sees nothing, add access to a new world.
 *
 * The rule does not fire twice running on the same branch, and stops once the branch is past its world bound.
 */
public class SerialRule extends Rule
{
  private final AdzHelper      mAdz;
  private final MaxWorlds      mMaxWorlds;
  private final UnserialWorlds mUnserial;

  public SerialRule(Tableau xiTableau)
  {
    super(xiTableau, "Serial");
    mTicking = false;
    mIgnoreTicked = false;
    mAdz = new AdzHelper(this);
    mMaxWorlds = new MaxWorlds(this);
    mUnserial = new UnserialWorlds(this);
  }

  @Override
  protected List<Target> getTargets(Branch xiBranch)
  {
    List<Target> lTargets = new ArrayList<>();
    List<StepEntry> lHistory = getTableau().getHistory();
    if (!lHistory.isEmpty())
    {
      StepEntry lLast = lHistory.get(lHistory.size() - 1);
      if (lLast.getRule() == this && lLast.getTarget().getBranch() == xiBranch)
      {
        return lTargets;
      }
    }
    if (mMaxWorlds.isExceeded(xiBranch))
    {
      return lTargets;
    }

    int lNewWorld = xiBranch.newWorld();
    for (int lWorld : mUnserial.get(xiBranch))
    {
      lTargets.add(new Target(xiBranch).setAdds(Node.anode(lWorld, lNewWorld)).setWorld(lWorld));
    }
    return lTargets;
  }

  @Override
  protected void applyTarget(Target xiTarget)
  {
    mAdz.apply(xiTarget);
  }

  @Override
  public List<Node> exampleNodes()
  {
    return Collections.singletonList(Node.swnode(Sentence.first(), 0));
  }
}
