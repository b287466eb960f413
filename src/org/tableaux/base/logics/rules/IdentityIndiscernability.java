package org.tableaux.base.logics.rules;

import java.util.ArrayList;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.SentenceFilter;
import org.tableaux.base.proof.helpers.PredNodes;
import org.tableaux.base.proof.rules.BaseNodeRule;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Parameter;
import org.tableaux.base.util.lex.Predicate;
import org.tableaux.base.util.lex.Predicated;

import com.google.common.base.Objects;

/**
 * From a = b and a predicated sentence about a (or b) at the same world, add the sentence with the other parameter
 * substituted.  The identity node is never ticked.
 */
public class IdentityIndiscernability extends BaseNodeRule
{
  private final NodeProfile mProfile;
  private final PredNodes   mPredNodes;

  public IdentityIndiscernability(Tableau xiTableau, NodeProfile xiProfile)
  {
    super(xiTableau,
          null,
          OperatorRule.filters(xiProfile, SentenceFilter.predicate(Predicate.System.IDENTITY.get(), false), null));
    mProfile = xiProfile;
    mTicking = false;
    mPredNodes = new PredNodes(this);
  }

  @Override
  public List<Target> nodeTargets(Node xiNode, Branch xiBranch)
  {
    List<Target> lTargets = new ArrayList<>();
    Predicated lIdentity = (Predicated)sentence(xiNode);
    Parameter lParamA = lIdentity.getParams().get(0);
    Parameter lParamB = lIdentity.getParams().get(1);
    if (lParamA.equals(lParamB))
    {
      return lTargets;
    }

    for (Node lOther : mPredNodes.get(xiBranch))
    {
      if (lOther == xiNode || !Objects.equal(lOther.getWorld(), xiNode.getWorld()))
      {
        continue;
      }

      Predicated lSentence = (Predicated)lOther.getSentence();
      Parameter lNew;
      Parameter lOld;
      if (lSentence.getParamSet().contains(lParamA))
      {
        lNew = lParamB;
        lOld = lParamA;
      }
      else if (lSentence.getParamSet().contains(lParamB))
      {
        lNew = lParamA;
        lOld = lParamB;
      }
      else
      {
        continue;
      }

      Predicated lSubstituted = lSentence.substitute(lNew, lOld);
      if (lSubstituted.isIdentity() && lSubstituted.getParamSet().size() == 1)
      {
        continue;
      }
      Node lAdd = mProfile.node(lSubstituted, null, xiNode.getWorld());
      if (xiBranch.has(lAdd.getProps()))
      {
        continue;
      }
      lTargets.add(new Target(xiBranch).setNodes(xiNode, lOther).setAdds(lAdd));
    }
    return lTargets;
  }

  @Override
  public List<Node> exampleNodes()
  {
    Constant lConstantA = Constant.first();
    Constant lConstantB = lConstantA.next();
    Integer lWorld = mProfile.trunkWorld();
    List<Node> lNodes = new ArrayList<>();
    lNodes.add(mProfile.node(Predicate.first().apply(lConstantA), null, lWorld));
    lNodes.add(mProfile.node(Predicate.System.IDENTITY.get().apply(lConstantA, lConstantB), null, lWorld));
    return lNodes;
  }
}
