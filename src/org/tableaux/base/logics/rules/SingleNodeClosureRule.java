package org.tableaux.base.logics.rules;

import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.rules.BaseClosureRule;
import org.tableaux.base.util.lex.Operated;
import org.tableaux.base.util.lex.Predicated;
import org.tableaux.base.util.lex.Sentence;

/**
 * A closure rule that closes a branch on a single negated predicated sentence that can never hold.
 */
public abstract class SingleNodeClosureRule extends BaseClosureRule
{
  protected final NodeProfile mProfile;

  protected SingleNodeClosureRule(Tableau xiTableau, NodeProfile xiProfile)
  {
    super(xiTableau, null);
    mProfile = xiProfile;
  }

  /**
   * @return whether the negatum is false in every model.
   */
  protected abstract boolean isAlwaysTrue(Predicated xiNegatum);

  /**
   * @return a predicated sentence for which {@link #isAlwaysTrue} holds.
   */
  protected abstract Predicated exampleNegatum();

  @Override
  public boolean nodeWillCloseBranch(Node xiNode, Branch xiBranch)
  {
    Sentence lSentence = xiNode.getSentence();
    if (lSentence == null || !lSentence.isNegated())
    {
      return false;
    }
    Sentence lNegatum = ((Operated)lSentence).getLhs();
    return lNegatum instanceof Predicated && isAlwaysTrue((Predicated)lNegatum);
  }

  @Override
  public Target branchTargetHook(Node xiNode, Branch xiBranch)
  {
    if (!nodeWillCloseBranch(xiNode, xiBranch))
    {
      return null;
    }
    return new Target(xiBranch).setNode(xiNode);
  }

  @Override
  public List<Node> exampleNodes()
  {
    return Collections.singletonList(mProfile.node(exampleNegatum().negate(), null, mProfile.trunkWorld()));
  }
}
