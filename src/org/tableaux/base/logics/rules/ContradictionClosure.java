package org.tableaux.base.logics.rules;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Sentence;

/**
 * Closes a branch on which a sentence and its negation both occur (at the same world, for modal nodes).
 */
public class ContradictionClosure extends PairClosureRule
{
  private final NodeProfile mProfile;

  public ContradictionClosure(Tableau xiTableau, NodeProfile xiProfile)
  {
    super(xiTableau, null);
    mProfile = xiProfile;
  }

  @Override
  protected Node complement(Node xiNode, Branch xiBranch)
  {
    Sentence lSentence = xiNode.getSentence();
    if (lSentence == null)
    {
      return null;
    }
    return xiBranch.find(Node.props().sentence(lSentence.negative()).world(xiNode.getWorld()));
  }

  @Override
  protected Node[] examplePair()
  {
    Sentence lSentence = Sentence.first();
    Integer lWorld = mProfile.trunkWorld();
    return new Node[] {mProfile.node(lSentence, null, lWorld), mProfile.node(lSentence.negate(), null, lWorld)};
  }
}
