package org.tableaux.base.logics.rules;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Sentence;

/**
 * Closes a branch on which a sentence and its negative are both designated.  Used by logics without truth value
 * gluts.
 */
public class GlutClosure extends PairClosureRule
{
  public GlutClosure(Tableau xiTableau)
  {
    super(xiTableau, null);
  }

  @Override
  protected Node complement(Node xiNode, Branch xiBranch)
  {
    if (xiNode.getSentence() == null || !Boolean.TRUE.equals(xiNode.getDesignated()))
    {
      return null;
    }
    return xiBranch.find(Node.props().sentence(xiNode.getSentence().negative()).designated(true));
  }

  @Override
  protected Node[] examplePair()
  {
    Sentence lSentence = Sentence.first();
    return new Node[] {Node.sdnode(lSentence, true), Node.sdnode(lSentence.negate(), true)};
  }
}
