package org.tableaux.base.logics.rules;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Sentence;

/**
 * Closes a branch on which a sentence is both designated and undesignated.
 */
public class DesignationClosure extends PairClosureRule
{
  public DesignationClosure(Tableau xiTableau)
  {
    super(xiTableau, null);
  }

  @Override
  protected Node complement(Node xiNode, Branch xiBranch)
  {
    Sentence lSentence = xiNode.getSentence();
    Boolean lDesignated = xiNode.getDesignated();
    if (lSentence == null || lDesignated == null)
    {
      return null;
    }
    return xiBranch.find(Node.props().sentence(lSentence).designated(!lDesignated));
  }

  @Override
  protected Node[] examplePair()
  {
    Sentence lSentence = Sentence.first();
    return new Node[] {Node.sdnode(lSentence, true), Node.sdnode(lSentence, false)};
  }
}
