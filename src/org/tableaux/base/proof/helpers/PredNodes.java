package org.tableaux.base.proof.helpers;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.util.lex.Predicated;

/**
 * Tracks, per branch, the nodes with predicated sentences.
 */
public class PredNodes extends FilterNodeCache
{
  public PredNodes(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  public boolean filter(Node xiNode, Branch xiBranch)
  {
    return xiNode.getSentence() instanceof Predicated;
  }

  @Override
  protected boolean isIgnoreTicked()
  {
    return false;
  }
}
