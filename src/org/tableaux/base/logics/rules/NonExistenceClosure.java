package org.tableaux.base.logics.rules;

import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Predicate;
import org.tableaux.base.util.lex.Predicated;

/**
 * Closes a branch with a denial of existence.  Every constant denotes.
 */
public class NonExistenceClosure extends SingleNodeClosureRule
{
  public NonExistenceClosure(Tableau xiTableau, NodeProfile xiProfile)
  {
    super(xiTableau, xiProfile);
  }

  @Override
  protected boolean isAlwaysTrue(Predicated xiNegatum)
  {
    return xiNegatum.isExistence();
  }

  @Override
  protected Predicated exampleNegatum()
  {
    return Predicate.System.EXISTENCE.get().apply(Constant.first());
  }
}
