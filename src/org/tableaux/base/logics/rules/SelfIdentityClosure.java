package org.tableaux.base.logics.rules;

import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Predicate;
import org.tableaux.base.util.lex.Predicated;

/**
 * Closes a branch with a denial of self identity, e.g. ~a = a.
 */
public class SelfIdentityClosure extends SingleNodeClosureRule
{
  public SelfIdentityClosure(Tableau xiTableau, NodeProfile xiProfile)
  {
    super(xiTableau, xiProfile);
  }

  @Override
  protected boolean isAlwaysTrue(Predicated xiNegatum)
  {
    return xiNegatum.isIdentity() && xiNegatum.getParamSet().size() == 1;
  }

  @Override
  protected Predicated exampleNegatum()
  {
    Constant lConstant = Constant.first();
    return Predicate.System.IDENTITY.get().apply(lConstant, lConstant);
  }
}
