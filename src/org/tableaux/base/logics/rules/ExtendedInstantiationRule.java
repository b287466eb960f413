package org.tableaux.base.logics.rules;

import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.filters.SentenceFilter;
import org.tableaux.base.proof.rules.ExtendedQuantifierRule;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Quantified;
import org.tableaux.base.util.lex.Quantifier;

/**
 * Instantiate a quantified sentence with each constant on the branch.  This is the rule for a designated (or
 * unmarked) universal, and for an undesignated existential.
 */
public class ExtendedInstantiationRule extends ExtendedQuantifierRule
{
  private final NodeProfile mProfile;
  private final Boolean     mDesignation;

  public ExtendedInstantiationRule(Tableau xiTableau,
                                   NodeProfile xiProfile,
                                   Quantifier xiQuantifier,
                                   Boolean xiDesignation)
  {
    super(xiTableau,
          xiQuantifier.getLabel() + xiProfile.suffix(xiDesignation),
          OperatorRule.filters(xiProfile, SentenceFilter.quantifier(xiQuantifier, false), xiDesignation));
    mProfile = xiProfile;
    mDesignation = xiProfile.hasDesignations() ? xiDesignation : null;
  }

  @Override
  protected List<Node> constantNodes(Node xiNode, Constant xiConstant, Branch xiBranch)
  {
    return Collections.singletonList(mProfile.node(((Quantified)sentence(xiNode)).unquantify(xiConstant),
                                                   mDesignation,
                                                   xiNode.getWorld()));
  }
}
