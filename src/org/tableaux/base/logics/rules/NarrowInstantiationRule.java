package org.tableaux.base.logics.rules;

import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.SentenceFilter;
import org.tableaux.base.proof.rules.NarrowQuantifierRule;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Quantified;
import org.tableaux.base.util.lex.Quantifier;

/**
 * Instantiate a quantified sentence once, with a constant new to the branch, and tick the node.  This is the rule for
 * a designated (or unmarked) existential, and for an undesignated universal.
 */
public class NarrowInstantiationRule extends NarrowQuantifierRule
{
  private final NodeProfile mProfile;
  private final Boolean     mDesignation;

  /**
   * @param xiTableau - the tableau.
   * @param xiProfile - the node profile of the logic.
   * @param xiQuantifier - the quantifier.
   * @param xiDesignation - the designation of the nodes to apply to, or null for unmarked profiles.
   */
  public NarrowInstantiationRule(Tableau xiTableau,
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
  protected List<Target> quantifierTargets(Node xiNode, Branch xiBranch)
  {
    Constant lConstant = xiBranch.newConstant();
    Node lAdd = mProfile.node(((Quantified)sentence(xiNode)).unquantify(lConstant), mDesignation, xiNode.getWorld());
    return Collections.singletonList(new Target(xiBranch).setAdds(lAdd).setConstant(lConstant));
  }
}
