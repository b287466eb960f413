package org.tableaux.base.logics.rules;

import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.SentenceFilter;
import org.tableaux.base.proof.rules.BaseNodeRule;
import org.tableaux.base.util.lex.Quantified;
import org.tableaux.base.util.lex.Quantifier;

/**
 * Push a negation through a quantifier: ~ExFx becomes Vx~Fx, and ~VxFx becomes Ex~Fx.  The designation and world are
 * kept.
 */
public class QuantifierConversionRule extends BaseNodeRule
{
  private final NodeProfile mProfile;
  private final Quantifier  mQuantifier;
  private final Boolean     mDesignation;

  public QuantifierConversionRule(Tableau xiTableau,
                                  NodeProfile xiProfile,
                                  Quantifier xiQuantifier,
                                  Boolean xiDesignation)
  {
    super(xiTableau,
          xiQuantifier.getLabel() + "Negated" + xiProfile.suffix(xiDesignation),
          OperatorRule.filters(xiProfile, SentenceFilter.quantifier(xiQuantifier, true), xiDesignation));
    mProfile = xiProfile;
    mQuantifier = xiQuantifier;
    mDesignation = xiProfile.hasDesignations() ? xiDesignation : null;
  }

  /**
   * @return the dual quantifier.
   */
  static Quantifier dual(Quantifier xiQuantifier)
  {
    return (xiQuantifier == Quantifier.EXISTENTIAL) ? Quantifier.UNIVERSAL : Quantifier.EXISTENTIAL;
  }

  @Override
  public List<Target> nodeTargets(Node xiNode, Branch xiBranch)
  {
    Quantified lNegatum = (Quantified)sentence(xiNode);
    Quantified lConverted = dual(mQuantifier).apply(lNegatum.getVariable(), lNegatum.getSentence().negate());
    Node lAdd = mProfile.node(lConverted, (mDesignation == null) ? Boolean.TRUE : mDesignation, xiNode.getWorld());
    return Collections.singletonList(new Target(xiBranch).setAdds(lAdd));
  }
}
