package org.tableaux.base.logics;

import java.util.ArrayList;
import java.util.List;

import org.tableaux.base.logics.rules.ContradictionClosure;
import org.tableaux.base.logics.rules.ExtendedInstantiationRule;
import org.tableaux.base.logics.rules.IdentityIndiscernability;
import org.tableaux.base.logics.rules.NarrowInstantiationRule;
import org.tableaux.base.logics.rules.NodeProfile;
import org.tableaux.base.logics.rules.NonExistenceClosure;
import org.tableaux.base.logics.rules.QuantifierConversionRule;
import org.tableaux.base.logics.rules.SelfIdentityClosure;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.RuleGroup;
import org.tableaux.base.proof.RuleGroups;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Quantifier;

/**
 * Bivalent logic.  The trunk holds the premises and the negated conclusion, and a branch closes on a sentence and its
 * negation.
 */
public class ClassicalLogic extends BaseLogic
{
  public static final ClassicalLogic CPL = new ClassicalLogic("CPL",
                                                              "Classical Predicate Logic",
                                                              "Bivalent",
                                                              NodeProfile.CLASSICAL,
                                                              false);
  public static final ClassicalLogic CFOL = new ClassicalLogic("CFOL",
                                                               "Classical First Order Logic",
                                                               "Bivalent",
                                                               NodeProfile.CLASSICAL,
                                                               true);

  private final boolean mQuantified;

  protected ClassicalLogic(String xiName,
                           String xiTitle,
                           String xiCategory,
                           NodeProfile xiProfile,
                           boolean xiQuantified)
  {
    super(xiName, xiTitle, xiCategory, xiProfile);
    mQuantified = xiQuantified;
  }

  public boolean isQuantified()
  {
    return mQuantified;
  }

  @Override
  public RuleGroups createRules(Tableau xiTableau)
  {
    RuleGroups lRules = new RuleGroups();
    addClosures(xiTableau, lRules);
    RuleGroup[] lOperatorGroups = operatorGroups(xiTableau, propositionalOperators());
    lRules.addGroup(lOperatorGroups[0]);
    lRules.addGroup(lOperatorGroups[1]);
    if (mQuantified)
    {
      lRules.addGroup(quantifierGroup(xiTableau));
    }
    return lRules;
  }

  protected void addClosures(Tableau xiTableau, RuleGroups xiRules)
  {
    xiRules.addClosure(new ContradictionClosure(xiTableau, mProfile));
    xiRules.addClosure(new SelfIdentityClosure(xiTableau, mProfile));
    xiRules.addClosure(new NonExistenceClosure(xiTableau, mProfile));
  }

  /**
   * @return the non-branching group (identity, the operator rules that never fork, then the negated quantifier
   *         conversions) and the branching group.
   */
  protected RuleGroup[] operatorGroups(Tableau xiTableau, List<Operator> xiOperators)
  {
    List<Rule> lNonBranching = new ArrayList<>();
    List<Rule> lBranching = new ArrayList<>();
    lNonBranching.add(new IdentityIndiscernability(xiTableau, mProfile));
    operatorRules(xiTableau, xiOperators, null, lNonBranching, lBranching);
    if (mQuantified)
    {
      for (Quantifier lQuantifier : Quantifier.values())
      {
        lNonBranching.add(new QuantifierConversionRule(xiTableau, mProfile, lQuantifier, null));
      }
    }
    return new RuleGroup[] {group("NonBranching", lNonBranching), group("Branching", lBranching)};
  }

  protected RuleGroup quantifierGroup(Tableau xiTableau)
  {
    List<Rule> lRules = new ArrayList<>();
    lRules.add(new NarrowInstantiationRule(xiTableau, mProfile, Quantifier.EXISTENTIAL, null));
    lRules.add(new ExtendedInstantiationRule(xiTableau, mProfile, Quantifier.UNIVERSAL, null));
    return group("Quantifier", lRules);
  }
}
