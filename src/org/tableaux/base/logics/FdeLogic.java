package org.tableaux.base.logics;

import java.util.ArrayList;
import java.util.List;

import org.tableaux.base.logics.rules.DesignationClosure;
import org.tableaux.base.logics.rules.ExtendedInstantiationRule;
import org.tableaux.base.logics.rules.GapClosure;
import org.tableaux.base.logics.rules.GlutClosure;
import org.tableaux.base.logics.rules.NarrowInstantiationRule;
import org.tableaux.base.logics.rules.NodeProfile;
import org.tableaux.base.logics.rules.QuantifierConversionRule;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.RuleGroups;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Quantifier;

/**
 * First Degree Entailment and its three-valued extensions.
 *
 * Nodes are designated or undesignated.  A branch closes when a sentence is both.  K3 also closes on a designated
 * sentence with a designated negative (no gluts), and LP on an undesignated sentence with an undesignated negative
 * (no gaps).
 */
public class FdeLogic extends BaseLogic
{
  public static final FdeLogic FDE = new FdeLogic("FDE", "First Degree Entailment", false, false);
  public static final FdeLogic K3 = new FdeLogic("K3", "Strong Kleene Logic", true, false);
  public static final FdeLogic LP = new FdeLogic("LP", "Logic of Paradox", false, true);

  private final boolean mNoGluts;
  private final boolean mNoGaps;

  private FdeLogic(String xiName, String xiTitle, boolean xiNoGluts, boolean xiNoGaps)
  {
    super(xiName, xiTitle, "Many-valued", NodeProfile.DESIGNATED);
    mNoGluts = xiNoGluts;
    mNoGaps = xiNoGaps;
  }

  @Override
  public RuleGroups createRules(Tableau xiTableau)
  {
    RuleGroups lRules = new RuleGroups();
    if (mNoGaps)
    {
      lRules.addClosure(new GapClosure(xiTableau));
    }
    lRules.addClosure(new DesignationClosure(xiTableau));
    if (mNoGluts)
    {
      lRules.addClosure(new GlutClosure(xiTableau));
    }

    List<Rule> lNonBranching = new ArrayList<>();
    List<Rule> lBranching = new ArrayList<>();
    operatorRules(xiTableau, propositionalOperators(), true, lNonBranching, lBranching);
    operatorRules(xiTableau, propositionalOperators(), false, lNonBranching, lBranching);
    for (Quantifier lQuantifier : Quantifier.values())
    {
      lNonBranching.add(new QuantifierConversionRule(xiTableau, mProfile, lQuantifier, true));
      lNonBranching.add(new QuantifierConversionRule(xiTableau, mProfile, lQuantifier, false));
    }

    List<Rule> lExistential = new ArrayList<>();
    lExistential.add(new NarrowInstantiationRule(xiTableau, mProfile, Quantifier.EXISTENTIAL, true));
    lExistential.add(new ExtendedInstantiationRule(xiTableau, mProfile, Quantifier.EXISTENTIAL, false));

    List<Rule> lUniversal = new ArrayList<>();
    lUniversal.add(new ExtendedInstantiationRule(xiTableau, mProfile, Quantifier.UNIVERSAL, true));
    lUniversal.add(new NarrowInstantiationRule(xiTableau, mProfile, Quantifier.UNIVERSAL, false));

    lRules.addGroup(group("NonBranching", lNonBranching));
    lRules.addGroup(group("Branching", lBranching));
    lRules.addGroup(group("Existential", lExistential));
    lRules.addGroup(group("Universal", lUniversal));
    return lRules;
  }
}
