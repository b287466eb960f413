package org.tableaux.base.logics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.tableaux.base.logics.rules.NecessityRule;
import org.tableaux.base.logics.rules.NodeProfile;
import org.tableaux.base.logics.rules.PossibilityRule;
import org.tableaux.base.logics.rules.ReflexiveRule;
import org.tableaux.base.logics.rules.SerialRule;
import org.tableaux.base.logics.rules.SymmetricRule;
import org.tableaux.base.logics.rules.TransitiveRule;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.RuleGroup;
import org.tableaux.base.proof.RuleGroups;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Operator;

/**
 * Normal modal logics.  Sentences are evaluated at worlds, the trunk is at world 0, and the frame conditions of each
 * logic add access nodes.
 */
public class ModalLogic extends ClassicalLogic
{
  /**
   * Frame conditions on the access relation.
   */
  public static enum Frame
  {
    /** No conditions. */
    ANY,
    /** Every world sees some world. */
    SERIAL,
    REFLEXIVE,
    /** Reflexive and transitive. */
    PREORDER,
    /** Reflexive, transitive and symmetric. */
    EQUIVALENCE;
  }

  public static final ModalLogic K = new ModalLogic("K", "Kripke Normal Modal Logic", Frame.ANY);
  public static final ModalLogic D = new ModalLogic("D", "Deontic Normal Modal Logic", Frame.SERIAL);
  public static final ModalLogic T = new ModalLogic("T", "Reflexive Normal Modal Logic", Frame.REFLEXIVE);
  public static final ModalLogic S4 = new ModalLogic("S4", "S4 Normal Modal Logic", Frame.PREORDER);
  public static final ModalLogic S5 = new ModalLogic("S5", "S5 Normal Modal Logic", Frame.EQUIVALENCE);

  private final Frame mFrame;

  private ModalLogic(String xiName, String xiTitle, Frame xiFrame)
  {
    super(xiName, xiTitle, "Bivalent Modal", NodeProfile.MODAL, true);
    mFrame = xiFrame;
  }

  public Frame getFrame()
  {
    return mFrame;
  }

  @Override
  public RuleGroups createRules(Tableau xiTableau)
  {
    RuleGroups lRules = new RuleGroups();
    addClosures(xiTableau, lRules);

    RuleGroup[] lOperatorGroups = operatorGroups(xiTableau, Arrays.asList(Operator.values()));
    List<Rule> lModal = new ArrayList<>();
    lModal.add(new NecessityRule(xiTableau));
    lModal.add(new PossibilityRule(xiTableau));

    lRules.addGroup(lOperatorGroups[0]);
    switch (mFrame)
    {
      case ANY:
      case SERIAL:
        lRules.addGroup(lOperatorGroups[1]);
        lRules.addGroup(group("Modal", lModal));
        lRules.addGroup(quantifierGroup(xiTableau));
        if (mFrame == Frame.SERIAL)
        {
          lRules.addGroup(single("Serial", new SerialRule(xiTableau)));
        }
        break;

      case REFLEXIVE:
      case PREORDER:
      case EQUIVALENCE:
        if (mFrame != Frame.REFLEXIVE)
        {
          lRules.addGroup(single("Transitive", new TransitiveRule(xiTableau)));
        }
        lRules.addGroup(group("Modal", lModal));
        lRules.addGroup(single("Reflexive", new ReflexiveRule(xiTableau)));
        lRules.addGroup(lOperatorGroups[1]);
        lRules.addGroup(quantifierGroup(xiTableau));
        if (mFrame == Frame.EQUIVALENCE)
        {
          lRules.addGroup(single("Symmetric", new SymmetricRule(xiTableau)));
        }
        break;

      default:
        throw new IllegalStateException("Unknown frame " + mFrame);
    }
    return lRules;
  }

  private static RuleGroup single(String xiName, Rule xiRule)
  {
    return new RuleGroup(xiName).add(xiRule);
  }
}
