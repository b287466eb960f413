package org.tableaux.base.test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Assert;
import org.junit.Test;
import org.tableaux.base.logics.ClassicalLogic;
import org.tableaux.base.logics.FdeLogic;
import org.tableaux.base.logics.LogicRegistry;
import org.tableaux.base.logics.ModalLogic;
import org.tableaux.base.proof.Logic;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.RuleGroup;
import org.tableaux.base.proof.RuleGroups;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.factory.PolishParser;

/**
 * Tests for the logic registry, rule sets and branching complexity.
 */
public class LogicTest extends Assert
{
  @Test
  public void testRegistryLookupIgnoresCase()
  {
    assertSame(ModalLogic.S4, LogicRegistry.get("s4"));
    assertSame(FdeLogic.LP, LogicRegistry.get("Lp"));
    assertTrue(LogicRegistry.contains("cfol"));
    assertFalse(LogicRegistry.contains("S6"));
    assertFalse(LogicRegistry.contains(null));
    assertEquals(10, LogicRegistry.getLogics().size());
    assertEquals("FDE", LogicRegistry.getNames().get(0));
  }

  @Test(expected = NoSuchElementException.class)
  public void testUnknownLogic()
  {
    LogicRegistry.get("S6");
  }

  @Test
  public void testLogicDescriptions()
  {
    for (Logic lLogic : LogicRegistry.getLogics())
    {
      assertNotNull(lLogic.getTitle());
      assertNotNull(lLogic.getCategory());
    }
    assertEquals("Bivalent Modal", ModalLogic.K.getCategory());
    assertEquals("Many-valued", FdeLogic.FDE.getCategory());
  }

  @Test
  public void testClassicalRules()
  {
    RuleGroups lRules = new Tableau(ClassicalLogic.CPL, null).getRules();
    assertTrue(lRules.contains("Conjunction"));
    assertTrue(lRules.contains("DoubleNegation"));
    assertTrue(lRules.contains("ContradictionClosure"));
    assertFalse(lRules.contains("Necessity"));
    assertFalse(lRules.contains("ConjunctionDesignated"));
    assertEquals(3, lRules.getClosureGroup().size());
  }

  @Test
  public void testFdeFamilyClosures()
  {
    assertEquals(1, new Tableau(FdeLogic.FDE, null).getRules().getClosureGroup().size());
    assertTrue(new Tableau(FdeLogic.K3, null).getRules().contains("GlutClosure"));
    assertFalse(new Tableau(FdeLogic.K3, null).getRules().contains("GapClosure"));
    assertTrue(new Tableau(FdeLogic.LP, null).getRules().contains("GapClosure"));
    assertTrue(new Tableau(FdeLogic.FDE, null).getRules().contains("ConjunctionNegatedUndesignated"));
  }

  @Test
  public void testModalFrameRules()
  {
    assertFalse(new Tableau(ModalLogic.K, null).getRules().contains("Serial"));
    assertTrue(new Tableau(ModalLogic.D, null).getRules().contains("Serial"));
    assertTrue(new Tableau(ModalLogic.T, null).getRules().contains("Reflexive"));
    assertFalse(new Tableau(ModalLogic.T, null).getRules().contains("Transitive"));
    assertTrue(new Tableau(ModalLogic.S4, null).getRules().contains("Transitive"));
    assertFalse(new Tableau(ModalLogic.S4, null).getRules().contains("Symmetric"));
    assertTrue(new Tableau(ModalLogic.S5, null).getRules().contains("Symmetric"));

    List<String> lGroupNames = new ArrayList<>();
    for (RuleGroup lGroup : new Tableau(ModalLogic.S4, null).getRules().getGroups())
    {
      lGroupNames.add(lGroup.getName());
    }
    assertTrue(lGroupNames.indexOf("Transitive") < lGroupNames.indexOf("Modal"));
    assertTrue(lGroupNames.indexOf("Modal") < lGroupNames.indexOf("Reflexive"));
  }

  @Test(expected = NoSuchElementException.class)
  public void testMissingRule()
  {
    new Tableau(ClassicalLogic.CPL, null).getRules().get("Necessity");
  }

  @Test
  public void testBranchingComplexity() throws Exception
  {
    PolishParser lParser = new PolishParser();
    Logic lLogic = ClassicalLogic.CPL;

    assertEquals(0, lLogic.branchingComplexity(Node.snode(lParser.parse("Kab"))));
    assertEquals(1, lLogic.branchingComplexity(Node.snode(lParser.parse("Aab"))));
    assertEquals(1, lLogic.branchingComplexity(Node.snode(lParser.parse("NKab"))));
    assertEquals(0, lLogic.branchingComplexity(Node.snode(lParser.parse("NAab"))));
    assertEquals(1, lLogic.branchingComplexity(Node.snode(lParser.parse("Eab"))));
    assertEquals(2, lLogic.branchingComplexity(Node.snode(lParser.parse("KAabAcd"))));
    assertEquals(0, lLogic.branchingComplexity(Node.flagNode(Node.QUIT_FLAG, null)));

    Logic lFde = FdeLogic.FDE;
    assertEquals(0, lFde.branchingComplexity(Node.sdnode(lParser.parse("Kab"), true)));
    assertEquals(1, lFde.branchingComplexity(Node.sdnode(lParser.parse("Kab"), false)));
    assertEquals(0, lFde.branchingComplexity(Node.sdnode(lParser.parse("Aab"), false)));
  }
}
