package org.tableaux.base.test;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.tableaux.base.logics.ClassicalLogic;
import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.StepEntry;
import org.tableaux.base.proof.TabFlag;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.TableauListener;
import org.tableaux.base.proof.TableauOptions;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.TreeStruct;
import org.tableaux.base.util.exceptions.BuildTimeoutException;
import org.tableaux.base.util.lex.Argument;
import org.tableaux.base.util.lex.Predicates;
import org.tableaux.base.util.lex.factory.PolishParser;

/**
 * Tests for the tableau build loop.
 */
public class TableauTest extends Assert
{
  private PolishParser mParser;

  @Before
  public void setUp()
  {
    Predicates lPredicates = new Predicates();
    lPredicates.add(0, 0, 1, null);
    lPredicates.add(1, 0, 2, null);
    mParser = new PolishParser(lPredicates);
  }

  private static List<String> ruleNames(Tableau xiTableau)
  {
    List<String> lNames = new ArrayList<>();
    for (StepEntry lEntry : xiTableau.getHistory())
    {
      lNames.add(lEntry.getRule().getName());
    }
    return lNames;
  }

  @Test
  public void testValidArgument() throws Exception
  {
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("a", "Kab")).build();

    assertEquals(Tableau.Result.VALID, lTableau.getResult());
    assertTrue(lTableau.isCompleted());
    assertFalse(lTableau.isPremature());
    assertEquals(Boolean.TRUE, lTableau.getValid());
    assertEquals(Boolean.FALSE, lTableau.getInvalid());
    assertEquals(1, lTableau.size());
    assertTrue(lTableau.getOpenBranches().isEmpty());

    List<String> lNames = ruleNames(lTableau);
    assertEquals(2, lNames.size());
    assertEquals("Conjunction", lNames.get(0));
    assertEquals("ContradictionClosure", lNames.get(1));
    assertEquals(3, lTableau.getCurrentStep());
  }

  @Test
  public void testInvalidArgumentBranches() throws Exception
  {
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("b", "Aab")).build();

    assertEquals(Tableau.Result.INVALID, lTableau.getResult());
    assertEquals(Boolean.FALSE, lTableau.getValid());
    assertEquals(2, lTableau.size());
    assertEquals(1, lTableau.getOpenBranches().size());

    Branch lOpen = lTableau.getOpenBranches().get(0);
    assertTrue(lOpen.has(Node.props().sentence(mParser.parse("a"))));
    assertFalse(lOpen.isClosed());
    assertEquals(2, lTableau.getStats().mBranches);
    assertEquals(1, lTableau.getStats().mOpenBranches);
  }

  @Test
  public void testTreeStructure() throws Exception
  {
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("b", "Aab")).build();
    TreeStruct lRoot = lTableau.getTree();

    assertNotNull(lRoot);
    assertEquals(2, lRoot.getNodes().size());
    assertEquals(2, lRoot.getChildren().size());
    assertEquals(2, lRoot.getWidth());
    assertEquals(1, lRoot.getLeft());
    assertEquals(6, lRoot.getRight());
    assertTrue(lRoot.hasOpen());
    assertTrue(lRoot.hasClosed());
    assertFalse(lRoot.isLeaf());

    int lClosed = 0;
    for (TreeStruct lChild : lRoot.getChildren())
    {
      assertTrue(lChild.isLeaf());
      assertNotNull(lChild.getBranchId());
      if (lChild.isClosed())
      {
        lClosed++;
      }
    }
    assertEquals(1, lClosed);
  }

  @Test
  public void testDeterministic() throws Exception
  {
    Argument lArgument = mParser.argument("Cac", "Cab", "Cbc", "Aab");
    Tableau lFirst = new Tableau(ClassicalLogic.CPL, lArgument).build();
    Tableau lSecond = new Tableau(ClassicalLogic.CPL, lArgument).build();

    assertEquals(lFirst.getResult(), lSecond.getResult());
    assertEquals(ruleNames(lFirst), ruleNames(lSecond));
    assertEquals(lFirst.size(), lSecond.size());
    for (int lii = 0; lii < lFirst.size(); lii++)
    {
      assertEquals(lFirst.getBranches().get(lii).size(), lSecond.getBranches().get(lii).size());
    }
  }

  @Test
  public void testOptimisationsDoNotChangeTheResult() throws Exception
  {
    Argument lArgument = mParser.argument("Cac", "Cab", "Cbc");
    TableauOptions lPlain = new TableauOptions().setGroupOptim(false).setRankOptim(false);
    Tableau lOptimised = new Tableau(ClassicalLogic.CPL, lArgument).build();
    Tableau lUnoptimised = new Tableau(ClassicalLogic.CPL, lArgument, lPlain).build();

    assertEquals(Tableau.Result.VALID, lOptimised.getResult());
    assertEquals(Tableau.Result.VALID, lUnoptimised.getResult());
  }

  @Test(expected = IllegalStateException.class)
  public void testTrunkBuiltOnce() throws Exception
  {
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("a", "a"));
    assertTrue(lTableau.isTrunkBuilt());
    lTableau.buildTrunk();
  }

  @Test(expected = IllegalStateException.class)
  public void testLogicFixedOnceStarted() throws Exception
  {
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("a", "a"));
    lTableau.setLogic(ClassicalLogic.CFOL);
  }

  @Test(expected = IllegalStateException.class)
  public void testStepNeedsTrunk()
  {
    new Tableau(ClassicalLogic.CPL, null).step();
  }

  @Test
  public void testMaxSteps() throws Exception
  {
    TableauOptions lOptions = new TableauOptions().setMaxSteps(0);
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("b", "Aab"), lOptions).build();

    assertTrue(lTableau.isFinished());
    assertTrue(lTableau.isPremature());
    assertEquals(Tableau.Result.PREMATURE, lTableau.getResult());
    assertNull(lTableau.getValid());
    assertTrue(lTableau.getHistory().isEmpty());
    assertEquals(1, lTableau.size());
  }

  @Test
  public void testZeroTimeout() throws Exception
  {
    TableauOptions lOptions = new TableauOptions().setBuildTimeoutMs(0);
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("b", "Aab"), lOptions);
    try
    {
      lTableau.build();
      fail("Expected a timeout");
    }
    catch (BuildTimeoutException lEx)
    {
      assertEquals(0, lEx.getTimeout());
    }

    assertTrue(lTableau.isFinished());
    assertTrue(lTableau.getFlags().contains(TabFlag.TIMED_OUT));
    assertEquals(Tableau.Result.PREMATURE, lTableau.getResult());
    assertNull(lTableau.getTree());
    assertNotNull(lTableau.getStats());
  }

  @Test
  public void testWatchdogExpiryStopsBuild() throws Exception
  {
    TableauOptions lOptions = new TableauOptions().setBuildTimeoutMs(20);
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("b", "Aab"), lOptions);
    lTableau.addListener(new TableauListener()
    {
      @Override
      public void afterBranchAdd(Branch xiBranch)
      {
        // Not needed.
      }

      @Override
      public void afterBranchClose(Branch xiBranch)
      {
        // Not needed.
      }

      @Override
      public void afterNodeAdd(Node xiNode, Branch xiBranch)
      {
        // Not needed.
      }

      @Override
      public void afterNodeTick(Node xiNode, Branch xiBranch)
      {
        // Outlast the timeout during the first step.
        try
        {
          Thread.sleep(500);
        }
        catch (InterruptedException lEx)
        {
          Thread.currentThread().interrupt();
        }
      }

      @Override
      public void beforeTrunkBuild(Tableau xiTableau)
      {
        // Not needed.
      }

      @Override
      public void afterTrunkBuild(Tableau xiTableau)
      {
        // Not needed.
      }

      @Override
      public void afterFinish(Tableau xiTableau)
      {
        // Not needed.
      }
    });

    try
    {
      lTableau.build();
      fail("Expected the watchdog to stop the build");
    }
    catch (BuildTimeoutException lEx)
    {
      assertEquals(20, lEx.getTimeout());
    }

    assertTrue(lTableau.isFinished());
    assertTrue(lTableau.getFlags().contains(TabFlag.TIMED_OUT));
    assertEquals(Tableau.Result.PREMATURE, lTableau.getResult());
    assertEquals("Disjunction", ruleNames(lTableau).get(0));
    assertNull(lTableau.getTree());
  }

  @Test
  public void testGenerousTimeout() throws Exception
  {
    TableauOptions lOptions = new TableauOptions().setBuildTimeoutMs(30000);
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("a", "Kab"), lOptions).build();
    assertEquals(Tableau.Result.VALID, lTableau.getResult());
    assertFalse(lTableau.getFlags().contains(TabFlag.TIMED_OUT));
  }

  @Test
  public void testQuitFlagMakesResultPremature() throws Exception
  {
    Tableau lTableau = new Tableau(ClassicalLogic.CFOL, mParser.argument("a", "VxSyGxy")).build();

    assertTrue(lTableau.isFinished());
    assertEquals(Tableau.Result.PREMATURE, lTableau.getResult());
    assertNull(lTableau.getValid());

    Branch lOpen = lTableau.getOpenBranches().get(0);
    assertTrue(lOpen.has(Node.props().put(Node.FLAG, Node.QUIT_FLAG)));
  }

  @Test
  public void testUniversalRuleFlagsPastConstantBound() throws Exception
  {
    // One quantifier and no constants in the trunk allow two constants per branch.
    Tableau lTableau = new Tableau(ClassicalLogic.CFOL, mParser.argument("a", "VxFx"));
    Branch lBranch = lTableau.getBranches().get(0);
    Rule lUniversal = lTableau.getRules().get("Universal");

    Target lBefore = lUniversal.target(lBranch);
    assertNotNull(lBefore);
    assertNull(lBefore.getFlag());

    lBranch.add(Node.snode(mParser.parse("Gmn")));
    lBranch.add(Node.snode(mParser.parse("Gos")));

    Target lTarget = lUniversal.target(lBranch);
    assertNotNull(lTarget);
    assertEquals(Node.QUIT_FLAG, lTarget.getFlag());

    lUniversal.apply(lTarget);
    assertTrue(lBranch.has(Node.props().put(Node.FLAG, Node.QUIT_FLAG)));
    assertNull(lUniversal.target(lBranch));
  }

  @Test
  public void testFinishedTableauDoesNotStep() throws Exception
  {
    Tableau lTableau = new Tableau(ClassicalLogic.CPL, mParser.argument("a", "Kab")).build();
    int lSteps = lTableau.getHistory().size();
    assertFalse(lTableau.step());
    assertEquals(lSteps, lTableau.getHistory().size());
  }

  @Test
  public void testListenersSeeEvents() throws Exception
  {
    final List<String> lEvents = new ArrayList<>();
    Tableau lTableau = new Tableau();
    lTableau.addListener(new TableauListener()
    {
      @Override
      public void afterBranchAdd(Branch xiBranch)
      {
        lEvents.add("branch");
      }

      @Override
      public void afterBranchClose(Branch xiBranch)
      {
        lEvents.add("close");
      }

      @Override
      public void afterNodeAdd(Node xiNode, Branch xiBranch)
      {
        // Not recorded.
      }

      @Override
      public void afterNodeTick(Node xiNode, Branch xiBranch)
      {
        lEvents.add("tick");
      }

      @Override
      public void beforeTrunkBuild(Tableau xiTableau)
      {
        lEvents.add("trunk");
      }

      @Override
      public void afterTrunkBuild(Tableau xiTableau)
      {
        lEvents.add("trunk built");
      }

      @Override
      public void afterFinish(Tableau xiTableau)
      {
        lEvents.add("finish");
      }
    });

    lTableau.setLogic(ClassicalLogic.CPL);
    assertFalse(lTableau.isTrunkBuilt());
    lTableau.setArgument(mParser.argument("a", "Kab"));
    lTableau.build();

    assertEquals("trunk", lEvents.get(0));
    assertEquals("branch", lEvents.get(1));
    assertEquals("trunk built", lEvents.get(2));
    assertEquals("tick", lEvents.get(3));
    assertEquals("close", lEvents.get(4));
    assertEquals("finish", lEvents.get(5));
    assertEquals(6, lEvents.size());
  }
}
