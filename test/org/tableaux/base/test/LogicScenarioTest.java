package org.tableaux.base.test;

import java.util.LinkedList;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.tableaux.base.logics.LogicRegistry;
import org.tableaux.base.proof.Logic;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Tableau.Result;
import org.tableaux.base.util.lex.Argument;
import org.tableaux.base.util.lex.Predicates;
import org.tableaux.base.util.lex.factory.PolishParser;

/**
 * Known arguments, proved in each logic that has an interesting verdict on them.
 */
@RunWith(Parameterized.class)
public class LogicScenarioTest extends Assert
{
  private static final String[] ALL_LOGICS = {"FDE", "K3", "LP", "CPL", "CFOL", "K", "D", "T", "S4", "S5"};

  private static void add(LinkedList<Object[]> xiTests,
                          String xiLogic,
                          Result xiExpected,
                          String xiConclusion,
                          String... xiPremises)
  {
    StringBuilder lName = new StringBuilder(xiLogic).append(": ");
    for (String lPremise : xiPremises)
    {
      lName.append(lPremise).append(' ');
    }
    lName.append("|- ").append(xiConclusion);
    xiTests.add(new Object[] {lName.toString(), xiLogic, xiConclusion, xiPremises, xiExpected});
  }

  /**
   * @return the scenarios to run.
   */
  @Parameters(name="{0}")
  public static Iterable<? extends Object> data()
  {
    LinkedList<Object[]> lTests = new LinkedList<>();

    for (String lLogic : ALL_LOGICS)
    {
      // Conjunction elimination holds everywhere, disjunctive inference nowhere.
      add(lTests, lLogic, Result.VALID, "a", "Kab");
      add(lTests, lLogic, Result.INVALID, "b", "Aab");
    }

    // Excluded middle needs no gaps; explosion needs no gluts.
    add(lTests, "FDE", Result.INVALID, "AaNa");
    add(lTests, "K3", Result.INVALID, "AaNa");
    add(lTests, "LP", Result.VALID, "AaNa");
    add(lTests, "CPL", Result.VALID, "AaNa");
    add(lTests, "FDE", Result.INVALID, "b", "KaNa");
    add(lTests, "K3", Result.VALID, "b", "KaNa");
    add(lTests, "LP", Result.INVALID, "b", "KaNa");
    add(lTests, "CPL", Result.VALID, "b", "KaNa");
    add(lTests, "CPL", Result.VALID, "Cac", "Cab", "Cbc");
    add(lTests, "FDE", Result.VALID, "a", "NNa");

    // Frame conditions.
    add(lTests, "K", Result.INVALID, "a", "La");
    add(lTests, "D", Result.INVALID, "a", "La");
    add(lTests, "T", Result.VALID, "a", "La");
    add(lTests, "S4", Result.VALID, "a", "La");
    add(lTests, "S5", Result.VALID, "a", "La");
    add(lTests, "K", Result.INVALID, "Ma", "La");
    add(lTests, "D", Result.VALID, "Ma", "La");
    add(lTests, "T", Result.VALID, "Ma", "La");
    add(lTests, "K", Result.INVALID, "LLa", "La");
    add(lTests, "T", Result.INVALID, "LLa", "La");
    add(lTests, "S4", Result.VALID, "LLa", "La");
    add(lTests, "S5", Result.VALID, "LLa", "La");
    add(lTests, "S4", Result.INVALID, "LMa", "Ma");
    add(lTests, "S5", Result.VALID, "LMa", "Ma");
    add(lTests, "K", Result.VALID, "Lb", "LCab", "La");

    // Quantifiers and identity.
    add(lTests, "CFOL", Result.VALID, "Fm", "VxFx");
    add(lTests, "CFOL", Result.VALID, "SxFx", "Fm");
    add(lTests, "CFOL", Result.INVALID, "VxFx", "SxFx");
    add(lTests, "CFOL", Result.VALID, "NSxFx", "VxNFx");
    add(lTests, "CFOL", Result.VALID, "Fn", "Fm", "Imn");
    add(lTests, "CFOL", Result.VALID, "Imm");
    // The witness for SxFx must be new even though n precedes the last constant on the branch.
    add(lTests, "CFOL", Result.INVALID, "a", "NFn", "Gmm", "SxFx");
    add(lTests, "FDE", Result.VALID, "Fm", "VxFx");
    add(lTests, "FDE", Result.VALID, "SxFx", "Fm");
    add(lTests, "CFOL", Result.PREMATURE, "a", "VxSyGxy");

    return lTests;
  }

  @Parameter(value = 0)
  public String mName;

  @Parameter(value = 1)
  public String mLogicName;

  @Parameter(value = 2)
  public String mConclusion;

  @Parameter(value = 3)
  public String[] mPremises;

  @Parameter(value = 4)
  public Result mExpected;

  @Test
  public void testScenario() throws Exception
  {
    Predicates lPredicates = new Predicates();
    lPredicates.add(0, 0, 1, null);
    lPredicates.add(1, 0, 2, null);
    Argument lArgument = new PolishParser(lPredicates).argument(mConclusion, mPremises);

    Logic lLogic = LogicRegistry.get(mLogicName);
    Tableau lTableau = new Tableau(lLogic, lArgument).build();

    assertTrue(lTableau.isFinished());
    assertEquals(mName, mExpected, lTableau.getResult());
  }
}
