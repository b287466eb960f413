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
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;

/**
 * Every rule of every logic must apply to its own example nodes.
 */
@RunWith(Parameterized.class)
public class RuleExampleTest extends Assert
{
  /**
   * @return one test per logic and rule.
   */
  @Parameters(name="{0}")
  public static Iterable<? extends Object> data()
  {
    LinkedList<Object[]> lTests = new LinkedList<>();
    for (Logic lLogic : LogicRegistry.getLogics())
    {
      for (Rule lRule : new Tableau(lLogic, null).getRules().getRules())
      {
        lTests.add(new Object[] {lLogic.getName() + "." + lRule.getName(), lLogic, lRule.getName()});
      }
    }
    return lTests;
  }

  @Parameter(value = 0)
  public String mName;

  @Parameter(value = 1)
  public Logic mLogic;

  @Parameter(value = 2)
  public String mRuleName;

  @Test
  public void testRuleAppliesToExample()
  {
    Target lTarget = Tableau.testRule(mLogic, mRuleName);
    assertNotNull(mName + " did not apply to its example", lTarget);
    assertEquals(mRuleName, lTarget.getRule().getName());
  }
}
