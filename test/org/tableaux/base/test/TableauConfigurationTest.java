package org.tableaux.base.test;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.tableaux.base.logics.ClassicalLogic;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.TableauOptions;
import org.tableaux.base.util.config.TableauConfiguration;
import org.tableaux.base.util.config.TableauConfiguration.CfgItem;
import org.tableaux.base.util.lex.factory.PolishParser;

/**
 * Tests for configuration defaults and their effect on tableau options.
 */
public class TableauConfigurationTest extends Assert
{
  @After
  public void tearDown()
  {
    for (CfgItem lItem : CfgItem.values())
    {
      TableauConfiguration.utOverrideCfgVal(lItem, null);
    }
  }

  @Test
  public void testDefaults()
  {
    assertEquals(-1, TableauConfiguration.getCfgInt(CfgItem.MAX_STEPS));
    assertEquals(-1, TableauConfiguration.getCfgInt(CfgItem.BUILD_TIMEOUT_MS));
    assertTrue(TableauConfiguration.getCfgBool(CfgItem.GROUP_OPTIM));
    assertTrue(TableauConfiguration.getCfgBool(CfgItem.RANK_OPTIM));
    assertFalse(TableauConfiguration.getCfgBool(CfgItem.BUILD_MODELS));

    TableauOptions lOptions = new TableauOptions();
    assertEquals(-1, lOptions.getMaxSteps());
    assertEquals(-1, lOptions.getBuildTimeoutMs());
    assertTrue(lOptions.isGroupOptim());
  }

  @Test
  public void testOverrideFeedsNewOptions() throws Exception
  {
    TableauConfiguration.utOverrideCfgVal(CfgItem.MAX_STEPS, "0");
    TableauConfiguration.utOverrideCfgVal(CfgItem.RANK_OPTIM, "false");

    TableauOptions lOptions = new TableauOptions();
    assertEquals(0, lOptions.getMaxSteps());
    assertFalse(lOptions.isRankOptim());

    Tableau lTableau = new Tableau(ClassicalLogic.CPL, new PolishParser().argument("a", "Kab")).build();
    assertEquals(Tableau.Result.PREMATURE, lTableau.getResult());
  }

  @Test
  public void testOverrideRestored()
  {
    TableauConfiguration.utOverrideCfgVal(CfgItem.GROUP_OPTIM, "false");
    assertFalse(TableauConfiguration.getCfgBool(CfgItem.GROUP_OPTIM));
    TableauConfiguration.utOverrideCfgVal(CfgItem.GROUP_OPTIM, null);
    assertEquals(CfgItem.GROUP_OPTIM.mDefault, TableauConfiguration.getCfgStr(CfgItem.GROUP_OPTIM));
  }

  @Test
  public void testLogConfig()
  {
    TableauConfiguration.logConfig();
  }
}
