package org.tableaux.base.proof;

import org.tableaux.base.util.config.TableauConfiguration;
import org.tableaux.base.util.config.TableauConfiguration.CfgItem;

/**
 * Options for building a single tableau.  Defaults come from {@link TableauConfiguration}.
 */
public class TableauOptions
{
  private boolean mGroupOptim  = TableauConfiguration.getCfgBool(CfgItem.GROUP_OPTIM);
  private boolean mRankOptim   = TableauConfiguration.getCfgBool(CfgItem.RANK_OPTIM);
  private boolean mBuildModels = TableauConfiguration.getCfgBool(CfgItem.BUILD_MODELS);
  private int     mMaxSteps    = TableauConfiguration.getCfgInt(CfgItem.MAX_STEPS);
  private long    mBuildTimeoutMs = TableauConfiguration.getCfgInt(CfgItem.BUILD_TIMEOUT_MS);

  public boolean isGroupOptim()
  {
    return mGroupOptim;
  }

  public TableauOptions setGroupOptim(boolean xiGroupOptim)
  {
    mGroupOptim = xiGroupOptim;
    return this;
  }

  public boolean isRankOptim()
  {
    return mRankOptim;
  }

  public TableauOptions setRankOptim(boolean xiRankOptim)
  {
    mRankOptim = xiRankOptim;
    return this;
  }

  public boolean isBuildModels()
  {
    return mBuildModels;
  }

  public TableauOptions setBuildModels(boolean xiBuildModels)
  {
    mBuildModels = xiBuildModels;
    return this;
  }

  /**
   * @return the maximum number of rule applications, or a negative number for no limit.
   */
  public int getMaxSteps()
  {
    return mMaxSteps;
  }

  public TableauOptions setMaxSteps(int xiMaxSteps)
  {
    mMaxSteps = xiMaxSteps;
    return this;
  }

  /**
   * @return the build timeout in milliseconds, or a negative number for none.
   */
  public long getBuildTimeoutMs()
  {
    return mBuildTimeoutMs;
  }

  public TableauOptions setBuildTimeoutMs(long xiBuildTimeoutMs)
  {
    mBuildTimeoutMs = xiBuildTimeoutMs;
    return this;
  }

  @Override
  public String toString()
  {
    return "group_optim=" + mGroupOptim + ", rank_optim=" + mRankOptim + ", build_models=" + mBuildModels +
           ", max_steps=" + mMaxSteps + ", build_timeout=" + mBuildTimeoutMs;
  }
}
