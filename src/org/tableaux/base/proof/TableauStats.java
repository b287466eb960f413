package org.tableaux.base.proof;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Summary statistics of a finished tableau.
 */
public class TableauStats
{
  public final Tableau.Result mResult;
  public final int            mBranches;
  public final int            mOpenBranches;
  public final int            mClosedBranches;
  public final int            mSteps;
  public final int            mDistinctNodes;
  public final long           mRulesDurationMs;
  public final long           mBuildDurationMs;
  public final long           mTrunkDurationMs;
  public final long           mTreeDurationMs;
  public final long           mRulesTimeMs;
  public final ImmutableList<Rule.RuleStats> mRules;

  TableauStats(Tableau.Result xiResult,
               int xiBranches,
               int xiOpenBranches,
               int xiSteps,
               int xiDistinctNodes,
               long xiRulesDurationMs,
               long xiBuildDurationMs,
               long xiTrunkDurationMs,
               long xiTreeDurationMs,
               long xiRulesTimeMs,
               List<Rule.RuleStats> xiRules)
  {
    mResult = xiResult;
    mBranches = xiBranches;
    mOpenBranches = xiOpenBranches;
    mClosedBranches = xiBranches - xiOpenBranches;
    mSteps = xiSteps;
    mDistinctNodes = xiDistinctNodes;
    mRulesDurationMs = xiRulesDurationMs;
    mBuildDurationMs = xiBuildDurationMs;
    mTrunkDurationMs = xiTrunkDurationMs;
    mTreeDurationMs = xiTreeDurationMs;
    mRulesTimeMs = xiRulesTimeMs;
    mRules = ImmutableList.copyOf(xiRules);
  }

  @Override
  public String toString()
  {
    return mResult.getLabel() + ": " + mSteps + " steps, " + mBranches + " branches (" + mOpenBranches + " open, " +
           mClosedBranches + " closed), " + mDistinctNodes + " distinct nodes, built in " + mBuildDurationMs + "ms";
  }
}
