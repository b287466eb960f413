package org.tableaux.base.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Stopwatch;

/**
 * A tableau rule.
 *
 * A rule searches a branch for targets it can apply to, picks the best of them, and applies it.  Rules carry their own
 * state in {@link RuleHelper}s, which see every tableau and rule event.
 *
 * Subclasses supply target search ({@link #getTargets}), application ({@link #applyTarget}) and example nodes, and may
 * override the scoring methods.
 */
public abstract class Rule
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Tableau                                        mTableau;
  private final String                                         mName;
  private final Map<Class<? extends RuleHelper>, RuleHelper>   mHelpers   = new LinkedHashMap<>();
  private final List<RuleListener>                             mListeners = new ArrayList<>();
  private final List<Target>                                   mHistory   = new ArrayList<>();
  private final Stopwatch                                      mSearchTimer = Stopwatch.createUnstarted();
  private final Stopwatch                                      mApplyTimer  = Stopwatch.createUnstarted();
  private int                                                  mSearchCount;
  private int                                                  mApplyCount;

  /**
   * Whether applying the rule ticks the target node.
   */
  protected boolean mTicking = true;

  /**
   * Whether ticked nodes are excluded from the rule's search.
   */
  protected boolean mIgnoreTicked = true;

  /**
   * Number of branches an application may result in, used to normalise the group score.
   */
  protected int mBranchLevel = 1;

  /**
   * Whether the rule ranks its candidates, when the tableau allows it.
   */
  protected boolean mRankOptim = true;

  /**
   * Create a rule on a tableau.
   *
   * @param xiTableau - the tableau.
   * @param xiName - the rule name, or null to use the class name.
   */
  protected Rule(Tableau xiTableau, String xiName)
  {
    if (xiTableau == null)
    {
      throw new IllegalArgumentException("A rule needs a tableau");
    }
    mTableau = xiTableau;
    mName = (xiName != null) ? xiName : getClass().getSimpleName();
  }

  public Tableau getTableau()
  {
    return mTableau;
  }

  public String getName()
  {
    return mName;
  }

  public boolean isTicking()
  {
    return mTicking;
  }

  public boolean isIgnoreTicked()
  {
    return mIgnoreTicked;
  }

  public int getBranchLevel()
  {
    return mBranchLevel;
  }

  /**
   * @return whether candidates are ranked: both the tableau option and the rule must allow it.
   */
  public boolean isRankOptim()
  {
    return mRankOptim && mTableau.getOptions().isRankOptim();
  }

  /**
   * @return the targets applied so far, in order.
   */
  public List<Target> getHistory()
  {
    return Collections.unmodifiableList(mHistory);
  }

  //---------------------------------------------------------------------------
  // Helpers and listeners
  //---------------------------------------------------------------------------

  void attachHelper(RuleHelper xiHelper)
  {
    if (mHelpers.containsKey(xiHelper.getClass()))
    {
      throw new IllegalStateException(mName + " already has a " + xiHelper.getClass().getSimpleName());
    }
    mHelpers.put(xiHelper.getClass(), xiHelper);
    mListeners.add(xiHelper);
    mTableau.addListener(xiHelper);
  }

  /**
   * @return the helper of the given class.
   *
   * @param xiClass - the helper class.
   *
   * @throws IllegalStateException if the rule has no such helper.
   */
  public <H extends RuleHelper> H getHelper(Class<H> xiClass)
  {
    RuleHelper lHelper = mHelpers.get(xiClass);
    if (lHelper == null)
    {
      throw new IllegalStateException(mName + " has no " + xiClass.getSimpleName());
    }
    return xiClass.cast(lHelper);
  }

  public boolean hasHelper(Class<? extends RuleHelper> xiClass)
  {
    return mHelpers.containsKey(xiClass);
  }

  public void addListener(RuleListener xiListener)
  {
    mListeners.add(xiListener);
  }

  //---------------------------------------------------------------------------
  // Search and apply
  //---------------------------------------------------------------------------

  /**
   * @return all the targets the rule could apply to on a branch, in a deterministic order.
   *
   * @param xiBranch - the branch to search.
   */
  protected abstract List<Target> getTargets(Branch xiBranch);

  /**
   * Apply a target.
   *
   * @param xiTarget - a target found by this rule.
   */
  protected abstract void applyTarget(Target xiTarget);

  /**
   * @return nodes that, placed on an otherwise empty branch, give the rule something to apply to.
   */
  public abstract List<Node> exampleNodes();

  /**
   * @return the score of a candidate target.  Higher is better.
   */
  public double scoreCandidate(Target xiTarget)
  {
    return 0;
  }

  /**
   * @return the score of the rule's selected target against those of the other rules in its group.
   */
  public double groupScore(Target xiTarget)
  {
    return xiTarget.getCandidateScore() / Math.max(1, mBranchLevel);
  }

  /**
   * @return the best target on a branch, or null if the rule does not apply.
   *
   * @param xiBranch - the branch to search.
   */
  public Target target(Branch xiBranch)
  {
    mSearchTimer.start();
    mSearchCount++;
    try
    {
      List<Target> lTargets = getTargets(xiBranch);
      if (lTargets.isEmpty())
      {
        return null;
      }

      boolean lRankOptim = isRankOptim();
      int lTotal = lTargets.size();
      if (!lRankOptim)
      {
        for (Target lTarget : lTargets)
        {
          lTarget.setRule(this);
          lTarget.setCandidateStats(0, 0, 0, lTotal, false);
        }
        return lTargets.get(0);
      }

      double[] lScores = new double[lTotal];
      double lMin = Double.POSITIVE_INFINITY;
      double lMax = Double.NEGATIVE_INFINITY;
      for (int lii = 0; lii < lTotal; lii++)
      {
        lScores[lii] = scoreCandidate(lTargets.get(lii));
        lMin = Math.min(lMin, lScores[lii]);
        lMax = Math.max(lMax, lScores[lii]);
      }

      Target lBest = null;
      for (int lii = 0; lii < lTotal; lii++)
      {
        Target lTarget = lTargets.get(lii);
        lTarget.setRule(this);
        lTarget.setCandidateStats(lScores[lii], lMin, lMax, lTotal, true);
        LOGGER.trace("{} candidate {} scored {}", mName, lTarget, lScores[lii]);
        if ((lBest == null) && (lScores[lii] == lMax))
        {
          lBest = lTarget;
        }
      }
      return lBest;
    }
    finally
    {
      mSearchTimer.stop();
    }
  }

  /**
   * Apply a target returned by {@link #target}.
   *
   * @param xiTarget - the target.
   */
  public void apply(Target xiTarget)
  {
    mApplyTimer.start();
    mApplyCount++;
    try
    {
      for (RuleListener lListener : new ArrayList<>(mListeners))
      {
        lListener.beforeApply(xiTarget);
      }
      applyTarget(xiTarget);
      mHistory.add(xiTarget);
      for (RuleListener lListener : new ArrayList<>(mListeners))
      {
        lListener.afterApply(xiTarget);
      }
    }
    finally
    {
      mApplyTimer.stop();
    }
    LOGGER.debug("{} applied to branch {}", mName, xiTarget.getBranch().getIndex());
  }

  //---------------------------------------------------------------------------
  // Stats and self test
  //---------------------------------------------------------------------------

  /**
   * Rule statistics.
   */
  public static class RuleStats
  {
    public final String mName;
    public final int    mApplied;
    public final long   mSearchMs;
    public final int    mSearchCount;
    public final long   mApplyMs;
    public final int    mApplyCount;

    RuleStats(String xiName, int xiApplied, long xiSearchMs, int xiSearchCount, long xiApplyMs, int xiApplyCount)
    {
      mName = xiName;
      mApplied = xiApplied;
      mSearchMs = xiSearchMs;
      mSearchCount = xiSearchCount;
      mApplyMs = xiApplyMs;
      mApplyCount = xiApplyCount;
    }

    @Override
    public String toString()
    {
      return mName + ": applied " + mApplied + ", search " + mSearchMs + "ms/" + mSearchCount + ", apply " +
             mApplyMs + "ms/" + mApplyCount;
    }
  }

  public RuleStats getStats()
  {
    return new RuleStats(mName,
                         mHistory.size(),
                         mSearchTimer.elapsed(TimeUnit.MILLISECONDS),
                         mSearchCount,
                         mApplyTimer.elapsed(TimeUnit.MILLISECONDS),
                         mApplyCount);
  }

  /**
   * @return total time spent searching and applying, in milliseconds.
   */
  public long getElapsedMs()
  {
    return mSearchTimer.elapsed(TimeUnit.MILLISECONDS) + mApplyTimer.elapsed(TimeUnit.MILLISECONDS);
  }

  @Override
  public String toString()
  {
    return mName;
  }
}
