package org.tableaux.base.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tableaux.base.util.exceptions.BuildTimeoutException;
import org.tableaux.base.util.lex.Argument;
import org.tableaux.base.util.watchdog.Watchdog;
import org.tableaux.base.util.watchdog.Watchdog.WatchdogExpiryHandler;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;

/**
 * A tableau: a tree of branches built for an argument by repeatedly applying a logic's rules.
 *
 * Setting both a logic and an argument builds the trunk.  Each {@link #step} then finds the next rule application,
 * scanning the open branches in order and, for each, the rule groups in order.  The tableau finishes when no rule
 * applies, the step limit is reached, or the build times out.  The argument is valid iff every branch closes.
 *
 * A tableau is not thread-safe.
 */
public class Tableau implements BranchListener, Iterable<Branch>
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Outcome of a tableau.
   */
  public static enum Result
  {
    VALID("Valid"),
    INVALID("Invalid"),
    COMPLETED("Completed"),
    PREMATURE("Premature"),
    UNFINISHED("Unfinished");

    private final String mLabel;

    private Result(String xiLabel)
    {
      mLabel = xiLabel;
    }

    public String getLabel()
    {
      return mLabel;
    }
  }

  private final TableauOptions           mOptions;
  private final List<TableauListener>    mHelperListeners = new ArrayList<>();
  private final List<TableauListener>    mListeners       = new ArrayList<>();
  private final List<Branch>             mBranches        = new ArrayList<>();
  private final Set<Branch>              mOpen            = new LinkedHashSet<>();
  private final Set<Branch>              mDirty           = new LinkedHashSet<>();
  private final List<StepEntry>          mHistory         = new ArrayList<>();
  private final Map<Branch, BranchStat>  mBranchStats     = new LinkedHashMap<>();
  private final Map<Node, Integer>       mComplexity      = new HashMap<>();
  private final EnumSet<TabFlag>         mFlags           = EnumSet.of(TabFlag.PREMATURE);

  private final Stopwatch mBuildTimer = Stopwatch.createUnstarted();

  // Set on the watchdog thread, read between steps.
  private volatile boolean mTimeoutSignalled;
  private final Stopwatch mTrunkTimer = Stopwatch.createUnstarted();
  private final Stopwatch mTreeTimer  = Stopwatch.createUnstarted();

  private Logic        mLogic;
  private Argument     mArgument;
  private RuleGroups   mRules = new RuleGroups();
  private TreeStruct   mTree;
  private TableauStats mStats;

  /**
   * Create an empty tableau with default options.
   */
  public Tableau()
  {
    this(null, null, new TableauOptions());
  }

  /**
   * Create a tableau and, when both logic and argument are given, build its trunk.
   *
   * @param xiLogic - the logic, or null.
   * @param xiArgument - the argument, or null.
   */
  public Tableau(Logic xiLogic, Argument xiArgument)
  {
    this(xiLogic, xiArgument, new TableauOptions());
  }

  /**
   * Create a tableau and, when both logic and argument are given, build its trunk.
   *
   * @param xiLogic - the logic, or null.
   * @param xiArgument - the argument, or null.
   * @param xiOptions - the build options.
   */
  public Tableau(Logic xiLogic, Argument xiArgument, TableauOptions xiOptions)
  {
    mOptions = xiOptions;
    if (xiLogic != null)
    {
      setLogic(xiLogic);
    }
    if (xiArgument != null)
    {
      setArgument(xiArgument);
    }
  }

  //---------------------------------------------------------------------------
  // Configuration
  //---------------------------------------------------------------------------

  public TableauOptions getOptions()
  {
    return mOptions;
  }

  public Logic getLogic()
  {
    return mLogic;
  }

  /**
   * Set the logic, creating its rules.
   *
   * @throws IllegalStateException if the tableau has started.
   */
  public Tableau setLogic(Logic xiLogic)
  {
    checkNotStarted();
    mLogic = xiLogic;
    mHelperListeners.clear();
    mComplexity.clear();
    mRules = xiLogic.createRules(this);
    if (mArgument != null)
    {
      buildTrunk();
    }
    return this;
  }

  public Argument getArgument()
  {
    return mArgument;
  }

  /**
   * Set the argument.
   *
   * @throws IllegalStateException if the tableau has started.
   */
  public Tableau setArgument(Argument xiArgument)
  {
    checkNotStarted();
    mArgument = xiArgument;
    if (mLogic != null)
    {
      buildTrunk();
    }
    return this;
  }

  public RuleGroups getRules()
  {
    return mRules;
  }

  /**
   * Add an external listener.  It sees events after the rule helpers do.
   */
  public void addListener(TableauListener xiListener)
  {
    if (xiListener instanceof RuleHelper)
    {
      mHelperListeners.add(xiListener);
    }
    else
    {
      mListeners.add(xiListener);
    }
  }

  private List<TableauListener> listeners()
  {
    List<TableauListener> lAll = new ArrayList<>(mHelperListeners);
    lAll.addAll(mListeners);
    return lAll;
  }

  //---------------------------------------------------------------------------
  // State
  //---------------------------------------------------------------------------

  public Set<TabFlag> getFlags()
  {
    return Collections.unmodifiableSet(mFlags);
  }

  public boolean isTrunkBuilt()
  {
    return mFlags.contains(TabFlag.TRUNK_BUILT);
  }

  public boolean isFinished()
  {
    return mFlags.contains(TabFlag.FINISHED);
  }

  /**
   * @return whether the tableau finished because no rule applied.
   */
  public boolean isCompleted()
  {
    return isFinished() && !mFlags.contains(TabFlag.PREMATURE);
  }

  /**
   * @return whether the tableau finished early: step limit, timeout, or a branch stopped at a bound.
   */
  public boolean isPremature()
  {
    return isFinished() && mFlags.contains(TabFlag.PREMATURE);
  }

  /**
   * @return whether the argument is valid, or null if the tableau has not completed for an argument.
   */
  public Boolean getValid()
  {
    if (!isCompleted() || mArgument == null)
    {
      return null;
    }
    return mOpen.isEmpty();
  }

  /**
   * @return whether the argument is invalid, or null if the tableau has not completed for an argument.
   */
  public Boolean getInvalid()
  {
    Boolean lValid = getValid();
    return (lValid == null) ? null : !lValid;
  }

  public Result getResult()
  {
    if (isPremature())
    {
      return Result.PREMATURE;
    }
    if (!isCompleted())
    {
      return Result.UNFINISHED;
    }
    if (mArgument == null)
    {
      return Result.COMPLETED;
    }
    return mOpen.isEmpty() ? Result.VALID : Result.INVALID;
  }

  /**
   * @return the step number of the next application: one for the trunk, plus one per application.
   */
  public int getCurrentStep()
  {
    return mHistory.size() + (isTrunkBuilt() ? 1 : 0);
  }

  public List<StepEntry> getHistory()
  {
    return Collections.unmodifiableList(mHistory);
  }

  public List<Branch> getBranches()
  {
    return Collections.unmodifiableList(mBranches);
  }

  /**
   * @return the open branches, in the order they were added.
   */
  public List<Branch> getOpenBranches()
  {
    return new ArrayList<>(mOpen);
  }

  public int size()
  {
    return mBranches.size();
  }

  @Override
  public Iterator<Branch> iterator()
  {
    return getBranches().iterator();
  }

  public BranchStat getBranchStat(Branch xiBranch)
  {
    return mBranchStats.get(xiBranch);
  }

  /**
   * @return the tree, or null if the tableau has not finished or timed out.
   */
  public TreeStruct getTree()
  {
    return mTree;
  }

  /**
   * @return the stats, or null if the tableau has not finished.
   */
  public TableauStats getStats()
  {
    return mStats;
  }

  /**
   * @return whether the step limit has been reached.
   */
  public boolean isMaxStepsExceeded()
  {
    int lMax = mOptions.getMaxSteps();
    return lMax >= 0 && mHistory.size() >= lMax;
  }

  /**
   * @return the logic's branching complexity of a node, cached.  Zero with no logic.
   */
  public int branchingComplexity(Node xiNode)
  {
    if (mLogic == null)
    {
      return 0;
    }
    Integer lComplexity = mComplexity.get(xiNode);
    if (lComplexity == null)
    {
      lComplexity = mLogic.branchingComplexity(xiNode);
      mComplexity.put(xiNode, lComplexity);
    }
    return lComplexity;
  }

  //---------------------------------------------------------------------------
  // Branches
  //---------------------------------------------------------------------------

  /**
   * Create a new root branch on the tableau.
   */
  public Branch branch()
  {
    return branch(null);
  }

  /**
   * Create a new branch on the tableau.
   *
   * @param xiParent - the branch to copy, or null for an empty root branch.
   */
  public Branch branch(Branch xiParent)
  {
    Branch lBranch = (xiParent == null) ? new Branch() : xiParent.copy(xiParent);
    add(lBranch);
    return lBranch;
  }

  /**
   * Add a branch to the tableau.
   */
  public Tableau add(Branch xiBranch)
  {
    int lIndex = mBranches.size();
    xiBranch.setIndex(lIndex);
    mBranches.add(xiBranch);
    if (!xiBranch.isClosed())
    {
      mOpen.add(xiBranch);
    }

    Branch lParent = xiBranch.getParent();
    BranchStat lParentStat = (lParent == null) ? null : mBranchStats.get(lParent);
    mBranchStats.put(xiBranch, new BranchStat(lIndex, getCurrentStep(), lParent, lParentStat));
    xiBranch.addListener(this);

    for (TableauListener lListener : listeners())
    {
      lListener.afterBranchAdd(xiBranch);
    }

    if (lParent == null)
    {
      for (Node lNode : new ArrayList<>(xiBranch.getNodes()))
      {
        afterNodeAdd(lNode, xiBranch);
      }
    }
    return this;
  }

  @Override
  public void afterNodeAdd(Node xiNode, Branch xiBranch)
  {
    mBranchStats.get(xiBranch).nodeAdded(xiNode, getCurrentStep());
    mDirty.add(xiBranch);
    for (TableauListener lListener : listeners())
    {
      lListener.afterNodeAdd(xiNode, xiBranch);
    }
  }

  @Override
  public void afterNodeTick(Node xiNode, Branch xiBranch)
  {
    mBranchStats.get(xiBranch).nodeTicked(xiNode, getCurrentStep());
    for (TableauListener lListener : listeners())
    {
      lListener.afterNodeTick(xiNode, xiBranch);
    }
  }

  @Override
  public void afterBranchClose(Branch xiBranch)
  {
    mBranchStats.get(xiBranch).closed(getCurrentStep());
    mOpen.remove(xiBranch);
    LOGGER.debug("Branch {} closed at step {}", xiBranch.getIndex(), getCurrentStep());
    for (TableauListener lListener : listeners())
    {
      lListener.afterBranchClose(xiBranch);
    }
  }

  //---------------------------------------------------------------------------
  // Building
  //---------------------------------------------------------------------------

  private void checkNotStarted()
  {
    if (isTrunkBuilt() || !mHistory.isEmpty())
    {
      throw new IllegalStateException("Tableau already started");
    }
  }

  /**
   * Build the trunk for the argument.  Called automatically once both logic and argument are set.
   *
   * @throws IllegalStateException if the trunk is already built, or there is no logic or argument.
   */
  public Tableau buildTrunk()
  {
    checkNotStarted();
    if (mLogic == null || mArgument == null)
    {
      throw new IllegalStateException("Building a trunk needs a logic and an argument");
    }

    mTrunkTimer.start();
    for (TableauListener lListener : listeners())
    {
      lListener.beforeTrunkBuild(this);
    }
    mLogic.buildTrunk(this, mArgument);
    mFlags.add(TabFlag.TRUNK_BUILT);
    for (TableauListener lListener : listeners())
    {
      lListener.afterTrunkBuild(this);
    }
    mTrunkTimer.stop();
    LOGGER.debug("Built {} trunk for {}", mLogic.getName(), mArgument);

    closeDirtyBranches();
    return this;
  }

  /**
   * Find the next rule application, without applying it.
   *
   * @return the step, or null if no rule applies to any open branch.
   */
  public StepEntry next()
  {
    for (Branch lBranch : new ArrayList<>(mOpen))
    {
      for (RuleGroup lGroup : mRules.getAllGroups())
      {
        StepEntry lEntry = groupApplication(lBranch, lGroup);
        if (lEntry != null)
        {
          return lEntry;
        }
      }
    }
    return null;
  }

  private StepEntry groupApplication(Branch xiBranch, RuleGroup xiGroup)
  {
    boolean lGroupOptim = mOptions.isGroupOptim();
    List<StepEntry> lResults = new ArrayList<>();
    for (Rule lRule : xiGroup)
    {
      Target lTarget = lRule.target(xiBranch);
      if (lTarget != null)
      {
        StepEntry lEntry = new StepEntry(lRule, lTarget);
        if (!lGroupOptim)
        {
          lTarget.setGroupStats(null, null, 1, false);
          return lEntry;
        }
        lResults.add(lEntry);
      }
    }

    if (lResults.isEmpty())
    {
      return null;
    }

    double[] lScores = new double[lResults.size()];
    double lMax = Double.NEGATIVE_INFINITY;
    double lMin = Double.POSITIVE_INFINITY;
    for (int lii = 0; lii < lScores.length; lii++)
    {
      StepEntry lEntry = lResults.get(lii);
      lScores[lii] = lEntry.getRule().groupScore(lEntry.getTarget());
      lMax = Math.max(lMax, lScores[lii]);
      lMin = Math.min(lMin, lScores[lii]);
    }
    for (int lii = 0; lii < lScores.length; lii++)
    {
      if (lScores[lii] == lMax)
      {
        Target lTarget = lResults.get(lii).getTarget();
        lTarget.setGroupStats(lScores[lii], lMin, lResults.size(), true);
        return lResults.get(lii);
      }
    }
    throw new IllegalStateException("No best group score");
  }

  /**
   * Apply the next rule, or finish the tableau if none applies.
   *
   * @return whether a rule was applied.  False if the tableau was, or has now become, finished.
   *
   * @throws IllegalStateException if the tableau has a logic but no trunk.
   */
  public boolean step()
  {
    if (isFinished())
    {
      return false;
    }
    if (mLogic != null && !isTrunkBuilt())
    {
      throw new IllegalStateException("Trunk not built");
    }

    Stopwatch lTimer = Stopwatch.createStarted();
    StepEntry lEntry = null;
    if (!isMaxStepsExceeded())
    {
      lEntry = next();
      if (lEntry == null && !hasQuitFlag())
      {
        mFlags.remove(TabFlag.PREMATURE);
      }
    }

    if (lEntry == null)
    {
      finish();
      return false;
    }

    lEntry.getRule().apply(lEntry.getTarget());
    lEntry.setDurationMs(lTimer.elapsed(TimeUnit.MILLISECONDS));
    mHistory.add(lEntry);
    closeDirtyBranches();
    return true;
  }

  private boolean hasQuitFlag()
  {
    ImmutableMap<String, Object> lFlag = ImmutableMap.<String, Object>of(Node.FLAG, Node.QUIT_FLAG);
    for (Branch lBranch : mOpen)
    {
      if (lBranch.has(lFlag))
      {
        return true;
      }
    }
    return false;
  }

  /**
   * Apply closure rules to every branch changed since the last check.
   */
  private void closeDirtyBranches()
  {
    while (!mDirty.isEmpty())
    {
      Iterator<Branch> lIterator = mDirty.iterator();
      Branch lBranch = lIterator.next();
      lIterator.remove();
      if (lBranch.isClosed())
      {
        continue;
      }

      for (Rule lRule : mRules.getClosureGroup())
      {
        Target lTarget = lRule.target(lBranch);
        if (lTarget != null)
        {
          lTarget.setGroupStats(null, null, 1, false);
          StepEntry lEntry = new StepEntry(lRule, lTarget);
          lRule.apply(lTarget);
          mHistory.add(lEntry);
          break;
        }
      }
    }
  }

  /**
   * Step until finished.
   *
   * @throws BuildTimeoutException if the build timeout is exceeded.  The tableau is left finished and premature.
   * @throws IllegalStateException if the tableau has a logic but no trunk.
   */
  public Tableau build() throws BuildTimeoutException
  {
    long lTimeout = mOptions.getBuildTimeoutMs();
    mTimeoutSignalled = (lTimeout == 0);
    Watchdog lWatchdog = null;
    if (lTimeout > 0)
    {
      lWatchdog = new Watchdog(lTimeout, new WatchdogExpiryHandler()
      {
        @Override
        public void expired()
        {
          LOGGER.debug("Build timeout signalled");
          mTimeoutSignalled = true;
        }
      });
    }

    mBuildTimer.start();
    try
    {
      while (!isFinished())
      {
        if (mTimeoutSignalled)
        {
          mFlags.add(TabFlag.TIMED_OUT);
          finish();
          throw new BuildTimeoutException(lTimeout);
        }
        step();
      }
    }
    finally
    {
      if (mBuildTimer.isRunning())
      {
        mBuildTimer.stop();
      }
      if (lWatchdog != null)
      {
        lWatchdog.stop();
      }
    }
    return this;
  }

  /**
   * Mark the tableau finished, and build the tree and stats.  Finishing a finished tableau does nothing.
   */
  public Tableau finish()
  {
    if (isFinished())
    {
      return this;
    }
    mFlags.add(TabFlag.FINISHED);

    if (mOptions.isBuildModels() && Boolean.TRUE.equals(getInvalid()))
    {
      LOGGER.warn("Countermodels were requested but model building is not supported");
    }

    if (!mFlags.contains(TabFlag.TIMED_OUT))
    {
      mTreeTimer.start();
      mTree = TreeStruct.build(mBranches, mBranchStats);
      mTreeTimer.stop();
    }

    mStats = computeStats();
    for (TableauListener lListener : listeners())
    {
      lListener.afterFinish(this);
    }
    LOGGER.info("Tableau finished: {}", mStats);
    return this;
  }

  private TableauStats computeStats()
  {
    long lRulesDuration = 0;
    long lRulesTime = 0;
    List<Rule.RuleStats> lRuleStats = new ArrayList<>();
    for (StepEntry lEntry : mHistory)
    {
      lRulesDuration += lEntry.getDurationMs();
    }
    for (Rule lRule : mRules.getRules())
    {
      lRuleStats.add(lRule.getStats());
      lRulesTime += lRule.getElapsedMs();
    }

    return new TableauStats(getResult(),
                            mBranches.size(),
                            mOpen.size(),
                            mHistory.size(),
                            (mTree == null) ? 0 : mTree.getDistinctNodes(),
                            lRulesDuration,
                            mBuildTimer.elapsed(TimeUnit.MILLISECONDS),
                            mTrunkTimer.elapsed(TimeUnit.MILLISECONDS),
                            mTreeTimer.elapsed(TimeUnit.MILLISECONDS),
                            lRulesTime,
                            lRuleStats);
  }

  //---------------------------------------------------------------------------
  // Rule self test
  //---------------------------------------------------------------------------

  /**
   * Check a rule against its own example: seed a branch of a fresh tableau with the rule's example nodes, and apply
   * the rule once.
   *
   * @param xiLogic - the logic owning the rule.
   * @param xiRuleName - the rule name.
   *
   * @return the target applied, or null if the rule did not apply.
   */
  public static Target testRule(Logic xiLogic, String xiRuleName)
  {
    Tableau lTableau = new Tableau(xiLogic, null);
    Rule lRule = lTableau.getRules().get(xiRuleName);
    Branch lBranch = lTableau.branch();
    lBranch.extend(lRule.exampleNodes());
    Target lTarget = lRule.target(lBranch);
    if (lTarget != null)
    {
      lRule.apply(lTarget);
      lTableau.mHistory.add(new StepEntry(lRule, lTarget));
    }
    lTableau.finish();
    return lTarget;
  }

  @Override
  public String toString()
  {
    return "Tableau(" + ((mLogic == null) ? "no logic" : mLogic.getName()) + ", " + mArgument + ", " +
           getResult().getLabel() + ", " + mBranches.size() + " branches)";
  }
}
