package org.tableaux.base.proof;

/**
 * One rule application in a tableau's history.
 */
public class StepEntry
{
  private final Rule   mRule;
  private final Target mTarget;
  private long         mDurationMs;

  public StepEntry(Rule xiRule, Target xiTarget)
  {
    mRule = xiRule;
    mTarget = xiTarget;
  }

  public Rule getRule()
  {
    return mRule;
  }

  public Target getTarget()
  {
    return mTarget;
  }

  /**
   * @return the time taken to select and apply the step.
   */
  public long getDurationMs()
  {
    return mDurationMs;
  }

  void setDurationMs(long xiDurationMs)
  {
    mDurationMs = xiDurationMs;
  }

  @Override
  public String toString()
  {
    return mRule.getName() + " -> " + mTarget;
  }
}
