package org.tableaux.base.proof;

/**
 * Interface implemented by objects that need to see a rule's applications.
 */
public interface RuleListener
{
  /**
   * Called before the rule applies a target.
   *
   * @param xiTarget - the target about to be applied.
   */
  public void beforeApply(Target xiTarget);

  /**
   * Called after the rule has applied a target.
   *
   * @param xiTarget - the target just applied.
   */
  public void afterApply(Target xiTarget);
}
