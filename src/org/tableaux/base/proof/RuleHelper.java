package org.tableaux.base.proof;

/**
 * Base class for the auxiliary state kept on behalf of a single rule.
 *
 * A helper is attached to its rule on construction and sees every tableau and rule event from then on.  Subclasses
 * override only the callbacks they need.
 */
public abstract class RuleHelper implements TableauListener, RuleListener
{
  protected final Rule mRule;

  /**
   * Create a helper and attach it to a rule.
   *
   * @param xiRule - the rule that owns the helper.
   */
  protected RuleHelper(Rule xiRule)
  {
    mRule = xiRule;
    xiRule.attachHelper(this);
  }

  public Rule getRule()
  {
    return mRule;
  }

  protected Tableau getTableau()
  {
    return mRule.getTableau();
  }

  @Override
  public void afterBranchAdd(Branch xiBranch)
  {
    // Nothing by default
  }

  @Override
  public void afterBranchClose(Branch xiBranch)
  {
    // Nothing by default
  }

  @Override
  public void afterNodeAdd(Node xiNode, Branch xiBranch)
  {
    // Nothing by default
  }

  @Override
  public void afterNodeTick(Node xiNode, Branch xiBranch)
  {
    // Nothing by default
  }

  @Override
  public void beforeTrunkBuild(Tableau xiTableau)
  {
    // Nothing by default
  }

  @Override
  public void afterTrunkBuild(Tableau xiTableau)
  {
    // Nothing by default
  }

  @Override
  public void afterFinish(Tableau xiTableau)
  {
    // Nothing by default
  }

  @Override
  public void beforeApply(Target xiTarget)
  {
    // Nothing by default
  }

  @Override
  public void afterApply(Target xiTarget)
  {
    // Nothing by default
  }

  @Override
  public String toString()
  {
    return mRule.getName() + ":" + getClass().getSimpleName();
  }
}
