package org.tableaux.base.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The rules of a tableau: the closure group followed by the ordered rule groups.
 */
public class RuleGroups
{
  private final RuleGroup         mClosure = new RuleGroup("closure");
  private final List<RuleGroup>   mGroups  = new ArrayList<>();
  private final Map<String, Rule> mByName  = new LinkedHashMap<>();

  public RuleGroup getClosureGroup()
  {
    return mClosure;
  }

  /**
   * Add a closure rule.
   */
  public RuleGroups addClosure(Rule xiRule)
  {
    index(xiRule);
    mClosure.add(xiRule);
    return this;
  }

  /**
   * Add a group of rules after the existing groups.
   */
  public RuleGroups addGroup(RuleGroup xiGroup)
  {
    for (Rule lRule : xiGroup)
    {
      index(lRule);
    }
    mGroups.add(xiGroup);
    return this;
  }

  private void index(Rule xiRule)
  {
    if (mByName.containsKey(xiRule.getName()))
    {
      throw new IllegalArgumentException("Duplicate rule name " + xiRule.getName());
    }
    mByName.put(xiRule.getName(), xiRule);
  }

  /**
   * @return the non-closure groups, in order.
   */
  public List<RuleGroup> getGroups()
  {
    return Collections.unmodifiableList(mGroups);
  }

  /**
   * @return the closure group followed by the other groups.
   */
  public List<RuleGroup> getAllGroups()
  {
    List<RuleGroup> lAll = new ArrayList<>();
    lAll.add(mClosure);
    lAll.addAll(mGroups);
    return lAll;
  }

  /**
   * @return all rules, closure rules first.
   */
  public List<Rule> getRules()
  {
    return new ArrayList<>(mByName.values());
  }

  /**
   * @return the named rule.
   *
   * @throws NoSuchElementException if there is no such rule.
   */
  public Rule get(String xiName)
  {
    Rule lRule = mByName.get(xiName);
    if (lRule == null)
    {
      throw new NoSuchElementException("No rule named " + xiName);
    }
    return lRule;
  }

  public boolean contains(String xiName)
  {
    return mByName.containsKey(xiName);
  }
}
