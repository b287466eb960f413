package org.tableaux.base.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A named, ordered group of rules.  Rules in a group compete on score for each step.
 */
public class RuleGroup implements Iterable<Rule>
{
  private final String     mName;
  private final List<Rule> mRules = new ArrayList<>();

  public RuleGroup(String xiName)
  {
    mName = xiName;
  }

  public String getName()
  {
    return mName;
  }

  public RuleGroup add(Rule xiRule)
  {
    mRules.add(xiRule);
    return this;
  }

  public List<Rule> getRules()
  {
    return Collections.unmodifiableList(mRules);
  }

  public int size()
  {
    return mRules.size();
  }

  public boolean isEmpty()
  {
    return mRules.isEmpty();
  }

  @Override
  public Iterator<Rule> iterator()
  {
    return getRules().iterator();
  }

  @Override
  public String toString()
  {
    return mName + mRules;
  }
}
