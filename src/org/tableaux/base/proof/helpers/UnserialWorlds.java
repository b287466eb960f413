package org.tableaux.base.proof.helpers;

import java.util.LinkedHashSet;
import java.util.Set;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;

/**
 * Tracks, per branch, the worlds that do not yet see any world.
 */
public class UnserialWorlds extends BranchCache<Set<Integer>>
{
  public UnserialWorlds(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  protected Set<Integer> newValue()
  {
    return new LinkedHashSet<>();
  }

  @Override
  protected Set<Integer> copyValue(Set<Integer> xiValue)
  {
    return new LinkedHashSet<>(xiValue);
  }

  @Override
  public void afterNodeAdd(Node xiNode, Branch xiBranch)
  {
    Set<Integer> lWorlds = get(xiBranch);
    for (int lWorld : xiNode.getWorlds())
    {
      if (Integer.valueOf(lWorld).equals(xiNode.getWorld1()) ||
          xiBranch.has(Node.props().world1(lWorld)))
      {
        lWorlds.remove(lWorld);
      }
      else
      {
        lWorlds.add(lWorld);
      }
    }
  }
}
