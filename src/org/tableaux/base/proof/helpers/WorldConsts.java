package org.tableaux.base.proof.helpers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Sentence;

/**
 * Tracks, per branch, the constants appearing at each world.  Unmodal nodes count as world 0.
 */
public class WorldConsts extends BranchCache<Map<Integer, Set<Constant>>>
{
  public WorldConsts(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  protected Map<Integer, Set<Constant>> newValue()
  {
    return new LinkedHashMap<>();
  }

  @Override
  protected Map<Integer, Set<Constant>> copyValue(Map<Integer, Set<Constant>> xiValue)
  {
    Map<Integer, Set<Constant>> lCopy = new LinkedHashMap<>();
    for (Map.Entry<Integer, Set<Constant>> lEntry : xiValue.entrySet())
    {
      lCopy.put(lEntry.getKey(), new TreeSet<>(lEntry.getValue()));
    }
    return lCopy;
  }

  /**
   * @return the constants at a world on the branch.
   */
  public Set<Constant> at(Branch xiBranch, Integer xiWorld)
  {
    Set<Constant> lConsts = get(xiBranch).get((xiWorld == null) ? 0 : xiWorld);
    return (lConsts == null) ? Collections.<Constant>emptySet() : Collections.unmodifiableSet(lConsts);
  }

  @Override
  public void afterNodeAdd(Node xiNode, Branch xiBranch)
  {
    Sentence lSentence = xiNode.getSentence();
    if (lSentence == null || lSentence.getConstants().isEmpty())
    {
      return;
    }
    int lWorld = (xiNode.getWorld() == null) ? 0 : xiNode.getWorld();
    Map<Integer, Set<Constant>> lByWorld = get(xiBranch);
    Set<Constant> lConsts = lByWorld.get(lWorld);
    if (lConsts == null)
    {
      lConsts = new TreeSet<>();
      lByWorld.put(lWorld, lConsts);
    }
    lConsts.addAll(lSentence.getConstants());
  }
}
