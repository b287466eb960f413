package org.tableaux.base.proof.helpers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.tableaux.base.proof.Access;
import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;

import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

/**
 * The accessibility relation on each branch: for each world, the worlds it sees, and the access node for each pair.
 */
public class WorldIndex extends BranchCache<SetMultimap<Integer, Integer>>
{
  private final Map<Branch, Map<Access, Node>> mNodes = new HashMap<>();

  public WorldIndex(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  protected SetMultimap<Integer, Integer> newValue()
  {
    return LinkedHashMultimap.create();
  }

  @Override
  protected SetMultimap<Integer, Integer> copyValue(SetMultimap<Integer, Integer> xiValue)
  {
    return LinkedHashMultimap.create(xiValue);
  }

  /**
   * @return the worlds seen from a world on the branch.
   */
  public Set<Integer> visible(Branch xiBranch, int xiWorld)
  {
    return get(xiBranch).get(xiWorld);
  }

  public boolean has(Branch xiBranch, Access xiAccess)
  {
    return get(xiBranch).containsEntry(xiAccess.getWorld1(), xiAccess.getWorld2());
  }

  /**
   * @return the access node for a pair of worlds, or null.
   */
  public Node getNode(Branch xiBranch, Access xiAccess)
  {
    Map<Access, Node> lNodes = mNodes.get(xiBranch);
    return (lNodes == null) ? null : lNodes.get(xiAccess);
  }

  /**
   * @return the worlds seen by world2 but not by world1.
   */
  public List<Integer> intransitives(Branch xiBranch, int xiWorld1, int xiWorld2)
  {
    SetMultimap<Integer, Integer> lSeen = get(xiBranch);
    List<Integer> lResult = new ArrayList<>();
    for (int lWorld : lSeen.get(xiWorld2))
    {
      if (!lSeen.containsEntry(xiWorld1, lWorld))
      {
        lResult.add(lWorld);
      }
    }
    return lResult;
  }

  @Override
  public void afterBranchAdd(Branch xiBranch)
  {
    super.afterBranchAdd(xiBranch);
    Branch lParent = xiBranch.getParent();
    Map<Access, Node> lParentNodes = (lParent == null) ? null : mNodes.get(lParent);
    mNodes.put(xiBranch, (lParentNodes == null) ? new LinkedHashMap<Access, Node>() :
                                                  new LinkedHashMap<>(lParentNodes));
  }

  @Override
  public void afterBranchClose(Branch xiBranch)
  {
    super.afterBranchClose(xiBranch);
    mNodes.remove(xiBranch);
  }

  @Override
  public void afterNodeAdd(Node xiNode, Branch xiBranch)
  {
    if (xiNode.isAccess())
    {
      Access lAccess = Access.forNode(xiNode);
      get(xiBranch).put(lAccess.getWorld1(), lAccess.getWorld2());
      Map<Access, Node> lNodes = mNodes.get(xiBranch);
      if (lNodes == null)
      {
        lNodes = new LinkedHashMap<>();
        mNodes.put(xiBranch, lNodes);
      }
      lNodes.put(lAccess, xiNode);
    }
  }
}
