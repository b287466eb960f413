package org.tableaux.base.proof.helpers;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Target;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Sentence;

/**
 * Tracks, per branch, the constants not yet used to instantiate each node the rule applies to.
 *
 * Requires the rule's {@link FilterHelper}, which must be attached first.
 */
public class NodeConsts extends BranchCache<Map<Node, SortedSet<Constant>>>
{
  private final Map<Branch, SortedSet<Constant>> mConsts = new HashMap<>();

  public NodeConsts(Rule xiRule)
  {
    super(xiRule);
  }

  @Override
  protected Map<Node, SortedSet<Constant>> newValue()
  {
    return new LinkedHashMap<>();
  }

  @Override
  protected Map<Node, SortedSet<Constant>> copyValue(Map<Node, SortedSet<Constant>> xiValue)
  {
    Map<Node, SortedSet<Constant>> lCopy = new LinkedHashMap<>();
    for (Map.Entry<Node, SortedSet<Constant>> lEntry : xiValue.entrySet())
    {
      lCopy.put(lEntry.getKey(), new TreeSet<>(lEntry.getValue()));
    }
    return lCopy;
  }

  /**
   * @return the constants not yet applied to the node on the branch.  Empty if the node is not tracked.
   */
  public SortedSet<Constant> unapplied(Branch xiBranch, Node xiNode)
  {
    SortedSet<Constant> lUnapplied = get(xiBranch).get(xiNode);
    return (lUnapplied == null) ? new TreeSet<Constant>() : lUnapplied;
  }

  private SortedSet<Constant> consts(Branch xiBranch)
  {
    SortedSet<Constant> lConsts = mConsts.get(xiBranch);
    if (lConsts == null)
    {
      lConsts = new TreeSet<>();
      mConsts.put(xiBranch, lConsts);
    }
    return lConsts;
  }

  @Override
  public void afterBranchAdd(Branch xiBranch)
  {
    super.afterBranchAdd(xiBranch);
    Branch lParent = xiBranch.getParent();
    SortedSet<Constant> lParentConsts = (lParent == null) ? null : mConsts.get(lParent);
    mConsts.put(xiBranch, (lParentConsts == null) ? new TreeSet<Constant>() : new TreeSet<>(lParentConsts));
  }

  @Override
  public void afterBranchClose(Branch xiBranch)
  {
    super.afterBranchClose(xiBranch);
    mConsts.remove(xiBranch);
  }

  @Override
  public void afterApply(Target xiTarget)
  {
    if (xiTarget.getFlag() != null || xiTarget.getBranch().isClosed())
    {
      return;
    }
    SortedSet<Constant> lUnapplied = get(xiTarget.getBranch()).get(xiTarget.getNode());
    if (lUnapplied != null)
    {
      lUnapplied.remove(xiTarget.getConstant());
    }
  }

  @Override
  public void afterNodeAdd(Node xiNode, Branch xiBranch)
  {
    Map<Node, SortedSet<Constant>> lTracked = get(xiBranch);
    SortedSet<Constant> lConsts = consts(xiBranch);

    if (!lTracked.containsKey(xiNode) && mRule.getHelper(FilterHelper.class).filter(xiNode, xiBranch))
    {
      lTracked.put(xiNode, new TreeSet<>(lConsts));
    }

    Sentence lSentence = xiNode.getSentence();
    if (lSentence != null)
    {
      Set<Constant> lNew = new TreeSet<>(lSentence.getConstants());
      lNew.removeAll(lConsts);
      if (!lNew.isEmpty())
      {
        for (SortedSet<Constant> lUnapplied : lTracked.values())
        {
          lUnapplied.addAll(lNew);
        }
        lConsts.addAll(lNew);
      }
    }
  }
}
