package org.tableaux.base.proof.helpers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.NodeFilter;
import org.tableaux.base.proof.filters.SentenceFilter;
import org.tableaux.base.util.lex.Sentence;

/**
 * Tracks, per branch, the nodes a node rule could apply to, and turns them into targets.
 */
public class FilterHelper extends FilterNodeCache
{
  /**
   * Interface implemented by rules that produce targets node by node.
   */
  public interface NodeTargets
  {
    /**
     * @return the targets for a node on a branch.  Empty if the rule does not apply to the node.
     */
    public List<Target> nodeTargets(Node xiNode, Branch xiBranch);
  }

  private final List<NodeFilter> mFilters;

  /**
   * @param xiRule - the rule, which must implement {@link NodeTargets}.
   * @param xiFilters - the filters a node must pass.
   */
  public FilterHelper(Rule xiRule, List<NodeFilter> xiFilters)
  {
    super(xiRule);
    if (!(xiRule instanceof NodeTargets))
    {
      throw new IllegalArgumentException(xiRule.getName() + " does not produce node targets");
    }
    mFilters = new ArrayList<>(xiFilters);
  }

  public List<NodeFilter> getFilters()
  {
    return Collections.unmodifiableList(mFilters);
  }

  @Override
  protected boolean isIgnoreTicked()
  {
    return mRule.isIgnoreTicked();
  }

  @Override
  public boolean filter(Node xiNode, Branch xiBranch)
  {
    if (isIgnoreTicked() && xiBranch.isTicked(xiNode))
    {
      return false;
    }
    for (NodeFilter lFilter : mFilters)
    {
      if (!lFilter.test(xiNode))
      {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the sentence examined by the first sentence filter, or the node's sentence if there is none.
   */
  public Sentence sentence(Node xiNode)
  {
    for (NodeFilter lFilter : mFilters)
    {
      if (lFilter instanceof SentenceFilter)
      {
        return ((SentenceFilter)lFilter).getSentence(xiNode);
      }
    }
    return xiNode.getSentence();
  }

  /**
   * @return a node that passes every filter.
   */
  public Node exampleNode()
  {
    Map<String, Object> lProps = new LinkedHashMap<>();
    for (NodeFilter lFilter : mFilters)
    {
      lProps.putAll(lFilter.example());
    }
    return Node.of(lProps);
  }

  /**
   * @return the targets for every tracked node on the branch, in node order.
   */
  public List<Target> nodeTargets(Branch xiBranch)
  {
    gc();
    List<Target> lTargets = new ArrayList<>();
    NodeTargets lRule = (NodeTargets)mRule;
    for (Node lNode : new ArrayList<>(get(xiBranch)))
    {
      for (Target lTarget : lRule.nodeTargets(lNode, xiBranch))
      {
        lTargets.add(lTarget.setNode(lNode));
      }
    }
    return lTargets;
  }
}
