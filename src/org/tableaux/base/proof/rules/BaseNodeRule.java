package org.tableaux.base.proof.rules;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.NodeFilter;
import org.tableaux.base.proof.helpers.AdzHelper;
import org.tableaux.base.proof.helpers.FilterHelper;
import org.tableaux.base.util.lex.Sentence;

/**
 * A rule that applies to single nodes passing its filters, adding groups of nodes.  Each group after the first forks a
 * new branch.
 */
public abstract class BaseNodeRule extends Rule implements FilterHelper.NodeTargets
{
  protected final FilterHelper mFilter;
  protected final AdzHelper    mAdz;

  protected BaseNodeRule(Tableau xiTableau, String xiName, NodeFilter... xiFilters)
  {
    super(xiTableau, xiName);
    mFilter = new FilterHelper(this, Arrays.asList(xiFilters));
    mAdz = new AdzHelper(this);
  }

  /**
   * @return the sentence the rule examines on a node.  For a negated rule, this is the negatum.
   */
  public Sentence sentence(Node xiNode)
  {
    return mFilter.sentence(xiNode);
  }

  @Override
  protected List<Target> getTargets(Branch xiBranch)
  {
    return mFilter.nodeTargets(xiBranch);
  }

  @Override
  protected void applyTarget(Target xiTarget)
  {
    mAdz.apply(xiTarget);
  }

  @Override
  public double scoreCandidate(Target xiTarget)
  {
    return mAdz.closureScore(xiTarget);
  }

  @Override
  public List<Node> exampleNodes()
  {
    return Collections.singletonList(mFilter.exampleNode());
  }

  /**
   * @return a single target adding the given groups to the branch.
   */
  protected static List<Target> adds(Branch xiBranch, List<List<Node>> xiGroups)
  {
    return Collections.singletonList(new Target(xiBranch).setAdds(xiGroups));
  }
}
