package org.tableaux.base.logics.rules;

import java.util.Arrays;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.rules.BaseClosureRule;

/**
 * A closure rule that closes a branch when a node meets a complementary node already on it.
 */
public abstract class PairClosureRule extends BaseClosureRule
{
  protected PairClosureRule(Tableau xiTableau, String xiName)
  {
    super(xiTableau, xiName);
  }

  /**
   * @return the node on the branch that closes it together with the given node, or null.
   *
   * @param xiNode - a node, which need not be on the branch.
   * @param xiBranch - the branch to search.
   */
  protected abstract Node complement(Node xiNode, Branch xiBranch);

  /**
   * @return a node and its complement, for the rule's self test.
   */
  protected abstract Node[] examplePair();

  @Override
  public boolean nodeWillCloseBranch(Node xiNode, Branch xiBranch)
  {
    return complement(xiNode, xiBranch) != null;
  }

  @Override
  public Target branchTargetHook(Node xiNode, Branch xiBranch)
  {
    Node lOther = complement(xiNode, xiBranch);
    if (lOther == null)
    {
      return null;
    }
    return new Target(xiBranch).setNode(xiNode).setNodes(xiNode, lOther);
  }

  @Override
  public List<Node> exampleNodes()
  {
    return Arrays.asList(examplePair());
  }
}
