package org.tableaux.base.proof;

import org.tableaux.base.util.lex.Argument;

/**
 * A logic, as seen by the tableau engine: how to start a tableau for an argument, and which rules to run.
 */
public interface Logic
{
  /**
   * @return the short name, e.g. "FDE".
   */
  public String getName();

  /**
   * @return the full title.
   */
  public String getTitle();

  /**
   * @return the family of logics this belongs to.
   */
  public String getCategory();

  /**
   * Build the trunk for an argument, on a new branch of the tableau.
   *
   * @param xiTableau - the tableau.
   * @param xiArgument - the argument.
   */
  public void buildTrunk(Tableau xiTableau, Argument xiArgument);

  /**
   * @return an estimate of how many branches the node will eventually split into.
   *
   * @param xiNode - the node.
   */
  public int branchingComplexity(Node xiNode);

  /**
   * Create the logic's rules for a tableau.
   *
   * @param xiTableau - the tableau the rules belong to.
   *
   * @return the closure rules and rule groups.
   */
  public RuleGroups createRules(Tableau xiTableau);
}
