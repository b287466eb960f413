package org.tableaux.base.proof;

/**
 * Observer of changes to a branch.
 */
public interface BranchListener
{
  public void afterNodeAdd(Node xiNode, Branch xiBranch);

  public void afterNodeTick(Node xiNode, Branch xiBranch);

  public void afterBranchClose(Branch xiBranch);
}
