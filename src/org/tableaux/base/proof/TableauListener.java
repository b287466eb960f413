package org.tableaux.base.proof;

/**
 * Interface implemented by objects that follow the lifecycle of a {@link Tableau}.
 */
public interface TableauListener
{
  public void afterBranchAdd(Branch xiBranch);

  public void afterBranchClose(Branch xiBranch);

  public void afterNodeAdd(Node xiNode, Branch xiBranch);

  public void afterNodeTick(Node xiNode, Branch xiBranch);

  public void beforeTrunkBuild(Tableau xiTableau);

  public void afterTrunkBuild(Tableau xiTableau);

  public void afterFinish(Tableau xiTableau);
}
