package org.tableaux.base.proof;

/**
 * A modal access edge world1 R world2.
 */
public final class Access
{
  private final int mWorld1;
  private final int mWorld2;

  public Access(int xiWorld1, int xiWorld2)
  {
    mWorld1 = xiWorld1;
    mWorld2 = xiWorld2;
  }

  /**
   * @return the access of an access node, or of a property map holding world1 and world2.
   */
  public static Access forNode(Node xiNode)
  {
    return new Access(xiNode.getWorld1(), xiNode.getWorld2());
  }

  public int getWorld1()
  {
    return mWorld1;
  }

  public int getWorld2()
  {
    return mWorld2;
  }

  public Access reversed()
  {
    return new Access(mWorld2, mWorld1);
  }

  public Node toNode()
  {
    return Node.anode(mWorld1, mWorld2);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof Access))
    {
      return false;
    }
    Access lOther = (Access)xiOther;
    return mWorld1 == lOther.mWorld1 && mWorld2 == lOther.mWorld2;
  }

  @Override
  public int hashCode()
  {
    return 31 * mWorld1 + mWorld2;
  }

  @Override
  public String toString()
  {
    return mWorld1 + "R" + mWorld2;
  }
}
