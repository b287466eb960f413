package org.tableaux.base.proof;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Statistics for one branch of a tableau, and for each node on it.
 */
public class BranchStat
{
  /**
   * Statistics for a node on a branch.
   */
  public static class NodeStat
  {
    private final int mStepAdded;
    private Integer   mStepTicked;

    NodeStat(int xiStepAdded)
    {
      mStepAdded = xiStepAdded;
    }

    NodeStat(NodeStat xiOther)
    {
      mStepAdded = xiOther.mStepAdded;
      mStepTicked = xiOther.mStepTicked;
    }

    public int getStepAdded()
    {
      return mStepAdded;
    }

    /**
     * @return the step at which the node was ticked, or null.
     */
    public Integer getStepTicked()
    {
      return mStepTicked;
    }
  }

  private final int                 mIndex;
  private final int                 mStepAdded;
  private final Branch              mParent;
  private final Map<Node, NodeStat> mNodes = new LinkedHashMap<>();
  private Integer                   mStepClosed;

  BranchStat(int xiIndex, int xiStepAdded, Branch xiParent, BranchStat xiParentStat)
  {
    mIndex = xiIndex;
    mStepAdded = xiStepAdded;
    mParent = xiParent;
    if (xiParentStat != null)
    {
      for (Map.Entry<Node, NodeStat> lEntry : xiParentStat.mNodes.entrySet())
      {
        mNodes.put(lEntry.getKey(), new NodeStat(lEntry.getValue()));
      }
    }
  }

  public int getIndex()
  {
    return mIndex;
  }

  public int getStepAdded()
  {
    return mStepAdded;
  }

  public Branch getParent()
  {
    return mParent;
  }

  public boolean isClosed()
  {
    return mStepClosed != null;
  }

  /**
   * @return the step at which the branch closed, or null if open.
   */
  public Integer getStepClosed()
  {
    return mStepClosed;
  }

  /**
   * @return the node's stats, or null if the node was never added to the branch.
   */
  public NodeStat getNodeStat(Node xiNode)
  {
    return mNodes.get(xiNode);
  }

  void nodeAdded(Node xiNode, int xiStep)
  {
    mNodes.put(xiNode, new NodeStat(xiStep));
  }

  void nodeTicked(Node xiNode, int xiStep)
  {
    NodeStat lStat = mNodes.get(xiNode);
    if (lStat == null)
    {
      lStat = new NodeStat(xiStep);
      mNodes.put(xiNode, lStat);
    }
    lStat.mStepTicked = xiStep;
  }

  void closed(int xiStep)
  {
    mStepClosed = xiStep;
  }
}
