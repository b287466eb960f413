package org.tableaux.base.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tree view of a tableau, for rendering.
 *
 * Each structure holds the run of nodes shared by all the branches below it, then one child per distinct next node.
 * Left and right are the pre-order nested-set positions.
 */
public class TreeStruct
{
  private final List<Node>       mNodes     = new ArrayList<>();
  private final List<Integer>    mTickSteps = new ArrayList<>();
  private final List<TreeStruct> mChildren  = new ArrayList<>();

  private boolean mLeaf;
  private boolean mClosed;
  private boolean mOpen;
  private int     mLeft;
  private int     mRight;
  private int     mDescendantNodeCount;
  private int     mStructureNodeCount;
  private int     mDepth;
  private boolean mHasOpen;
  private boolean mHasClosed;
  private Integer mClosedStep;
  private Integer mStep;
  private int     mWidth;
  private double  mBalancedLineWidth;
  private double  mBalancedLineMargin;
  private Integer mBranchId;
  private boolean mIsOnlyBranch;
  private Integer mBranchStep;
  private int     mDistinctNodes;

  private TreeStruct()
  {
  }

  /**
   * Running state of a tree build.
   */
  private static class Track
  {
    int        mPos = 1;
    int        mDepth;
    int        mDistinctNodes;
    TreeStruct mRoot;
  }

  /**
   * Build the tree for a tableau's branches.
   *
   * @param xiBranches - the branches, in tableau order.
   * @param xiStats - the branch statistics.
   */
  static TreeStruct build(List<Branch> xiBranches, Map<Branch, BranchStat> xiStats)
  {
    return build(xiBranches, xiStats, 0, null);
  }

  private static TreeStruct build(List<Branch> xiBranches,
                                  Map<Branch, BranchStat> xiStats,
                                  int xiNodeDepth,
                                  Track xiTrack)
  {
    TreeStruct lStruct = new TreeStruct();
    Track lTrack = xiTrack;
    if (lTrack == null)
    {
      lTrack = new Track();
      lTrack.mRoot = lStruct;
    }
    else
    {
      lTrack.mPos++;
    }
    lStruct.mDepth = lTrack.mDepth;
    lStruct.mLeft = lTrack.mPos;

    int lNodeDepth = xiNodeDepth;
    Set<Node> lDepthNodes;
    while (true)
    {
      List<Branch> lRelevant = new ArrayList<>();
      lDepthNodes = new LinkedHashSet<>();
      for (Branch lBranch : xiBranches)
      {
        if (lBranch.size() > lNodeDepth)
        {
          lRelevant.add(lBranch);
          lDepthNodes.add(lBranch.get(lNodeDepth));
          if (xiStats.get(lBranch).isClosed())
          {
            lStruct.mHasClosed = true;
          }
          else
          {
            lStruct.mHasOpen = true;
          }
        }
      }

      if (lDepthNodes.size() != 1)
      {
        break;
      }

      // Every branch shares this node.
      Node lNode = lDepthNodes.iterator().next();
      lStruct.mNodes.add(lNode);
      BranchStat.NodeStat lNodeStat = xiStats.get(lRelevant.get(0)).getNodeStat(lNode);
      lStruct.mTickSteps.add(lNodeStat == null ? null : lNodeStat.getStepTicked());
      if (lNodeStat != null && (lStruct.mStep == null || lNodeStat.getStepAdded() < lStruct.mStep))
      {
        lStruct.mStep = lNodeStat.getStepAdded();
      }
      lNodeDepth++;
    }

    lTrack.mDistinctNodes += lStruct.mNodes.size();

    if (xiBranches.size() == 1)
    {
      lStruct.finishLeaf(xiBranches.get(0), xiStats.get(xiBranches.get(0)), lTrack);
    }
    else
    {
      lTrack.mDepth++;
      lStruct.buildChildren(xiBranches, xiStats, lDepthNodes, lNodeDepth, lTrack);
      lTrack.mDepth--;
    }

    lStruct.mStructureNodeCount = lStruct.mDescendantNodeCount + lStruct.mNodes.size();
    lTrack.mPos++;
    lStruct.mRight = lTrack.mPos;

    if (lTrack.mRoot == lStruct)
    {
      lStruct.mDistinctNodes = lTrack.mDistinctNodes;
    }
    return lStruct;
  }

  private void finishLeaf(Branch xiBranch, BranchStat xiStat, Track xiTrack)
  {
    mClosed = xiStat.isClosed();
    mOpen = !mClosed;
    if (mClosed)
    {
      mClosedStep = xiStat.getStepClosed();
      mHasClosed = true;
    }
    else
    {
      mHasOpen = true;
    }
    mWidth = 1;
    mLeaf = true;
    mBranchId = xiBranch.getIndex();
    mBranchStep = xiStat.getStepAdded();
    if (xiTrack.mDepth == 0)
    {
      mIsOnlyBranch = true;
    }
  }

  private void buildChildren(List<Branch> xiBranches,
                             Map<Branch, BranchStat> xiStats,
                             Set<Node> xiDepthNodes,
                             int xiNodeDepth,
                             Track xiTrack)
  {
    double lFirst = 0;
    double lLast = 0;
    double lMid = 0;
    int lii = 0;
    for (Node lNode : xiDepthNodes)
    {
      List<Branch> lBranches = new ArrayList<>();
      for (Branch lBranch : xiBranches)
      {
        if (lBranch.size() > xiNodeDepth && lBranch.get(xiNodeDepth) == lNode)
        {
          lBranches.add(lBranch);
        }
      }

      TreeStruct lChild = build(lBranches, xiStats, xiNodeDepth, xiTrack);
      mDescendantNodeCount += lChild.mNodes.size() + lChild.mDescendantNodeCount;
      mWidth += lChild.mWidth;
      mChildren.add(lChild);

      if (lii == 0)
      {
        lFirst = lChild.mWidth / 2.0;
      }
      else if (lii == xiDepthNodes.size() - 1)
      {
        lLast = lChild.mWidth / 2.0;
      }
      else
      {
        lMid += lChild.mWidth;
      }

      if (lChild.mStep != null && (mBranchStep == null || lChild.mStep < mBranchStep))
      {
        mBranchStep = lChild.mStep;
      }
      lii++;
    }

    if (mWidth > 0)
    {
      mBalancedLineWidth = (lFirst + lLast + lMid) / mWidth;
      mBalancedLineMargin = lFirst / mWidth;
    }
  }

  public List<Node> getNodes()
  {
    return Collections.unmodifiableList(mNodes);
  }

  /**
   * @return for each shared node, the step at which it was ticked, or null.
   */
  public List<Integer> getTickSteps()
  {
    return Collections.unmodifiableList(mTickSteps);
  }

  public List<TreeStruct> getChildren()
  {
    return Collections.unmodifiableList(mChildren);
  }

  public boolean isLeaf()
  {
    return mLeaf;
  }

  public boolean isClosed()
  {
    return mClosed;
  }

  public boolean isOpen()
  {
    return mOpen;
  }

  public int getLeft()
  {
    return mLeft;
  }

  public int getRight()
  {
    return mRight;
  }

  public int getDescendantNodeCount()
  {
    return mDescendantNodeCount;
  }

  public int getStructureNodeCount()
  {
    return mStructureNodeCount;
  }

  public int getDepth()
  {
    return mDepth;
  }

  public boolean hasOpen()
  {
    return mHasOpen;
  }

  public boolean hasClosed()
  {
    return mHasClosed;
  }

  public Integer getClosedStep()
  {
    return mClosedStep;
  }

  /**
   * @return the earliest step at which one of the shared nodes was added.
   */
  public Integer getStep()
  {
    return mStep;
  }

  /**
   * @return the number of leaves below, or 1 for a leaf.
   */
  public int getWidth()
  {
    return mWidth;
  }

  public double getBalancedLineWidth()
  {
    return mBalancedLineWidth;
  }

  public double getBalancedLineMargin()
  {
    return mBalancedLineMargin;
  }

  /**
   * @return the index of the leaf's branch, or null if not a leaf.
   */
  public Integer getBranchId()
  {
    return mBranchId;
  }

  public boolean isOnlyBranch()
  {
    return mIsOnlyBranch;
  }

  public Integer getBranchStep()
  {
    return mBranchStep;
  }

  /**
   * @return the number of distinct nodes in the whole tree.  Only set on the root.
   */
  public int getDistinctNodes()
  {
    return mDistinctNodes;
  }
}
