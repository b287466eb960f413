package org.tableaux.base.proof;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Sentence;

import com.google.common.collect.Iterators;

/**
 * A tableau branch: an ordered sequence of nodes, with the set of nodes ticked on it.
 *
 * A branch keeps a search index over node properties, and the sets of constants and worlds seen.  It can be copied to
 * fork a child branch.  Once closed it can no longer be changed.
 */
public class Branch implements Iterable<Node>
{
  private final List<Node>           mNodes;
  private final Set<Node>            mTicked;
  private final Index                mIndex;
  private final SortedSet<Integer>   mWorlds;
  private final SortedSet<Constant>  mConstants;
  private final List<BranchListener> mListeners = new ArrayList<>();

  private Constant mNextConstant;
  private int      mNextWorld;
  private boolean  mClosed;
  private Branch   mParent;
  private Branch   mOrigin;
  private int      mIndexInTableau = -1;

  /**
   * Create an empty root branch.
   */
  public Branch()
  {
    this(null);
  }

  /**
   * Create an empty branch.
   *
   * @param xiParent - the parent branch, or null for a root.
   */
  public Branch(Branch xiParent)
  {
    mNodes = new ArrayList<>();
    mTicked = new LinkedHashSet<>();
    mIndex = new Index();
    mWorlds = new TreeSet<>();
    mConstants = new TreeSet<>();
    mNextConstant = Constant.first();
    mNextWorld = 0;
    setParent(xiParent);
  }

  private Branch(Branch xiSource, Branch xiParent)
  {
    mNodes = new ArrayList<>(xiSource.mNodes);
    mTicked = new LinkedHashSet<>(xiSource.mTicked);
    mIndex = xiSource.mIndex.copy();
    mWorlds = new TreeSet<>(xiSource.mWorlds);
    mConstants = new TreeSet<>(xiSource.mConstants);
    mNextConstant = xiSource.mNextConstant;
    mNextWorld = xiSource.mNextWorld;
    mClosed = xiSource.mClosed;
    setParent(xiParent);
  }

  /**
   * @return a copy of this branch, without listeners.
   *
   * @param xiParent - the parent of the copy, or null.
   */
  public Branch copy(Branch xiParent)
  {
    return new Branch(this, xiParent);
  }

  private void setParent(Branch xiParent)
  {
    if (xiParent == this)
    {
      throw new IllegalStateException("A branch cannot be its own parent");
    }
    mParent = xiParent;
    mOrigin = (xiParent == null) ? this : xiParent.mOrigin;
  }

  public void addListener(BranchListener xiListener)
  {
    mListeners.add(xiListener);
  }

  public void removeListener(BranchListener xiListener)
  {
    mListeners.remove(xiListener);
  }

  public Branch getParent()
  {
    return mParent;
  }

  /**
   * @return the root branch from which this one descends.
   */
  public Branch getOrigin()
  {
    return mOrigin;
  }

  public boolean isClosed()
  {
    return mClosed;
  }

  /**
   * @return the branch's position in its tableau, or -1 if not in a tableau.
   */
  public int getIndex()
  {
    return mIndexInTableau;
  }

  void setIndex(int xiIndex)
  {
    mIndexInTableau = xiIndex;
  }

  /**
   * Append a node.
   *
   * @throws IllegalStateException if the branch is closed.
   */
  public Branch add(Node xiNode)
  {
    if (mClosed)
    {
      throw new IllegalStateException("Cannot add a node to a closed branch");
    }
    append(xiNode);
    return this;
  }

  private void append(Node xiNode)
  {
    mNodes.add(xiNode);

    Sentence lSentence = xiNode.getSentence();
    if (lSentence != null)
    {
      SortedSet<Constant> lConstants = lSentence.getConstants();
      if (!lConstants.isEmpty())
      {
        mConstants.addAll(lConstants);
        if (mConstants.contains(mNextConstant))
        {
          mNextConstant = mConstants.last().next();
        }
      }
    }

    SortedSet<Integer> lWorlds = xiNode.getWorlds();
    if (!lWorlds.isEmpty())
    {
      int lMax = lWorlds.last();
      if (lMax >= mNextWorld)
      {
        mNextWorld = lMax + 1;
      }
      mWorlds.addAll(lWorlds);
    }

    // Index before notifying, so listeners can search for the new node.
    mIndex.add(xiNode);
    for (BranchListener lListener : new ArrayList<>(mListeners))
    {
      lListener.afterNodeAdd(xiNode, this);
    }
  }

  /**
   * Append nodes in order.
   */
  public Branch extend(Iterable<Node> xiNodes)
  {
    for (Node lNode : xiNodes)
    {
      add(lNode);
    }
    return this;
  }

  /**
   * Tick a node on this branch.  Ticking a ticked node does nothing.
   *
   * @throws IllegalStateException if the branch is closed.
   */
  public void tick(Node xiNode)
  {
    if (mClosed)
    {
      throw new IllegalStateException("Cannot tick a node on a closed branch");
    }
    if (mTicked.add(xiNode))
    {
      for (BranchListener lListener : new ArrayList<>(mListeners))
      {
        lListener.afterNodeTick(xiNode, this);
      }
    }
  }

  public boolean isTicked(Node xiNode)
  {
    return mTicked.contains(xiNode);
  }

  /**
   * Close the branch, appending a closure node.  Closing a closed branch does nothing.
   */
  public Branch close()
  {
    if (!mClosed)
    {
      append(Node.closureNode());
      mClosed = true;
      for (BranchListener lListener : new ArrayList<>(mListeners))
      {
        lListener.afterBranchClose(this);
      }
    }
    return this;
  }

  /**
   * @return a constant that does not appear on the branch.
   */
  public Constant newConstant()
  {
    return mNextConstant;
  }

  /**
   * @return a world that does not appear on the branch.
   */
  public int newWorld()
  {
    return mNextWorld;
  }

  public SortedSet<Integer> getWorlds()
  {
    return Collections.unmodifiableSortedSet(mWorlds);
  }

  public SortedSet<Constant> getConstants()
  {
    return Collections.unmodifiableSortedSet(mConstants);
  }

  public List<Node> getNodes()
  {
    return Collections.unmodifiableList(mNodes);
  }

  public Node get(int xiIndex)
  {
    return mNodes.get(xiIndex);
  }

  /**
   * @return the last node, or null if the branch is empty.
   */
  public Node getLeaf()
  {
    return mNodes.isEmpty() ? null : mNodes.get(mNodes.size() - 1);
  }

  public int size()
  {
    return mNodes.size();
  }

  public boolean contains(Node xiNode)
  {
    return mIndex.mAll.contains(xiNode);
  }

  @Override
  public Iterator<Node> iterator()
  {
    return Iterators.unmodifiableIterator(mNodes.iterator());
  }

  /**
   * @return the nodes meeting all the given properties, in branch order, up to the limit.
   *
   * @param xiLimit - maximum number of results, or -1 for no limit.
   */
  public List<Node> search(Map<String, ?> xiProps, int xiLimit)
  {
    List<Node> lResult = new ArrayList<>();
    if (xiLimit == 0)
    {
      return lResult;
    }
    for (Node lNode : mIndex.select(xiProps))
    {
      if (lNode.meets(xiProps))
      {
        lResult.add(lNode);
        if (lResult.size() == xiLimit)
        {
          break;
        }
      }
    }
    return lResult;
  }

  /**
   * @return the first node meeting the properties, or null.
   */
  public Node find(Map<String, ?> xiProps)
  {
    List<Node> lFound = search(xiProps, 1);
    return lFound.isEmpty() ? null : lFound.get(0);
  }

  public Node find(Node.Props xiProps)
  {
    return find(xiProps.map());
  }

  public boolean has(Map<String, ?> xiProps)
  {
    return find(xiProps) != null;
  }

  public boolean has(Node.Props xiProps)
  {
    return find(xiProps.map()) != null;
  }

  /**
   * @return whether some node meets the properties of some node in the collection.
   */
  public boolean any(Iterable<Node> xiNodes)
  {
    for (Node lNode : xiNodes)
    {
      if (has(lNode.getProps()))
      {
        return true;
      }
    }
    return false;
  }

  /**
   * @return whether, for every node in the collection, some node on the branch meets its properties.
   */
  public boolean all(Iterable<Node> xiNodes)
  {
    for (Node lNode : xiNodes)
    {
      if (!has(lNode.getProps()))
      {
        return false;
      }
    }
    return true;
  }

  public boolean hasAccess(int xiWorld1, int xiWorld2)
  {
    return has(Node.props().world1(xiWorld1).world2(xiWorld2));
  }

  @Override
  public String toString()
  {
    return "Branch(" + mIndexInTableau + ", nodes:" + mNodes.size() + ", closed:" + mClosed + ")";
  }

  /**
   * Search index: buckets of nodes keyed by property value.
   */
  private static final class Index
  {
    private static final String ACCESS = "w1Rw2";
    private static final String[] KEYS = {Node.SENTENCE,
                                          Node.DESIGNATED,
                                          Node.WORLD,
                                          Node.WORLD1,
                                          Node.WORLD2,
                                          ACCESS};

    private final Map<String, Map<Object, Set<Node>>> mBuckets = new HashMap<>();
    private final Set<Node> mAll = new LinkedHashSet<>();

    Index()
    {
      for (String lKey : KEYS)
      {
        mBuckets.put(lKey, new HashMap<Object, Set<Node>>());
      }
    }

    private static Object valueFor(String xiKey, Map<String, ?> xiProps)
    {
      if (ACCESS.equals(xiKey))
      {
        Object lW1 = xiProps.get(Node.WORLD1);
        Object lW2 = xiProps.get(Node.WORLD2);
        if (lW1 instanceof Integer && lW2 instanceof Integer)
        {
          return new Access((Integer)lW1, (Integer)lW2);
        }
        return null;
      }
      return xiProps.get(xiKey);
    }

    void add(Node xiNode)
    {
      mAll.add(xiNode);
      for (String lKey : KEYS)
      {
        Object lValue = valueFor(lKey, xiNode.getProps());
        if (lValue != null)
        {
          Map<Object, Set<Node>> lBuckets = mBuckets.get(lKey);
          Set<Node> lBucket = lBuckets.get(lValue);
          if (lBucket == null)
          {
            lBucket = new LinkedHashSet<>();
            lBuckets.put(lValue, lBucket);
          }
          lBucket.add(xiNode);
        }
      }
    }

    /**
     * @return the smallest bucket matching an indexed property, or all nodes if no property is indexed.
     */
    Collection<Node> select(Map<String, ?> xiProps)
    {
      Set<Node> lBest = null;
      for (String lKey : KEYS)
      {
        Object lValue = valueFor(lKey, xiProps);
        if (lValue != null)
        {
          Set<Node> lBucket = mBuckets.get(lKey).get(lValue);
          if (lBucket == null)
          {
            return Collections.emptySet();
          }
          if (lBest == null || lBucket.size() < lBest.size())
          {
            lBest = lBucket;
          }
          if (lBest.size() == 1)
          {
            break;
          }
        }
      }
      return (lBest == null) ? mAll : lBest;
    }

    Index copy()
    {
      Index lCopy = new Index();
      lCopy.mAll.addAll(mAll);
      for (Entry<String, Map<Object, Set<Node>>> lEntry : mBuckets.entrySet())
      {
        Map<Object, Set<Node>> lTarget = lCopy.mBuckets.get(lEntry.getKey());
        for (Entry<Object, Set<Node>> lBucket : lEntry.getValue().entrySet())
        {
          lTarget.put(lBucket.getKey(), new LinkedHashSet<>(lBucket.getValue()));
        }
      }
      return lCopy;
    }
  }
}
