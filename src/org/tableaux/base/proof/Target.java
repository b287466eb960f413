package org.tableaux.base.proof;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.tableaux.base.util.exceptions.ValueConflictException;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.Sentence;

import com.google.common.collect.ImmutableList;

/**
 * A proposed rule application on a branch.
 *
 * The application properties (node, nodes, adds, constant, designated, flag, sentence, worlds) can each be set once:
 * setting a different value for a property already set throws {@link ValueConflictException}.  The scoring properties
 * are filled in by the rule and tableau during selection.
 */
public class Target
{
  private final Branch mBranch;

  private Rule                      mRule;
  private Node                      mNode;
  private Set<Node>                 mNodes;
  private ImmutableList<List<Node>> mAdds;
  private Constant                  mConstant;
  private Boolean                   mDesignated;
  private String                    mFlag;
  private Sentence                  mSentence;
  private Integer                   mWorld;
  private Integer                   mWorld1;
  private Integer                   mWorld2;

  private double  mCandidateScore;
  private double  mMinCandidateScore;
  private double  mMaxCandidateScore;
  private int     mTotalCandidates;
  private Double  mGroupScore;
  private Double  mMinGroupScore;
  private int     mTotalGroupTargets;
  private boolean mRankOptim;
  private boolean mGroupOptim;

  /**
   * @param xiBranch - the branch to which the target applies.
   */
  public Target(Branch xiBranch)
  {
    if (xiBranch == null)
    {
      throw new IllegalArgumentException("Target requires a branch");
    }
    mBranch = xiBranch;
  }

  private static <T> T checked(String xiKey, T xiExisting, T xiValue)
  {
    if (xiExisting != null && !xiExisting.equals(xiValue))
    {
      throw new ValueConflictException(xiKey, xiValue, xiExisting);
    }
    return xiValue;
  }

  public Branch getBranch()
  {
    return mBranch;
  }

  public Rule getRule()
  {
    return mRule;
  }

  public Target setRule(Rule xiRule)
  {
    mRule = checked("rule", mRule, xiRule);
    return this;
  }

  public Node getNode()
  {
    return mNode;
  }

  public Target setNode(Node xiNode)
  {
    mNode = checked("node", mNode, xiNode);
    return this;
  }

  /**
   * @return the nodes of the target: the set given, or else the single node, or else nothing.
   */
  public Set<Node> getNodes()
  {
    if (mNodes != null)
    {
      return mNodes;
    }
    if (mNode != null)
    {
      return Collections.singleton(mNode);
    }
    return Collections.emptySet();
  }

  public Target setNodes(Node... xiNodes)
  {
    Set<Node> lNodes = new LinkedHashSet<>();
    Collections.addAll(lNodes, xiNodes);
    mNodes = checked("nodes", mNodes, Collections.unmodifiableSet(lNodes));
    return this;
  }

  /**
   * @return the groups of nodes to add.  The first group goes on the target branch and each further group on a new
   * branch.
   */
  public ImmutableList<List<Node>> getAdds()
  {
    return (mAdds == null) ? ImmutableList.<List<Node>>of() : mAdds;
  }

  public Target setAdds(List<List<Node>> xiAdds)
  {
    ImmutableList.Builder<List<Node>> lBuilder = ImmutableList.builder();
    for (List<Node> lGroup : xiAdds)
    {
      lBuilder.add(ImmutableList.copyOf(lGroup));
    }
    mAdds = checked("adds", mAdds, lBuilder.build());
    return this;
  }

  /**
   * Set a single group of nodes to add.
   */
  public Target setAdds(Node... xiGroup)
  {
    return setAdds(ImmutableList.<List<Node>>of(ImmutableList.copyOf(xiGroup)));
  }

  public Constant getConstant()
  {
    return mConstant;
  }

  public Target setConstant(Constant xiConstant)
  {
    mConstant = checked("constant", mConstant, xiConstant);
    return this;
  }

  public Boolean getDesignated()
  {
    return mDesignated;
  }

  public Target setDesignated(Boolean xiDesignated)
  {
    mDesignated = checked("designated", mDesignated, xiDesignated);
    return this;
  }

  public String getFlag()
  {
    return mFlag;
  }

  public Target setFlag(String xiFlag)
  {
    mFlag = checked("flag", mFlag, xiFlag);
    return this;
  }

  public Sentence getSentence()
  {
    return mSentence;
  }

  public Target setSentence(Sentence xiSentence)
  {
    mSentence = checked("sentence", mSentence, xiSentence);
    return this;
  }

  public Integer getWorld()
  {
    return mWorld;
  }

  public Target setWorld(Integer xiWorld)
  {
    mWorld = checked("world", mWorld, xiWorld);
    return this;
  }

  public Integer getWorld1()
  {
    return mWorld1;
  }

  public Target setWorld1(Integer xiWorld)
  {
    mWorld1 = checked("world1", mWorld1, xiWorld);
    return this;
  }

  public Integer getWorld2()
  {
    return mWorld2;
  }

  public Target setWorld2(Integer xiWorld)
  {
    mWorld2 = checked("world2", mWorld2, xiWorld);
    return this;
  }

  public double getCandidateScore()
  {
    return mCandidateScore;
  }

  public double getMinCandidateScore()
  {
    return mMinCandidateScore;
  }

  public double getMaxCandidateScore()
  {
    return mMaxCandidateScore;
  }

  public int getTotalCandidates()
  {
    return mTotalCandidates;
  }

  public boolean isRankOptim()
  {
    return mRankOptim;
  }

  void setCandidateStats(double xiScore, double xiMin, double xiMax, int xiTotal, boolean xiRankOptim)
  {
    mCandidateScore = xiScore;
    mMinCandidateScore = xiMin;
    mMaxCandidateScore = xiMax;
    mTotalCandidates = xiTotal;
    mRankOptim = xiRankOptim;
  }

  /**
   * @return the group score, or null if the target was not chosen by group optimisation.
   */
  public Double getGroupScore()
  {
    return mGroupScore;
  }

  public Double getMinGroupScore()
  {
    return mMinGroupScore;
  }

  public int getTotalGroupTargets()
  {
    return mTotalGroupTargets;
  }

  public boolean isGroupOptim()
  {
    return mGroupOptim;
  }

  void setGroupStats(Double xiScore, Double xiMin, int xiTotal, boolean xiGroupOptim)
  {
    mGroupScore = xiScore;
    mMinGroupScore = xiMin;
    mTotalGroupTargets = xiTotal;
    mGroupOptim = xiGroupOptim;
  }

  /**
   * @return "Nodes", "Node" or "Branch", according to what the target was set on.
   */
  public String getType()
  {
    if (mNodes != null)
    {
      return "Nodes";
    }
    if (mNode != null)
    {
      return "Node";
    }
    return "Branch";
  }

  @Override
  public String toString()
  {
    StringBuilder lBuf = new StringBuilder("Target(");
    lBuf.append(mBranch);
    if (mRule != null)
    {
      lBuf.append(", rule=").append(mRule.getName());
    }
    if (mNode != null)
    {
      lBuf.append(", node=").append(mNode);
    }
    if (mSentence != null)
    {
      lBuf.append(", sentence=").append(mSentence);
    }
    if (mConstant != null)
    {
      lBuf.append(", constant=").append(mConstant);
    }
    if (mWorld != null)
    {
      lBuf.append(", world=").append(mWorld);
    }
    if (mFlag != null)
    {
      lBuf.append(", flag=").append(mFlag);
    }
    return lBuf.append(')').toString();
  }
}
