package org.tableaux.base.logics;

import java.util.ArrayList;
import java.util.List;

import org.tableaux.base.logics.rules.NodeProfile;
import org.tableaux.base.logics.rules.OperatorRule;
import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Logic;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Rule;
import org.tableaux.base.proof.RuleGroup;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.util.lex.Argument;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Sentence;

/**
 * Common behaviour of the logics: naming, trunk building and branching complexity, all driven by the logic's
 * {@link NodeProfile}.
 */
public abstract class BaseLogic implements Logic
{
  private final String        mName;
  private final String        mTitle;
  private final String        mCategory;
  protected final NodeProfile mProfile;

  protected BaseLogic(String xiName, String xiTitle, String xiCategory, NodeProfile xiProfile)
  {
    mName = xiName;
    mTitle = xiTitle;
    mCategory = xiCategory;
    mProfile = xiProfile;
  }

  @Override
  public String getName()
  {
    return mName;
  }

  @Override
  public String getTitle()
  {
    return mTitle;
  }

  @Override
  public String getCategory()
  {
    return mCategory;
  }

  public NodeProfile getProfile()
  {
    return mProfile;
  }

  /**
   * Add each premise, then the conclusion.  With designations the premises are designated and the conclusion is
   * undesignated.  Without, the conclusion is negated.
   */
  @Override
  public void buildTrunk(Tableau xiTableau, Argument xiArgument)
  {
    Branch lBranch = xiTableau.branch();
    Integer lWorld = mProfile.trunkWorld();
    for (Sentence lPremise : xiArgument.getPremises())
    {
      lBranch.add(mProfile.node(lPremise, true, lWorld));
    }
    if (mProfile.hasDesignations())
    {
      lBranch.add(mProfile.node(xiArgument.getConclusion(), false, lWorld));
    }
    else
    {
      lBranch.add(mProfile.node(xiArgument.getConclusion().negate(), null, lWorld));
    }
  }

  /**
   * Counts the branching operators in the node's sentence, reading each through any negation directly above it.  An
   * unmarked node counts as designated.
   */
  @Override
  public int branchingComplexity(Node xiNode)
  {
    Sentence lSentence = xiNode.getSentence();
    if (lSentence == null)
    {
      return 0;
    }
    boolean lDesignated = !Boolean.FALSE.equals(xiNode.getDesignated());
    boolean lLastNegated = false;
    int lComplexity = 0;
    for (Operator lOperator : lSentence.getOperators())
    {
      if (lOperator == Operator.NEGATION && !lLastNegated)
      {
        lLastNegated = true;
        continue;
      }
      lComplexity += branches(lOperator, lLastNegated, lDesignated);
      lLastNegated = false;
    }
    return lComplexity;
  }

  /**
   * @return 1 if decomposing the operator (negated or not) at the given designation forks the branch, else 0.
   */
  static int branches(Operator xiOperator, boolean xiNegated, boolean xiDesignated)
  {
    switch (xiOperator)
    {
      case CONJUNCTION:
        return (xiNegated == xiDesignated) ? 1 : 0;

      case DISJUNCTION:
      case MATERIAL_CONDITIONAL:
      case CONDITIONAL:
        return (xiNegated != xiDesignated) ? 1 : 0;

      case MATERIAL_BICONDITIONAL:
      case BICONDITIONAL:
        return 1;

      default:
        return 0;
    }
  }

  //---------------------------------------------------------------------------
  // Rule catalog building
  //---------------------------------------------------------------------------

  /**
   * @return a group of rules.
   */
  protected static RuleGroup group(String xiName, List<? extends Rule> xiRules)
  {
    RuleGroup lGroup = new RuleGroup(xiName);
    for (Rule lRule : xiRules)
    {
      lGroup.add(lRule);
    }
    return lGroup;
  }

  /**
   * Create the operator rules for a designation, split by whether they fork the branch.
   *
   * @param xiTableau - the tableau.
   * @param xiOperators - the operators to cover.  Negation and the modal operators get only their negated rules.
   * @param xiDesignation - the designation, or null for unmarked profiles.
   * @param xiNonBranching - receives the rules that never fork.
   * @param xiBranching - receives the rules that fork.
   */
  protected void operatorRules(Tableau xiTableau,
                               List<Operator> xiOperators,
                               Boolean xiDesignation,
                               List<Rule> xiNonBranching,
                               List<Rule> xiBranching)
  {
    for (Operator lOperator : xiOperators)
    {
      for (boolean lNegated : new boolean[] {false, true})
      {
        if (!lNegated && (lOperator == Operator.NEGATION || lOperator.isModal()))
        {
          continue;
        }
        OperatorRule lRule = new OperatorRule(xiTableau, mProfile, lOperator, lNegated, xiDesignation);
        if (lRule.getBranchLevel() > 1)
        {
          xiBranching.add(lRule);
        }
        else
        {
          xiNonBranching.add(lRule);
        }
      }
    }
  }

  /**
   * @return the truth-functional operators.
   */
  protected static List<Operator> propositionalOperators()
  {
    List<Operator> lOperators = new ArrayList<>();
    for (Operator lOperator : Operator.values())
    {
      if (!lOperator.isModal())
      {
        lOperators.add(lOperator);
      }
    }
    return lOperators;
  }

  @Override
  public String toString()
  {
    return mName;
  }
}
