package org.tableaux.base.logics.rules;

import java.util.ArrayList;
import java.util.List;

import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.Tableau;
import org.tableaux.base.proof.Target;
import org.tableaux.base.proof.filters.NodeFilter;
import org.tableaux.base.proof.filters.SentenceFilter;
import org.tableaux.base.proof.rules.BaseNodeRule;
import org.tableaux.base.util.lex.Operated;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Sentence;

/**
 * Rule that decomposes an operated sentence (or a negated one) into groups of its parts, ticking the node.
 *
 * The decomposition depends only on the operator, whether the sentence is negated, and the node's designation.
 * Unmarked nodes decompose as designated ones.  New nodes keep the world of the node they come from.
 */
public class OperatorRule extends BaseNodeRule
{
  private final NodeProfile mProfile;
  private final Operator    mOperator;
  private final boolean     mNegated;
  private final Boolean     mDesignation;

  /**
   * A sentence to add, with its designation.
   */
  static final class Add
  {
    final Sentence mSentence;
    final boolean  mDesignated;

    Add(Sentence xiSentence, boolean xiDesignated)
    {
      mSentence = xiSentence;
      mDesignated = xiDesignated;
    }
  }

  /**
   * @param xiTableau - the tableau.
   * @param xiProfile - the node profile of the logic.
   * @param xiOperator - the operator.
   * @param xiNegated - whether the rule applies to negations of the operator's sentences.
   * @param xiDesignation - the designation of the nodes to apply to, or null for unmarked profiles.
   */
  public OperatorRule(Tableau xiTableau,
                      NodeProfile xiProfile,
                      Operator xiOperator,
                      boolean xiNegated,
                      Boolean xiDesignation)
  {
    super(xiTableau,
          name(xiProfile, xiOperator, xiNegated, xiDesignation),
          filters(xiProfile, SentenceFilter.operator(xiOperator, xiNegated), xiDesignation));
    mProfile = xiProfile;
    mOperator = xiOperator;
    mNegated = xiNegated;
    mDesignation = xiProfile.hasDesignations() ? xiDesignation : null;
    mBranchLevel = expand(Operated.first(xiOperator)).size();
  }

  static String name(NodeProfile xiProfile, Operator xiOperator, boolean xiNegated, Boolean xiDesignation)
  {
    String lBase;
    if (xiOperator == Operator.NEGATION && xiNegated)
    {
      lBase = "DoubleNegation";
    }
    else
    {
      lBase = xiOperator.getLabel().replace(" ", "") + (xiNegated ? "Negated" : "");
    }
    return lBase + xiProfile.suffix(xiDesignation);
  }

  static NodeFilter[] filters(NodeProfile xiProfile, NodeFilter xiSentenceFilter, Boolean xiDesignation)
  {
    List<NodeFilter> lFilters = new ArrayList<>();
    lFilters.add(xiSentenceFilter);
    lFilters.addAll(xiProfile.filters(xiDesignation));
    return lFilters.toArray(new NodeFilter[lFilters.size()]);
  }

  public Operator getOperator()
  {
    return mOperator;
  }

  public boolean isNegated()
  {
    return mNegated;
  }

  @Override
  public List<Target> nodeTargets(Node xiNode, Branch xiBranch)
  {
    List<List<Add>> lExpansion = expand((Operated)sentence(xiNode));
    List<List<Node>> lGroups = new ArrayList<>();
    for (List<Add> lAdds : lExpansion)
    {
      List<Node> lGroup = new ArrayList<>();
      for (Add lAdd : lAdds)
      {
        lGroup.add(mProfile.node(lAdd.mSentence, lAdd.mDesignated, xiNode.getWorld()));
      }
      lGroups.add(lGroup);
    }
    return adds(xiBranch, lGroups);
  }

  private static List<Add> group(Add... xiAdds)
  {
    List<Add> lGroup = new ArrayList<>();
    for (Add lAdd : xiAdds)
    {
      lGroup.add(lAdd);
    }
    return lGroup;
  }

  private static List<List<Add>> groups(List<Add> xiFirst)
  {
    List<List<Add>> lGroups = new ArrayList<>();
    lGroups.add(xiFirst);
    return lGroups;
  }

  private static List<List<Add>> groups(List<Add> xiFirst, List<Add> xiSecond)
  {
    List<List<Add>> lGroups = groups(xiFirst);
    lGroups.add(xiSecond);
    return lGroups;
  }

  /**
   * @return the groups of sentences that the examined sentence decomposes into.
   *
   * @param xiSentence - the operated sentence (the negatum, for a negated rule).
   */
  List<List<Add>> expand(Operated xiSentence)
  {
    boolean lDesignated = (mDesignation == null) ? true : mDesignation;
    Sentence lLhs = xiSentence.getLhs();
    Sentence lRhs = (xiSentence.getOperands().size() > 1) ? xiSentence.getRhs() : null;

    if (!mNegated)
    {
      switch (mOperator)
      {
        case ASSERTION:
          return groups(group(new Add(lLhs, lDesignated)));

        case CONJUNCTION:
          if (lDesignated)
          {
            return groups(group(new Add(lLhs, true), new Add(lRhs, true)));
          }
          return groups(group(new Add(lLhs, false)), group(new Add(lRhs, false)));

        case DISJUNCTION:
          if (lDesignated)
          {
            return groups(group(new Add(lLhs, true)), group(new Add(lRhs, true)));
          }
          return groups(group(new Add(lLhs, false), new Add(lRhs, false)));

        case MATERIAL_CONDITIONAL:
        case CONDITIONAL:
          if (lDesignated)
          {
            return groups(group(new Add(lLhs.negate(), true)), group(new Add(lRhs, true)));
          }
          return groups(group(new Add(lLhs.negate(), false), new Add(lRhs, false)));

        case MATERIAL_BICONDITIONAL:
        case BICONDITIONAL:
          if (lDesignated)
          {
            return groups(group(new Add(lLhs.negate(), true), new Add(lRhs.negate(), true)),
                          group(new Add(lRhs, true), new Add(lLhs, true)));
          }
          return groups(group(new Add(lLhs, false), new Add(lRhs.negate(), false)),
                        group(new Add(lLhs.negate(), false), new Add(lRhs, false)));

        default:
          throw new IllegalStateException("No decomposition for " + mOperator);
      }
    }

    switch (mOperator)
    {
      case NEGATION:
        return groups(group(new Add(lLhs, lDesignated)));

      case ASSERTION:
        return groups(group(new Add(lLhs.negate(), lDesignated)));

      case CONJUNCTION:
        if (lDesignated)
        {
          return groups(group(new Add(lLhs.negate(), true)), group(new Add(lRhs.negate(), true)));
        }
        return groups(group(new Add(lLhs.negate(), false), new Add(lRhs.negate(), false)));

      case DISJUNCTION:
        if (lDesignated)
        {
          return groups(group(new Add(lLhs.negate(), true), new Add(lRhs.negate(), true)));
        }
        return groups(group(new Add(lLhs.negate(), false)), group(new Add(lRhs.negate(), false)));

      case MATERIAL_CONDITIONAL:
      case CONDITIONAL:
        if (lDesignated)
        {
          return groups(group(new Add(lLhs, true), new Add(lRhs.negate(), true)));
        }
        return groups(group(new Add(lLhs, false)), group(new Add(lRhs.negate(), false)));

      case MATERIAL_BICONDITIONAL:
      case BICONDITIONAL:
        if (lDesignated)
        {
          return groups(group(new Add(lLhs, true), new Add(lRhs.negate(), true)),
                        group(new Add(lLhs.negate(), true), new Add(lRhs, true)));
        }
        return groups(group(new Add(lLhs.negate(), false), new Add(lRhs.negate(), false)),
                      group(new Add(lRhs, false), new Add(lLhs, false)));

      case POSSIBILITY:
        return groups(group(new Add(Operator.NECESSITY.apply(lLhs.negate()), lDesignated)));

      case NECESSITY:
        return groups(group(new Add(Operator.POSSIBILITY.apply(lLhs.negate()), lDesignated)));

      default:
        throw new IllegalStateException("No decomposition for negated " + mOperator);
    }
  }
}
