package org.tableaux.base.logics.rules;

import java.util.ArrayList;
import java.util.List;

import org.tableaux.base.proof.Node;
import org.tableaux.base.proof.filters.DesignationFilter;
import org.tableaux.base.proof.filters.ModalFilter;
import org.tableaux.base.proof.filters.NodeFilter;
import org.tableaux.base.util.lex.Sentence;

/**
 * The shape of sentence nodes in a family of logics: whether they carry a designation, and whether they carry a
 * world.
 */
public final class NodeProfile
{
  /**
   * Designated and undesignated nodes, without worlds.
   */
  public static final NodeProfile DESIGNATED = new NodeProfile("Designated", true, false);

  /**
   * Plain sentence nodes.
   */
  public static final NodeProfile CLASSICAL = new NodeProfile("Classical", false, false);

  /**
   * Sentence nodes at worlds.
   */
  public static final NodeProfile MODAL = new NodeProfile("Modal", false, true);

  private final String  mName;
  private final boolean mDesignations;
  private final boolean mModal;

  private NodeProfile(String xiName, boolean xiDesignations, boolean xiModal)
  {
    mName = xiName;
    mDesignations = xiDesignations;
    mModal = xiModal;
  }

  public boolean hasDesignations()
  {
    return mDesignations;
  }

  public boolean isModal()
  {
    return mModal;
  }

  /**
   * @return the world of a trunk node, or null.
   */
  public Integer trunkWorld()
  {
    return mModal ? 0 : null;
  }

  /**
   * @return a sentence node.  The designation and world are dropped if the profile has none.
   */
  public Node node(Sentence xiSentence, Boolean xiDesignated, Integer xiWorld)
  {
    return Node.props()
               .sentence(xiSentence)
               .designated(mDesignations ? xiDesignated : null)
               .world(mModal ? xiWorld : null)
               .node();
  }

  /**
   * @return the filters that select the nodes of this profile with the given designation.
   *
   * @param xiDesignation - the designation, ignored if the profile has none.
   */
  public List<NodeFilter> filters(Boolean xiDesignation)
  {
    List<NodeFilter> lFilters = new ArrayList<>();
    if (mDesignations)
    {
      lFilters.add(new DesignationFilter(xiDesignation));
    }
    else
    {
      lFilters.add(new ModalFilter(mModal, null));
    }
    return lFilters;
  }

  /**
   * @return the rule name suffix for a designation.
   */
  public String suffix(Boolean xiDesignation)
  {
    if (!mDesignations || xiDesignation == null)
    {
      return "";
    }
    return xiDesignation ? "Designated" : "Undesignated";
  }

  @Override
  public String toString()
  {
    return mName;
  }
}
