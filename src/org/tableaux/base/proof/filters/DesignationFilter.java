package org.tableaux.base.proof.filters;

import java.util.Collections;
import java.util.Map;

import org.tableaux.base.proof.Node;

import com.google.common.collect.ImmutableMap;

/**
 * Filter on a node's designation.  A null designation imposes no condition.
 */
public class DesignationFilter implements NodeFilter
{
  private final Boolean mDesignation;

  public DesignationFilter(Boolean xiDesignation)
  {
    mDesignation = xiDesignation;
  }

  public Boolean getDesignation()
  {
    return mDesignation;
  }

  @Override
  public boolean test(Node xiNode)
  {
    return mDesignation == null || mDesignation.equals(xiNode.getDesignated());
  }

  @Override
  public Map<String, Object> example()
  {
    if (mDesignation == null)
    {
      return Collections.emptyMap();
    }
    return ImmutableMap.<String, Object>of(Node.DESIGNATED, mDesignation);
  }
}
