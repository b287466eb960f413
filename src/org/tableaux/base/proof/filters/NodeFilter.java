package org.tableaux.base.proof.filters;

import java.util.Map;

import org.tableaux.base.proof.Node;

/**
 * Test applied to the nodes a rule considers.
 */
public interface NodeFilter
{
  /**
   * @return whether the node passes the filter.
   */
  public boolean test(Node xiNode);

  /**
   * @return properties of a node that passes the filter.  Empty if the filter imposes no condition.
   */
  public Map<String, Object> example();
}
