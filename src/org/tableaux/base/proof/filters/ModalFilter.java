package org.tableaux.base.proof.filters;

import java.util.LinkedHashMap;
import java.util.Map;

import org.tableaux.base.proof.Node;

/**
 * Filter on whether a node carries worlds, and whether it is an access node.  A null setting imposes no condition.
 */
public class ModalFilter implements NodeFilter
{
  private final Boolean mModal;
  private final Boolean mAccess;

  /**
   * @param xiModal - required value of {@link Node#isModal()}, or null.
   * @param xiAccess - required value of {@link Node#isAccess()}, or null.
   */
  public ModalFilter(Boolean xiModal, Boolean xiAccess)
  {
    mModal = xiModal;
    mAccess = xiAccess;
  }

  @Override
  public boolean test(Node xiNode)
  {
    if (mModal != null && mModal.booleanValue() != xiNode.isModal())
    {
      return false;
    }
    return mAccess == null || mAccess.booleanValue() == xiNode.isAccess();
  }

  @Override
  public Map<String, Object> example()
  {
    Map<String, Object> lExample = new LinkedHashMap<>();
    if (Boolean.TRUE.equals(mAccess))
    {
      lExample.put(Node.WORLD1, 0);
      lExample.put(Node.WORLD2, 1);
    }
    else if (Boolean.TRUE.equals(mModal))
    {
      lExample.put(Node.WORLD, 0);
    }
    return lExample;
  }
}
