package org.tableaux.base.logics;

import java.util.Locale;
import java.util.NoSuchElementException;

import org.tableaux.base.proof.Logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The known logics, by name.  Lookup ignores case.
 */
public final class LogicRegistry
{
  private static final ImmutableMap<String, Logic> LOGICS;

  static
  {
    ImmutableMap.Builder<String, Logic> lBuilder = ImmutableMap.builder();
    for (Logic lLogic : new Logic[] {FdeLogic.FDE,
                                     FdeLogic.K3,
                                     FdeLogic.LP,
                                     ClassicalLogic.CPL,
                                     ClassicalLogic.CFOL,
                                     ModalLogic.K,
                                     ModalLogic.D,
                                     ModalLogic.T,
                                     ModalLogic.S4,
                                     ModalLogic.S5})
    {
      lBuilder.put(key(lLogic.getName()), lLogic);
    }
    LOGICS = lBuilder.build();
  }

  private LogicRegistry()
  {
  }

  private static String key(String xiName)
  {
    return xiName.toUpperCase(Locale.ROOT);
  }

  /**
   * @return the logic with the given name.
   *
   * @throws NoSuchElementException if there is no such logic.
   */
  public static Logic get(String xiName)
  {
    Logic lLogic = (xiName == null) ? null : LOGICS.get(key(xiName));
    if (lLogic == null)
    {
      throw new NoSuchElementException("Unknown logic: " + xiName);
    }
    return lLogic;
  }

  public static boolean contains(String xiName)
  {
    return xiName != null && LOGICS.containsKey(key(xiName));
  }

  /**
   * @return the logics, in registration order.
   */
  public static ImmutableList<Logic> getLogics()
  {
    return LOGICS.values().asList();
  }

  public static ImmutableList<String> getNames()
  {
    ImmutableList.Builder<String> lNames = ImmutableList.builder();
    for (Logic lLogic : LOGICS.values())
    {
      lNames.add(lLogic.getName());
    }
    return lNames.build();
  }
}
