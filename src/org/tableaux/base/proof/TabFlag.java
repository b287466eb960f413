package org.tableaux.base.proof;

/**
 * State flags of a {@link Tableau}.
 */
public enum TabFlag
{
  /**
   * Set until the tableau runs out of applicable rules.  Still set on finish if a step limit, timeout or bound cut the
   * build short.
   */
  PREMATURE,

  FINISHED,

  TIMED_OUT,

  TRUNK_BUILT;
}
