package org.tableaux.base.util.exceptions;

/**
 * Thrown when building a tableau takes longer than its configured timeout.  The tableau is left finished (and
 * premature) in its last consistent state, so it can still be inspected.
 */
public class BuildTimeoutException extends TableauException
{
  private static final long serialVersionUID = 1L;

  private final long mTimeout;

  public BuildTimeoutException(long xiTimeout)
  {
    super("Build timeout of " + xiTimeout + "ms exceeded");
    mTimeout = xiTimeout;
  }

  /**
   * @return the timeout that was exceeded, in milliseconds.
   */
  public long getTimeout()
  {
    return mTimeout;
  }
}
