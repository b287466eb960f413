package org.tableaux.base.util.exceptions;

/**
 * Thrown when input notation cannot be turned into a sentence.
 */
public class ParseException extends TableauException
{
  private static final long serialVersionUID = 1L;

  private final String mInput;
  private final int    mPosition;

  /**
   * @param xiMessage  - what went wrong.
   * @param xiInput    - the full input being parsed.
   * @param xiPosition - offset into the input at which the problem was found.
   */
  public ParseException(String xiMessage, String xiInput, int xiPosition)
  {
    super(xiMessage + " at position " + xiPosition + " in '" + xiInput + "'");
    mInput = xiInput;
    mPosition = xiPosition;
  }

  public String getInput()
  {
    return mInput;
  }

  public int getPosition()
  {
    return mPosition;
  }
}
