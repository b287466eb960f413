package org.tableaux.base.util.exceptions;

/**
 * Abstract class for checked failures raised by the tableau engine and its input layer.
 */
public abstract class TableauException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected TableauException(String xiMessage)
  {
    super(xiMessage);
  }
}
