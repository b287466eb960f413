package org.tableaux.base.util.exceptions;

/**
 * Thrown when a value would replace a different value already bound to the same key, e.g. two predicates sharing a
 * coordinate in a predicate store, or a target property being reassigned.
 */
public class ValueConflictException extends IllegalArgumentException
{
  private static final long serialVersionUID = 1L;

  public ValueConflictException(Object xiKey, Object xiValue, Object xiExisting)
  {
    super("Value conflict for " + xiKey + ": " + xiValue + " (existing: " + xiExisting + ")");
  }
}
