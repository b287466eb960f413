package org.tableaux.base.util.lex;

import com.google.common.collect.ImmutableList;

/**
 * A predicate argument: either a {@link Constant} or a {@link Variable}.
 */
public abstract class Parameter extends CoordsItem
{
  private static final long serialVersionUID = 1L;

  protected Parameter(int xiIndex, int xiSubscript)
  {
    super(xiIndex, xiSubscript);
    checkCoords(getType(), xiIndex, xiSubscript);
  }

  public abstract boolean isConstant();

  public boolean isVariable()
  {
    return !isConstant();
  }

  @Override
  public ImmutableList<Object> getSpec()
  {
    return ImmutableList.<Object>of(mIndex, mSubscript);
  }

  @Override
  public abstract Parameter next();
}
