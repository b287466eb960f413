package org.tableaux.base.util.lex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A predicate, identified by (index, subscript, arity).
 *
 * System predicates (Identity and Existence) have negative indices.  A predicate's name is a lookup reference only:
 * it takes no part in equality, hashing or ordering.
 */
public final class Predicate extends CoordsItem
{
  private static final long serialVersionUID = 1L;

  static final String SYMBOLS = "FGHO";

  /**
   * The built-in system predicates.
   */
  public static enum System
  {
    IDENTITY(-1, 0, 2, "Identity", 'I'),
    EXISTENCE(-2, 0, 1, "Existence", 'J');

    private final int    mIndex;
    private final int    mSubscript;
    private final int    mArity;
    private final String mName;
    private final char   mSymbol;

    private System(int xiIndex, int xiSubscript, int xiArity, String xiName, char xiSymbol)
    {
      mIndex = xiIndex;
      mSubscript = xiSubscript;
      mArity = xiArity;
      mName = xiName;
      mSymbol = xiSymbol;
    }

    public String getName()
    {
      return mName;
    }

    public char getSymbol()
    {
      return mSymbol;
    }

    /**
     * @return the predicate.
     */
    public Predicate get()
    {
      return LexPool.getPredicate(mIndex, mSubscript, mArity, mName);
    }

    static System forIndex(int xiIndex)
    {
      for (System lSys : values())
      {
        if (lSys.mIndex == xiIndex)
        {
          return lSys;
        }
      }
      return null;
    }

    public static System forName(String xiName)
    {
      for (System lSys : values())
      {
        if (lSys.mName.equals(xiName))
        {
          return lSys;
        }
      }
      return null;
    }
  }

  private final int    mArity;
  private final Object mName;

  Predicate(int xiIndex, int xiSubscript, int xiArity, String xiName)
  {
    super(xiIndex, xiSubscript);
    if (xiArity < 1)
    {
      throw new IllegalArgumentException("Predicate arity must be at least 1, got " + xiArity);
    }
    if (xiIndex < 0)
    {
      System lSys = System.forIndex(xiIndex);
      if (lSys == null || lSys.mSubscript != xiSubscript || lSys.mArity != xiArity)
      {
        throw new IllegalArgumentException("Not a system predicate: " + Arrays.asList(xiIndex, xiSubscript, xiArity));
      }
      xiName = lSys.mName;
    }
    else
    {
      checkCoords(LexType.PREDICATE, xiIndex, xiSubscript);
      if (xiName != null && System.forName(xiName) != null)
      {
        throw new IllegalArgumentException("Name is reserved for a system predicate: " + xiName);
      }
    }
    mArity = xiArity;
    mName = (xiName == null) ? getSpec() : xiName;
  }

  @Override
  public LexType getType()
  {
    return LexType.PREDICATE;
  }

  public int getArity()
  {
    return mArity;
  }

  /**
   * @return the name: the given string, or the spec if none was given.
   */
  public Object getName()
  {
    return mName;
  }

  public boolean isSystem()
  {
    return mIndex < 0;
  }

  @Override
  public ImmutableList<Object> getSpec()
  {
    return ImmutableList.<Object>of(mIndex, mSubscript, mArity);
  }

  /**
   * @return the lookup references: spec, ident, bicoords and name.
   */
  public ImmutableSet<Object> getRefs()
  {
    return ImmutableSet.<Object>of(getSpec(), getIdent(), getBiCoords(), mName);
  }

  @Override
  protected int[] buildSortTuple()
  {
    return new int[] {LexType.PREDICATE.getRank(), mSubscript, mIndex, mArity};
  }

  /**
   * @return a predicate with the same coordinates and arity but a different name.
   */
  public Predicate withName(String xiName)
  {
    return LexPool.getPredicate(mIndex, mSubscript, mArity, xiName);
  }

  public static Predicate first()
  {
    return LexPool.getPredicate(0, 0, 1, null);
  }

  /**
   * The successor keeps the arity.  A system predicate is followed by the next system predicate of the same arity, or
   * failing that by the first user predicate of that arity.
   */
  @Override
  public Predicate next()
  {
    if (isSystem())
    {
      boolean lFound = false;
      for (System lSys : System.values())
      {
        if (lFound && lSys.mArity == mArity)
        {
          return lSys.get();
        }
        if (lSys.mIndex == mIndex)
        {
          lFound = true;
        }
      }
      return LexPool.getPredicate(0, 0, mArity, null);
    }
    int[] lNext = nextCoords(LexType.PREDICATE, mIndex, mSubscript);
    return LexPool.getPredicate(lNext[0], lNext[1], mArity, null);
  }

  /**
   * @return the first xiCount predicates of the given arity.
   */
  public static List<Predicate> gen(int xiCount, int xiArity)
  {
    List<Predicate> lResult = new ArrayList<>(xiCount);
    Predicate lPred = LexPool.getPredicate(0, 0, xiArity, null);
    for (int lii = 0; lii < xiCount; lii++)
    {
      lResult.add(lPred);
      lPred = lPred.next();
    }
    return lResult;
  }

  /**
   * Apply this predicate to parameters.
   */
  public Predicated apply(Parameter... xiParams)
  {
    return LexPool.getPredicated(this, xiParams);
  }

  @Override
  public String toString()
  {
    if (isSystem())
    {
      return String.valueOf(System.forIndex(mIndex).mSymbol);
    }
    return render(SYMBOLS, mIndex, mSubscript);
  }
}
