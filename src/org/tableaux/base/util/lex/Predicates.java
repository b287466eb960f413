package org.tableaux.base.util.lex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tableaux.base.util.exceptions.ValueConflictException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

/**
 * An ordered store of predicates with a multi-keyed lookup index.
 *
 * A predicate can be looked up by any of its references (spec, ident, bicoords, name) or by the predicate itself.  No
 * two stored predicates may share a reference.  Lookups fall back to the system predicates.
 */
public class Predicates implements Iterable<Predicate>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Set<Predicate>         mPredicates = new LinkedHashSet<>();
  private final Map<Object, Predicate> mLookup     = new HashMap<>();

  /**
   * The system predicates, by all their references.
   */
  private static final Map<Object, Predicate> SYSTEM_LOOKUP = new HashMap<>();
  static
  {
    for (Predicate.System lSys : Predicate.System.values())
    {
      Predicate lPred = lSys.get();
      for (Object lRef : lPred.getRefs())
      {
        SYSTEM_LOOKUP.put(lRef, lPred);
      }
      SYSTEM_LOOKUP.put(lPred, lPred);
    }
  }

  public Predicates()
  {
  }

  public Predicates(Iterable<Predicate> xiPredicates)
  {
    addAll(xiPredicates);
  }

  /**
   * Add a predicate.  Adding one that is already stored does nothing.
   *
   * @return the stored predicate.
   *
   * @throws ValueConflictException if a different stored predicate shares one of its references.
   */
  public Predicate add(Predicate xiPredicate)
  {
    addAll(Arrays.asList(xiPredicate));
    return mLookup.get(xiPredicate);
  }

  /**
   * Build and add a predicate.
   *
   * @param xiName - the name, or null for none.
   */
  public Predicate add(int xiIndex, int xiSubscript, int xiArity, String xiName)
  {
    return add(LexPool.getPredicate(xiIndex, xiSubscript, xiArity, xiName));
  }

  /**
   * Add a batch of predicates.  Either all are added or, on conflict, none are.
   *
   * @throws ValueConflictException if any arriving predicate shares a reference with a different predicate, whether
   * stored or arriving in the same batch.
   */
  public void addAll(Iterable<Predicate> xiPredicates)
  {
    Map<Object, Predicate> lArriving = new HashMap<>();
    List<Predicate> lNew = new ArrayList<>();
    for (Predicate lPred : xiPredicates)
    {
      if (mPredicates.contains(lPred) || lArriving.containsKey(lPred))
      {
        continue;
      }
      for (Object lRef : lPred.getRefs())
      {
        Predicate lOther = mLookup.get(lRef);
        if (lOther == null)
        {
          lOther = lArriving.get(lRef);
        }
        if (lOther != null && !lOther.equals(lPred))
        {
          LOGGER.debug("Rejected predicate " + lPred.getSpec() + " which conflicts with " + lOther.getSpec());
          throw new ValueConflictException(lRef, lPred.getSpec(), lOther.getSpec());
        }
        lArriving.put(lRef, lPred);
      }
      lArriving.put(lPred, lPred);
      lNew.add(lPred);
    }
    mLookup.putAll(lArriving);
    mPredicates.addAll(lNew);
  }

  /**
   * Remove a predicate, if stored.
   *
   * @return whether it was stored.
   */
  public boolean remove(Predicate xiPredicate)
  {
    Predicate lStored = mLookup.get(xiPredicate);
    if (lStored == null)
    {
      return false;
    }
    mPredicates.remove(lStored);
    mLookup.remove(lStored);
    for (Object lRef : lStored.getRefs())
    {
      mLookup.remove(lRef);
    }
    return true;
  }

  /**
   * @return the predicate with the given reference, falling back to the system predicates.
   *
   * @param xiRef - a spec, ident or bicoords list, a name, or a predicate.
   *
   * @throws NoSuchElementException if there is none.
   */
  public Predicate get(Object xiRef)
  {
    Predicate lPred = get(xiRef, null);
    if (lPred == null)
    {
      throw new NoSuchElementException("No predicate for " + xiRef);
    }
    return lPred;
  }

  /**
   * @return the predicate with the given reference, falling back to the system predicates, or xiDefault.
   */
  public Predicate get(Object xiRef, Predicate xiDefault)
  {
    Object lRef = normalize(xiRef);
    Predicate lPred = mLookup.get(lRef);
    if (lPred == null)
    {
      lPred = SYSTEM_LOOKUP.get(lRef);
    }
    return (lPred == null) ? xiDefault : lPred;
  }

  /**
   * @return whether a stored predicate has the given reference.  System predicates are not included.
   */
  public boolean contains(Object xiRef)
  {
    return mLookup.containsKey(normalize(xiRef));
  }

  private static Object normalize(Object xiRef)
  {
    if (xiRef instanceof List && !(xiRef instanceof ImmutableList))
    {
      return ImmutableList.copyOf((List<?>)xiRef);
    }
    return xiRef;
  }

  /**
   * @return the specs of the stored predicates, in insertion order.
   */
  public List<ImmutableList<Object>> specs()
  {
    List<ImmutableList<Object>> lSpecs = new ArrayList<>();
    for (Predicate lPred : mPredicates)
    {
      lSpecs.add(lPred.getSpec());
    }
    return lSpecs;
  }

  public int size()
  {
    return mPredicates.size();
  }

  public boolean isEmpty()
  {
    return mPredicates.isEmpty();
  }

  public void clear()
  {
    mPredicates.clear();
    mLookup.clear();
  }

  public Predicates copy()
  {
    return new Predicates(mPredicates);
  }

  @Override
  public Iterator<Predicate> iterator()
  {
    return Iterators.unmodifiableIterator(mPredicates.iterator());
  }

  @Override
  public String toString()
  {
    return mPredicates.toString();
  }
}
