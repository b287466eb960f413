package org.tableaux.base.util.lex;

import java.util.List;

import org.tableaux.base.util.config.TableauConfiguration;
import org.tableaux.base.util.config.TableauConfiguration.CfgItem;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * The pool of lexical items.
 *
 * All items are built here.  Recently built items are interned in a bounded cache keyed by concrete type and sort
 * tuple (plus the name, for predicates), so building an item equal to a cached one returns the cached instance.
 * Items evicted from the cache stay valid: equality never depends on identity.
 */
public final class LexPool
{
  private static final Cache<List<Object>, Lexical> POOL = CacheBuilder.newBuilder()
      .maximumSize(TableauConfiguration.getCfgInt(CfgItem.LEX_CACHE_SIZE))
      .build();

  private LexPool()
  {
  }

  private static List<Object> keyFor(Lexical xiItem)
  {
    Object lName = (xiItem instanceof Predicate) ? ((Predicate)xiItem).getName() : "";
    return ImmutableList.<Object>of(xiItem.getClass().getSimpleName(),
                                    Ints.asList(xiItem.sortTuple()),
                                    lName);
  }

  /**
   * @return the pooled instance equal to the given item, pooling the item if there is none.
   */
  @SuppressWarnings("unchecked")
  static <T extends Lexical> T intern(T xiItem)
  {
    List<Object> lKey = keyFor(xiItem);
    Lexical lPooled = POOL.getIfPresent(lKey);
    if (lPooled != null)
    {
      return (T)lPooled;
    }
    POOL.put(lKey, xiItem);
    return xiItem;
  }

  public static Constant getConstant(int xiIndex, int xiSubscript)
  {
    return intern(new Constant(xiIndex, xiSubscript));
  }

  public static Variable getVariable(int xiIndex, int xiSubscript)
  {
    return intern(new Variable(xiIndex, xiSubscript));
  }

  /**
   * @param xiName - the predicate name, or null to use the spec.
   */
  public static Predicate getPredicate(int xiIndex, int xiSubscript, int xiArity, String xiName)
  {
    return intern(new Predicate(xiIndex, xiSubscript, xiArity, xiName));
  }

  public static Predicate getPredicate(int xiIndex, int xiSubscript, int xiArity)
  {
    return getPredicate(xiIndex, xiSubscript, xiArity, null);
  }

  public static Atomic getAtomic(int xiIndex, int xiSubscript)
  {
    return intern(new Atomic(xiIndex, xiSubscript));
  }

  public static Predicated getPredicated(Predicate xiPredicate, Parameter... xiParams)
  {
    return intern(new Predicated(xiPredicate, xiParams));
  }

  public static Quantified getQuantified(Quantifier xiQuantifier, Variable xiVariable, Sentence xiSentence)
  {
    return intern(new Quantified(xiQuantifier, xiVariable, xiSentence));
  }

  public static Operated getOperated(Operator xiOperator, Sentence... xiOperands)
  {
    return intern(new Operated(xiOperator, xiOperands));
  }

  /**
   * @return the number of items currently pooled.
   */
  public static long size()
  {
    return POOL.size();
  }

  /**
   * Empty the pool.
   */
  public static void drainPool()
  {
    POOL.invalidateAll();
  }
}
