package org.tableaux.base.test;

import java.util.Arrays;
import java.util.NoSuchElementException;

import org.junit.Assert;
import org.junit.Test;
import org.tableaux.base.util.exceptions.ValueConflictException;
import org.tableaux.base.util.lex.LexPool;
import org.tableaux.base.util.lex.Predicate;
import org.tableaux.base.util.lex.Predicates;

import com.google.common.collect.ImmutableList;

/**
 * Tests for the predicate store.
 */
public class PredicatesTest extends Assert
{
  @Test
  public void testLookupByEveryReference()
  {
    Predicates lStore = new Predicates();
    Predicate lFriends = lStore.add(1, 0, 2, "friends");

    assertSame(lFriends, lStore.get("friends"));
    assertEquals(lFriends, lStore.get(ImmutableList.of(1, 0)));
    assertEquals(lFriends, lStore.get(Arrays.asList(1, 0, 2)));
    assertEquals(lFriends, lStore.get(lFriends));
    assertTrue(lStore.contains("friends"));
    assertEquals(1, lStore.size());
  }

  @Test
  public void testSystemPredicatesAlwaysAvailable()
  {
    Predicates lStore = new Predicates();
    assertEquals(Predicate.System.IDENTITY.get(), lStore.get("Identity"));
    assertFalse(lStore.contains("Identity"));
    assertTrue(lStore.isEmpty());
  }

  @Test(expected = NoSuchElementException.class)
  public void testMissingPredicate()
  {
    new Predicates().get("missing");
  }

  @Test
  public void testDefaultForMissingPredicate()
  {
    Predicate lDefault = Predicate.first();
    assertSame(lDefault, new Predicates().get("missing", lDefault));
  }

  @Test
  public void testReAddIsIdempotent()
  {
    Predicates lStore = new Predicates();
    lStore.add(0, 0, 1, null);
    lStore.add(0, 0, 1, null);
    assertEquals(1, lStore.size());
  }

  @Test(expected = ValueConflictException.class)
  public void testCoordinateConflict()
  {
    Predicates lStore = new Predicates();
    lStore.add(0, 0, 1, null);
    lStore.add(0, 0, 2, null);
  }

  @Test
  public void testBatchAddIsAtomic()
  {
    Predicates lStore = new Predicates();
    lStore.add(0, 0, 1, "tall");

    Predicate lG = LexPool.getPredicate(1, 0, 1, null);
    Predicate lClash = LexPool.getPredicate(2, 0, 1, "tall");
    try
    {
      lStore.addAll(Arrays.asList(lG, lClash));
      fail("Expected a conflict on the name");
    }
    catch (ValueConflictException lEx)
    {
      // Expected.
    }
    assertEquals(1, lStore.size());
    assertFalse(lStore.contains(lG));
  }

  @Test
  public void testRemoveAndCopy()
  {
    Predicates lStore = new Predicates();
    Predicate lF = lStore.add(0, 0, 1, null);
    Predicates lCopy = lStore.copy();

    assertTrue(lStore.remove(lF));
    assertFalse(lStore.remove(lF));
    assertFalse(lStore.contains(ImmutableList.of(0, 0)));
    assertTrue(lCopy.contains(ImmutableList.of(0, 0)));
  }
}
