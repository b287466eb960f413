package org.tableaux.base.test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Assert;
import org.junit.Test;
import org.tableaux.base.util.lex.Atomic;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.LexPool;
import org.tableaux.base.util.lex.Operated;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Predicate;
import org.tableaux.base.util.lex.Predicated;
import org.tableaux.base.util.lex.Quantified;
import org.tableaux.base.util.lex.Quantifier;
import org.tableaux.base.util.lex.Sentence;
import org.tableaux.base.util.lex.Variable;

/**
 * Tests for lexical items: ordering, successors, rendering and substitution.
 */
public class LexicalTest extends Assert
{
  @Test
  public void testAtomicSuccession()
  {
    List<Atomic> lAtomics = Atomic.gen(7);
    assertEquals("a", lAtomics.get(0).toString());
    assertEquals("e", lAtomics.get(4).toString());
    assertEquals("a1", lAtomics.get(5).toString());
    assertEquals("b1", lAtomics.get(6).toString());
    assertEquals(Sentence.first(), Atomic.first());
  }

  @Test
  public void testOrderingFollowsSubscriptThenIndex()
  {
    Atomic lA = LexPool.getAtomic(0, 0);
    Atomic lE = LexPool.getAtomic(4, 0);
    Atomic lA1 = LexPool.getAtomic(0, 1);

    List<Atomic> lSorted = new ArrayList<>();
    lSorted.add(lA1);
    lSorted.add(lE);
    lSorted.add(lA);
    Collections.sort(lSorted);

    assertEquals(lA, lSorted.get(0));
    assertEquals(lE, lSorted.get(1));
    assertEquals(lA1, lSorted.get(2));
  }

  @Test
  public void testEqualityIsStructural()
  {
    Sentence lFirst = Operator.CONJUNCTION.apply(LexPool.getAtomic(0, 0), LexPool.getAtomic(1, 0));
    Sentence lSecond = LexPool.getOperated(Operator.CONJUNCTION, LexPool.getAtomic(0, 0), LexPool.getAtomic(1, 0));
    assertEquals(lFirst, lSecond);
    assertEquals(lFirst.hashCode(), lSecond.hashCode());
    assertEquals(0, lFirst.compareTo(lSecond));
    assertNotEquals(lFirst, Operator.DISJUNCTION.apply(LexPool.getAtomic(0, 0), LexPool.getAtomic(1, 0)));
  }

  @Test
  public void testParameterRendering()
  {
    assertEquals("m", Constant.first().toString());
    assertEquals("n", Constant.first().next().toString());
    assertEquals("x", Variable.first().toString());
    assertEquals(4, Constant.gen(4).size());
    assertEquals("s", Constant.gen(4).get(3).toString());
  }

  @Test
  public void testOperatedRendersInPolishNotation()
  {
    Atomic lA = Atomic.first();
    Atomic lB = lA.next();
    Operated lSentence = Operator.MATERIAL_CONDITIONAL.apply(lA.negate(), lB);
    assertEquals("CNab", lSentence.toString());
    assertEquals(lA.negate(), lSentence.getLhs());
    assertEquals(lB, lSentence.getRhs());
    assertEquals(2, lSentence.getOperands().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongOperandCountRejected()
  {
    Operator.NEGATION.apply(Atomic.first(), Atomic.first());
  }

  @Test
  public void testNegative()
  {
    Atomic lA = Atomic.first();
    Operated lNotA = lA.negate();
    assertTrue(lNotA.isNegated());
    assertFalse(lA.isNegated());
    assertEquals(lA, lNotA.negative());
    assertEquals(lNotA, lA.negative());
    assertEquals(lNotA.negate(), lNotA.negate().negative().negate());
  }

  @Test
  public void testOperatorSymbols()
  {
    assertEquals(Operator.NECESSITY, Operator.forSymbol('L'));
    assertEquals(Operator.POSSIBILITY, Operator.forSymbol('M'));
    assertEquals(Operator.BICONDITIONAL, Operator.forSymbol('B'));
    assertNull(Operator.forSymbol('Q'));
    assertTrue(Operator.NECESSITY.isModal());
    assertFalse(Operator.CONJUNCTION.isModal());
    assertEquals("Material Conditional", Operator.MATERIAL_CONDITIONAL.getLabel());
    assertEquals(1, Operator.ASSERTION.getArity());
  }

  @Test
  public void testPredicates()
  {
    Predicate lF = Predicate.first();
    assertEquals("F", lF.toString());
    assertEquals(1, lF.getArity());
    assertFalse(lF.isSystem());

    Predicate lIdentity = Predicate.System.IDENTITY.get();
    assertTrue(lIdentity.isSystem());
    assertEquals(2, lIdentity.getArity());
    assertEquals("I", lIdentity.toString());

    Predicated lFm = lF.apply(Constant.first());
    assertEquals("Fm", lFm.toString());
    assertFalse(lFm.isIdentity());
    assertTrue(lIdentity.apply(Constant.first(), Constant.first()).isIdentity());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroArityPredicateRejected()
  {
    LexPool.getPredicate(0, 0, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFakeSystemPredicateRejected()
  {
    LexPool.getPredicate(-1, 0, 1);
  }

  @Test
  public void testPredicatedSubstitution()
  {
    Constant lM = Constant.first();
    Constant lN = lM.next();
    Predicated lImn = Predicate.System.IDENTITY.get().apply(lM, lN);
    Predicated lInn = lImn.substitute(lN, lM);
    assertEquals("Inn", lInn.toString());
    assertEquals(1, lInn.getParamSet().size());
    assertEquals(2, lImn.getParamSet().size());
  }

  @Test
  public void testNoOpSubstitutionKeepsInstance()
  {
    Constant lM = Constant.first();
    Constant lN = lM.next();
    Sentence lSentence = Operator.CONJUNCTION.apply(Predicate.first().apply(lM), Atomic.first());
    assertSame(lSentence, lSentence.substitute(lM, lM));
    assertSame(lSentence, lSentence.substitute(lN.next(), lN));

    Sentence lQuantified = Quantifier.EXISTENTIAL.apply(Variable.first(), Predicate.first().apply(Variable.first()));
    assertSame(lQuantified, lQuantified.substitute(lN, lM));
  }

  @Test
  public void testSubstitutionReverses()
  {
    Constant lM = Constant.first();
    Constant lN = lM.next();
    Sentence lSentence = Operator.NECESSITY.apply(Predicate.first().apply(lM).negate());
    Sentence lSwapped = lSentence.substitute(lN, lM);
    assertEquals("LNFn", lSwapped.toString());
    assertEquals(lSentence, lSwapped.substitute(lM, lN));
  }

  @Test
  public void testEnumerationEdges()
  {
    assertEquals(Operator.first(), Operator.NECESSITY.next(true));
    assertEquals(Quantifier.first(), Quantifier.UNIVERSAL.next(true));
    try
    {
      Operator.NECESSITY.next();
      fail("Expected no operator after the last");
    }
    catch (NoSuchElementException lEx)
    {
      // Expected.
    }
  }

  @Test
  public void testTotalOrder()
  {
    List<Sentence> lSentences = new ArrayList<>();
    lSentences.add(Atomic.first());
    lSentences.add(Atomic.first().negate());
    lSentences.add(Predicate.first().apply(Constant.first()));
    lSentences.add(Quantified.first());
    lSentences.add(Operated.first());
    for (Sentence lA : lSentences)
    {
      for (Sentence lB : lSentences)
      {
        int lAB = Integer.signum(lA.compareTo(lB));
        int lBA = Integer.signum(lB.compareTo(lA));
        assertEquals(-lAB, lBA);
        assertEquals(lA.equals(lB), lAB == 0);
      }
    }
  }

  @Test
  public void testUnquantify()
  {
    Variable lX = Variable.first();
    Sentence lFx = Predicate.first().apply(lX);
    Quantified lAll = Quantifier.UNIVERSAL.apply(lX, lFx);
    assertEquals("VxFx", lAll.toString());
    assertEquals(Predicate.first().apply(Constant.first()), lAll.unquantify(Constant.first()));
    assertTrue(lAll.getConstants().isEmpty());
    assertEquals(1, lAll.getQuantifiers().size());
  }

  @Test
  public void testSentenceCollections()
  {
    Constant lM = Constant.first();
    Sentence lSentence = Operator.NECESSITY.apply(Predicate.first().apply(lM).negate());
    assertEquals(2, lSentence.getOperators().size());
    assertEquals(Operator.NECESSITY, lSentence.getOperators().get(0));
    assertEquals(1, lSentence.getConstants().size());
    assertEquals(lM, lSentence.getConstants().first());
  }
}
