package org.tableaux.base.test;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.tableaux.base.util.exceptions.ParseException;
import org.tableaux.base.util.lex.Argument;
import org.tableaux.base.util.lex.Atomic;
import org.tableaux.base.util.lex.Operated;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Predicated;
import org.tableaux.base.util.lex.Predicates;
import org.tableaux.base.util.lex.Quantified;
import org.tableaux.base.util.lex.Quantifier;
import org.tableaux.base.util.lex.Sentence;
import org.tableaux.base.util.lex.factory.PolishParser;

/**
 * Tests for the Polish notation parser.
 */
public class PolishParserTest extends Assert
{
  private PolishParser mParser;

  @Before
  public void setUp()
  {
    Predicates lPredicates = new Predicates();
    lPredicates.add(0, 0, 1, null);
    lPredicates.add(1, 0, 2, null);
    mParser = new PolishParser(lPredicates);
  }

  @Test
  public void testAtomics() throws Exception
  {
    assertEquals(Atomic.first(), mParser.parse("a"));
    assertEquals("c2", mParser.parse("c2").toString());
    assertEquals(mParser.parse("a"), mParser.parse("  a "));
  }

  @Test
  public void testOperators() throws Exception
  {
    Sentence lSentence = mParser.parse("KaNb");
    assertTrue(lSentence instanceof Operated);
    Operated lOperated = (Operated)lSentence;
    assertEquals(Operator.CONJUNCTION, lOperated.getOperator());
    assertEquals(Atomic.first(), lOperated.getLhs());
    assertTrue(lOperated.getRhs().isNegated());
    assertEquals("KaNb", lSentence.toString());
    assertEquals("LMa", mParser.parse("LMa").toString());
  }

  @Test
  public void testQuantifiersAndPredicates() throws Exception
  {
    Sentence lSentence = mParser.parse("VxSyGxy");
    assertTrue(lSentence instanceof Quantified);
    assertEquals(Quantifier.UNIVERSAL, ((Quantified)lSentence).getQuantifier());
    assertEquals(2, lSentence.getQuantifiers().size());
    assertEquals("VxSyGxy", lSentence.toString());

    Sentence lIdentity = mParser.parse("Imn");
    assertTrue(((Predicated)lIdentity).isIdentity());
    assertTrue(((Predicated)mParser.parse("Jm")).isExistence());
  }

  @Test
  public void testArgument() throws Exception
  {
    Argument lArgument = mParser.titledArgument("Modus Ponens", "b", "a", "Cab");
    assertEquals("Modus Ponens", lArgument.getTitle());
    assertEquals(Atomic.first().next(), lArgument.getConclusion());
    assertEquals(2, lArgument.getPremises().size());
    assertEquals(mParser.parse("Cab"), lArgument.getPremises().get(1));

    Argument lNoPremises = mParser.argument("AaNa");
    assertTrue(lNoPremises.getPremises().isEmpty());
    assertNull(lNoPremises.getTitle());
  }

  private void assertRejected(String xiInput)
  {
    try
    {
      mParser.parse(xiInput);
      fail("Parsed " + xiInput);
    }
    catch (ParseException lEx)
    {
      assertEquals(xiInput, lEx.getInput());
      assertTrue(lEx.getPosition() >= 0);
    }
  }

  @Test
  public void testEmptyInput()
  {
    assertRejected("");
    assertRejected("   ");
  }

  @Test
  public void testTrailingInput() throws Exception
  {
    try
    {
      mParser.parse("ab");
      fail("Parsed trailing input");
    }
    catch (ParseException lEx)
    {
      assertEquals(1, lEx.getPosition());
    }
  }

  @Test
  public void testTruncatedInput()
  {
    assertRejected("K");
    assertRejected("Ka");
    assertRejected("Vx");
  }

  @Test
  public void testVariableErrors()
  {
    // Unbound.
    assertRejected("Fx");
    // Re-bound in scope.
    assertRejected("VxVxFx");
    // Quantified variable never used.
    assertRejected("VxFm");
    // Constant after a quantifier.
    assertRejected("VmFm");
  }

  @Test
  public void testUndeclaredPredicate()
  {
    assertRejected("Hm");
    assertRejected("F1m");
  }

  @Test
  public void testUnknownSymbol()
  {
    assertRejected("Q");
    assertRejected("K?a");
  }
}
