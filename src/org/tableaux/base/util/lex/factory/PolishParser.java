package org.tableaux.base.util.lex.factory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.tableaux.base.util.exceptions.ParseException;
import org.tableaux.base.util.lex.Argument;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.LexPool;
import org.tableaux.base.util.lex.Operator;
import org.tableaux.base.util.lex.Parameter;
import org.tableaux.base.util.lex.Predicate;
import org.tableaux.base.util.lex.Predicates;
import org.tableaux.base.util.lex.Quantifier;
import org.tableaux.base.util.lex.Sentence;
import org.tableaux.base.util.lex.Variable;

import com.google.common.collect.ImmutableList;

/**
 * Parser for sentences in Polish notation.
 *
 * Atomics are a-e, constants m n o s, variables x y z v and user predicates F G H O, each optionally followed by a
 * numeric subscript.  I and J are the Identity and Existence predicates.  Operators and quantifiers are prefix
 * symbols (see {@link Operator#getSymbol()} and {@link Quantifier#getSymbol()}).  Whitespace between symbols is
 * ignored.
 *
 * User predicates must be declared in the parser's {@link Predicates} store.
 */
public class PolishParser
{
  private static final String ATOMIC_SYMBOLS    = "abcde";
  private static final String CONSTANT_SYMBOLS  = "mnos";
  private static final String VARIABLE_SYMBOLS  = "xyzv";
  private static final String PREDICATE_SYMBOLS = "FGHO";

  private final Predicates mPredicates;

  /**
   * Create a parser over a predicate store.
   *
   * @param xiPredicates - the predicates that sentences may use.
   */
  public PolishParser(Predicates xiPredicates)
  {
    mPredicates = xiPredicates;
  }

  /**
   * Create a parser with an empty predicate store.  Only system predicates are then available.
   */
  public PolishParser()
  {
    this(new Predicates());
  }

  public Predicates getPredicates()
  {
    return mPredicates;
  }

  /**
   * Parse a sentence.
   *
   * @param xiInput - the input string.
   *
   * @throws ParseException if the input is not a single well-formed sentence.
   */
  public Sentence parse(String xiInput) throws ParseException
  {
    if (StringUtils.isBlank(xiInput))
    {
      throw new ParseException("Empty input", xiInput, 0);
    }
    Cursor lCursor = new Cursor(xiInput);
    Sentence lSentence = lCursor.readSentence();
    lCursor.skipSpace();
    if (lCursor.mPos < xiInput.length())
    {
      throw new ParseException("Unexpected trailing input '" + xiInput.substring(lCursor.mPos) + "'",
                               xiInput,
                               lCursor.mPos);
    }
    return lSentence;
  }

  /**
   * Parse an argument.
   *
   * @param xiConclusion - the conclusion.
   * @param xiPremises - the premises.
   */
  public Argument argument(String xiConclusion, String... xiPremises) throws ParseException
  {
    return titledArgument(null, xiConclusion, xiPremises);
  }

  /**
   * Parse a titled argument.
   */
  public Argument titledArgument(String xiTitle, String xiConclusion, String... xiPremises) throws ParseException
  {
    List<Sentence> lPremises = new ArrayList<>(xiPremises.length);
    for (String lPremise : xiPremises)
    {
      lPremises.add(parse(lPremise));
    }
    return new Argument(parse(xiConclusion), lPremises, xiTitle);
  }

  /**
   * Parse state for one input string.
   */
  private class Cursor
  {
    final String        mInput;
    int                 mPos;
    final Set<Variable> mBound = new HashSet<>();

    Cursor(String xiInput)
    {
      mInput = xiInput;
      mPos = 0;
    }

    void skipSpace()
    {
      while (mPos < mInput.length() && Character.isWhitespace(mInput.charAt(mPos)))
      {
        mPos++;
      }
    }

    char peek() throws ParseException
    {
      skipSpace();
      if (mPos >= mInput.length())
      {
        throw new ParseException("Unexpected end of input", mInput, mPos);
      }
      return mInput.charAt(mPos);
    }

    int readSubscript()
    {
      int lStart = mPos;
      while (mPos < mInput.length() && Character.isDigit(mInput.charAt(mPos)))
      {
        mPos++;
      }
      return (mPos == lStart) ? 0 : Integer.parseInt(mInput.substring(lStart, mPos));
    }

    Sentence readSentence() throws ParseException
    {
      char lChar = peek();
      int lStart = mPos;

      int lIndex = ATOMIC_SYMBOLS.indexOf(lChar);
      if (lIndex >= 0)
      {
        mPos++;
        return LexPool.getAtomic(lIndex, readSubscript());
      }

      Operator lOper = Operator.forSymbol(lChar);
      if (lOper != null)
      {
        mPos++;
        Sentence[] lOperands = new Sentence[lOper.getArity()];
        for (int lii = 0; lii < lOperands.length; lii++)
        {
          lOperands[lii] = readSentence();
        }
        return LexPool.getOperated(lOper, lOperands);
      }

      Quantifier lQuant = Quantifier.forSymbol(lChar);
      if (lQuant != null)
      {
        mPos++;
        int lVarPos = mPos;
        Parameter lParam = readParameter(false);
        if (lParam.isConstant())
        {
          throw new ParseException("Expected a variable after quantifier, found constant " + lParam, mInput, lVarPos);
        }
        Variable lVar = (Variable)lParam;
        if (!mBound.add(lVar))
        {
          throw new ParseException("Variable " + lVar + " is already bound", mInput, lVarPos);
        }
        Sentence lInner = readSentence();
        mBound.remove(lVar);
        if (!lInner.variableOccurs(lVar))
        {
          throw new ParseException("Variable " + lVar + " does not occur in " + lInner, mInput, lVarPos);
        }
        return LexPool.getQuantified(lQuant, lVar, lInner);
      }

      Predicate lPred = readPredicate();
      if (lPred != null)
      {
        Parameter[] lParams = new Parameter[lPred.getArity()];
        for (int lii = 0; lii < lParams.length; lii++)
        {
          lParams[lii] = readParameter(true);
        }
        return lPred.apply(lParams);
      }

      throw new ParseException("Unexpected symbol '" + lChar + "'", mInput, lStart);
    }

    Predicate readPredicate() throws ParseException
    {
      char lChar = peek();
      int lStart = mPos;
      Predicate.System lSys = null;
      for (Predicate.System lCandidate : Predicate.System.values())
      {
        if (lCandidate.getSymbol() == lChar)
        {
          lSys = lCandidate;
        }
      }
      if (lSys != null)
      {
        mPos++;
        return lSys.get();
      }

      int lIndex = PREDICATE_SYMBOLS.indexOf(lChar);
      if (lIndex < 0)
      {
        return null;
      }
      mPos++;
      int lSubscript = readSubscript();
      Predicate lPred = mPredicates.get(ImmutableList.of(lIndex, lSubscript), null);
      if (lPred == null)
      {
        throw new ParseException("Undeclared predicate '" + mInput.substring(lStart, mPos) + "'", mInput, lStart);
      }
      return lPred;
    }

    Parameter readParameter(boolean xiCheckBound) throws ParseException
    {
      char lChar = peek();
      int lStart = mPos;
      int lIndex = CONSTANT_SYMBOLS.indexOf(lChar);
      if (lIndex >= 0)
      {
        mPos++;
        return LexPool.getConstant(lIndex, readSubscript());
      }
      lIndex = VARIABLE_SYMBOLS.indexOf(lChar);
      if (lIndex >= 0)
      {
        mPos++;
        Variable lVar = LexPool.getVariable(lIndex, readSubscript());
        if (xiCheckBound && !mBound.contains(lVar))
        {
          throw new ParseException("Unbound variable " + lVar, mInput, lStart);
        }
        return lVar;
      }
      throw new ParseException("Expected a parameter, found '" + lChar + "'", mInput, lStart);
    }
  }
}
