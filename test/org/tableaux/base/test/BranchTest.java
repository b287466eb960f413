package org.tableaux.base.test;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;
import org.tableaux.base.proof.Branch;
import org.tableaux.base.proof.Node;
import org.tableaux.base.util.lex.Atomic;
import org.tableaux.base.util.lex.Constant;
import org.tableaux.base.util.lex.LexPool;
import org.tableaux.base.util.lex.Predicate;
import org.tableaux.base.util.lex.Sentence;

/**
 * Tests for branches and nodes.
 */
public class BranchTest extends Assert
{
  private static final Sentence A = Atomic.first();
  private static final Sentence B = Atomic.first().next();

  @Test
  public void testSearch()
  {
    Branch lBranch = new Branch();
    Node lA0 = Node.swnode(A, 0);
    Node lB1 = Node.swnode(B, 1);
    Node lA1 = Node.swnode(A, 1);
    lBranch.extend(Arrays.asList(lA0, lB1, lA1));

    assertSame(lA0, lBranch.find(Node.props().sentence(A)));
    assertSame(lA1, lBranch.find(Node.props().sentence(A).world(1)));
    assertEquals(2, lBranch.search(Node.props().world(1).map(), -1).size());
    assertEquals(1, lBranch.search(Node.props().world(1).map(), 1).size());
    assertTrue(lBranch.search(Node.props().world(1).map(), 0).isEmpty());
    assertNull(lBranch.find(Node.props().sentence(B).world(0)));
    assertFalse(lBranch.has(Node.props().sentence(A.negate())));
  }

  @Test
  public void testAnyAndAll()
  {
    Branch lBranch = new Branch();
    lBranch.add(Node.snode(A));

    assertTrue(lBranch.any(Arrays.asList(Node.snode(B), Node.snode(A))));
    assertFalse(lBranch.all(Arrays.asList(Node.snode(B), Node.snode(A))));
    assertTrue(lBranch.all(Arrays.asList(Node.snode(A))));
    assertFalse(lBranch.any(Arrays.<Node>asList()));
  }

  @Test
  public void testWorldsAndAccess()
  {
    Branch lBranch = new Branch();
    assertEquals(0, lBranch.newWorld());
    lBranch.add(Node.anode(0, 3));
    assertEquals(4, lBranch.newWorld());
    assertEquals(2, lBranch.getWorlds().size());
    assertTrue(lBranch.hasAccess(0, 3));
    assertFalse(lBranch.hasAccess(3, 0));

    Node lAccess = lBranch.get(0);
    assertTrue(lAccess.isAccess());
    assertTrue(lAccess.isModal());
    assertFalse(Node.snode(A).isModal());
  }

  @Test
  public void testNewConstant()
  {
    Branch lBranch = new Branch();
    Constant lM = Constant.first();
    assertEquals(lM, lBranch.newConstant());

    lBranch.add(Node.snode(Predicate.first().apply(lM)));
    assertEquals(lM.next(), lBranch.newConstant());
    assertEquals(1, lBranch.getConstants().size());
  }

  @Test
  public void testNewConstantSkipsEveryConstantOnTheBranch()
  {
    Constant lM = Constant.first();
    Constant lN = lM.next();
    Branch lBranch = new Branch();

    lBranch.add(Node.snode(Predicate.first().apply(lN)));
    assertEquals(lM, lBranch.newConstant());

    lBranch.add(Node.snode(LexPool.getPredicate(1, 0, 2).apply(lM, lM)));
    assertFalse(lBranch.getConstants().contains(lBranch.newConstant()));
    assertEquals(lN.next(), lBranch.newConstant());
  }

  @Test
  public void testTickAndClose()
  {
    Branch lBranch = new Branch();
    Node lNode = Node.snode(A);
    lBranch.add(lNode);
    assertFalse(lBranch.isTicked(lNode));
    lBranch.tick(lNode);
    lBranch.tick(lNode);
    assertTrue(lBranch.isTicked(lNode));

    lBranch.close();
    assertTrue(lBranch.isClosed());
    assertTrue(lBranch.getLeaf().isClosure());
    assertTrue(lBranch.getLeaf().isFlag());
    assertEquals(2, lBranch.size());

    // Closing again does nothing.
    lBranch.close();
    assertEquals(2, lBranch.size());
  }

  @Test(expected = IllegalStateException.class)
  public void testAddToClosedBranch()
  {
    Branch lBranch = new Branch();
    lBranch.close();
    lBranch.add(Node.snode(A));
  }

  @Test
  public void testCopyIsIndependent()
  {
    Branch lBranch = new Branch();
    Node lNode = Node.snode(A);
    lBranch.add(lNode);
    lBranch.tick(lNode);

    Branch lCopy = lBranch.copy(lBranch);
    assertSame(lBranch, lCopy.getParent());
    assertSame(lBranch, lCopy.getOrigin());
    assertTrue(lCopy.isTicked(lNode));
    assertTrue(lCopy.contains(lNode));

    lCopy.add(Node.snode(B));
    assertTrue(lCopy.has(Node.props().sentence(B)));
    assertFalse(lBranch.has(Node.props().sentence(B)));
    assertEquals(1, lBranch.size());
  }

  @Test
  public void testFlagNode()
  {
    Node lFlag = Node.flagNode(Node.QUIT_FLAG, "limit");
    assertTrue(lFlag.isFlag());
    assertFalse(lFlag.isClosure());
    assertEquals(Node.QUIT_FLAG, lFlag.getFlag());
    assertEquals("limit", lFlag.getInfo());
    assertNull(lFlag.getSentence());
  }

  @Test
  public void testNullPropertiesDropped()
  {
    Node lNode = Node.swnode(A, null);
    assertFalse(lNode.has(Node.WORLD));
    assertTrue(lNode.getWorlds().isEmpty());
  }
}
