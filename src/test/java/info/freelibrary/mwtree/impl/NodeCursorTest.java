
package info.freelibrary.mwtree.impl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.NoSuchElementException;

import org.junit.Before;
import org.junit.Test;

import info.freelibrary.mwtree.Cursor;
import info.freelibrary.mwtree.MutableCursor;

public class NodeCursorTest {

    private MultiwayTree<Integer> myTree;

    @Before
    public void before() {
        myTree = new MultiwayTree<>(2);

        for (final int value : new int[] { 5, 3, 8, 1, 4, 7, 9 }) {
            myTree.insert(value);
        }
    }

    @Test
    public void testForwardWalk() {
        final Cursor<Integer> cursor = myTree.cbegin();
        final StringBuilder builder = new StringBuilder();

        while (!cursor.equals(myTree.cend())) {
            builder.append(cursor.get());
            cursor.next();
        }

        assertEquals("1345789", builder.toString());
    }

    @Test
    public void testBackwardWalk() {
        final Cursor<Integer> cursor = myTree.cend();
        final StringBuilder builder = new StringBuilder();

        while (!cursor.equals(myTree.cbegin())) {
            builder.append(cursor.previous().get());
        }

        assertEquals("9875431", builder.toString());
    }

    @Test
    public void testSuccessorDescendsIntoRightChild() {
        assertEquals(Integer.valueOf(7), myTree.find(5).next().get());
        assertEquals(Integer.valueOf(9), myTree.find(8).next().get());
    }

    @Test
    public void testSuccessorAscends() {
        assertEquals(Integer.valueOf(5), myTree.find(4).next().get());
        assertEquals(Integer.valueOf(3), myTree.find(1).next().get());
    }

    @Test
    public void testPredecessorDescendsIntoLeftChild() {
        assertEquals(Integer.valueOf(4), myTree.find(5).previous().get());
        assertEquals(Integer.valueOf(1), myTree.find(3).previous().get());
    }

    @Test
    public void testPredecessorAscends() {
        assertEquals(Integer.valueOf(5), myTree.find(7).previous().get());
        assertEquals(Integer.valueOf(8), myTree.find(9).previous().get());
    }

    @Test
    public void testLastElementAdvancesToEnd() {
        assertEquals(myTree.end(), myTree.find(9).next());
    }

    @Test
    public void testEndRetreatsToLastElement() {
        assertEquals(Integer.valueOf(9), myTree.end().previous().get());
    }

    @Test
    public void testRoundTripThroughEnd() {
        final Cursor<Integer> cursor = myTree.cfind(9);

        cursor.next();
        cursor.previous();

        assertEquals(myTree.cfind(9), cursor);
    }

    @Test
    public void testMixedMutabilityEquality() {
        final MutableCursor<Integer> found = myTree.find(4);
        final Cursor<Integer> constFound = myTree.cfind(4);

        assertEquals(found, constFound);
        assertEquals(constFound, found);
        assertEquals(found.hashCode(), constFound.hashCode());
        assertEquals(myTree.end(), myTree.cend());
        assertEquals(myTree.cend(), myTree.end());
        assertEquals(myTree.rbegin(), myTree.crbegin());
        assertEquals(myTree.crend(), myTree.rend());
        assertNotEquals(found, myTree.cfind(5));
    }

    @Test
    public void testForwardAndReverseNotEqual() {
        assertNotEquals(myTree.begin(), myTree.rend());
        assertNotEquals(myTree.crbegin(), myTree.cend());
    }

    @Test
    public void testCursorsOfCopiesNotEqual() {
        final MultiwayTree<Integer> copy = myTree.copy();

        assertNotEquals(myTree.begin(), copy.begin());
        assertEquals(myTree.begin().get(), copy.begin().get());
    }

    @Test
    public void testCopyIsIndependent() {
        final Cursor<Integer> cursor = myTree.cbegin();
        final Cursor<Integer> copy = cursor.copy();

        cursor.next();

        assertEquals(Integer.valueOf(1), copy.get());
        assertEquals(Integer.valueOf(3), cursor.get());
        assertNotEquals(cursor, copy);
    }

    @Test
    public void testReverseCursor() {
        final MutableCursor<Integer> cursor = myTree.rbegin();

        assertEquals(Integer.valueOf(9), cursor.get());
        assertEquals(Integer.valueOf(8), cursor.next().get());
        assertEquals(Integer.valueOf(9), cursor.previous().get());
    }

    @Test
    public void testReverseEndCursor() {
        final Cursor<Integer> cursor = myTree.crend();

        assertEquals(Integer.valueOf(1), cursor.previous().get());
        assertEquals(myTree.crend(), cursor.next());
    }

    @Test(expected = NoSuchElementException.class)
    public void testGetAtEnd() {
        myTree.end().get();
    }

    @Test(expected = NoSuchElementException.class)
    public void testNextAtEnd() {
        myTree.cend().next();
    }

    @Test
    public void testPreviousAtBegin() {
        final Cursor<Integer> cursor = myTree.cbegin();

        try {
            cursor.previous();
            fail("Expected a NoSuchElementException");
        } catch (final NoSuchElementException details) {
            assertEquals(myTree.cbegin(), cursor);
        }
    }

    @Test(expected = NoSuchElementException.class)
    public void testGetAtReverseEnd() {
        myTree.rend().get();
    }

    @Test(expected = NoSuchElementException.class)
    public void testPreviousOnEmptyTree() {
        new MultiwayTree<Integer>(3).end().previous();
    }

    @Test
    public void testSet() {
        final MultiwayTree<String> tree = new MultiwayTree<>(2, String.CASE_INSENSITIVE_ORDER);

        tree.insert("ash");
        tree.insert("elm");
        tree.insert("yew");

        final MutableCursor<String> cursor = tree.find("yew");

        assertEquals("yew", cursor.set("YEW"));
        assertEquals("ash elm YEW", tree.toString());
        assertEquals("elm", tree.rbegin().next().set("ELM"));
        assertEquals("ash ELM YEW", tree.toString());
    }

    @Test
    public void testSetRejectsReordering() {
        final MutableCursor<Integer> cursor = myTree.find(4);

        try {
            cursor.set(6);
            fail("Expected an IllegalArgumentException");
        } catch (final IllegalArgumentException details) {
            assertEquals(Integer.valueOf(4), cursor.get());
        }
    }

    @Test(expected = NoSuchElementException.class)
    public void testSetAtEnd() {
        myTree.end().set(10);
    }

    @Test
    public void testSetKeepsIdentity() {
        final Integer replacement = Integer.valueOf(1000);
        final MultiwayTree<Integer> tree = new MultiwayTree<>(2);

        tree.insert(1000);
        tree.begin().set(replacement);

        assertSame(replacement, tree.cbegin().get());
        assertTrue(tree.contains(1000));
        assertFalse(tree.contains(999));
    }

}
