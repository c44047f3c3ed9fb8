
package info.freelibrary.mwtree.impl;

import java.util.NoSuchElementException;

import info.freelibrary.mwtree.Cursor;
import info.freelibrary.mwtree.TreeStateException;

/**
 * A read-only forward cursor: a node index and a position within that node. The end cursor sits one past the last
 * element of the rightmost node.
 */
class NodeCursor<T> implements Cursor<T> {

    private static final String STALE_CURSOR = "MWT-004";

    final NodePool<T> myPool;

    final int myEpoch;

    int myNode;

    int myIndex;

    NodeCursor(final NodePool<T> aPool, final Position aPosition) {
        this(aPool, aPool.getEpoch(), aPosition.myNode, aPosition.myIndex);
    }

    NodeCursor(final NodePool<T> aPool, final int aEpoch, final int aNode, final int aIndex) {
        myPool = aPool;
        myEpoch = aEpoch;
        myNode = aNode;
        myIndex = aIndex;
    }

    @Override
    public T get() {
        final TreeNode<T> node = checkedNode();

        if (myIndex >= node.myItemCount) {
            throw new NoSuchElementException();
        }

        return node.getItem(myIndex);
    }

    @Override
    public NodeCursor<T> next() {
        advance();
        return this;
    }

    @Override
    public NodeCursor<T> previous() {
        retreat();
        return this;
    }

    @Override
    public NodeCursor<T> copy() {
        return new NodeCursor<>(myPool, myEpoch, myNode, myIndex);
    }

    /**
     * Moves to the successor: the leftmost element of the child subtree right of the current element if there is one,
     * else the next element in this node, else the first larger element found while climbing towards the root.
     */
    final void advance() {
        TreeNode<T> node = checkedNode();

        if (myIndex >= node.myItemCount) {
            throw new NoSuchElementException();
        }

        final int child = node.getChild(myIndex + 1);

        if (child != TreeNode.NONE) {
            myNode = myPool.leftmost(child);
            myIndex = 0;
        } else if (myIndex + 1 < node.myItemCount) {
            myIndex += 1;
        } else {
            final T departed = node.getItem(myIndex);

            while (node.myParent != TreeNode.NONE) {
                node = myPool.getNode(node.myParent);

                final int position = node.lowerBound(departed);

                if (position < node.myItemCount) {
                    myNode = node.myIndex;
                    myIndex = position;
                    return;
                }
            }

            final Position end = myPool.end();

            myNode = end.myNode;
            myIndex = end.myIndex;
        }
    }

    /**
     * Moves to the predecessor: the rightmost element of the child subtree left of the current position if there is
     * one, else the previous element in this node, else the first smaller element found while climbing towards the
     * root.
     */
    final void retreat() {
        TreeNode<T> node = checkedNode();

        final int child = node.getChild(myIndex);

        if (child != TreeNode.NONE) {
            myNode = myPool.rightmost(child);
            myIndex = myPool.getNode(myNode).myItemCount - 1;
        } else if (myIndex > 0) {
            myIndex -= 1;
        } else {
            if (node.myItemCount == 0) {
                throw new NoSuchElementException();
            }

            final T departed = node.getItem(0);

            while (node.myParent != TreeNode.NONE) {
                node = myPool.getNode(node.myParent);

                final int position = node.lowerBound(departed);

                if (position > 0) {
                    myNode = node.myIndex;
                    myIndex = position - 1;
                    return;
                }
            }

            throw new NoSuchElementException();
        }
    }

    final TreeNode<T> checkedNode() {
        if (myPool.getEpoch() != myEpoch) {
            throw new TreeStateException(STALE_CURSOR);
        }

        return myPool.getNode(myNode);
    }

    @Override
    public final boolean equals(final Object aObject) {
        if (this == aObject) {
            return true;
        }

        if (!(aObject instanceof NodeCursor)) {
            return false;
        }

        final NodeCursor<?> cursor = (NodeCursor<?>) aObject;

        return myPool == cursor.myPool && myEpoch == cursor.myEpoch && myNode == cursor.myNode &&
                myIndex == cursor.myIndex;
    }

    @Override
    public final int hashCode() {
        return (System.identityHashCode(myPool) * 31 + myNode) * 31 + myIndex;
    }

    @Override
    public String toString() {
        return "Cursor[node=" + myNode + ", index=" + myIndex + "]";
    }

}
