
package info.freelibrary.mwtree.impl;

import java.util.Arrays;
import java.util.function.UnaryOperator;

/**
 * A node of a multiway tree. Child slot <code>i</code> holds the subtree of values between elements <code>i - 1</code>
 * and <code>i</code>. Children and parent are indices into the owning {@link NodePool}.
 */
final class TreeNode<T> {

    static final int NONE = -1;

    private static final int INITIAL_ITEMS = 8;

    NodePool<T> myPool;

    final int myIndex;

    final int myParent;

    Object[] myItems;

    int myItemCount;

    int[] myChildren;

    TreeNode(final NodePool<T> aPool, final int aIndex, final int aParent) {
        myPool = aPool;
        myIndex = aIndex;
        myParent = aParent;
        myItems = new Object[Math.min(INITIAL_ITEMS, aPool.getCapacity())];
    }

    private TreeNode(final NodePool<T> aPool, final TreeNode<T> aNode) {
        myPool = aPool;
        myIndex = aNode.myIndex;
        myParent = aNode.myParent;
        myItems = Arrays.copyOf(aNode.myItems, aNode.myItems.length);
        myItemCount = aNode.myItemCount;
        myChildren = aNode.myChildren == null ? null : aNode.myChildren.clone();
    }

    @SuppressWarnings("unchecked")
    final T getItem(final int aPosition) {
        return (T) myItems[aPosition];
    }

    final int getChild(final int aSlot) {
        return myChildren == null ? NONE : myChildren[aSlot];
    }

    final boolean isFull() {
        return myItemCount == myPool.getCapacity();
    }

    /**
     * Finds the first position whose element is not less than the supplied one.
     */
    final int lowerBound(final T aElement) {
        int left = 0;
        int right = myItemCount;

        while (left < right) {
            final int m = left + right >>> 1;

            if (myPool.compare(getItem(m), aElement) < 0) {
                left = m + 1;
            } else {
                right = m;
            }
        }

        return left;
    }

    /**
     * Checks whether the element at a search position is equal to the supplied one; the position may be one past the
     * last element.
     */
    final boolean matches(final int aPosition, final T aElement) {
        return aPosition < myItemCount && myPool.compare(getItem(aPosition), aElement) == 0;
    }

    final void insertItem(final int aPosition, final T aElement) {
        if (myItemCount == myItems.length) {
            final long grown = (long) Math.max(myItems.length, 1) << 1;
            myItems = Arrays.copyOf(myItems, (int) Math.min(grown, myPool.getCapacity()));
        }

        System.arraycopy(myItems, aPosition, myItems, aPosition + 1, myItemCount - aPosition);
        myItems[aPosition] = aElement;
        myItemCount += 1;
    }

    final void setChild(final int aSlot, final int aChild) {
        if (myChildren == null) {
            myChildren = new int[myPool.getCapacity() + 1];
            Arrays.fill(myChildren, NONE);
        }

        myChildren[aSlot] = aChild;
    }

    final TreeNode<T> copy(final NodePool<T> aPool, final UnaryOperator<T> aCopier) {
        final TreeNode<T> node = new TreeNode<>(aPool, this);

        if (aCopier != null) {
            for (int index = 0; index < myItemCount; index++) {
                node.myItems[index] = aPool.checkCopy(getItem(index), aCopier.apply(getItem(index)));
            }
        }

        return node;
    }

    @Override
    public String toString() {
        return "Node " + myIndex + Arrays.toString(Arrays.copyOf(myItems, myItemCount));
    }

}
