
package info.freelibrary.mwtree.impl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;

import info.freelibrary.util.Logger;
import info.freelibrary.util.LoggerFactory;

import info.freelibrary.mwtree.Constants;

/**
 * The nodes of one tree, addressed by index. The root is always at index 0. Nodes are only ever added; the pool as a
 * whole is copied, handed to another tree, or retired.
 */
final class NodePool<T> {

    static final int ROOT = 0;

    private static final Logger LOGGER = LoggerFactory.getLogger(NodePool.class, Constants.MESSAGES);

    private static final String NODE_CREATED = "MWT-005";

    private static final String BAD_ELEMENT_COPY = "MWT-010";

    private static final String POOL_RETIRED = "MWT-008";

    private final List<TreeNode<T>> myNodes;

    private final int myCapacity;

    private final Comparator<? super T> myComparator;

    private int mySize;

    private int myModCount;

    private int myEpoch;

    NodePool(final int aCapacity, final Comparator<? super T> aComparator) {
        myNodes = new ArrayList<>();
        myCapacity = aCapacity;
        myComparator = aComparator;
        myNodes.add(new TreeNode<>(this, ROOT, TreeNode.NONE));
    }

    private NodePool(final NodePool<T> aPool, final UnaryOperator<T> aCopier) {
        myNodes = new ArrayList<>(aPool.myNodes.size());
        myCapacity = aPool.myCapacity;
        myComparator = aPool.myComparator;
        mySize = aPool.mySize;

        for (final TreeNode<T> node : aPool.myNodes) {
            myNodes.add(node.copy(this, aCopier));
        }
    }

    final TreeNode<T> getNode(final int aIndex) {
        return myNodes.get(aIndex);
    }

    final int getCapacity() {
        return myCapacity;
    }

    final Comparator<? super T> getComparator() {
        return myComparator;
    }

    final int compare(final T aFirst, final T aSecond) {
        return myComparator.compare(aFirst, aSecond);
    }

    final int size() {
        return mySize;
    }

    final int getNodeCount() {
        return myNodes.size();
    }

    final int getModCount() {
        return myModCount;
    }

    final int getEpoch() {
        return myEpoch;
    }

    /**
     * Adds an element, descending past full nodes into the child slot where it belongs. At most one node is created.
     *
     * @param aElement An element to add
     * @return The position of the added element, or of the equal element already present
     */
    final Position insert(final T aElement) {
        TreeNode<T> node = getNode(ROOT);

        while (true) {
            if (node.myItemCount == 0) {
                node.insertItem(0, aElement);
                return added(node.myIndex, 0);
            }

            final int position = node.lowerBound(aElement);

            if (node.matches(position, aElement)) {
                return new Position(node.myIndex, position);
            } else if (!node.isFull()) {
                node.insertItem(position, aElement);
                return added(node.myIndex, position);
            }

            int child = node.getChild(position);

            if (child == TreeNode.NONE) {
                child = createNode(node, position);
            }

            node = getNode(child);
        }
    }

    /**
     * Finds an element equal to the supplied one.
     *
     * @param aElement An element to look for
     * @return The position of the equal element or <code>null</code> if there is none
     */
    final Position find(final T aElement) {
        TreeNode<T> node = getNode(ROOT);

        while (true) {
            final int position = node.lowerBound(aElement);

            if (node.matches(position, aElement)) {
                return new Position(node.myIndex, position);
            }

            final int child = node.getChild(position);

            if (child == TreeNode.NONE) {
                return null;
            }

            node = getNode(child);
        }
    }

    /**
     * Descends through the first child slot to the node holding the smallest element of a subtree.
     */
    final int leftmost(final int aNode) {
        int index = aNode;
        int child;

        while ((child = getNode(index).getChild(0)) != TreeNode.NONE) {
            index = child;
        }

        return index;
    }

    /**
     * Descends through the slot past each node's last element to the node holding the largest element of a subtree.
     */
    final int rightmost(final int aNode) {
        int index = aNode;
        int child;

        while (true) {
            final TreeNode<T> node = getNode(index);

            if ((child = node.getChild(node.myItemCount)) == TreeNode.NONE) {
                return index;
            }

            index = child;
        }
    }

    final Position first() {
        return new Position(leftmost(ROOT), 0);
    }

    final Position end() {
        final int index = rightmost(ROOT);
        return new Position(index, getNode(index).myItemCount);
    }

    final T replace(final int aNode, final int aPosition, final T aElement) {
        final TreeNode<T> node = getNode(aNode);
        final T current = node.getItem(aPosition);

        node.myItems[aPosition] = aElement;
        return current;
    }

    final T checkCopy(final T aOriginal, final T aCopy) {
        if (aCopy == null || compare(aOriginal, aCopy) != 0) {
            throw new IllegalArgumentException(LOGGER.getMessage(BAD_ELEMENT_COPY));
        }

        return aCopy;
    }

    final int getHeight() {
        final int[] depths = new int[myNodes.size()];
        int height = 0;

        // Parents are always created before their children
        for (int index = 0; index < depths.length; index++) {
            final int parent = myNodes.get(index).myParent;

            depths[index] = parent == TreeNode.NONE ? 1 : depths[parent] + 1;
            height = Math.max(height, depths[index]);
        }

        return height;
    }

    final NodePool<T> copy(final UnaryOperator<T> aCopier) {
        return new NodePool<>(this, aCopier);
    }

    /**
     * Invalidates every cursor created against the pool so far.
     */
    final void retire() {
        myEpoch += 1;

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(POOL_RETIRED, myNodes.size());
        }
    }

    private Position added(final int aNode, final int aPosition) {
        mySize += 1;
        myModCount += 1;

        return new Position(aNode, aPosition, true);
    }

    private int createNode(final TreeNode<T> aParent, final int aSlot) {
        final int index = myNodes.size();

        myNodes.add(new TreeNode<>(this, index, aParent.myIndex));
        aParent.setChild(aSlot, index);

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(NODE_CREATED, index, aParent.myIndex, myCapacity);
        }

        return index;
    }

}
