
package info.freelibrary.mwtree.impl;

import java.io.IOException;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.UnaryOperator;

import info.freelibrary.util.Logger;
import info.freelibrary.util.LoggerFactory;

import info.freelibrary.mwtree.Constants;
import info.freelibrary.mwtree.Cursor;
import info.freelibrary.mwtree.InsertResult;
import info.freelibrary.mwtree.MutableCursor;
import info.freelibrary.mwtree.SortedTree;
import info.freelibrary.mwtree.TreeStateException;

/**
 * A multiway search tree whose nodes hold up to a fixed number of sorted elements. An element that does not fit in a
 * full node is pushed down into the child slot between its neighbours, creating that child if needed. Nodes are
 * never split, merged or rebalanced.
 * <p>
 * The tree owns its nodes through a {@link NodePool}. Copying a tree clones the pool; moving a tree hands the pool to
 * the receiving tree and invalidates every cursor created before the move.
 *
 * @param <T> The type of element in the tree
 */
public class MultiwayTree<T> implements SortedTree<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiwayTree.class, Constants.MESSAGES);

    private static final String CAPACITY_TOO_SMALL = "MWT-001";

    private static final String CAPACITY_TOO_LARGE = "MWT-002";

    private static final String TREE_MOVED = "MWT-003";

    private static final String TREE_COPIED = "MWT-006";

    private static final String TREE_TRANSFERRED = "MWT-007";

    private static final String FOREIGN_TREE = "MWT-011";

    private static final String NULL_ELEMENT = "MWT-014";

    private static final String COPY_OF_MOVED = "MWT-015";

    private NodePool<T> myPool;

    /**
     * Creates an empty tree with the default node capacity, ordering elements by their natural ordering.
     */
    public MultiwayTree() {
        this(Constants.DEFAULT_CAPACITY);
    }

    /**
     * Creates an empty tree ordering elements by their natural ordering.
     *
     * @param aCapacity The maximum number of elements in a node
     * @throws IllegalArgumentException If the capacity is less than one
     */
    public MultiwayTree(final int aCapacity) {
        this(aCapacity, DefaultComparator.getInstance());
    }

    /**
     * Creates an empty tree.
     *
     * @param aCapacity The maximum number of elements in a node
     * @param aComparator The ordering of the tree's elements
     * @throws IllegalArgumentException If the capacity is less than one
     */
    public MultiwayTree(final int aCapacity, final Comparator<? super T> aComparator) {
        Objects.requireNonNull(aComparator);

        if (aCapacity < 1) {
            throw new IllegalArgumentException(LOGGER.getMessage(CAPACITY_TOO_SMALL, aCapacity));
        } else if (aCapacity > Constants.MAX_CAPACITY) {
            throw new IllegalArgumentException(LOGGER.getMessage(CAPACITY_TOO_LARGE, aCapacity,
                    Constants.MAX_CAPACITY));
        }

        myPool = new NodePool<>(aCapacity, aComparator);
    }

    /**
     * Creates a tree with the same shape and elements as the supplied one.
     *
     * @param aOriginal A tree to copy
     * @throws TreeStateException If the original has been moved
     */
    public MultiwayTree(final MultiwayTree<T> aOriginal) {
        this(aOriginal.copyPool(null), false);
    }

    private MultiwayTree(final NodePool<T> aPool, final boolean aMoved) {
        myPool = aPool;

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(aMoved ? TREE_TRANSFERRED : TREE_COPIED, aPool.size(), aPool.getNodeCount());
        }
    }

    @Override
    public InsertResult<T> insert(final T aElement) {
        final NodePool<T> pool = checkedPool();
        final Position position = pool.insert(checkElement(aElement));

        return new InsertResult<>(new MutableNodeCursor<>(pool, position), position.isInserted);
    }

    @Override
    public MutableCursor<T> find(final T aElement) {
        final NodePool<T> pool = checkedPool();
        final Position position = pool.find(checkElement(aElement));

        return new MutableNodeCursor<>(pool, position == null ? pool.end() : position);
    }

    @Override
    public Cursor<T> cfind(final T aElement) {
        final NodePool<T> pool = checkedPool();
        final Position position = pool.find(checkElement(aElement));

        return new NodeCursor<>(pool, position == null ? pool.end() : position);
    }

    @Override
    public boolean contains(final T aElement) {
        return checkedPool().find(checkElement(aElement)) != null;
    }

    @Override
    public MutableCursor<T> begin() {
        final NodePool<T> pool = checkedPool();
        return new MutableNodeCursor<>(pool, pool.first());
    }

    @Override
    public MutableCursor<T> end() {
        final NodePool<T> pool = checkedPool();
        return new MutableNodeCursor<>(pool, pool.end());
    }

    @Override
    public MutableCursor<T> rbegin() {
        final NodePool<T> pool = checkedPool();
        return new MutableReverseNodeCursor<>(new MutableNodeCursor<>(pool, pool.end()));
    }

    @Override
    public MutableCursor<T> rend() {
        final NodePool<T> pool = checkedPool();
        return new MutableReverseNodeCursor<>(new MutableNodeCursor<>(pool, pool.first()));
    }

    @Override
    public Cursor<T> cbegin() {
        final NodePool<T> pool = checkedPool();
        return new NodeCursor<>(pool, pool.first());
    }

    @Override
    public Cursor<T> cend() {
        final NodePool<T> pool = checkedPool();
        return new NodeCursor<>(pool, pool.end());
    }

    @Override
    public Cursor<T> crbegin() {
        final NodePool<T> pool = checkedPool();
        return new ReverseNodeCursor<>(new NodeCursor<>(pool, pool.end()));
    }

    @Override
    public Cursor<T> crend() {
        final NodePool<T> pool = checkedPool();
        return new ReverseNodeCursor<>(new NodeCursor<>(pool, pool.first()));
    }

    @Override
    public Iterator<T> iterator() {
        return new CursorIterator<>(checkedPool(), cbegin(), cend());
    }

    @Override
    public Iterator<T> descendingIterator() {
        return new CursorIterator<>(checkedPool(), crbegin(), crend());
    }

    @Override
    public MultiwayTree<T> copy() {
        return new MultiwayTree<>(this);
    }

    @Override
    public MultiwayTree<T> copy(final UnaryOperator<T> aElementCopier) {
        return new MultiwayTree<>(copyPool(Objects.requireNonNull(aElementCopier)), false);
    }

    @Override
    public MultiwayTree<T> move() {
        return new MultiwayTree<>(detach(), true);
    }

    @Override
    public void assign(final SortedTree<T> aSource) {
        final MultiwayTree<T> source = checkSource(aSource);

        if (source != this) {
            replacePool(source.copyPool(null));

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(TREE_COPIED, myPool.size(), myPool.getNodeCount());
            }
        }
    }

    @Override
    public void assignMove(final SortedTree<T> aSource) {
        final MultiwayTree<T> source = checkSource(aSource);

        if (source != this) {
            replacePool(source.detach());

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(TREE_TRANSFERRED, myPool.size(), myPool.getNodeCount());
            }
        }
    }

    @Override
    public boolean isMoved() {
        return myPool == null;
    }

    @Override
    public int size() {
        return myPool == null ? 0 : myPool.size();
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public int getCapacity() {
        return checkedPool().getCapacity();
    }

    @Override
    public Comparator<? super T> getComparator() {
        return checkedPool().getComparator();
    }

    @Override
    public int getNodeCount() {
        return checkedPool().getNodeCount();
    }

    @Override
    public int getHeight() {
        return checkedPool().getHeight();
    }

    @Override
    public void writeTo(final Appendable aAppendable) throws IOException {
        final Cursor<T> end = cend();
        final Cursor<T> cursor = cbegin();

        if (!cursor.equals(end)) {
            aAppendable.append(String.valueOf(cursor.get()));

            for (cursor.next(); !cursor.equals(end); cursor.next()) {
                aAppendable.append(' ').append(String.valueOf(cursor.get()));
            }
        }
    }

    /**
     * Gets the elements in ascending order, separated by single spaces. A moved tree renders as an empty string.
     */
    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();

        if (myPool != null) {
            try {
                writeTo(builder);
            } catch (final IOException details) {
                throw new IllegalStateException(details);
            }
        }

        return builder.toString();
    }

    private NodePool<T> checkedPool() {
        if (myPool == null) {
            throw new TreeStateException(TREE_MOVED);
        }

        return myPool;
    }

    private NodePool<T> copyPool(final UnaryOperator<T> aElementCopier) {
        if (myPool == null) {
            throw new TreeStateException(COPY_OF_MOVED);
        }

        return myPool.copy(aElementCopier);
    }

    private NodePool<T> detach() {
        final NodePool<T> pool = checkedPool();

        pool.retire();
        myPool = null;

        return pool;
    }

    private void replacePool(final NodePool<T> aPool) {
        if (myPool != null) {
            myPool.retire();
        }

        myPool = aPool;
    }

    private MultiwayTree<T> checkSource(final SortedTree<T> aSource) {
        if (!(aSource instanceof MultiwayTree)) {
            final String type = aSource == null ? "null" : aSource.getClass().getName();
            throw new IllegalArgumentException(LOGGER.getMessage(FOREIGN_TREE, type));
        }

        return (MultiwayTree<T>) aSource;
    }

    private T checkElement(final T aElement) {
        if (aElement == null) {
            throw new NullPointerException(LOGGER.getMessage(NULL_ELEMENT));
        }

        return aElement;
    }

}
