
package info.freelibrary.mwtree.impl;

import java.util.NoSuchElementException;
import java.util.Objects;

import info.freelibrary.util.Logger;
import info.freelibrary.util.LoggerFactory;

import info.freelibrary.mwtree.Constants;
import info.freelibrary.mwtree.MutableCursor;

/**
 * A forward cursor that can replace the element it points at.
 */
final class MutableNodeCursor<T> extends NodeCursor<T> implements MutableCursor<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MutableNodeCursor.class, Constants.MESSAGES);

    private static final String NOT_EQUAL = "MWT-009";

    MutableNodeCursor(final NodePool<T> aPool, final Position aPosition) {
        super(aPool, aPosition);
    }

    private MutableNodeCursor(final NodePool<T> aPool, final int aEpoch, final int aNode, final int aIndex) {
        super(aPool, aEpoch, aNode, aIndex);
    }

    @Override
    public T set(final T aElement) {
        Objects.requireNonNull(aElement);

        final TreeNode<T> node = checkedNode();

        if (myIndex >= node.myItemCount) {
            throw new NoSuchElementException();
        }

        if (myPool.compare(node.getItem(myIndex), aElement) != 0) {
            throw new IllegalArgumentException(LOGGER.getMessage(NOT_EQUAL));
        }

        return myPool.replace(myNode, myIndex, aElement);
    }

    @Override
    public MutableNodeCursor<T> next() {
        advance();
        return this;
    }

    @Override
    public MutableNodeCursor<T> previous() {
        retreat();
        return this;
    }

    @Override
    public MutableNodeCursor<T> copy() {
        return new MutableNodeCursor<>(myPool, myEpoch, myNode, myIndex);
    }

}
