
package info.freelibrary.mwtree.impl;

import info.freelibrary.mwtree.MutableCursor;

final class MutableReverseNodeCursor<T> extends ReverseNodeCursor<T> implements MutableCursor<T> {

    private final MutableNodeCursor<T> myMutableBase;

    MutableReverseNodeCursor(final MutableNodeCursor<T> aBase) {
        super(aBase);
        myMutableBase = aBase;
    }

    @Override
    public T set(final T aElement) {
        return myMutableBase.copy().previous().set(aElement);
    }

    @Override
    public MutableReverseNodeCursor<T> next() {
        myBase.retreat();
        return this;
    }

    @Override
    public MutableReverseNodeCursor<T> previous() {
        myBase.advance();
        return this;
    }

    @Override
    public MutableReverseNodeCursor<T> copy() {
        return new MutableReverseNodeCursor<>(myMutableBase.copy());
    }

}
