
package info.freelibrary.mwtree.impl;

import info.freelibrary.mwtree.Cursor;

/**
 * A read-only reverse cursor. It wraps a forward cursor and denotes the element just before it, so the reverse
 * cursor built on the forward end cursor is at the largest element.
 */
class ReverseNodeCursor<T> implements Cursor<T> {

    final NodeCursor<T> myBase;

    ReverseNodeCursor(final NodeCursor<T> aBase) {
        myBase = aBase;
    }

    @Override
    public T get() {
        return myBase.copy().previous().get();
    }

    @Override
    public ReverseNodeCursor<T> next() {
        myBase.retreat();
        return this;
    }

    @Override
    public ReverseNodeCursor<T> previous() {
        myBase.advance();
        return this;
    }

    @Override
    public ReverseNodeCursor<T> copy() {
        return new ReverseNodeCursor<>(myBase.copy());
    }

    @Override
    public final boolean equals(final Object aObject) {
        return aObject instanceof ReverseNodeCursor && myBase.equals(((ReverseNodeCursor<?>) aObject).myBase);
    }

    @Override
    public final int hashCode() {
        return ~myBase.hashCode();
    }

    @Override
    public String toString() {
        return "Reverse" + myBase;
    }

}
