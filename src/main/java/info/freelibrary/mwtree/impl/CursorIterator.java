
package info.freelibrary.mwtree.impl;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import info.freelibrary.mwtree.Cursor;

/**
 * Adapts a pair of cursors to a fail-fast {@link Iterator}.
 */
final class CursorIterator<T> implements Iterator<T> {

    private final NodePool<T> myPool;

    private final Cursor<T> myCursor;

    private final Cursor<T> myEnd;

    private final int myModCount;

    CursorIterator(final NodePool<T> aPool, final Cursor<T> aStart, final Cursor<T> aEnd) {
        myPool = aPool;
        myCursor = aStart;
        myEnd = aEnd;
        myModCount = aPool.getModCount();
    }

    @Override
    public boolean hasNext() {
        return !myCursor.equals(myEnd);
    }

    @Override
    public T next() {
        if (myPool.getModCount() != myModCount) {
            throw new ConcurrentModificationException();
        }

        if (!hasNext()) {
            throw new NoSuchElementException();
        }

        final T element = myCursor.get();

        myCursor.next();
        return element;
    }

}
