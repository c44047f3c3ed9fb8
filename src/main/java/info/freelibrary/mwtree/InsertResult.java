
package info.freelibrary.mwtree;

/**
 * The outcome of an insertion: a cursor at the matching element and whether the tree grew.
 *
 * @param <T> The type of element in the tree
 */
public final class InsertResult<T> {

    private final MutableCursor<T> myCursor;

    private final boolean isInserted;

    /**
     * Creates an insertion result.
     *
     * @param aCursor A cursor positioned at the inserted or already present element
     * @param aInserted Whether the element was added
     */
    public InsertResult(final MutableCursor<T> aCursor, final boolean aInserted) {
        myCursor = aCursor;
        isInserted = aInserted;
    }

    /**
     * Gets a cursor positioned at the element that matched the insertion.
     *
     * @return A cursor at the matching element
     */
    public MutableCursor<T> getCursor() {
        return myCursor;
    }

    /**
     * Returns whether the element was added; <code>false</code> if an equal element was already present.
     *
     * @return <code>true</code> if the tree grew by one element
     */
    public boolean isInserted() {
        return isInserted;
    }

    @Override
    public String toString() {
        return "(" + myCursor + ", " + isInserted + ")";
    }

}
