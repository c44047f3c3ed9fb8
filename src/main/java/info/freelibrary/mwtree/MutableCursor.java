
package info.freelibrary.mwtree;

/**
 * A cursor that can replace the element it points at.
 *
 * @param <T> The type of element the cursor visits
 */
public interface MutableCursor<T> extends Cursor<T> {

    /**
     * Replaces the element under the cursor. The replacement must order equal to the current element so that the
     * tree stays sorted.
     *
     * @param aElement A replacement element
     * @return The element that was replaced
     * @throws IllegalArgumentException If the replacement does not order equal to the current element
     * @throws java.util.NoSuchElementException If the cursor is an end cursor
     */
    T set(T aElement);

    @Override
    MutableCursor<T> next();

    @Override
    MutableCursor<T> previous();

    @Override
    MutableCursor<T> copy();

}
