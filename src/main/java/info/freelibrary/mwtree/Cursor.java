
package info.freelibrary.mwtree;

import java.util.NoSuchElementException;

/**
 * Read-only cursor over the ascending sequence of a {@link SortedTree}. A cursor is a position in the tree's node
 * graph: it moves in place and two cursors are equal when they denote the same position, whether or not either of
 * them allows mutation.
 * <p>
 * An insertion into the tree may shift elements within a node, so a cursor obtained before an insertion may denote a
 * different element afterwards. Re-acquire cursors after inserting. Cursors obtained before the tree is moved or
 * reassigned throw {@link TreeStateException} on their next use.
 *
 * @param <T> The type of element the cursor visits
 */
public interface Cursor<T> {

    /**
     * Gets the element under the cursor.
     *
     * @return The element under the cursor
     * @throws NoSuchElementException If the cursor is an end cursor
     */
    T get();

    /**
     * Moves the cursor to the next element in its direction of travel.
     *
     * @return This cursor
     * @throws NoSuchElementException If the cursor is already an end cursor
     */
    Cursor<T> next();

    /**
     * Moves the cursor back to the previous element in its direction of travel.
     *
     * @return This cursor
     * @throws NoSuchElementException If the cursor is already at the first element
     */
    Cursor<T> previous();

    /**
     * Creates an independent cursor at the same position.
     *
     * @return A copy of this cursor
     */
    Cursor<T> copy();

}
