
package info.freelibrary.mwtree;

import java.io.IOException;
import java.util.Comparator;
import java.util.Iterator;
import java.util.function.UnaryOperator;

/**
 * An in-memory multiway search tree of unique elements. Each node holds up to a fixed number of sorted elements and
 * partitions the remaining values into one more subtree than it holds elements. Nodes are never split or merged, so
 * the shape of the tree depends on the order in which elements are inserted.
 * <p>
 * Trees are not thread safe.
 *
 * @param <T> The type of element in the tree
 */
public interface SortedTree<T> extends Iterable<T> {

    /**
     * Adds an element unless an equal element is already present.
     *
     * @param aElement An element to add
     * @return A cursor at the matching element and whether the element was added
     * @throws NullPointerException If the element is null
     * @throws TreeStateException If the tree has been moved
     */
    InsertResult<T> insert(T aElement);

    /**
     * Finds an element equal to the supplied one.
     *
     * @param aElement An element to look for
     * @return A cursor at the matching element, or the end cursor if there is none
     */
    MutableCursor<T> find(T aElement);

    /**
     * Finds an element equal to the supplied one, returning a read-only cursor.
     *
     * @param aElement An element to look for
     * @return A cursor at the matching element, or the end cursor if there is none
     */
    Cursor<T> cfind(T aElement);

    /**
     * Checks whether an element equal to the supplied one is in the tree.
     *
     * @param aElement An element to look for
     * @return <code>true</code> if the tree contains a matching element
     */
    boolean contains(T aElement);

    /**
     * Gets a cursor at the smallest element.
     *
     * @return A cursor at the first element, equal to {@link #end()} when the tree is empty
     */
    MutableCursor<T> begin();

    /**
     * Gets the cursor one past the largest element.
     *
     * @return The end cursor
     */
    MutableCursor<T> end();

    /**
     * Gets a reverse cursor at the largest element.
     *
     * @return A reverse cursor at the last element
     */
    MutableCursor<T> rbegin();

    /**
     * Gets the reverse cursor one before the smallest element.
     *
     * @return The reverse end cursor
     */
    MutableCursor<T> rend();

    Cursor<T> cbegin();

    Cursor<T> cend();

    Cursor<T> crbegin();

    Cursor<T> crend();

    /**
     * Gets an iterator over the elements in descending order. Like {@link #iterator()}, it fails with a
     * {@link java.util.ConcurrentModificationException} if the tree is changed while it is in use.
     *
     * @return An iterator over the elements from largest to smallest
     */
    Iterator<T> descendingIterator();

    /**
     * Creates a copy of this tree with the same shape. Elements are shared with this tree.
     *
     * @return A new tree
     */
    SortedTree<T> copy();

    /**
     * Creates a copy of this tree with the same shape, copying each element with the supplied function.
     *
     * @param aElementCopier A function that returns a copy of an element
     * @return A new tree
     * @throws IllegalArgumentException If a copy does not order equal to its original
     */
    SortedTree<T> copy(UnaryOperator<T> aElementCopier);

    /**
     * Transfers this tree's elements to a new tree. This tree cannot be used again until it is reassigned and all
     * cursors obtained from it become invalid.
     *
     * @return A new tree owning this tree's elements
     */
    SortedTree<T> move();

    /**
     * Replaces the contents of this tree with a copy of the supplied tree.
     *
     * @param aSource A tree to copy
     */
    void assign(SortedTree<T> aSource);

    /**
     * Replaces the contents of this tree with the contents of the supplied tree, which is left moved.
     *
     * @param aSource A tree to take the contents of
     */
    void assignMove(SortedTree<T> aSource);

    /**
     * Returns whether this tree's contents have been moved to another tree.
     *
     * @return <code>true</code> if the tree must be reassigned before use
     */
    boolean isMoved();

    /**
     * Gets the number of elements in the tree.
     *
     * @return The number of elements
     */
    int size();

    boolean isEmpty();

    /**
     * Gets the maximum number of elements a node may hold.
     *
     * @return The node capacity
     */
    int getCapacity();

    Comparator<? super T> getComparator();

    /**
     * Gets the number of nodes in the tree, including an empty root.
     *
     * @return The node count
     */
    int getNodeCount();

    /**
     * Gets the number of levels from the root to the deepest node.
     *
     * @return The tree height
     */
    int getHeight();

    /**
     * Writes the elements in ascending order, separated by single spaces.
     *
     * @param aAppendable A destination for the elements
     * @throws IOException If the destination cannot be written
     */
    void writeTo(Appendable aAppendable) throws IOException;

}
