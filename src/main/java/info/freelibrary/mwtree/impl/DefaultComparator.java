
package info.freelibrary.mwtree.impl;

import java.util.Comparator;

/**
 * Orders elements by their natural ordering. Elements that are not {@link Comparable} fail with a
 * {@link ClassCastException} when they are compared.
 */
public final class DefaultComparator<T> implements Comparator<T> {

    @SuppressWarnings("rawtypes")
    private static final DefaultComparator INSTANCE = new DefaultComparator();

    private DefaultComparator() {
    }

    /**
     * Gets the natural ordering comparator.
     *
     * @return A comparator using {@link Comparable#compareTo(Object)}
     */
    @SuppressWarnings("unchecked")
    public static <T> DefaultComparator<T> getInstance() {
        return INSTANCE;
    }

    @SuppressWarnings("unchecked")
    @Override
    public int compare(final T aFirstMember, final T aSecondMember) {
        return ((Comparable<Object>) aFirstMember).compareTo(aSecondMember);
    }

    @Override
    public String toString() {
        return "natural order";
    }

}
