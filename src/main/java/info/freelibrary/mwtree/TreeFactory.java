
package info.freelibrary.mwtree;

import java.util.Comparator;
import java.util.Properties;

import info.freelibrary.util.Logger;
import info.freelibrary.util.LoggerFactory;

import info.freelibrary.mwtree.impl.DefaultComparator;
import info.freelibrary.mwtree.impl.MultiwayTree;

/**
 * Creates trees using a configurable default node capacity. The default is read from the
 * <code>mwtree.node.capacity</code> system property when the factory is first used, and can be changed afterwards
 * with {@link #setProperty(String, Object)} or {@link #setProperties(Properties)}.
 */
public final class TreeFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeFactory.class, Constants.MESSAGES);

    private static final String BAD_PROPERTY_VALUE = "MWT-012";

    private static final String CAPACITY_CHANGED = "MWT-013";

    private static final TreeFactory INSTANCE = new TreeFactory();

    private final Properties myProperties = new Properties();

    private int myCapacity = Constants.DEFAULT_CAPACITY;

    private TreeFactory() {
        final String capacity = System.getProperty(Constants.NODE_CAPACITY);

        if (capacity != null) {
            try {
                setProperty(Constants.NODE_CAPACITY, capacity);
            } catch (final IllegalArgumentException details) {
                LOGGER.warn(details.getMessage(), details);
            }
        }
    }

    /**
     * Gets the tree factory.
     *
     * @return The tree factory
     */
    public static TreeFactory getInstance() {
        return INSTANCE;
    }

    /**
     * Creates an empty tree with the default node capacity, ordering elements by their natural ordering.
     *
     * @return A new tree
     */
    public <T> SortedTree<T> createTree() {
        return createTree(getNodeCapacity());
    }

    /**
     * Creates an empty tree ordering elements by their natural ordering.
     *
     * @param aCapacity The maximum number of elements in a node
     * @return A new tree
     * @throws IllegalArgumentException If the capacity is less than one
     */
    public <T> SortedTree<T> createTree(final int aCapacity) {
        return createTree(aCapacity, DefaultComparator.getInstance());
    }

    /**
     * Creates an empty tree with the default node capacity.
     *
     * @param aComparator The ordering of the tree's elements
     * @return A new tree
     */
    public <T> SortedTree<T> createTree(final Comparator<? super T> aComparator) {
        return createTree(getNodeCapacity(), aComparator);
    }

    /**
     * Creates an empty tree.
     *
     * @param aCapacity The maximum number of elements in a node
     * @param aComparator The ordering of the tree's elements
     * @return A new tree
     * @throws IllegalArgumentException If the capacity is less than one
     */
    public <T> SortedTree<T> createTree(final int aCapacity, final Comparator<? super T> aComparator) {
        return new MultiwayTree<>(aCapacity, aComparator);
    }

    /**
     * Gets the node capacity used when none is supplied.
     *
     * @return The default node capacity
     */
    public synchronized int getNodeCapacity() {
        return myCapacity;
    }

    /**
     * Gets a configuration property.
     *
     * @param aName A property name
     * @return The property's value or <code>null</code> if it has not been set
     */
    public synchronized Object getProperty(final String aName) {
        return myProperties.get(aName);
    }

    /**
     * Sets a configuration property. The only property the factory interprets is
     * {@link Constants#NODE_CAPACITY}, whose value may be a number or a decimal string.
     *
     * @param aName A property name
     * @param aValue A property value
     * @throws IllegalArgumentException If the value of a recognized property is not valid
     */
    public synchronized void setProperty(final String aName, final Object aValue) {
        if (Constants.NODE_CAPACITY.equals(aName)) {
            final long capacity = getIntegerValue(aName, aValue);

            if (capacity < 1 || capacity > Constants.MAX_CAPACITY) {
                throw new IllegalArgumentException(LOGGER.getMessage(BAD_PROPERTY_VALUE, aName, aValue));
            }

            myCapacity = (int) capacity;

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(CAPACITY_CHANGED, myCapacity);
            }
        }

        myProperties.put(aName, aValue);
    }

    /**
     * Sets a group of configuration properties.
     *
     * @param aProperties Configuration properties
     * @throws IllegalArgumentException If the value of a recognized property is not valid
     */
    public synchronized void setProperties(final Properties aProperties) {
        for (final String name : aProperties.stringPropertyNames()) {
            setProperty(name, aProperties.getProperty(name));
        }
    }

    private long getIntegerValue(final String aName, final Object aValue) {
        if (aValue instanceof Number) {
            return ((Number) aValue).longValue();
        } else if (aValue instanceof String) {
            try {
                return Long.parseLong(((String) aValue).trim(), 10);
            } catch (final NumberFormatException details) {
                LOGGER.warn(details.getMessage(), details);
            }
        }

        throw new IllegalArgumentException(LOGGER.getMessage(BAD_PROPERTY_VALUE, aName, aValue));
    }

}
