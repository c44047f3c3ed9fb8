
package info.freelibrary.mwtree;

public final class Constants {

    public static final String MESSAGES = "mwtree_messages";

    /**
     * Number of elements a node holds when no capacity is given.
     */
    public static final int DEFAULT_CAPACITY = 40;

    /**
     * Largest node capacity; a node's child slot array has one more entry than its capacity.
     */
    public static final int MAX_CAPACITY = Integer.MAX_VALUE - 9;

    public static final String NODE_CAPACITY = "mwtree.node.capacity";

    private Constants() {
        super();
    }

}
