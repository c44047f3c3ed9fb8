
package info.freelibrary.mwtree.impl;

/**
 * A node index and a position within that node's elements.
 */
final class Position {

    final int myNode;

    final int myIndex;

    final boolean isInserted;

    Position(final int aNode, final int aIndex) {
        this(aNode, aIndex, false);
    }

    Position(final int aNode, final int aIndex, final boolean aInserted) {
        myNode = aNode;
        myIndex = aIndex;
        isInserted = aInserted;
    }

}
