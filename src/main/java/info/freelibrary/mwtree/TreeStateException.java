
package info.freelibrary.mwtree;

import info.freelibrary.util.I18nRuntimeException;

/**
 * Exception thrown when a tree or cursor is used after its node graph has been moved to another tree or replaced by
 * an assignment.
 */
public class TreeStateException extends I18nRuntimeException {

    private static final long serialVersionUID = -4263075533180746221L;

    /**
     * Creates a tree state exception.
     *
     * @param aMessageKey A key into the message bundle
     */
    public TreeStateException(final String aMessageKey) {
        super(Constants.MESSAGES, aMessageKey);
    }

}
