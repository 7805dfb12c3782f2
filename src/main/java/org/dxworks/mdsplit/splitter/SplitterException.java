package org.dxworks.mdsplit.splitter;

/**
 * Signals an unexpected fault while splitting. Never used for input that merely has no headings.
 */
public class SplitterException extends RuntimeException {

    public SplitterException(String message, Throwable cause) {
        super(message, cause);
    }
}
