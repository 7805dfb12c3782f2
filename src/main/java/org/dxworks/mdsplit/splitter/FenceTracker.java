package org.dxworks.mdsplit.splitter;

/**
 * Tracks whether a line-by-line scan is inside a fenced code block.
 *
 * <p>A fence line is indented by at most three spaces and starts with three or more backticks
 * or tildes, optionally followed by a language tag. Outside a block, a fence line opens one,
 * except a backtick run whose tag contains a backtick, which is inline code. Inside a block, a
 * fence line made of the opening character closes it, whatever its length or tag. A block that
 * never closes runs to the end of the input.</p>
 */
class FenceTracker {

    private static final int FENCE_MIN_LENGTH = 3;
    private static final int MAX_FENCE_INDENT = 3;
    private static final char BACKTICK = '`';
    private static final char TILDE = '~';

    private boolean inFence;
    private char fenceChar;

    /**
     * Feeds the next line to the tracker.
     *
     * @return true if the line belongs to a fenced code block, opening and closing fence lines included
     */
    boolean accept(String line) {
        int indent = 0;
        while (indent < line.length() && line.charAt(indent) == ' ') {
            indent++;
        }
        if (indent > MAX_FENCE_INDENT || indent == line.length()) {
            return inFence;
        }

        char markerChar = line.charAt(indent);
        if (markerChar != BACKTICK && markerChar != TILDE) {
            return inFence;
        }
        int length = 0;
        while (indent + length < line.length() && line.charAt(indent + length) == markerChar) {
            length++;
        }
        if (length < FENCE_MIN_LENGTH) {
            return inFence;
        }

        if (!inFence) {
            if (markerChar == BACKTICK && line.indexOf(BACKTICK, indent + length) >= 0) {
                return false;
            }
            inFence = true;
            fenceChar = markerChar;
            return true;
        }
        if (markerChar == fenceChar) {
            inFence = false;
            fenceChar = 0;
        }
        return true;
    }
}
