package dev.pbxsort.sort;

/**
 * A multi-line section record whose braces never balance.
 */
public class UnbalancedRecordException extends ProjectFormatException {

    public UnbalancedRecordException(String section, int lineNumber, String reason) {
        super("Unbalanced braces in " + section + " record: " + reason, lineNumber);
    }
}
