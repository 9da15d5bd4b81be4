package dev.pbxsort.sort;

/**
 * Runtime exception raised when a document cannot be sorted safely. The file it came from must be left untouched.
 */
public class ProjectFormatException extends RuntimeException {

    private final int lineNumber;

    public ProjectFormatException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    /**
     * One-based line at which the offending region or record starts.
     */
    public int lineNumber() {
        return lineNumber;
    }
}
