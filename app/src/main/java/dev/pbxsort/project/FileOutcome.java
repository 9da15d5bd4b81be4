package dev.pbxsort.project;

/**
 * What happened to one project file.
 */
public enum FileOutcome {
    /** Content was already canonical; nothing written. */
    ALREADY_SORTED,
    /** Content was replaced with its sorted form. */
    REWRITTEN,
    /** Check mode found the content out of order; nothing written. */
    UNSORTED
}
