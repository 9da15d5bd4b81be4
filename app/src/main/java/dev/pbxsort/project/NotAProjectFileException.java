package dev.pbxsort.project;

import java.nio.file.Path;

/**
 * Raised for a path that does not name a {@code project.pbxproj} document. Callers skip such paths.
 */
public class NotAProjectFileException extends RuntimeException {

    private final transient Path path;

    public NotAProjectFileException(Path path) {
        super("Not an Xcode project file: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
