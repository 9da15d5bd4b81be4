package dev.pbxsort.project;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps command-line paths to {@code project.pbxproj} documents.
 */
public class ProjectFileResolver {

    public static final String PROJECT_FILE_NAME = "project.pbxproj";
    public static final String BUNDLE_SUFFIX = ".xcodeproj";

    /**
     * Resolves an {@code .xcodeproj} bundle to the document inside it and accepts a path named
     * {@value #PROJECT_FILE_NAME} as is.
     *
     * @throws NotAProjectFileException for any other file name
     */
    public Path resolve(Path argument) {
        Path candidate = argument;
        if (isBundle(argument)) {
            candidate = argument.resolve(PROJECT_FILE_NAME);
        }
        Path fileName = candidate.getFileName();
        if (fileName == null || !PROJECT_FILE_NAME.equals(fileName.toString())) {
            throw new NotAProjectFileException(candidate);
        }
        return candidate;
    }

    /**
     * Finds every {@value #PROJECT_FILE_NAME} that sits directly inside an {@code .xcodeproj} bundle below
     * {@code root}, in path order.
     */
    public List<Path> discover(Path root) {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> PROJECT_FILE_NAME.equals(String.valueOf(path.getFileName())))
                    .filter(path -> path.getParent() != null && isBundle(path.getParent()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to scan " + root, ex);
        }
    }

    private static boolean isBundle(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().endsWith(BUNDLE_SUFFIX);
    }
}
