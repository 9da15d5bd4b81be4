package dev.pbxsort.project;

import dev.pbxsort.logging.SimpleJsonLayout;
import dev.pbxsort.sort.RegionRouter;
import dev.pbxsort.writer.AtomicFileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Sorts a single project document, either in place or as a read-only check.
 */
public class ProjectFileProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectFileProcessor.class);

    private final RegionRouter router;
    private final AtomicFileWriter writer;

    public ProjectFileProcessor(RegionRouter router, AtomicFileWriter writer) {
        this.router = Objects.requireNonNull(router, "router");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Sorts {@code file}. The file is rewritten only when its sorted form differs and {@code checkOnly} is false;
     * on any exception it is left as it was.
     */
    public FileOutcome process(Path file, boolean checkOnly) {
        MDC.put(SimpleJsonLayout.MDC_PROJECT_FILE, file.toString());
        try {
            String original = read(file);
            String sorted = router.sort(original);
            if (sorted.equals(original)) {
                LOGGER.debug("{} is already sorted", file);
                return FileOutcome.ALREADY_SORTED;
            }
            if (checkOnly) {
                LOGGER.info("{} is not sorted", file);
                return FileOutcome.UNSORTED;
            }
            writer.write(file, sorted);
            LOGGER.info("Sorted {}", file);
            return FileOutcome.REWRITTEN;
        } finally {
            MDC.remove(SimpleJsonLayout.MDC_PROJECT_FILE);
        }
    }

    /**
     * Sorts an in-memory document.
     */
    public String sortText(String document) {
        return router.sort(document);
    }

    private String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + file, ex);
        }
    }
}
