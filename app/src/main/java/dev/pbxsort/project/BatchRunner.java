package dev.pbxsort.project;

import dev.pbxsort.sort.ProjectFormatException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes the project files named on the command line one after another.
 *
 * <p>Files are independent: a file that fails keeps its original content. By default the run carries on with the
 * remaining files; with fail-fast it stops at the first failure.</p>
 */
public class BatchRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchRunner.class);

    private final ProjectFileResolver resolver;
    private final ProjectFileProcessor processor;

    public BatchRunner(ProjectFileResolver resolver, ProjectFileProcessor processor) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.processor = Objects.requireNonNull(processor, "processor");
    }

    public BatchResult run(List<String> inputs, boolean checkOnly, boolean recursive, boolean failFast) {
        List<Path> alreadySorted = new ArrayList<>();
        List<Path> rewritten = new ArrayList<>();
        List<Path> unsorted = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        List<Path> failed = new ArrayList<>();
        List<String> invalidInputs = new ArrayList<>();

        List<Path> targets = new ArrayList<>();
        for (String input : inputs) {
            Path path;
            try {
                path = Path.of(input);
            } catch (InvalidPathException ex) {
                LOGGER.error("Invalid path {}: {}", input, ex.getMessage());
                invalidInputs.add(input);
                continue;
            }
            collectTargets(path, recursive, targets, skipped, failed);
        }

        boolean aborted = false;
        for (int i = 0; i < targets.size() && !aborted; i++) {
            Path target = targets.get(i);
            FileOutcome outcome = processOne(target, checkOnly);
            if (outcome == null) {
                failed.add(target);
                if (failFast) {
                    aborted = true;
                    int remaining = targets.size() - i - 1;
                    if (remaining > 0) {
                        LOGGER.error("Stopping after first failure; {} file(s) not processed", remaining);
                    }
                }
                continue;
            }
            switch (outcome) {
                case ALREADY_SORTED -> alreadySorted.add(target);
                case REWRITTEN -> rewritten.add(target);
                case UNSORTED -> unsorted.add(target);
            }
        }
        return new BatchResult(alreadySorted, rewritten, unsorted, skipped, failed, invalidInputs, aborted);
    }

    /**
     * @return the outcome, or {@code null} when the file could not be sorted
     */
    private FileOutcome processOne(Path target, boolean checkOnly) {
        if (!Files.isRegularFile(target)) {
            LOGGER.error("File not found: {}", target);
            return null;
        }
        try {
            return processor.process(target, checkOnly);
        } catch (ProjectFormatException | UncheckedIOException ex) {
            LOGGER.error("Could not sort {}: {}", target, ex.getMessage());
            LOGGER.debug("Failure details for {}", target, ex);
            return null;
        }
    }

    private void collectTargets(Path input, boolean recursive, List<Path> targets, List<Path> skipped, List<Path> failed) {
        if (recursive && Files.isDirectory(input) && !String.valueOf(input.getFileName()).endsWith(ProjectFileResolver.BUNDLE_SUFFIX)) {
            try {
                List<Path> found = resolver.discover(input);
                if (found.isEmpty()) {
                    LOGGER.warn("No Xcode project files found under {}", input);
                }
                targets.addAll(found);
            } catch (UncheckedIOException ex) {
                LOGGER.error(ex.getMessage(), ex.getCause());
                failed.add(input);
            }
            return;
        }
        try {
            targets.add(resolver.resolve(input));
        } catch (NotAProjectFileException ex) {
            LOGGER.warn(ex.getMessage());
            skipped.add(ex.path());
        }
    }
}
