package dev.pbxsort.project;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one run over several project files.
 *
 * <p>{@code invalidInputs} holds arguments that are not valid paths on this platform; they count as failures.</p>
 */
public record BatchResult(
        List<Path> alreadySorted,
        List<Path> rewritten,
        List<Path> unsorted,
        List<Path> skipped,
        List<Path> failed,
        List<String> invalidInputs,
        boolean aborted
) {

    public BatchResult {
        alreadySorted = List.copyOf(Objects.requireNonNull(alreadySorted, "alreadySorted"));
        rewritten = List.copyOf(Objects.requireNonNull(rewritten, "rewritten"));
        unsorted = List.copyOf(Objects.requireNonNull(unsorted, "unsorted"));
        skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped"));
        failed = List.copyOf(Objects.requireNonNull(failed, "failed"));
        invalidInputs = List.copyOf(Objects.requireNonNull(invalidInputs, "invalidInputs"));
    }

    public boolean hasFailures() {
        return !failed.isEmpty() || !invalidInputs.isEmpty();
    }

    public boolean allSorted() {
        return unsorted.isEmpty();
    }
}
