package dev.pbxsort.project;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.pbxsort.Fixtures;
import dev.pbxsort.logging.SimpleJsonLayout;
import dev.pbxsort.sort.RegionRouter;
import dev.pbxsort.sort.SortSettings;
import dev.pbxsort.sort.UnterminatedRegionException;
import dev.pbxsort.writer.AtomicFileWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class ProjectFileProcessorTest {

    @TempDir
    Path tempDir;

    private final RecordingWriter writer = new RecordingWriter();
    private final ProjectFileProcessor processor = new ProjectFileProcessor(new RegionRouter(SortSettings.defaults()), writer);

    @Test
    void rewritesUnsortedFile() throws Exception {
        Path file = writeProject(Fixtures.read("unsorted.pbxproj"));

        FileOutcome outcome = processor.process(file, false);

        assertThat(outcome).isEqualTo(FileOutcome.REWRITTEN);
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(Fixtures.read("sorted.pbxproj"));
        assertThat(writer.writes).isEqualTo(1);
    }

    @Test
    void sortedFileIsNotWritten() throws Exception {
        Path file = writeProject(Fixtures.read("sorted.pbxproj"));

        FileOutcome outcome = processor.process(file, false);

        assertThat(outcome).isEqualTo(FileOutcome.ALREADY_SORTED);
        assertThat(writer.writes).isZero();
    }

    @Test
    void checkModeNeverWrites() throws Exception {
        String unsorted = Fixtures.read("unsorted.pbxproj");
        Path file = writeProject(unsorted);

        FileOutcome outcome = processor.process(file, true);

        assertThat(outcome).isEqualTo(FileOutcome.UNSORTED);
        assertThat(writer.writes).isZero();
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(unsorted);
    }

    @Test
    void formatErrorLeavesFileUntouched() throws Exception {
        String broken = "/* Begin PBXGroup section */\n\t\t0A0000000000000000000001 /* a */ = {isa = PBXGroup; };\n";
        Path file = writeProject(broken);

        Throwable thrown = catchThrowable(() -> processor.process(file, false));

        assertThat(thrown).isInstanceOf(UnterminatedRegionException.class);
        assertThat(writer.writes).isZero();
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(broken);
        assertThat(MDC.get(SimpleJsonLayout.MDC_PROJECT_FILE)).isNull();
    }

    @Test
    void jsonLogLinesNameTheFileBeingSorted() throws Exception {
        Path file = writeProject(Fixtures.read("unsorted.pbxproj"));
        Logger logger = (Logger) LoggerFactory.getLogger(ProjectFileProcessor.class);
        ListAppender<ILoggingEvent> appender = new SnapshotAppender();
        appender.start();
        logger.setLevel(Level.INFO);
        logger.addAppender(appender);
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext((LoggerContext) LoggerFactory.getILoggerFactory());
        layout.start();
        try {
            processor.process(file, false);
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(null);
        }

        assertThat(appender.list).isNotEmpty();
        assertThat(appender.list)
                .allSatisfy(event -> assertThat(layout.doLayout(event))
                        .contains("\"file\":\"" + file.toString().replace("\\", "\\\\") + "\""));
    }

    @Test
    void sortsTextInMemory() {
        assertThat(processor.sortText(Fixtures.read("unsorted.pbxproj"))).isEqualTo(Fixtures.read("sorted.pbxproj"));
    }

    private Path writeProject(String content) throws Exception {
        Path bundle = Files.createDirectories(tempDir.resolve("Demo.xcodeproj"));
        Path file = bundle.resolve("project.pbxproj");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static final class SnapshotAppender extends ListAppender<ILoggingEvent> {

        // the MDC is read lazily, so capture it while the file is still set
        @Override
        protected void append(ILoggingEvent event) {
            event.prepareForDeferredProcessing();
            super.append(event);
        }
    }

    private static final class RecordingWriter extends AtomicFileWriter {
        private int writes;

        @Override
        public void write(Path target, String content) {
            writes++;
            super.write(target, content);
        }
    }
}
