package dev.pbxsort.cli;

import dev.pbxsort.config.Config;
import dev.pbxsort.config.ConfigLoader;
import dev.pbxsort.config.SystemEnvironmentReader;
import dev.pbxsort.logging.LoggingConfigurator;
import dev.pbxsort.project.BatchResult;
import dev.pbxsort.project.BatchRunner;
import dev.pbxsort.project.ProjectFileProcessor;
import dev.pbxsort.project.ProjectFileResolver;
import dev.pbxsort.sort.ProjectFormatException;
import dev.pbxsort.sort.RegionRouter;
import dev.pbxsort.writer.AtomicFileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the sorting pipeline.
 *
 * <p>Exit status: {@value #EXIT_OK} when everything is sorted, {@value #EXIT_NOT_SORTED} when check mode found an
 * unsorted file or no input was given, picocli's invalid-input status for bad options, and {@value #EXIT_FAILURE}
 * when at least one file could not be processed.</p>
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_NOT_SORTED = 1;
    static final int EXIT_FAILURE = 3;

    static final String NO_INPUT_MESSAGE = "ERROR: No Xcode project files (project.pbxproj) listed on command-line.";

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), System.in, System.out, System.err);
    }

    CliApplication(ConfigLoader configLoader, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        this.configLoader = configLoader;
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(new PrintWriter(stdout, true));
        commandLine.setErr(new PrintWriter(stderr, true));

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }
        if (cliArguments.files().isEmpty()) {
            commandLine.getErr().println(NO_INPUT_MESSAGE);
            commandLine.usage(commandLine.getErr());
            return EXIT_NOT_SORTED;
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println("ERROR: " + ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.warningsEnabled(), config.verbose());
        LOGGER.debug("Sorting {} input(s) (caseInsensitive={}, check={}, recursive={}, failFast={})",
                config.inputs().size(), config.caseInsensitive(), config.checkOnly(), config.recursive(), config.failFast());

        ProjectFileProcessor processor = new ProjectFileProcessor(new RegionRouter(config.sortSettings()), new AtomicFileWriter());
        if (config.streamMode()) {
            return runStream(config, processor);
        }

        BatchRunner batchRunner = new BatchRunner(new ProjectFileResolver(), processor);
        BatchResult result = batchRunner.run(config.inputs(), config.checkOnly(), config.recursive(), config.failFast());
        LOGGER.debug("Finished: {} sorted, {} rewritten, {} unsorted, {} skipped, {} failed",
                result.alreadySorted().size(), result.rewritten().size(), result.unsorted().size(),
                result.skipped().size(), result.failed().size() + result.invalidInputs().size());
        if (result.hasFailures()) {
            return EXIT_FAILURE;
        }
        if (config.checkOnly() && !result.allSorted()) {
            return EXIT_NOT_SORTED;
        }
        return EXIT_OK;
    }

    private int runStream(Config config, ProjectFileProcessor processor) {
        String document;
        try {
            document = decodeUtf8(stdin.readAllBytes());
        } catch (CharacterCodingException ex) {
            LOGGER.error("Standard input is not valid UTF-8: {}", ex.toString());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            LOGGER.error("Failed to read standard input", ex);
            return EXIT_FAILURE;
        }
        String sorted;
        try {
            sorted = processor.sortText(document);
        } catch (ProjectFormatException ex) {
            LOGGER.error("Could not sort standard input: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
        if (config.checkOnly()) {
            return sorted.equals(document) ? EXIT_OK : EXIT_NOT_SORTED;
        }
        stdout.writeBytes(sorted.getBytes(StandardCharsets.UTF_8));
        stdout.flush();
        return EXIT_OK;
    }

    // malformed bytes are an error, never replaced with U+FFFD
    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
