package dev.pbxsort.config;

import dev.pbxsort.cli.CliArguments;
import dev.pbxsort.sort.SortSettings;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_CASE_INSENSITIVE = "SORT_CASE_INSENSITIVE";
    static final String ENV_FAIL_FAST = "SORT_FAIL_FAST";
    static final String ENV_KNOWN_FILES = "SORT_KNOWN_FILES";
    static final String ENV_SORTABLE_SECTIONS = "SORT_SECTIONS";
    static final String ENV_MAX_RECORD_LINES = "SORT_MAX_RECORD_LINES";
    static final String ENV_TOP_LEVEL_ARRAYS_ONLY = "SORT_TOP_LEVEL_ARRAYS_ONLY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        boolean caseInsensitive = resolveCaseInsensitive(arguments);
        boolean failFast = arguments.failFast() || resolveFlag(ENV_FAIL_FAST);
        boolean topLevelArraysOnly = arguments.topLevelArraysOnly() || resolveFlag(ENV_TOP_LEVEL_ARRAYS_ONLY);
        LogFormat logFormat = resolveLogFormat(arguments);

        Set<String> knownFiles = new LinkedHashSet<>(arguments.knownFiles());
        environmentReader.get(ENV_KNOWN_FILES)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseList)
                .ifPresent(knownFiles::addAll);

        Set<String> sortableSections = new LinkedHashSet<>(arguments.sortableSections());
        environmentReader.get(ENV_SORTABLE_SECTIONS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseList)
                .ifPresent(sortableSections::addAll);

        int maxRecordLines = environmentReader.get(ENV_MAX_RECORD_LINES)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(SortSettings.DEFAULT_MAX_RECORD_LINES);

        return new Config(arguments.files(), caseInsensitive, arguments.check(), !arguments.noWarnings(),
                arguments.verbose(), arguments.recursive(), failFast, logFormat, knownFiles, sortableSections,
                maxRecordLines, topLevelArraysOnly);
    }

    private boolean resolveCaseInsensitive(CliArguments arguments) {
        Boolean cliValue = arguments.caseInsensitive();
        if (cliValue != null) {
            return cliValue;
        }
        return resolveFlag(ENV_CASE_INSENSITIVE);
    }

    private boolean resolveFlag(String envKey) {
        return environmentReader.get(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_MAX_RECORD_LINES + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_MAX_RECORD_LINES + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }
}
