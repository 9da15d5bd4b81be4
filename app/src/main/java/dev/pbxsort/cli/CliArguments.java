package dev.pbxsort.cli;

import dev.pbxsort.config.LogFormat;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "pbxsort", mixinStandardHelpOptions = true, version = "pbxsort 0.1.0",
        description = {
                "Sorts arrays and sections of Xcode project.pbxproj files so that independent edits produce minimal diffs.",
                "Build-order sensitive content (buildPhases, PBXFrameworksBuildPhase) is never reordered."
        })
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "project.pbxproj", arity = "0..*",
            description = "project.pbxproj files, .xcodeproj bundles, directories with --recursive, or '-' for stdin")
    private List<String> files = new ArrayList<>();

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "0..1")
    private CaseMode caseMode;

    @CommandLine.Option(names = "--check", description = "Report whether files are sorted (exit 1 when not) without modifying them")
    private boolean check;

    @CommandLine.Option(names = {"-w", "--no-warnings"}, description = "Suppress warnings")
    private boolean noWarnings;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every region that is sorted or kept")
    private boolean verbose;

    @CommandLine.Option(names = {"-r", "--recursive"}, description = "Search directories for *.xcodeproj/project.pbxproj files")
    private boolean recursive;

    @CommandLine.Option(names = "--fail-fast", description = "Stop at the first file that cannot be sorted")
    private boolean failFast;

    @CommandLine.Option(names = "--top-level-arrays-only",
            description = "Leave arrays inside 'Begin ... section' regions in their original order")
    private boolean topLevelArraysOnly;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--known-file", paramLabel = "NAME",
            description = "Extension-less name to sort as a file rather than a group (repeatable)")
    private List<String> knownFiles = new ArrayList<>();

    @CommandLine.Option(names = "--sortable-section", paramLabel = "KIND",
            description = "Additional 'Begin <KIND> section' whose records may be reordered (repeatable)")
    private List<String> sortableSections = new ArrayList<>();

    static class CaseMode {

        @CommandLine.Option(names = "--case-insensitive", description = "Enable case-insensitive sorting (default: disabled)")
        boolean caseInsensitive;

        @CommandLine.Option(names = "--case-sensitive", description = "Force case-sensitive sorting")
        boolean caseSensitive;
    }

    public List<String> files() {
        return files;
    }

    /**
     * {@code null} when neither case option was given.
     */
    public Boolean caseInsensitive() {
        if (caseMode == null) {
            return null;
        }
        return caseMode.caseInsensitive && !caseMode.caseSensitive;
    }

    public boolean check() {
        return check;
    }

    public boolean noWarnings() {
        return noWarnings;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean recursive() {
        return recursive;
    }

    public boolean failFast() {
        return failFast;
    }

    public boolean topLevelArraysOnly() {
        return topLevelArraysOnly;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<String> knownFiles() {
        return knownFiles;
    }

    public List<String> sortableSections() {
        return sortableSections;
    }
}
