package dev.pbxsort.sort;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a project document line by line, hands each recognized region to its sorter and reassembles the text.
 *
 * <p>The document is split on {@code \n} only, so carriage returns and a missing final newline survive unchanged.
 * Content outside arrays and sortable sections is copied through as is. Arrays are sorted wherever they appear,
 * including inside sections whose records keep their order, unless {@link SortSettings#topLevelArraysOnly()} is
 * set. The link-order sensitive {@value SortSettings#PROTECTED_SECTION} section is always copied verbatim.</p>
 */
public class RegionRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegionRouter.class);

    private static final Pattern ARRAY_START = Pattern.compile(
            "^(\\s*)(children|files|buildConfigurations|targets|packageProductDependencies|packageReferences)"
                    + "\\s*=\\s*\\(\\s*$");
    private static final Pattern SECTION_BEGIN = Pattern.compile("Begin\\s+(\\S+)\\s+section");
    private static final String PROTECTED_BEGIN = "Begin " + SortSettings.PROTECTED_SECTION + " section";
    private static final String ARRAY_END = ");";

    private final SortSettings settings;
    private final ArrayRegionSorter arraySorter;
    private final BlockSectionSorter blockSorter;

    public RegionRouter(SortSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        EntryClassifier classifier = new EntryClassifier(settings);
        this.arraySorter = new ArrayRegionSorter(classifier);
        this.blockSorter = new BlockSectionSorter(classifier, settings.maxRecordLines());
    }

    public SortSettings settings() {
        return settings;
    }

    /**
     * Returns the canonical form of {@code document}.
     *
     * @throws UnterminatedRegionException when an array or section has no end marker
     * @throws UnbalancedRecordException when a section record never closes its braces
     */
    public String sort(String document) {
        Objects.requireNonNull(document, "document");
        List<String> lines = Arrays.asList(document.split("\n", -1));
        List<String> output = new ArrayList<>(lines.size());
        int index = 0;
        while (index < lines.size()) {
            RegionStart start = classify(lines.get(index));
            index = switch (start.type()) {
                case ARRAY -> routeArray(lines, index, start, output, 1);
                case SORTABLE_SECTION -> routeSortableSection(lines, index, start, output);
                case VERBATIM_SECTION -> routeVerbatimSection(lines, index, start, output);
                case PROTECTED_SECTION -> routeProtectedSection(lines, index, start, output);
                case PASSTHROUGH -> {
                    output.add(lines.get(index));
                    yield index + 1;
                }
            };
        }
        return String.join("\n", output);
    }

    RegionStart classify(String line) {
        RegionStart array = matchArrayStart(line);
        if (array != null) {
            return array;
        }
        if (line.contains(PROTECTED_BEGIN)) {
            return new RegionStart(RegionType.PROTECTED_SECTION, "", null, SortSettings.PROTECTED_SECTION);
        }
        Matcher section = SECTION_BEGIN.matcher(line);
        if (section.find()) {
            String kind = section.group(1);
            RegionType type = settings.isSortableSection(kind) ? RegionType.SORTABLE_SECTION : RegionType.VERBATIM_SECTION;
            return new RegionStart(type, "", null, kind);
        }
        return RegionStart.PASSTHROUGH;
    }

    private static RegionStart matchArrayStart(String line) {
        Matcher array = ARRAY_START.matcher(line);
        if (!array.matches()) {
            return null;
        }
        ArrayKind kind = ArrayKind.fromKeyword(array.group(2)).orElseThrow();
        return new RegionStart(RegionType.ARRAY, array.group(1), kind, null);
    }

    /**
     * @param firstLineNumber one-based document line number of {@code lines.get(0)}
     */
    private int routeArray(List<String> lines, int openIndex, RegionStart start, List<String> output, int firstLineNumber) {
        String endMarker = start.indent() + ARRAY_END;
        int endIndex = openIndex + 1;
        while (endIndex < lines.size() && !isArrayEnd(lines.get(endIndex), endMarker)) {
            endIndex++;
        }
        int lineNumber = firstLineNumber + openIndex;
        if (endIndex >= lines.size()) {
            throw new UnterminatedRegionException(start.arrayKind().keyword() + " array", lineNumber);
        }
        List<String> entries = lines.subList(openIndex + 1, endIndex);
        List<String> sorted = arraySorter.sort(entries, start.arrayKind());
        LOGGER.debug("Sorted {} array at line {}: {} entries, {} after de-duplication",
                start.arrayKind().keyword(), lineNumber, entries.size(), sorted.size());
        output.add(lines.get(openIndex));
        output.addAll(sorted);
        output.add(lines.get(endIndex));
        return endIndex + 1;
    }

    private List<String> sortArraysIn(List<String> lines, int firstLineNumber) {
        List<String> output = new ArrayList<>(lines.size());
        int index = 0;
        while (index < lines.size()) {
            RegionStart array = matchArrayStart(lines.get(index));
            if (array == null) {
                output.add(lines.get(index));
                index++;
            } else {
                index = routeArray(lines, index, array, output, firstLineNumber);
            }
        }
        return output;
    }

    private int routeSortableSection(List<String> lines, int beginIndex, RegionStart start, List<String> output) {
        int endIndex = findSectionEnd(lines, beginIndex, start.sectionKind());
        List<String> body = lines.subList(beginIndex + 1, endIndex);
        if (!settings.topLevelArraysOnly()) {
            body = sortArraysIn(body, beginIndex + 2);
        }
        List<String> sorted = blockSorter.sort(start.sectionKind(), body, beginIndex + 2);
        LOGGER.debug("Sorted {} section at line {}", start.sectionKind(), beginIndex + 1);
        output.add(lines.get(beginIndex));
        output.addAll(sorted);
        output.add(lines.get(endIndex));
        return endIndex + 1;
    }

    private int routeVerbatimSection(List<String> lines, int beginIndex, RegionStart start, List<String> output) {
        int endIndex = findSectionEnd(lines, beginIndex, start.sectionKind());
        if (settings.topLevelArraysOnly()) {
            LOGGER.debug("Kept {} section at line {} in original order", start.sectionKind(), beginIndex + 1);
            output.addAll(lines.subList(beginIndex, endIndex + 1));
            return endIndex + 1;
        }
        LOGGER.debug("Kept {} section at line {} in original order, sorting its arrays", start.sectionKind(), beginIndex + 1);
        output.add(lines.get(beginIndex));
        output.addAll(sortArraysIn(lines.subList(beginIndex + 1, endIndex), beginIndex + 2));
        output.add(lines.get(endIndex));
        return endIndex + 1;
    }

    private int routeProtectedSection(List<String> lines, int beginIndex, RegionStart start, List<String> output) {
        int endIndex = findSectionEnd(lines, beginIndex, start.sectionKind());
        LOGGER.debug("Copied link-order sensitive {} section at line {} verbatim", start.sectionKind(), beginIndex + 1);
        output.addAll(lines.subList(beginIndex, endIndex + 1));
        return endIndex + 1;
    }

    private static int findSectionEnd(List<String> lines, int beginIndex, String kind) {
        Pattern end = Pattern.compile("End\\s+" + Pattern.quote(kind) + "\\s+section");
        for (int i = beginIndex + 1; i < lines.size(); i++) {
            if (end.matcher(lines.get(i)).find()) {
                return i;
            }
        }
        throw new UnterminatedRegionException(kind + " section", beginIndex + 1);
    }

    private static boolean isArrayEnd(String line, String endMarker) {
        return line.startsWith(endMarker) && line.substring(endMarker.length()).isBlank();
    }

    enum RegionType {
        PASSTHROUGH,
        ARRAY,
        SORTABLE_SECTION,
        VERBATIM_SECTION,
        PROTECTED_SECTION
    }

    record RegionStart(RegionType type, String indent, ArrayKind arrayKind, String sectionKind) {

        static final RegionStart PASSTHROUGH = new RegionStart(RegionType.PASSTHROUGH, "", null, null);
    }
}
