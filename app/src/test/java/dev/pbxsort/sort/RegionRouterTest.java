package dev.pbxsort.sort;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.pbxsort.Fixtures;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RegionRouterTest {

    private final RegionRouter router = new RegionRouter(SortSettings.defaults());
    private final RegionRouter topLevelRouter = new RegionRouter(SortSettings.defaults().withTopLevelArraysOnly(true));

    @Test
    void sortsSampleProject() {
        String unsorted = Fixtures.read("unsorted.pbxproj");

        assertThat(router.sort(unsorted)).isEqualTo(Fixtures.read("sorted.pbxproj"));
    }

    @Test
    void sortsArraysInsideSectionsByDefault() {
        String sorted = router.sort(Fixtures.read("unsorted.pbxproj"));

        assertThat(sorted).contains(lines(
                "\t\t\tchildren = (",
                "\t\t\t\tB10000000000000000000002 /* View2.m */,",
                "\t\t\t\tB10000000000000000000010 /* View10.m */,",
                "\t\t\t\tB10000000000000000000003 /* main.m */,",
                "\t\t\t);"));
        assertThat(sorted).contains(lines(
                "\t\t\tchildren = (",
                "\t\t\t\tD10000000000000000000003 /* Products */,",
                "\t\t\t\tD10000000000000000000002 /* Sources */,",
                "\t\t\t\tB10000000000000000000004 /* Cocoa.framework */,",
                "\t\t\t);"));
        assertThat(sorted).contains(lines(
                "\t\t\tbuildConfigurations = (",
                "\t\t\t\t9B0000000000000000000003 /* Debug */,",
                "\t\t\t\t9B0000000000000000000004 /* Release */,",
                "\t\t\t);"));
    }

    @Test
    void topLevelArraysOnlyLeavesSectionArraysAlone() {
        String unsorted = Fixtures.read("unsorted.pbxproj");

        assertThat(topLevelRouter.sort(unsorted)).isEqualTo(Fixtures.read("sorted-top-level.pbxproj"));
    }

    @Test
    void sortedOutputIsAFixedPoint() {
        String sorted = Fixtures.read("sorted.pbxproj");
        String sortedTopLevel = Fixtures.read("sorted-top-level.pbxproj");

        assertThat(router.sort(sorted)).isEqualTo(sorted);
        assertThat(topLevelRouter.sort(sortedTopLevel)).isEqualTo(sortedTopLevel);
        assertThat(router.sort(router.sort(Fixtures.read("unsorted.pbxproj")))).isEqualTo(sorted);
    }

    @Test
    void frameworksBuildPhaseIsCopiedByteForByte() {
        String unsorted = Fixtures.read("unsorted.pbxproj");

        String sorted = router.sort(unsorted);

        assertThat(frameworksSpan(sorted)).isEqualTo(frameworksSpan(unsorted));
        assertThat(frameworksSpan(sorted)).contains("Cocoa.framework in Frameworks */,\n\t\t\t\tA10000000000000000000099");
    }

    @Test
    void buildPhasesKeepTheirOrder() {
        String sorted = router.sort(Fixtures.read("unsorted.pbxproj"));

        assertThat(sorted).contains(lines(
                "\t\t\tbuildPhases = (",
                "\t\t\t\tF10000000000000000000002 /* Sources */,",
                "\t\t\t\tC10000000000000000000001 /* Frameworks */,",
                "\t\t\t);"));
    }

    @Test
    void sortsTopLevelArrays() {
        String document = lines(
                "children = (",
                "\t0A0000000000000000000002 /* b.m */,",
                "\t0A0000000000000000000001 /* a.m */,",
                "\t0A0000000000000000000001 /* a.m */,",
                ");",
                "");

        assertThat(router.sort(document)).isEqualTo(lines(
                "children = (",
                "\t0A0000000000000000000001 /* a.m */,",
                "\t0A0000000000000000000002 /* b.m */,",
                ");",
                ""));
    }

    @Test
    void arrayEndsOnlyAtItsOwnIndentation() {
        String document = lines(
                "\ttargets = (",
                "\t\t0A0000000000000000000002 /* Widget */,",
                "\t\t);",
                "\t\t0A0000000000000000000001 /* App */,",
                "\t);");

        String sorted = router.sort(document);

        assertThat(sorted).startsWith(lines(
                "\ttargets = (",
                "\t\t0A0000000000000000000001 /* App */,",
                "\t\t0A0000000000000000000002 /* Widget */,",
                "\t\t);"));
        assertThat(sorted).endsWith("\t);");
    }

    @Test
    void preservesCarriageReturnsAndMissingFinalNewline() {
        String document = String.join("\r\n",
                "/* Begin PBXFileReference section */",
                "\t\t0D0000000000000000000002 /* b.m */ = {isa = PBXFileReference; path = b.m; };",
                "\t\t0D0000000000000000000001 /* a.m */ = {isa = PBXFileReference; path = a.m; };",
                "/* End PBXFileReference section */");

        String sorted = router.sort(document);

        assertThat(sorted).isEqualTo(String.join("\r\n",
                "/* Begin PBXFileReference section */",
                "\t\t0D0000000000000000000001 /* a.m */ = {isa = PBXFileReference; path = a.m; };",
                "\t\t0D0000000000000000000002 /* b.m */ = {isa = PBXFileReference; path = b.m; };",
                "/* End PBXFileReference section */"));
    }

    @Test
    void leavesUnknownSectionsAlone() {
        String document = lines(
                "/* Begin PBXShellScriptBuildPhase section */",
                "\t\t0D0000000000000000000002 /* Run Script B */ = {isa = PBXShellScriptBuildPhase; };",
                "\t\t0D0000000000000000000001 /* Run Script A */ = {isa = PBXShellScriptBuildPhase; };",
                "/* End PBXShellScriptBuildPhase section */",
                "");

        assertThat(router.sort(document)).isEqualTo(document);
    }

    @Test
    void extraSortableSectionsAreReordered() {
        RegionRouter custom = new RegionRouter(new SortSettings(false, Set.of(),
                Set.of("PBXShellScriptBuildPhase"), SortSettings.DEFAULT_MAX_RECORD_LINES, false));
        String document = lines(
                "/* Begin PBXShellScriptBuildPhase section */",
                "\t\t0D0000000000000000000002 /* Run Script B */ = {isa = PBXShellScriptBuildPhase; };",
                "\t\t0D0000000000000000000001 /* Run Script A */ = {isa = PBXShellScriptBuildPhase; };",
                "/* End PBXShellScriptBuildPhase section */");

        assertThat(custom.sort(document)).isEqualTo(lines(
                "/* Begin PBXShellScriptBuildPhase section */",
                "\t\t0D0000000000000000000001 /* Run Script A */ = {isa = PBXShellScriptBuildPhase; };",
                "\t\t0D0000000000000000000002 /* Run Script B */ = {isa = PBXShellScriptBuildPhase; };",
                "/* End PBXShellScriptBuildPhase section */"));
    }

    @Test
    void unterminatedArrayIsReported() {
        String document = lines(
                "// !$*UTF8*$!",
                "\tchildren = (",
                "\t\t0A0000000000000000000001 /* a.m */,",
                "");

        Throwable thrown = catchThrowable(() -> router.sort(document));

        assertThat(thrown).isInstanceOf(UnterminatedRegionException.class);
        UnterminatedRegionException error = (UnterminatedRegionException) thrown;
        assertThat(error.region()).isEqualTo("children array");
        assertThat(error.lineNumber()).isEqualTo(2);
    }

    @Test
    void unterminatedSectionIsReported() {
        String document = lines(
                "{",
                "/* Begin PBXGroup section */",
                "\t\t0A0000000000000000000001 /* a */ = {isa = PBXGroup; };",
                "}");

        Throwable thrown = catchThrowable(() -> router.sort(document));

        assertThat(thrown)
                .isInstanceOf(UnterminatedRegionException.class)
                .hasMessageContaining("PBXGroup section")
                .hasMessageContaining("line 2");
    }

    @Test
    void unterminatedProtectedSectionIsReported() {
        String document = lines(
                "/* Begin PBXFrameworksBuildPhase section */",
                "\t\tC10000000000000000000001 /* Frameworks */ = {isa = PBXFrameworksBuildPhase; };");

        Throwable thrown = catchThrowable(() -> router.sort(document));

        assertThat(thrown).isInstanceOf(UnterminatedRegionException.class);
    }

    @Test
    void unterminatedArrayInsideSectionReportsItsDocumentLine() {
        String document = lines(
                "/* Begin PBXNativeTarget section */",
                "\t\tE10000000000000000000001 /* Demo */ = {",
                "\t\t\ttargets = (",
                "\t\t\t\t0A0000000000000000000001 /* App */,",
                "\t\t};",
                "/* End PBXNativeTarget section */");

        Throwable thrown = catchThrowable(() -> router.sort(document));

        assertThat(thrown).isInstanceOf(UnterminatedRegionException.class);
        assertThat(((UnterminatedRegionException) thrown).lineNumber()).isEqualTo(3);
        assertThat(topLevelRouter.sort(document)).isEqualTo(document);
    }

    @Test
    void unbalancedRecordReportsItsDocumentLine() {
        String document = lines(
                "// !$*UTF8*$!",
                "/* Begin PBXGroup section */",
                "\t\t0A0000000000000000000001 /* Sources */ = {",
                "\t\t\tisa = PBXGroup;",
                "/* End PBXGroup section */");

        Throwable thrown = catchThrowable(() -> router.sort(document));

        assertThat(thrown).isInstanceOf(UnbalancedRecordException.class);
        assertThat(((UnbalancedRecordException) thrown).lineNumber()).isEqualTo(3);
    }

    @Test
    void classifiesRegionStarts() {
        assertThat(router.classify("\t\t\tchildren = (").type()).isEqualTo(RegionRouter.RegionType.ARRAY);
        assertThat(router.classify("\t\t\tchildren = (").indent()).isEqualTo("\t\t\t");
        assertThat(router.classify("\t\t\tfiles = (").arrayKind()).isEqualTo(ArrayKind.FILES);
        assertThat(router.classify("\t\t\tbuildPhases = (").type()).isEqualTo(RegionRouter.RegionType.PASSTHROUGH);
        assertThat(router.classify("/* Begin PBXGroup section */").type()).isEqualTo(RegionRouter.RegionType.SORTABLE_SECTION);
        assertThat(router.classify("/* Begin PBXNativeTarget section */").type()).isEqualTo(RegionRouter.RegionType.VERBATIM_SECTION);
        assertThat(router.classify("/* Begin PBXFrameworksBuildPhase section */").type())
                .isEqualTo(RegionRouter.RegionType.PROTECTED_SECTION);
        assertThat(router.classify("\tobjectVersion = 56;").type()).isEqualTo(RegionRouter.RegionType.PASSTHROUGH);
    }

    @Test
    void emptyDocumentStaysEmpty() {
        assertThat(router.sort("")).isEmpty();
    }

    private static String frameworksSpan(String document) {
        int begin = document.indexOf("/* Begin PBXFrameworksBuildPhase section */");
        int end = document.indexOf("/* End PBXFrameworksBuildPhase section */");
        return document.substring(begin, end);
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }
}
