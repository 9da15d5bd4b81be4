package dev.pbxsort.sort;

import java.util.Optional;

/**
 * Named list declarations whose entries may be reordered.
 */
public enum ArrayKind {
    CHILDREN("children", true),
    FILES("files", false),
    BUILD_CONFIGURATIONS("buildConfigurations", true),
    TARGETS("targets", true),
    PACKAGE_PRODUCT_DEPENDENCIES("packageProductDependencies", true),
    PACKAGE_REFERENCES("packageReferences", true);

    private final String keyword;
    private final boolean directoryPrecedence;

    ArrayKind(String keyword, boolean directoryPrecedence) {
        this.keyword = keyword;
        this.directoryPrecedence = directoryPrecedence;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Whether groups sort ahead of files. Build-phase {@code files} lists compare by name only.
     */
    public boolean directoryPrecedence() {
        return directoryPrecedence;
    }

    public static Optional<ArrayKind> fromKeyword(String keyword) {
        for (ArrayKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
