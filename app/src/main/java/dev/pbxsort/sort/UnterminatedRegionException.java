package dev.pbxsort.sort;

/**
 * An array or section was opened but its end marker never appeared.
 */
public class UnterminatedRegionException extends ProjectFormatException {

    private final String region;

    public UnterminatedRegionException(String region, int lineNumber) {
        super("Unexpected end of input while parsing " + region, lineNumber);
        this.region = region;
    }

    public String region() {
        return region;
    }
}
