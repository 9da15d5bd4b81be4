package dev.pbxsort.sort;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comparable key giving names a human numeric order, so that {@code file2} sorts before {@code file10}.
 *
 * <p>A name is split into maximal runs of digits and non-digits. Two digit runs compare by numeric value and,
 * when numerically equal, the shorter run first ({@code "1" < "01" < "001"}). Any other pair of runs compares
 * lexically by code point, case-folded when the key was built case-insensitively. When all shared runs are equal
 * the key with fewer runs sorts first.</p>
 */
public final class NaturalKey implements Comparable<NaturalKey> {

    private static final Pattern TOKEN = Pattern.compile("\\d+|\\D+");

    private static final NaturalKey EMPTY = new NaturalKey(List.of());

    private final List<Token> tokens;

    private NaturalKey(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static NaturalKey of(String name, boolean caseInsensitive) {
        if (name == null || name.isEmpty()) {
            return EMPTY;
        }
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(name);
        while (matcher.find()) {
            String run = matcher.group();
            if (isDigit(run.charAt(0))) {
                tokens.add(Token.numeric(run));
            } else {
                tokens.add(Token.text(caseInsensitive ? run.toLowerCase(Locale.ROOT) : run));
            }
        }
        return new NaturalKey(Collections.unmodifiableList(tokens));
    }

    int size() {
        return tokens.size();
    }

    @Override
    public int compareTo(NaturalKey other) {
        int shared = Math.min(tokens.size(), other.tokens.size());
        for (int i = 0; i < shared; i++) {
            int result = tokens.get(i).compareTo(other.tokens.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(tokens.size(), other.tokens.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof NaturalKey other && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        return tokens.stream().map(Token::text).toList().hashCode();
    }

    @Override
    public String toString() {
        return tokens.stream().map(Token::text).toList().toString();
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    static int compareCodePoints(String left, String right) {
        int leftIndex = 0;
        int rightIndex = 0;
        while (leftIndex < left.length() && rightIndex < right.length()) {
            int leftCodePoint = left.codePointAt(leftIndex);
            int rightCodePoint = right.codePointAt(rightIndex);
            if (leftCodePoint != rightCodePoint) {
                return Integer.compare(leftCodePoint, rightCodePoint);
            }
            leftIndex += Character.charCount(leftCodePoint);
            rightIndex += Character.charCount(rightCodePoint);
        }
        return Integer.compare(left.length() - leftIndex, right.length() - rightIndex);
    }

    private record Token(String text, BigInteger value) implements Comparable<Token> {

        static Token numeric(String run) {
            return new Token(run, new BigInteger(run));
        }

        static Token text(String run) {
            return new Token(run, null);
        }

        boolean isNumeric() {
            return value != null;
        }

        @Override
        public int compareTo(Token other) {
            if (isNumeric() && other.isNumeric()) {
                int byValue = value.compareTo(other.value);
                if (byValue != 0) {
                    return byValue;
                }
                return Integer.compare(text.length(), other.text.length());
            }
            return compareCodePoints(text, other.text);
        }
    }
}
