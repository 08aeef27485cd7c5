package de.alive.otpfetch.parser;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered list of patterns whose first capturing group is the code. The first pattern that matches wins.
 */
public final class OtpExtractionRule {

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("enter this code[^\\d]*(\\d{6})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:verification code is|your code is|login code is)[:\\s]*(\\d{6})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:verification code|confirmation code)[:\\s]*is[:\\s]*(\\d{6})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcode[:\\s]*(\\d{6})\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<!\\d)(\\d{6})(?!\\d)")
    );

    private final String name;
    private final List<Pattern> patterns;

    private OtpExtractionRule(String name, List<Pattern> patterns) {
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("Extraction rule needs at least one pattern");
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher("").groupCount() < 1) {
                throw new IllegalArgumentException("Pattern must capture the code in group 1: " + pattern);
            }
        }
        this.name = name;
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Phrase-anchored six-digit codes first, then any standalone six-digit run.
     */
    public static OtpExtractionRule defaults() {
        return new OtpExtractionRule("defaults", DEFAULT_PATTERNS);
    }

    /**
     * Any standalone run of exactly {@code length} digits.
     */
    public static OtpExtractionRule digits(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Code length must be positive");
        }
        return new OtpExtractionRule("digits(" + length + ")",
                List.of(Pattern.compile("(?<!\\d)(\\d{" + length + "})(?!\\d)")));
    }

    /**
     * A code of {@code length} digits directly after {@code delimiter}, e.g. {@code "Code:"}.
     */
    public static OtpExtractionRule prefixed(@NotNull String delimiter, int length) {
        if (delimiter == null || delimiter.trim().isEmpty()) {
            throw new IllegalArgumentException("Delimiter cannot be null or empty");
        }
        if (length <= 0) {
            throw new IllegalArgumentException("Code length must be positive");
        }
        return new OtpExtractionRule("prefixed(" + delimiter + ")",
                List.of(Pattern.compile(Pattern.quote(delimiter.trim()) + "\\s*(\\d{" + length + "})(?!\\d)",
                        Pattern.CASE_INSENSITIVE)));
    }

    public static OtpExtractionRule of(@NotNull String name, @NotNull List<Pattern> patterns) {
        return new OtpExtractionRule(name, patterns);
    }

    @NotNull
    public Optional<String> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }

        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && matcher.group(1) != null) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    public String getName() {
        return name;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return "OtpExtractionRule{" + name + ", patterns=" + patterns.size() + "}";
    }
}
