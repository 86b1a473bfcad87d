package org.elogsync.pipeline.utils;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style exclusion patterns for experiment identifiers.
 * <p>
 * {@code *} matches any run of characters, {@code ?} a single character, everything else matches
 * literally. Patterns are anchored at both ends and case-sensitive: {@code txi*} excludes
 * {@code txi9999} but not {@code TXI9999} or {@code mfxtxi01}.
 */
public final class ExcludePatterns {

    private static final ExcludePatterns NONE = new ExcludePatterns(List.of(), List.of());

    private final List<String> globs;
    private final List<Pattern> compiled;

    private ExcludePatterns(List<String> globs, List<Pattern> compiled) {
        this.globs = globs;
        this.compiled = compiled;
    }

    /**
     * @param globs Patterns; blank entries are ignored
     */
    public static ExcludePatterns of(List<String> globs) {
        Objects.requireNonNull(globs, "globs must not be null");
        List<String> kept = globs.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(g -> !g.isEmpty())
            .toList();
        if (kept.isEmpty()) {
            return NONE;
        }
        return new ExcludePatterns(kept, kept.stream().map(ExcludePatterns::toRegex).toList());
    }

    public static ExcludePatterns none() {
        return NONE;
    }

    public boolean excludes(String identifier) {
        for (Pattern p : compiled) {
            if (p.matcher(identifier).matches()) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return compiled.isEmpty();
    }

    public List<String> globs() {
        return globs;
    }

    static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return globs.toString();
    }
}
