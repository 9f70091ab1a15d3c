package com.delta.resumeextractor.extraction.parse;

import com.delta.resumeextractor.extraction.model.ParsedFieldSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tries each question phrasing in order; the first one answered with a real value wins.
 */
public class PatternFieldExtractor implements FieldExtractor {
    private static final String LINE_PREFIX = "(?im)^[ \\t]*(?:[-*•>#]+[ \\t]*)?(?:\\d+[.)][ \\t]*)?(?:\\*\\*)?";
    private static final String LABEL_SUFFIX = "(?:[ \\t]*\\([^)\\n]*\\))?(?:\\*\\*)?[ \\t]*:[ \\t]*";

    private final List<Pattern> patterns;

    public PatternFieldExtractor(List<Pattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static PatternFieldExtractor forLabels(List<String> labelRegexes) {
        List<Pattern> patterns = new ArrayList<>(labelRegexes.size());
        for (String label : labelRegexes) {
            patterns.add(linePattern(label));
        }
        return new PatternFieldExtractor(patterns);
    }

    /**
     * Builds a line-anchored pattern whose group 1 is the answer following {@code label:}.
     */
    public static Pattern linePattern(String labelRegex) {
        return Pattern.compile(LINE_PREFIX + "(?:" + labelRegex + ")" + LABEL_SUFFIX + "(.+?)[ \\t]*$");
    }

    /**
     * Pattern matching just the label line, with whatever follows the colon in group 1.
     */
    public static Pattern labelLinePattern(String labelRegex) {
        return Pattern.compile(LINE_PREFIX + "(?:" + labelRegex + ")" + LABEL_SUFFIX + "(.*)$");
    }

    @Override
    public Optional<String> extract(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(response);
            while (matcher.find()) {
                String value = FieldExtractor.clean(matcher.group(1));
                if (!ParsedFieldSet.isUnknownValue(value)) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    List<Pattern> patterns() {
        return patterns;
    }
}
