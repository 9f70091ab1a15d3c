package com.delta.resumeextractor.extraction.parse;

import com.delta.resumeextractor.extraction.model.ParsedFieldSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a list answer that is either inline after the label or given as bulleted or numbered
 * lines beneath it. Items are returned comma separated.
 */
public class ListFieldExtractor implements FieldExtractor {
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s*(.+?)\\s*$");

    private final List<Pattern> labelPatterns;

    public ListFieldExtractor(List<String> labelRegexes) {
        List<Pattern> patterns = new ArrayList<>(labelRegexes.size());
        for (String label : labelRegexes) {
            patterns.add(PatternFieldExtractor.labelLinePattern(label));
        }
        this.labelPatterns = List.copyOf(patterns);
    }

    @Override
    public Optional<String> extract(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : labelPatterns) {
            Matcher matcher = pattern.matcher(response);
            if (!matcher.find()) {
                continue;
            }
            String inline = FieldExtractor.clean(matcher.group(1));
            if (!ParsedFieldSet.isUnknownValue(inline)) {
                return Optional.of(inline);
            }
            if (inline != null && inline.trim().equalsIgnoreCase("NULL")) {
                return Optional.empty();
            }
            String following = followingItems(response.substring(matcher.end()));
            if (!following.isEmpty()) {
                return Optional.of(following);
            }
        }
        return Optional.empty();
    }

    private String followingItems(String rest) {
        List<String> items = new ArrayList<>();
        for (String line : rest.split("\\r?\\n")) {
            if (line.isBlank()) {
                if (items.isEmpty()) {
                    continue;
                }
                break;
            }
            Matcher item = LIST_ITEM.matcher(line);
            if (!item.matches()) {
                break;
            }
            String value = FieldExtractor.clean(item.group(1));
            if (!ParsedFieldSet.isUnknownValue(value)) {
                items.add(value);
            }
        }
        return String.join(", ", items);
    }
}
