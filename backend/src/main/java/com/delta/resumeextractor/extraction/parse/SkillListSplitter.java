package com.delta.resumeextractor.extraction.parse;

import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Spreads the "top 10 skills" answer across the ranked skill fields.
 */
public final class SkillListSplitter {
    private static final Pattern SEPARATOR = Pattern.compile("\\s*(?:,|;|\\r?\\n)\\s*");
    private static final Pattern ITEM_PREFIX = Pattern.compile("^(?:\\d+[.)]|[-*•])\\s*");

    private SkillListSplitter() {
    }

    public static List<String> split(String skills) {
        List<String> result = new ArrayList<>();
        if (ParsedFieldSet.isUnknownValue(skills)) {
            return result;
        }
        for (String part : SEPARATOR.split(skills.trim())) {
            String skill = ITEM_PREFIX.matcher(part.trim()).replaceFirst("").trim();
            if (!ParsedFieldSet.isUnknownValue(skill)) {
                result.add(skill);
            }
            if (result.size() == CandidateField.MAX_SKILLS) {
                break;
            }
        }
        return result;
    }

    /**
     * Fills unknown skill slots from the skills list, or from the top software languages when the
     * model gave no list.
     */
    public static void apply(ParsedFieldSet fields) {
        List<String> skills = split(fields.getOrNull(CandidateField.TOP_SKILLS));
        if (skills.isEmpty()) {
            fields.get(CandidateField.PRIMARY_SOFTWARE_LANGUAGE).ifPresent(skills::add);
            fields.get(CandidateField.SECONDARY_SOFTWARE_LANGUAGE).ifPresent(skills::add);
        }
        for (int i = 0; i < skills.size(); i++) {
            fields.putIfAbsent(CandidateField.skill(i + 1), skills.get(i));
        }
    }
}
