package com.delta.resumeextractor.extraction.parse;

import com.delta.resumeextractor.extraction.model.CandidateField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Question phrasings per field, oldest prompt wording last. New phrasings are added here rather
 * than in parser code.
 */
public final class ExtractionRules {
    static final String[] JOB_ORDINALS = {
        "", "Second ", "Third ", "Fourth ", "Fifth ", "Sixth ", "Seventh "
    };
    static final String[] USAGE_ORDINALS = {
        "most", "second most", "third most", "fourth most", "fifth most"
    };
    static final String[] RANK_WORDS = {"Primary", "Secondary", "Tertiary"};

    private static final Map<CandidateField, FieldExtractor> DEFAULT_RULES = Collections.unmodifiableMap(build());

    private ExtractionRules() {
    }

    public static Map<CandidateField, FieldExtractor> defaults() {
        return DEFAULT_RULES;
    }

    private static Map<CandidateField, FieldExtractor> build() {
        Map<CandidateField, FieldExtractor> rules = new EnumMap<>(CandidateField.class);

        labels(rules, CandidateField.PRIMARY_TITLE,
            "Best job title that fits their primary experience",
            "Primary Job Title");
        labels(rules, CandidateField.SECONDARY_TITLE,
            "Best secondary job title that fits their secondary experience",
            "Best job title that fits their secondary experience",
            "Secondary Job Title");
        labels(rules, CandidateField.TERTIARY_TITLE,
            "Best tertiary job title that fits their tertiary experience",
            "Best job title that fits their tertiary experience",
            "Tertiary Job Title");

        labels(rules, CandidateField.FIRST_NAME, "First Name");
        labels(rules, CandidateField.MIDDLE_NAME, "Middle Name", "Middle Initial");
        labels(rules, CandidateField.LAST_NAME, "Last Name", "Surname");
        labels(rules, CandidateField.ADDRESS, "Street Address", "Address");
        labels(rules, CandidateField.CITY, "City");
        labels(rules, CandidateField.STATE, "State");
        labels(rules, CandidateField.ZIP_CODE, "Zip ?Code", "Postal Code");
        labels(rules, CandidateField.PHONE1, "Phone ?1", "Primary Phone", "Phone Number");
        labels(rules, CandidateField.PHONE2, "Phone ?2", "Secondary Phone");
        labels(rules, CandidateField.EMAIL, "Email ?1?", "Email Address", "Primary Email");
        labels(rules, CandidateField.EMAIL2, "Email ?2", "Secondary Email");
        labels(rules, CandidateField.LINKEDIN, "LinkedIn(?: URL| Profile)?");
        labels(rules, CandidateField.BACHELORS, "Bachelor'?s(?: Degree)?");
        labels(rules, CandidateField.MASTERS, "Master'?s(?: Degree)?");
        labels(rules, CandidateField.CERTIFICATIONS, "Certifications?");

        for (int rank = 1; rank <= CandidateField.MAX_JOBS; rank++) {
            String ordinal = JOB_ORDINALS[rank - 1];
            labels(rules, CandidateField.company(rank),
                ordinal + "Most Recent Company Worked for",
                ordinal + "Most Recent Company");
            labels(rules, CandidateField.startDate(rank),
                ordinal + "Most Recent Start Date");
            labels(rules, CandidateField.endDate(rank),
                ordinal + "Most Recent End Date");
            labels(rules, CandidateField.location(rank),
                ordinal + "Most Recent Job Location",
                ordinal + "Most Recent Location");
        }

        labels(rules, CandidateField.PRIMARY_INDUSTRY,
            "Best industry that fits their primary experience",
            "What industry does this candidate primarily work in",
            "Primary Industry");
        labels(rules, CandidateField.SECONDARY_INDUSTRY,
            "Best industry that fits their secondary experience",
            "What industry does this candidate secondarily work in",
            "Secondary Industry");

        List<CandidateField> languages = CandidateField.softwareLanguages();
        for (int i = 0; i < languages.size(); i++) {
            String rank = RANK_WORDS[i];
            labels(rules, languages.get(i),
                "What is the " + rank.toLowerCase(Locale.ROOT) + " software language they use",
                rank + " Software Language",
                rank + " Programming Language");
        }

        for (int rank = 1; rank <= CandidateField.MAX_SOFTWARE_APPS; rank++) {
            String usage = USAGE_ORDINALS[rank - 1];
            labels(rules, CandidateField.softwareApp(rank),
                "What software do they talk about using the " + usage + "\\??",
                "Software App(?:lication)? ?" + rank);
        }

        for (int rank = 1; rank <= CandidateField.MAX_HARDWARE; rank++) {
            String usage = USAGE_ORDINALS[rank - 1];
            labels(rules, CandidateField.hardware(rank),
                "Hardware ?" + rank,
                "What physical hardware do they talk about using the " + usage + "\\??",
                "What hardware do they talk about using the " + usage + "\\??");
        }

        labels(rules, CandidateField.PRIMARY_CATEGORY,
            "Best category that fits their primary experience",
            "Primary Category");
        labels(rules, CandidateField.SECONDARY_CATEGORY,
            "Best category that fits their secondary experience",
            "Secondary Category");
        labels(rules, CandidateField.PROJECT_TYPES,
            "What types of projects have they worked on",
            "Project Types");

        labels(rules, CandidateField.LENGTH_IN_US,
            "How long have they lived in the United States",
            "Length in (?:the )?US");
        labels(rules, CandidateField.YEARS_OF_EXPERIENCE,
            "Total years of professional experience",
            "Years of Experience");
        labels(rules, CandidateField.AVG_TENURE,
            "Average tenure at companies in years",
            "Average Tenure");

        rules.put(CandidateField.TOP_SKILLS, new ListFieldExtractor(List.of(
            "Top 10 Technical Skills",
            "Top 10 Skills",
            "Top Technical Skills")));
        return rules;
    }

    private static void labels(Map<CandidateField, FieldExtractor> rules, CandidateField field, String... phrasings) {
        List<String> regexes = new ArrayList<>(phrasings.length);
        for (String phrasing : phrasings) {
            regexes.add(phrasing.replace(" ", "\\s+").replace("\\s+?", " ?"));
        }
        rules.put(field, PatternFieldExtractor.forLabels(regexes));
    }
}
