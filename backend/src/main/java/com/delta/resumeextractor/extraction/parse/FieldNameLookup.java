package com.delta.resumeextractor.extraction.parse;

import com.delta.resumeextractor.extraction.model.CandidateField;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the many historical answer keys onto canonical fields. Keys are compared ignoring case,
 * spaces and punctuation.
 */
public final class FieldNameLookup {
    private static final String[] JOB_ORDINAL_KEYS = {
        "mostrecent", "secondmostrecent", "thirdmostrecent", "fourthmostrecent",
        "fifthmostrecent", "sixthmostrecent", "seventhmostrecent"
    };

    private final Map<String, CandidateField> synonyms = new HashMap<>();

    public FieldNameLookup() {
        for (CandidateField field : CandidateField.values()) {
            register(field.label(), field);
            if (field.column() != null) {
                register(field.column(), field);
            }
        }

        register("jobtitle", CandidateField.PRIMARY_TITLE);
        register("primaryjobtitle", CandidateField.PRIMARY_TITLE);
        register("title", CandidateField.PRIMARY_TITLE);
        register("secondaryjobtitle", CandidateField.SECONDARY_TITLE);
        register("tertiaryjobtitle", CandidateField.TERTIARY_TITLE);

        register("middleinitial", CandidateField.MIDDLE_NAME);
        register("surname", CandidateField.LAST_NAME);
        register("streetaddress", CandidateField.ADDRESS);
        register("zip", CandidateField.ZIP_CODE);
        register("postalcode", CandidateField.ZIP_CODE);
        register("phone", CandidateField.PHONE1);
        register("phonenumber", CandidateField.PHONE1);
        register("primaryphone", CandidateField.PHONE1);
        register("secondaryphone", CandidateField.PHONE2);
        register("email1", CandidateField.EMAIL);
        register("emailaddress", CandidateField.EMAIL);
        register("primaryemail", CandidateField.EMAIL);
        register("secondaryemail", CandidateField.EMAIL2);
        register("linkedinurl", CandidateField.LINKEDIN);
        register("linkedinprofile", CandidateField.LINKEDIN);
        register("bachelor", CandidateField.BACHELORS);
        register("bachelorsdegree", CandidateField.BACHELORS);
        register("master", CandidateField.MASTERS);
        register("mastersdegree", CandidateField.MASTERS);
        register("certification", CandidateField.CERTIFICATIONS);

        for (int rank = 1; rank <= CandidateField.MAX_JOBS; rank++) {
            String prefix = JOB_ORDINAL_KEYS[rank - 1];
            register(prefix + "companyworkedfor", CandidateField.company(rank));
            register(prefix + "employer", CandidateField.company(rank));
            register(prefix + "joblocation", CandidateField.location(rank));
            register("company" + rank, CandidateField.company(rank));
            register("startdate" + rank, CandidateField.startDate(rank));
            register("enddate" + rank, CandidateField.endDate(rank));
            register("location" + rank, CandidateField.location(rank));
        }

        register("industry", CandidateField.PRIMARY_INDUSTRY);
        register("programminglanguage", CandidateField.PRIMARY_SOFTWARE_LANGUAGE);
        register("primaryprogramminglanguage", CandidateField.PRIMARY_SOFTWARE_LANGUAGE);
        register("secondaryprogramminglanguage", CandidateField.SECONDARY_SOFTWARE_LANGUAGE);
        register("tertiaryprogramminglanguage", CandidateField.TERTIARY_SOFTWARE_LANGUAGE);
        for (int rank = 1; rank <= CandidateField.MAX_SOFTWARE_APPS; rank++) {
            register("softwareapplication" + rank, CandidateField.softwareApp(rank));
            register("software" + rank, CandidateField.softwareApp(rank));
        }
        register("category", CandidateField.PRIMARY_CATEGORY);
        register("projecttype", CandidateField.PROJECT_TYPES);
        register("lengthinunitedstates", CandidateField.LENGTH_IN_US);
        register("yearsinus", CandidateField.LENGTH_IN_US);
        register("yearsexperience", CandidateField.YEARS_OF_EXPERIENCE);
        register("totalexperience", CandidateField.YEARS_OF_EXPERIENCE);
        register("totalyearsofexperience", CandidateField.YEARS_OF_EXPERIENCE);
        register("totalyearsofprofessionalexperience", CandidateField.YEARS_OF_EXPERIENCE);
        register("averagetenure", CandidateField.AVG_TENURE);
        register("averagetenureatcompaniesinyears", CandidateField.AVG_TENURE);
        register("topskills", CandidateField.TOP_SKILLS);
        register("top10technicalskills", CandidateField.TOP_SKILLS);
        register("topTechnicalSkills", CandidateField.TOP_SKILLS);
    }

    public CandidateField lookup(String key) {
        if (key == null) {
            return null;
        }
        return synonyms.get(normalize(key));
    }

    static String normalize(String key) {
        StringBuilder normalized = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                normalized.append(Character.toLowerCase(c));
            }
        }
        return normalized.toString().toLowerCase(Locale.ROOT);
    }

    private void register(String key, CandidateField field) {
        synonyms.put(normalize(key), field);
    }
}
