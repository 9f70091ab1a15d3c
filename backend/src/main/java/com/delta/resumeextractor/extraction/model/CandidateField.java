package com.delta.resumeextractor.extraction.model;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public enum CandidateField {
    PRIMARY_TITLE("PrimaryTitle", "primary_title", FieldKind.TEXT, 255),
    SECONDARY_TITLE("SecondaryTitle", "secondary_title", FieldKind.TEXT, 255),
    TERTIARY_TITLE("TertiaryTitle", "tertiary_title", FieldKind.TEXT, 255),

    FIRST_NAME("FirstName", "first_name", FieldKind.TEXT, 100),
    MIDDLE_NAME("MiddleName", "middle_name", FieldKind.TEXT, 100),
    LAST_NAME("LastName", "last_name", FieldKind.TEXT, 100),
    ADDRESS("Address", "address", FieldKind.TEXT, 255),
    CITY("City", "city", FieldKind.TEXT, 100),
    STATE("State", "state", FieldKind.TEXT, 50),
    ZIP_CODE("ZipCode", "zip_code", FieldKind.TEXT, 10),
    PHONE1("Phone1", "phone1", FieldKind.TEXT, 50),
    PHONE2("Phone2", "phone2", FieldKind.TEXT, 50),
    EMAIL("Email", "email", FieldKind.TEXT, 255),
    EMAIL2("Email2", "email2", FieldKind.TEXT, 255),
    LINKEDIN("Linkedin", "linkedin", FieldKind.TEXT, 255),
    BACHELORS("Bachelors", "bachelors", FieldKind.TEXT, 255),
    MASTERS("Masters", "masters", FieldKind.TEXT, 255),
    CERTIFICATIONS("Certifications", "certifications", FieldKind.TEXT, 0),

    COMPANY_1("MostRecentCompany", "company_1", FieldKind.TEXT, 255),
    START_DATE_1("MostRecentStartDate", "start_date_1", FieldKind.DATE, 0),
    END_DATE_1("MostRecentEndDate", "end_date_1", FieldKind.DATE, 0),
    LOCATION_1("MostRecentLocation", "location_1", FieldKind.TEXT, 255),
    COMPANY_2("SecondMostRecentCompany", "company_2", FieldKind.TEXT, 255),
    START_DATE_2("SecondMostRecentStartDate", "start_date_2", FieldKind.DATE, 0),
    END_DATE_2("SecondMostRecentEndDate", "end_date_2", FieldKind.DATE, 0),
    LOCATION_2("SecondMostRecentLocation", "location_2", FieldKind.TEXT, 255),
    COMPANY_3("ThirdMostRecentCompany", "company_3", FieldKind.TEXT, 255),
    START_DATE_3("ThirdMostRecentStartDate", "start_date_3", FieldKind.DATE, 0),
    END_DATE_3("ThirdMostRecentEndDate", "end_date_3", FieldKind.DATE, 0),
    LOCATION_3("ThirdMostRecentLocation", "location_3", FieldKind.TEXT, 255),
    COMPANY_4("FourthMostRecentCompany", "company_4", FieldKind.TEXT, 255),
    START_DATE_4("FourthMostRecentStartDate", "start_date_4", FieldKind.DATE, 0),
    END_DATE_4("FourthMostRecentEndDate", "end_date_4", FieldKind.DATE, 0),
    LOCATION_4("FourthMostRecentLocation", "location_4", FieldKind.TEXT, 255),
    COMPANY_5("FifthMostRecentCompany", "company_5", FieldKind.TEXT, 255),
    START_DATE_5("FifthMostRecentStartDate", "start_date_5", FieldKind.DATE, 0),
    END_DATE_5("FifthMostRecentEndDate", "end_date_5", FieldKind.DATE, 0),
    LOCATION_5("FifthMostRecentLocation", "location_5", FieldKind.TEXT, 255),
    COMPANY_6("SixthMostRecentCompany", "company_6", FieldKind.TEXT, 255),
    START_DATE_6("SixthMostRecentStartDate", "start_date_6", FieldKind.DATE, 0),
    END_DATE_6("SixthMostRecentEndDate", "end_date_6", FieldKind.DATE, 0),
    LOCATION_6("SixthMostRecentLocation", "location_6", FieldKind.TEXT, 255),
    COMPANY_7("SeventhMostRecentCompany", "company_7", FieldKind.TEXT, 255),
    START_DATE_7("SeventhMostRecentStartDate", "start_date_7", FieldKind.DATE, 0),
    END_DATE_7("SeventhMostRecentEndDate", "end_date_7", FieldKind.DATE, 0),
    LOCATION_7("SeventhMostRecentLocation", "location_7", FieldKind.TEXT, 255),

    PRIMARY_INDUSTRY("PrimaryIndustry", "primary_industry", FieldKind.TEXT, 255),
    SECONDARY_INDUSTRY("SecondaryIndustry", "secondary_industry", FieldKind.TEXT, 255),

    SKILL_1("Skill1", "skill_1", FieldKind.TEXT, 100),
    SKILL_2("Skill2", "skill_2", FieldKind.TEXT, 100),
    SKILL_3("Skill3", "skill_3", FieldKind.TEXT, 100),
    SKILL_4("Skill4", "skill_4", FieldKind.TEXT, 100),
    SKILL_5("Skill5", "skill_5", FieldKind.TEXT, 100),
    SKILL_6("Skill6", "skill_6", FieldKind.TEXT, 100),
    SKILL_7("Skill7", "skill_7", FieldKind.TEXT, 100),
    SKILL_8("Skill8", "skill_8", FieldKind.TEXT, 100),
    SKILL_9("Skill9", "skill_9", FieldKind.TEXT, 100),
    SKILL_10("Skill10", "skill_10", FieldKind.TEXT, 100),

    PRIMARY_SOFTWARE_LANGUAGE("PrimarySoftwareLanguage", "primary_software_language", FieldKind.TEXT, 255),
    SECONDARY_SOFTWARE_LANGUAGE("SecondarySoftwareLanguage", "secondary_software_language", FieldKind.TEXT, 255),
    TERTIARY_SOFTWARE_LANGUAGE("TertiarySoftwareLanguage", "tertiary_software_language", FieldKind.TEXT, 255),

    SOFTWARE_APP_1("SoftwareApp1", "software_app_1", FieldKind.TEXT, 255),
    SOFTWARE_APP_2("SoftwareApp2", "software_app_2", FieldKind.TEXT, 255),
    SOFTWARE_APP_3("SoftwareApp3", "software_app_3", FieldKind.TEXT, 255),
    SOFTWARE_APP_4("SoftwareApp4", "software_app_4", FieldKind.TEXT, 255),
    SOFTWARE_APP_5("SoftwareApp5", "software_app_5", FieldKind.TEXT, 255),

    HARDWARE_1("Hardware1", "hardware_1", FieldKind.TEXT, 255),
    HARDWARE_2("Hardware2", "hardware_2", FieldKind.TEXT, 255),
    HARDWARE_3("Hardware3", "hardware_3", FieldKind.TEXT, 255),
    HARDWARE_4("Hardware4", "hardware_4", FieldKind.TEXT, 255),
    HARDWARE_5("Hardware5", "hardware_5", FieldKind.TEXT, 255),

    PRIMARY_CATEGORY("PrimaryCategory", "primary_category", FieldKind.TEXT, 255),
    SECONDARY_CATEGORY("SecondaryCategory", "secondary_category", FieldKind.TEXT, 255),
    PROJECT_TYPES("ProjectTypes", "project_types", FieldKind.TEXT, 0),

    LENGTH_IN_US("LengthinUS", "length_in_us", FieldKind.METRIC, 50),
    YEARS_OF_EXPERIENCE("YearsofExperience", "years_of_experience", FieldKind.METRIC, 50),
    AVG_TENURE("AvgTenure", "avg_tenure", FieldKind.METRIC, 50),

    // parse-only: split into SKILL_1..SKILL_10 before writeback
    TOP_SKILLS("Top10Skills", null, FieldKind.TEXT, 0);

    public enum FieldKind {
        TEXT,
        DATE,
        METRIC
    }

    public static final int MAX_JOBS = 7;
    public static final int MAX_SKILLS = 10;
    public static final int MAX_SOFTWARE_APPS = 5;
    public static final int MAX_HARDWARE = 5;

    private static final Map<String, CandidateField> BY_LABEL = new HashMap<>();

    static {
        for (CandidateField field : values()) {
            BY_LABEL.put(field.label.toLowerCase(Locale.ROOT), field);
        }
    }

    private final String label;
    private final String column;
    private final FieldKind kind;
    private final int maxLength;

    CandidateField(String label, String column, FieldKind kind, int maxLength) {
        this.label = label;
        this.column = column;
        this.kind = kind;
        this.maxLength = maxLength;
    }

    public String label() {
        return label;
    }

    public String column() {
        return column;
    }

    public FieldKind kind() {
        return kind;
    }

    /**
     * Maximum stored length, or 0 when the column is unbounded.
     */
    public int maxLength() {
        return maxLength;
    }

    public boolean isPersisted() {
        return column != null;
    }

    public boolean isDate() {
        return kind == FieldKind.DATE;
    }

    public static CandidateField fromLabel(String label) {
        if (label == null) {
            return null;
        }
        return BY_LABEL.get(label.trim().toLowerCase(Locale.ROOT));
    }

    public static Set<CandidateField> persisted() {
        EnumSet<CandidateField> result = EnumSet.noneOf(CandidateField.class);
        for (CandidateField field : values()) {
            if (field.isPersisted()) {
                result.add(field);
            }
        }
        return result;
    }

    public static CandidateField company(int rank) {
        return jobField("COMPANY_", rank);
    }

    public static CandidateField startDate(int rank) {
        return jobField("START_DATE_", rank);
    }

    public static CandidateField endDate(int rank) {
        return jobField("END_DATE_", rank);
    }

    public static CandidateField location(int rank) {
        return jobField("LOCATION_", rank);
    }

    public static CandidateField skill(int rank) {
        return ranked("SKILL_", rank, MAX_SKILLS);
    }

    public static CandidateField softwareApp(int rank) {
        return ranked("SOFTWARE_APP_", rank, MAX_SOFTWARE_APPS);
    }

    public static CandidateField hardware(int rank) {
        return ranked("HARDWARE_", rank, MAX_HARDWARE);
    }

    public static List<CandidateField> softwareLanguages() {
        return List.of(PRIMARY_SOFTWARE_LANGUAGE, SECONDARY_SOFTWARE_LANGUAGE, TERTIARY_SOFTWARE_LANGUAGE);
    }

    private static CandidateField jobField(String prefix, int rank) {
        return ranked(prefix, rank, MAX_JOBS);
    }

    private static CandidateField ranked(String prefix, int rank, int max) {
        if (rank < 1 || rank > max) {
            throw new IllegalArgumentException("rank out of range: " + rank);
        }
        return valueOf(prefix + rank);
    }
}
