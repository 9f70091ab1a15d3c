package com.delta.resumeextractor.extraction.model;

public record JobEntry(String company, String startDate, String endDate, String location) {
    public boolean hasCompany() {
        return !ParsedFieldSet.isUnknownValue(company);
    }
}
