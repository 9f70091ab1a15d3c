package com.delta.resumeextractor.extraction.parse;

import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ParseDiagnostics;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import com.delta.resumeextractor.extraction.model.ParsedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one model answer into fields. Question patterns are tried first; any field they leave
 * unknown may then be filled from plain {@code key: value} lines.
 */
@Component
public class ResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final List<CandidateField> CORE_FIELDS = List.of(
        CandidateField.PRIMARY_TITLE,
        CandidateField.COMPANY_1,
        CandidateField.START_DATE_1,
        CandidateField.YEARS_OF_EXPERIENCE
    );

    private final Map<CandidateField, FieldExtractor> rules;
    private final StructuredLineParser lineParser;
    private final FieldNameLookup lookup;

    public ResponseParser() {
        this(ExtractionRules.defaults(), new StructuredLineParser(), new FieldNameLookup());
    }

    ResponseParser(Map<CandidateField, FieldExtractor> rules, StructuredLineParser lineParser, FieldNameLookup lookup) {
        this.rules = rules;
        this.lineParser = lineParser;
        this.lookup = lookup;
    }

    public ParsedResponse parse(long recordId, String response) {
        ParsedFieldSet fields = new ParsedFieldSet();
        if (response == null || response.isBlank()) {
            log.warn("Record {} returned an empty response", recordId);
            return new ParsedResponse(fields, diagnostics(fields));
        }

        for (Map.Entry<CandidateField, FieldExtractor> rule : rules.entrySet()) {
            Optional<String> value = rule.getValue().extract(response);
            value.ifPresent(v -> fields.put(rule.getKey(), v));
        }
        int direct = fields.size();

        for (StructuredLineParser.Entry entry : lineParser.parse(response)) {
            CandidateField field = lookup.lookup(entry.key());
            if (field != null) {
                fields.putIfAbsent(field, entry.value());
            }
        }
        log.debug("Record {} parsed {} fields directly, {} from key/value lines", recordId, direct, fields.size() - direct);

        normalizeMetrics(fields);
        SkillListSplitter.apply(fields);

        ParseDiagnostics diagnostics = diagnostics(fields);
        if (diagnostics.hardwareFound() < CandidateField.MAX_HARDWARE) {
            log.debug("Record {} hardware found {}/{}", recordId, diagnostics.hardwareFound(), CandidateField.MAX_HARDWARE);
        }
        if (!diagnostics.missingCoreFields().isEmpty()) {
            log.info("Record {} response missing core fields {}", recordId, diagnostics.missingCoreFields());
        }
        return new ParsedResponse(fields, diagnostics);
    }

    private void normalizeMetrics(ParsedFieldSet fields) {
        for (CandidateField field : List.of(
            CandidateField.LENGTH_IN_US,
            CandidateField.YEARS_OF_EXPERIENCE,
            CandidateField.AVG_TENURE
        )) {
            String value = fields.getOrNull(field);
            if (value == null) {
                continue;
            }
            Matcher matcher = NUMBER.matcher(value);
            if (matcher.find()) {
                fields.put(field, matcher.group());
            } else {
                fields.clear(field);
            }
        }
    }

    private ParseDiagnostics diagnostics(ParsedFieldSet fields) {
        int companies = 0;
        for (int rank = 1; rank <= CandidateField.MAX_JOBS; rank++) {
            if (fields.isKnown(CandidateField.company(rank))) {
                companies++;
            }
        }
        int apps = 0;
        for (int rank = 1; rank <= CandidateField.MAX_SOFTWARE_APPS; rank++) {
            if (fields.isKnown(CandidateField.softwareApp(rank))) {
                apps++;
            }
        }
        int hardware = 0;
        for (int rank = 1; rank <= CandidateField.MAX_HARDWARE; rank++) {
            if (fields.isKnown(CandidateField.hardware(rank))) {
                hardware++;
            }
        }
        int skills = 0;
        for (int rank = 1; rank <= CandidateField.MAX_SKILLS; rank++) {
            if (fields.isKnown(CandidateField.skill(rank))) {
                skills++;
            }
        }
        List<CandidateField> missing = new ArrayList<>();
        for (CandidateField field : CORE_FIELDS) {
            if (!fields.isKnown(field)) {
                missing.add(field);
            }
        }
        return new ParseDiagnostics(companies, apps, hardware, skills, missing);
    }
}
