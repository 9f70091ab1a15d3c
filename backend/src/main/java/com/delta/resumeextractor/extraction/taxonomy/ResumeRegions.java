package com.delta.resumeextractor.extraction.taxonomy;

import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slices of a resume used for weighted taxonomy scoring.
 */
public record ResumeRegions(String full, String header, String workHistory, String mostRecentJob) {
    private static final int MAX_HEADING_LENGTH = 60;
    private static final Pattern WORK_HEADING = Pattern.compile(
        "(?im)^[\\s#*-]*(work experience|employment(?: history)?|professional experience)\\b.*$"
    );
    private static final Pattern SECTION_HEADING = Pattern.compile(
        "(?i)^[\\s#*-]*(education|skills|technical skills|certifications?|projects|summary|"
            + "awards|publications|references|languages|interests)\\b[^\\n]*$"
    );
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    public static ResumeRegions of(String text, int headerLines) {
        if (text == null || text.isBlank()) {
            return new ResumeRegions("", "", "", "");
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        String[] lines = normalized.split("\n", -1);
        String header = String.join("\n", Arrays.copyOfRange(lines, 0, Math.min(headerLines, lines.length)));

        Matcher heading = WORK_HEADING.matcher(normalized);
        while (heading.find()) {
            if (heading.group().trim().length() > MAX_HEADING_LENGTH) {
                continue;
            }
            String workHistory = untilNextSection(normalized.substring(heading.end()));
            return new ResumeRegions(normalized, header, workHistory, firstParagraph(workHistory));
        }
        return new ResumeRegions(normalized, header, "", "");
    }

    private static String untilNextSection(String afterHeading) {
        String[] lines = afterHeading.split("\n", -1);
        StringBuilder region = new StringBuilder();
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()
                && trimmed.length() <= MAX_HEADING_LENGTH
                && SECTION_HEADING.matcher(trimmed).matches()) {
                break;
            }
            region.append(line).append('\n');
        }
        return region.toString().strip();
    }

    private static String firstParagraph(String workHistory) {
        if (workHistory.isEmpty()) {
            return "";
        }
        String[] paragraphs = PARAGRAPH_BREAK.split(workHistory, 2);
        return paragraphs[0].strip();
    }
}
