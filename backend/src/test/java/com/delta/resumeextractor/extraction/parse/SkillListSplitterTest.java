package com.delta.resumeextractor.extraction.parse;

import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SkillListSplitterTest {

    @Test
    void splitsOnCommasSemicolonsAndLinesAndStripsNumbering() {
        assertThat(SkillListSplitter.split("1. Java, 2) Spring;\n- SQL, NULL,  "))
            .containsExactly("Java", "Spring", "SQL");
    }

    @Test
    void keepsAtMostTenSkills() {
        assertThat(SkillListSplitter.split("a,b,c,d,e,f,g,h,i,j,k,l")).hasSize(10).endsWith("j");
    }

    @Test
    void fallsBackToSoftwareLanguages() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.PRIMARY_SOFTWARE_LANGUAGE, "Kotlin");
        fields.put(CandidateField.SECONDARY_SOFTWARE_LANGUAGE, "Java");

        SkillListSplitter.apply(fields);

        assertThat(fields.getOrNull(CandidateField.SKILL_1)).isEqualTo("Kotlin");
        assertThat(fields.getOrNull(CandidateField.SKILL_2)).isEqualTo("Java");
    }

    @Test
    void doesNotOverwriteKnownSkills() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.SKILL_1, "Leadership");
        fields.put(CandidateField.TOP_SKILLS, "Java, SQL");

        SkillListSplitter.apply(fields);

        assertThat(fields.getOrNull(CandidateField.SKILL_1)).isEqualTo("Leadership");
        assertThat(fields.getOrNull(CandidateField.SKILL_2)).isEqualTo("SQL");
    }
}
