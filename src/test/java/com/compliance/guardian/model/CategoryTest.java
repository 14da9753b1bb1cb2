package com.compliance.guardian.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryTest {

    @Test
    void fromLabel_resolvesOutcomeAliases() {
        assertThat(Category.fromLabel("Cleared")).isEqualTo(Category.BENIGN);
        assertThat(Category.fromLabel("false-positive")).isEqualTo(Category.BENIGN);
        assertThat(Category.fromLabel("  Policy Violation ")).isEqualTo(Category.POLICY_VIOLATION);
        assertThat(Category.fromLabel("escalated")).isEqualTo(Category.POLICY_VIOLATION);
        assertThat(Category.fromLabel("needs-review")).isEqualTo(Category.NEEDS_REVIEW);
    }

    @Test
    void fromLabel_unknownOrBlank_returnsNull() {
        assertThat(Category.fromLabel("spam")).isNull();
        assertThat(Category.fromLabel(" ")).isNull();
        assertThat(Category.fromLabel(null)).isNull();
    }

    @Test
    void riskLevel_bucketsScores() {
        assertThat(RiskLevel.fromScore(0.95)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskLevel.fromScore(0.1)).isEqualTo(RiskLevel.LOW);
    }
}
