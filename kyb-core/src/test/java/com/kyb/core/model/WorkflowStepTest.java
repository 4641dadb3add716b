package com.kyb.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WorkflowStepTest {

    @Test
    void canonicalOrder_shouldListSixStepsInDeclarationOrder() {
        assertThat(WorkflowStep.canonicalOrder()).containsExactly(
            WorkflowStep.JOURNEY_CLASSIFIER,
            WorkflowStep.ENTITY_PARTIES,
            WorkflowStep.TRANSACTIONS_INSIGHTS,
            WorkflowStep.COMPANIES_HOUSE,
            WorkflowStep.RISK_RULES,
            WorkflowStep.KYB_SUMMARY_NOTE);
    }

    @Test
    void isLast_shouldOnlyHoldForSummaryNote() {
        assertThat(WorkflowStep.KYB_SUMMARY_NOTE.isLast()).isTrue();
        assertThat(WorkflowStep.RISK_RULES.isLast()).isFalse();
    }

    @Test
    void isCanonicalPrefix_shouldAcceptEmptyAndFull() {
        assertThat(WorkflowStep.isCanonicalPrefix(List.of())).isTrue();
        assertThat(WorkflowStep.isCanonicalPrefix(WorkflowStep.canonicalOrder())).isTrue();
        assertThat(WorkflowStep.isCanonicalPrefix(List.of(WorkflowStep.RISK_RULES))).isFalse();
    }

    @Test
    void displayName_shouldBeHumanReadable() {
        assertThat(WorkflowStep.ENTITY_PARTIES.displayName()).isEqualTo("Entity & Parties");
    }
}
