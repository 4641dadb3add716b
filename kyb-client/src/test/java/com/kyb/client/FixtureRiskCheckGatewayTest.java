package com.kyb.client;

import com.kyb.core.json.KybJson;
import com.kyb.core.model.CheckOutcome;
import com.kyb.core.model.RiskBand;
import com.kyb.core.model.result.KybRunResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FixtureRiskCheckGatewayTest {

    @Test
    void servesBundledPayload() {
        FixtureRiskCheckGateway gateway = new FixtureRiskCheckGateway(KybJson.newObjectMapper());

        CheckOutcome outcome = gateway.runCheck("CUST-0001", "trace-1");

        assertThat(outcome).isInstanceOf(CheckOutcome.Success.class);
        KybRunResult result = ((CheckOutcome.Success) outcome).result();
        assertThat(result.riskBand()).isEqualTo(RiskBand.AMBER);
        assertThat(result.entityProfile().legalName()).isEqualTo("ABC Exports Private Limited");
        assertThat(result.riskAssessment().scoreBreakdown().totalDelta()).isEqualTo(20);
        assertThat(result.auditTrail().agentsCalled()).hasSize(6);
        assertThat(result.companiesHouse().isAvailable()).isTrue();
    }

    @Test
    void missingResourceIsFailure() {
        FixtureRiskCheckGateway gateway = new FixtureRiskCheckGateway("fixtures/missing.json", KybJson.newObjectMapper());

        CheckOutcome outcome = gateway.runCheck("CUST-0001", "trace-1");

        assertThat(outcome).isInstanceOf(CheckOutcome.Failure.class);
        assertThat(((CheckOutcome.Failure) outcome).message()).contains("fixtures/missing.json");
    }
}
