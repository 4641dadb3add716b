package com.kyb.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "kyb.remote.mode=FIXTURE",
    "kyb.run.step-delay=0s",
    "kyb.storage.mode=MEMORY"
})
@AutoConfigureMockMvc
class DashboardApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void resetDashboard() throws Exception {
        mockMvc.perform(post("/api/v1/dashboard/runs/reset")).andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/dashboard")).andExpect(status().isOk());
    }

    @Test
    void enterDashboardListsConfiguredCustomersWithNoSelection() throws Exception {
        mockMvc.perform(get("/api/v1/dashboard"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.customers.length()").value(4))
            .andExpect(jsonPath("$.customers[0].customerId").value("CUST-0001"))
            .andExpect(jsonPath("$.customers[0].legalName").value("ABC Exports Private Limited"))
            .andExpect(jsonPath("$.selectedCustomerId").doesNotExist())
            .andExpect(jsonPath("$.runEnabled").value(false))
            .andExpect(jsonPath("$.run.phase").value("IDLE"));
    }

    @Test
    void startWithoutSelectionIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/dashboard/runs"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.accepted").value(false))
            .andExpect(jsonPath("$.run.phase").value("IDLE"));
    }

    @Test
    void selectingUnknownCustomerReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/dashboard/customers/CUST-9999/select"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("UNKNOWN_CUSTOMER"))
            .andExpect(jsonPath("$.path").value("/api/v1/dashboard/customers/CUST-9999/select"));
    }

    @Test
    void navigationWithoutCompletedRunReturnsNoContent() throws Exception {
        mockMvc.perform(post("/api/v1/dashboard/navigation"))
            .andExpect(status().isNoContent());
    }

    @Test
    void unknownTraceIdReturnsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/results/missing-trace/summary"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").exists())
            .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void completedRunFlowsThroughNavigationIntoDetailTabs() throws Exception {
        mockMvc.perform(post("/api/v1/dashboard/customers/CUST-0001/select"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.selectedCustomerId").value("CUST-0001"))
            .andExpect(jsonPath("$.runEnabled").value(true));

        mockMvc.perform(post("/api/v1/dashboard/runs"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.accepted").value(true))
            .andExpect(jsonPath("$.run.traceId").isNotEmpty());

        JsonNode state = awaitPhase("COMPLETED");
        String traceId = state.path("run").path("traceId").asText();
        assertThat(state.path("run").path("riskBand").asText()).isEqualTo("AMBER");
        assertThat(state.path("recentChecks").get(0).path("traceId").asText()).isEqualTo(traceId);

        // a second start is ignored while the completed run is showing
        mockMvc.perform(post("/api/v1/dashboard/runs"))
            .andExpect(status().isConflict());

        mockMvc.perform(post("/api/v1/dashboard/navigation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.customerId").value("CUST-0001"))
            .andExpect(jsonPath("$.traceId").value(traceId))
            .andExpect(jsonPath("$.summaryPath").value("/api/v1/results/" + traceId + "/summary"));

        mockMvc.perform(get("/api/v1/dashboard/state"))
            .andExpect(jsonPath("$.run.phase").value("IDLE"));

        // the signal is delivered once
        mockMvc.perform(post("/api/v1/dashboard/navigation"))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/results/{traceId}/summary", traceId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.customerId").value("CUST-0001"))
            .andExpect(jsonPath("$.score").value(62))
            .andExpect(jsonPath("$.riskBand").value("AMBER"));

        mockMvc.perform(get("/api/v1/results/{traceId}/risk", traceId))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/results/{traceId}/decision", traceId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.modelBand").value("AMBER"))
            .andExpect(jsonPath("$.overridden").value(false));

        mockMvc.perform(put("/api/v1/results/{traceId}/decision", traceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"overrideBand\":\"red\",\"comments\":\"Adverse media\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.overrideBand").value("RED"))
            .andExpect(jsonPath("$.effectiveBand").value("RED"))
            .andExpect(jsonPath("$.overridden").value(true))
            .andExpect(jsonPath("$.comments").value("Adverse media"));

        mockMvc.perform(put("/api/v1/results/{traceId}/decision", traceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"overrideBand\":\"PURPLE\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));

        mockMvc.perform(get("/api/v1/results/{traceId}/audit", traceId))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$._audit_trail.customer_id").value("CUST-0001"));

        mockMvc.perform(get("/api/v1/dashboard/recent-checks"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].customerId").value("CUST-0001"))
            .andExpect(jsonPath("$[0].customerName").value("ABC Exports Private Limited"));
    }

    private JsonNode awaitPhase(String phase) throws Exception {
        long deadline = System.currentTimeMillis() + 5_000;
        JsonNode state;
        do {
            MvcResult result = mockMvc.perform(get("/api/v1/dashboard/state"))
                .andExpect(status().isOk())
                .andReturn();
            state = objectMapper.readTree(result.getResponse().getContentAsString());
            if (phase.equals(state.path("run").path("phase").asText())) {
                return state;
            }
            Thread.sleep(20);
        } while (System.currentTimeMillis() < deadline);
        throw new AssertionError("Run did not reach " + phase + "; last state " + state);
    }
}
