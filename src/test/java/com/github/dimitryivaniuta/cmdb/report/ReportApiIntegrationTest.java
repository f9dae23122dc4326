package com.github.dimitryivaniuta.cmdb.report;

import com.github.dimitryivaniuta.cmdb.infra.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
class ReportApiIntegrationTest extends BaseIntegrationTest {

    private static final String REPORT = """
            {"reportId":"vpc-east","name":"VPC east","reportType":"vpc_inventory","category":"infrastructure",
             "queryConfig":{"queryName":"vpc_inventory","parameters":{"region":"us-east-1"}}}
            """;

    @Autowired MockMvc mvc;

    @BeforeEach
    void dropCachedResults() throws Exception {
        mvc.perform(delete("/api/reports/cache")).andExpect(status().isOk());
    }

    @Test
    void createThenDuplicateIsConflict() throws Exception {
        mvc.perform(post("/api/reports").contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", "bob")
                        .content(REPORT))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.reportId").value("vpc-east"))
                .andExpect(jsonPath("$.data.version").value(1))
                .andExpect(jsonPath("$.data.createdBy").value("bob"));

        mvc.perform(post("/api/reports").contentType(MediaType.APPLICATION_JSON).content(REPORT))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errors[0].code").value("DUPLICATE_REPORT"));
    }

    @Test
    void reportTypeMustMatchItsQuery() throws Exception {
        mvc.perform(post("/api/reports").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"reportId":"mismatch","name":"Mismatch","reportType":"vpc_inventory","category":"infrastructure",
                                 "queryConfig":{"queryName":"transit_gateway_inventory"}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].code").value("REPORT_TYPE_MISMATCH"));
    }

    @Test
    void runUsesCacheUntilTheDataChanges() throws Exception {
        createVpc("vpc-0000000a", "10.1.0.0/16", "us-east-1");
        createVpc("vpc-0000000b", "10.2.0.0/16", "eu-west-1");
        mvc.perform(post("/api/reports").contentType(MediaType.APPLICATION_JSON).content(REPORT))
                .andExpect(status().isCreated());

        mvc.perform(post("/api/reports/{id}/run", "vpc-east"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.execution.status").value("completed"))
                .andExpect(jsonPath("$.data.execution.recordsProcessed").value(1))
                .andExpect(jsonPath("$.data.execution.resultSummary.fromCache").value(false))
                .andExpect(jsonPath("$.data.rows[0].vpc_id").value("vpc-0000000a"))
                .andExpect(jsonPath("$.data.truncated").value(false));

        mvc.perform(post("/api/reports/{id}/run", "vpc-east"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.execution.resultSummary.fromCache").value(true));

        createVpc("vpc-0000000c", "10.3.0.0/16", "us-east-1");

        mvc.perform(post("/api/reports/{id}/run", "vpc-east"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.execution.resultSummary.fromCache").value(false))
                .andExpect(jsonPath("$.data.execution.recordsProcessed").value(2));

        mvc.perform(get("/api/reports/{id}/executions", "vpc-east"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pagination.totalCount").value(3));
    }

    @Test
    void previewRejectsUnknownQuery() throws Exception {
        mvc.perform(post("/api/reports/preview").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queryName\":\"drop_everything\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].code").value("UNKNOWN_QUERY"));

        mvc.perform(get("/api/reports/queries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].name", hasItem("vpc_inventory")));
    }

    @Test
    void deactivatedReportCannotRun() throws Exception {
        mvc.perform(post("/api/reports").contentType(MediaType.APPLICATION_JSON).content(REPORT))
                .andExpect(status().isCreated());

        mvc.perform(delete("/api/reports/{id}", "vpc-east"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isActive").value(false));

        mvc.perform(post("/api/reports/{id}/run", "vpc-east"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].code").value("REPORT_INACTIVE"));

        mvc.perform(get("/api/reports/{id}", "missing"))
                .andExpect(status().isNotFound());
    }

    private void createVpc(String vpcId, String cidr, String region) throws Exception {
        mvc.perform(post("/api/vpcs").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"vpcId":"%s","cidrBlock":"%s","region":"%s"}
                                """.formatted(vpcId, cidr, region)))
                .andExpect(status().isCreated());
    }
}
