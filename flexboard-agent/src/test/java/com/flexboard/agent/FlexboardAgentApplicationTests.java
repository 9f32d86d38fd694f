package com.flexboard.agent;

import com.flexboard.agent.service.QueryDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FlexboardAgentApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private QueryDispatcher queryDispatcher;

    @Test
    void contextLoads() {
        assertThat(queryDispatcher.availableDataSources()).containsExactly("postgresql", "http-api");
    }

    @Test
    void executesAgainstConfiguredBackend() throws Exception {
        mockMvc.perform(post("/api/widgets/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceKind\": \"pg\", \"query\": \"SELECT CAST(? AS INT) + 1 AS answer\", "
                                + "\"params\": {\"n\": 41}, \"tenantId\": \"acme\", \"widgetId\": \"kpi\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.columns[0]").value("answer"))
                .andExpect(jsonPath("$.data[0].answer").value(42))
                .andExpect(jsonPath("$.metadata.widgetId").value("kpi"));
    }

    @Test
    void rejectsUnconfiguredKind() throws Exception {
        mockMvc.perform(post("/api/widgets/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceKind\": \"mongodb\", \"query\": \"{}\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    void reportsUnreachableBackend() throws Exception {
        mockMvc.perform(get("/api/connections/test").param("tenantId", "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tenantId").value("acme"))
                .andExpect(jsonPath("$.connections.postgresql").value(true))
                .andExpect(jsonPath("$.connections['http-api']").value(false))
                .andExpect(jsonPath("$.success").value(false));
    }
}
