package com.flexboard.agent.controller;

import com.flexboard.agent.api.QueryRequest;
import com.flexboard.agent.api.QueryResult;
import com.flexboard.agent.error.CapacityException;
import com.flexboard.agent.error.QueryTimeoutException;
import com.flexboard.agent.pool.PoolStats;
import com.flexboard.agent.service.QueryDispatcher;
import com.flexboard.agent.web.GlobalExceptionHandler;
import com.flexboard.agent.web.TraceIdFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("QueryController Tests")
class QueryControllerTest {

    private QueryDispatcher dispatcher;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        dispatcher = mock(QueryDispatcher.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(dispatcher))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new TraceIdFilter())
                .build();
    }

    @Test
    @DisplayName("Should execute a widget query and return its rows")
    void executesQuery() throws Exception {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("branch", "north");
        row.put("avg_cost", 150);
        when(dispatcher.execute(any(QueryRequest.class))).thenReturn(QueryResult.success(
                List.of("branch", "avg_cost"), List.of(row), 12L,
                QueryResult.Metadata.builder().dataSource("postgresql").tenantId("vpi-co-ltd").build()));

        mockMvc.perform(post("/api/widgets/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceType\": \"postgres\", \"query\": \"SELECT 1\", "
                                + "\"params\": {\"tenant\": \"vpi-co-ltd\"}, \"tenantId\": \"vpi-co-ltd\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.columns[1]").value("avg_cost"))
                .andExpect(jsonPath("$.data[0].branch").value("north"))
                .andExpect(jsonPath("$.rowCount").value(1))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(jsonPath("$.metadata.dataSource").value("postgresql"));

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(dispatcher).execute(captor.capture());
        assertThat(captor.getValue().getDataSourceKind()).isEqualTo("postgres");
        assertThat(captor.getValue().getParams()).containsEntry("tenant", "vpi-co-ltd");
    }

    @Test
    @DisplayName("Should map failed results to their HTTP status")
    void mapsFailureStatus() throws Exception {
        QueryResult.Metadata metadata = QueryResult.Metadata.builder().dataSource("http-api").build();
        when(dispatcher.execute(any(QueryRequest.class)))
                .thenReturn(QueryResult.failure(new CapacityException("No connection available"), metadata))
                .thenReturn(QueryResult.failure(new QueryTimeoutException("Query timed out"), metadata));

        mockMvc.perform(post("/api/widgets/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceKind\": \"api\", \"query\": \"/orders\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("CAPACITY_EXHAUSTED"))
                .andExpect(jsonPath("$.data").doesNotExist());

        mockMvc.perform(post("/api/widgets/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceKind\": \"api\", \"query\": \"/orders\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.errorCode").value("TIMEOUT"));
    }

    @Test
    @DisplayName("Should reject malformed and oversized requests before dispatch")
    void rejectsBadRequests() throws Exception {
        mockMvc.perform(post("/api/widgets/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.traceId").exists());

        mockMvc.perform(post("/api/widgets/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceKind\": \"api\", \"query\": \"/x\", \"tenantId\": \"" + "t".repeat(200) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value(org.hamcrest.Matchers.containsString("tenantId")));

        verify(dispatcher, never()).execute(any(QueryRequest.class));
    }

    @Test
    @DisplayName("Should echo a safe request id and replace an unsafe one")
    void tracesRequests() throws Exception {
        when(dispatcher.availableDataSources()).thenReturn(List.of());
        when(dispatcher.poolStatistics()).thenReturn(List.of());

        mockMvc.perform(get("/api/connections").header(TraceIdFilter.TRACE_ID_HEADER, "req-42"))
                .andExpect(header().string(TraceIdFilter.TRACE_ID_HEADER, "req-42"));
        mockMvc.perform(get("/api/connections").header(TraceIdFilter.TRACE_ID_HEADER, "bad id\r\n"))
                .andExpect(header().string(TraceIdFilter.TRACE_ID_HEADER, not("bad id\r\n")));
    }

    @Test
    @DisplayName("Should tag the named tenant in MDC during the request and clear it afterwards")
    void tagsTenantInMdc() throws Exception {
        AtomicReference<String> tenantDuringRequest = new AtomicReference<>();
        AtomicReference<String> traceDuringRequest = new AtomicReference<>();
        when(dispatcher.testConnections("acme")).thenAnswer(invocation -> {
            tenantDuringRequest.set(MDC.get(QueryDispatcher.MDC_TENANT));
            traceDuringRequest.set(MDC.get(TraceIdFilter.MDC_TRACE_ID));
            return Map.of("postgresql", true);
        });

        mockMvc.perform(get("/api/connections/test").param("tenantId", "acme").header(TraceIdFilter.TRACE_ID_HEADER, "req-7"))
                .andExpect(status().isOk());

        assertThat(tenantDuringRequest.get()).isEqualTo("acme");
        assertThat(traceDuringRequest.get()).isEqualTo("req-7");
        assertThat(MDC.get(QueryDispatcher.MDC_TENANT)).isNull();
        assertThat(MDC.get(TraceIdFilter.MDC_TRACE_ID)).isNull();
    }

    @Test
    @DisplayName("Should report connection test results for the default tenant")
    void testsConnections() throws Exception {
        Map<String, Boolean> connections = new LinkedHashMap<>();
        connections.put("postgresql", true);
        connections.put("http-api", false);
        when(dispatcher.testConnections(null)).thenReturn(connections);

        mockMvc.perform(get("/api/connections/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.tenantId").value("default"))
                .andExpect(jsonPath("$.connections.postgresql").value(true))
                .andExpect(jsonPath("$.connections['http-api']").value(false));
    }

    @Test
    @DisplayName("Should list data sources and pool statistics")
    void listsConnections() throws Exception {
        when(dispatcher.availableDataSources()).thenReturn(List.of("postgresql", "http-api"));
        when(dispatcher.poolStatistics()).thenReturn(List.of(
                new PoolStats("flexboard-acme-postgresql", "acme", "postgresql", 5, 0, 1, 2, 3, 0)));

        mockMvc.perform(get("/api/connections"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataSources[1]").value("http-api"))
                .andExpect(jsonPath("$.pools[0].tenantId").value("acme"))
                .andExpect(jsonPath("$.pools[0].idleConnections").value(2));
    }
}
