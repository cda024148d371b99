package com.example.hostwatch.controller;

import com.example.hostwatch.alert.AlertStatus;
import com.example.hostwatch.alert.AlertTransition;
import com.example.hostwatch.alert.TransitionType;
import com.example.hostwatch.monitoring.MetricKind;
import com.example.hostwatch.monitoring.MetricReading;
import com.example.hostwatch.notification.DeliveryResult;
import com.example.hostwatch.scheduler.MonitorScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MonitorController.class)
@ActiveProfiles("test")
class MonitorControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MonitorScheduler scheduler;

    @Test
    @DisplayName("GET /api/monitor/status returns the scheduler status")
    void statusEndpoint() throws Exception {
        when(scheduler.getStatus()).thenReturn(Map.of("running", true, "ticks", 12));

        mockMvc.perform(get("/api/monitor/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.ticks").value(12));
    }

    @Test
    @DisplayName("POST /api/monitor/tick returns the transitions of the run")
    void tick() throws Exception {
        AlertTransition raised = new AlertTransition(MetricKind.CPU, AlertStatus.OK, AlertStatus.ALERTING,
                TransitionType.RAISED, new MetricReading(MetricKind.CPU, 93.5, "host-1", Instant.now()), 1);
        when(scheduler.requestTick()).thenReturn(CompletableFuture.completedFuture(List.of(raised)));

        mockMvc.perform(post("/api/monitor/tick"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transitions[0].kind").value("CPU"))
                .andExpect(jsonPath("$.transitions[0].type").value("RAISED"))
                .andExpect(jsonPath("$.transitions[0].value").value(93.5));
    }

    @Test
    @DisplayName("A failing tick is reported as a server error")
    void tickFailure() throws Exception {
        when(scheduler.requestTick()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        mockMvc.perform(post("/api/monitor/tick"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Metric check failed: boom"));
    }

    @Test
    @DisplayName("POST /api/monitor/report returns the delivery result")
    void report() throws Exception {
        when(scheduler.sendHealthReport()).thenReturn(DeliveryResult.delivered("#alerts"));

        mockMvc.perform(post("/api/monitor/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DELIVERED"))
                .andExpect(jsonPath("$.channel").value("#alerts"));
    }
}
