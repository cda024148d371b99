package com.example.hostwatch.controller;

import com.example.hostwatch.alert.AlertTransition;
import com.example.hostwatch.notification.DeliveryResult;
import com.example.hostwatch.scheduler.MonitorScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Monitor REST API Controller.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
@RequiredArgsConstructor
public class MonitorController {

    private static final long TICK_WAIT_SECONDS = 120;

    private final MonitorScheduler scheduler;

    /**
     * Running state, counters, thresholds and per-kind alert state.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        return ResponseEntity.ok(scheduler.getStatus());
    }

    /**
     * Run a metric check now on the scheduler thread and return its transitions.
     */
    @PostMapping("/tick")
    public ResponseEntity<Map<String, Object>> tick() {
        try {
            List<AlertTransition> transitions = scheduler.requestTick().get(TICK_WAIT_SECONDS, TimeUnit.SECONDS);
            List<Map<String, Object>> view = transitions.stream().map(MonitorController::toView).toList();
            return ResponseEntity.ok(Map.of("transitions", view));
        } catch (TimeoutException e) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(Map.of("error", "Metric check did not finish within " + TICK_WAIT_SECONDS + "s"));
        } catch (ExecutionException e) {
            log.error("Manual metric check failed", e.getCause());
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Metric check failed: " + e.getCause().getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Interrupted while waiting for the metric check"));
        }
    }

    /**
     * Post a system health report to the notification channel.
     */
    @PostMapping("/report")
    public ResponseEntity<Map<String, Object>> report() {
        DeliveryResult result = scheduler.sendHealthReport();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", result.status());
        body.put("channel", result.channel());
        body.put("detail", result.detail());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> toView(AlertTransition transition) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("kind", transition.kind());
        view.put("value", transition.reading().value());
        view.put("from", transition.from());
        view.put("to", transition.to());
        view.put("type", transition.type());
        view.put("consecutiveBreaches", transition.consecutiveBreaches());
        return view;
    }
}
