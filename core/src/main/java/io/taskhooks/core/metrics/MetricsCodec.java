package io.taskhooks.core.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/** JSON form of {@link MetricsWindow}. */
final class MetricsCodec {

    private final ObjectMapper mapper;

    MetricsCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    ObjectNode toNode(MetricsWindow window) {
        ObjectNode node = mapper.createObjectNode();
        node.put("period_start", window.periodStart().toString());
        node.put("period_end", window.periodEnd().toString());
        node.set("global", stats(window.global()));
        ObjectNode perHook = node.putObject("per_hook");
        window.perHook().forEach((name, stats) -> perHook.set(name, stats(stats)));
        ObjectNode perType = node.putObject("per_event_type");
        window.perEventType().forEach((type, stats) -> perType.set(type, stats(stats)));
        ObjectNode timeouts = node.putObject("hook_timeouts_ms");
        window.hookTimeouts().forEach((hook, millis) -> timeouts.put(hook, millis.longValue()));
        return node;
    }

    MetricsWindow fromNode(JsonNode node) {
        Map<String, Stats> perHook = new HashMap<>();
        node.path("per_hook").fields().forEachRemaining(e -> perHook.put(e.getKey(), stats(e.getValue())));
        Map<String, Stats> perType = new HashMap<>();
        node.path("per_event_type").fields().forEachRemaining(e -> perType.put(e.getKey(), stats(e.getValue())));
        Map<String, Long> timeouts = new HashMap<>();
        node.path("hook_timeouts_ms").fields().forEachRemaining(e -> timeouts.put(e.getKey(), e.getValue().asLong()));
        return new MetricsWindow(
                Instant.parse(node.path("period_start").asText()),
                Instant.parse(node.path("period_end").asText()),
                stats(node.path("global")),
                perHook,
                perType,
                timeouts);
    }

    private ObjectNode stats(Stats stats) {
        ObjectNode node = mapper.createObjectNode();
        node.put("count", stats.count());
        node.put("success", stats.success());
        node.put("failed", stats.failed());
        node.put("timeout", stats.timeout());
        node.put("error", stats.error());
        node.put("security_violations", stats.securityViolations());
        node.put("success_rate", stats.successRate());
        node.put("p50_ms", stats.p50());
        node.put("p95_ms", stats.p95());
        node.put("p99_ms", stats.p99());
        node.put("min_ms", stats.min());
        node.put("max_ms", stats.max());
        node.put("mean_ms", stats.mean());
        return node;
    }

    private static Stats stats(JsonNode node) {
        return new Stats(
                node.path("count").asLong(),
                node.path("success").asLong(),
                node.path("failed").asLong(),
                node.path("timeout").asLong(),
                node.path("error").asLong(),
                node.path("security_violations").asLong(),
                node.path("p50_ms").asLong(),
                node.path("p95_ms").asLong(),
                node.path("p99_ms").asLong(),
                node.path("min_ms").asLong(),
                node.path("max_ms").asLong(),
                node.path("mean_ms").asDouble());
    }
}
