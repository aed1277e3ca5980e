package ru.tgproxy.proxybot.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import ru.tgproxy.proxybot.config.ProxyProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Читает Prometheus-метрики MTProto прокси (mtg) с http://host:metrics-port/metrics.
 */
@Slf4j
@Component
public class ProxyMetricsClient {

    public static final String CLIENT_CONNECTIONS = "mtg_client_connections";
    public static final String TELEGRAM_CONNECTIONS = "mtg_telegram_connections";
    public static final String DOMAIN_FRONTING = "mtg_domain_fronting_connections";
    public static final String REPLAY_ATTACKS = "mtg_replay_attacks";
    public static final String CONCURRENCY_LIMITED = "mtg_concurrency_limited";

    private final RestClient rest;
    private final int metricsPort;

    public ProxyMetricsClient(RestClient proxyMetricsRestClient, ProxyProperties props) {
        this.rest = proxyMetricsRestClient;
        this.metricsPort = props.metricsPort();
    }

    public Map<String, Double> fetchMetrics(String host) {
        try {
            String body = rest.get()
                    .uri(metricsUrl(host))
                    .retrieve()
                    .body(String.class);
            return parse(body);
        } catch (RestClientException e) {
            log.warn("Failed to fetch proxy metrics from {}: {}", host, e.getMessage());
            return Collections.emptyMap();
        }
    }

    public boolean isHealthy(String host) {
        try {
            return rest.get()
                    .uri(metricsUrl(host))
                    .retrieve()
                    .toBodilessEntity()
                    .getStatusCode()
                    .is2xxSuccessful();
        } catch (RestClientException e) {
            log.warn("Proxy health check failed for {}: {}", host, e.getMessage());
            return false;
        }
    }

    String metricsUrl(String host) {
        return "http://" + host + ":" + metricsPort + "/metrics";
    }

    /**
     * Метки отбрасываются, при повторе имени побеждает последняя строка.
     */
    static Map<String, Double> parse(String text) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return metrics;
        for (String raw : text.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String name;
            String rest;
            int brace = line.indexOf('{');
            int space = indexOfWhitespace(line);
            if (brace >= 0 && (space < 0 || brace < space)) {
                int close = line.indexOf('}', brace);
                if (close < 0) continue;
                name = line.substring(0, brace);
                rest = line.substring(close + 1).trim();
            } else {
                if (space < 0) continue;
                name = line.substring(0, space);
                rest = line.substring(space).trim();
            }
            if (name.isEmpty() || rest.isEmpty()) continue;
            // после значения может идти timestamp
            String value = rest.split("\\s+")[0];
            try {
                metrics.put(name, Double.parseDouble(value));
            } catch (NumberFormatException e) {
                log.debug("Skipping unparsable metric line: {}", line);
            }
        }
        return metrics;
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }
}
