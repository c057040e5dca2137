package com.feedwatch.engine.infrastructure.heartbeat;

import java.net.URI;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Pings an uptime monitor. Failures are only logged; a missed beat is what the monitor reports. */
@Slf4j
@RequiredArgsConstructor
public class HeartbeatClient {

    private final RestClient restClient;
    private final URI url;

    public boolean beat() {
        try {
            var response = restClient.get().uri(url).retrieve().toBodilessEntity();
            log.debug("Heartbeat sent, status {}", response.getStatusCode().value());
            return true;
        } catch (RestClientException e) {
            log.warn("Heartbeat to {} failed: {}", url.getHost(), e.getMessage());
            return false;
        }
    }
}
