package com.feedwatch.engine.infrastructure.heartbeat;

import java.net.URI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HeartbeatClientTest {

    private static final URI URL = URI.create("http://uptime.test/api/push/abc?status=up");

    private MockRestServiceServer server;
    private HeartbeatClient client;

    @BeforeEach
    void setUp() {
        var builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HeartbeatClient(builder.build(), URL);
    }

    @Test
    void shouldPingMonitor() {
        server.expect(requestTo(URL)).andExpect(method(GET)).andRespond(withSuccess());

        assertThat(client.beat()).isTrue();
        server.verify();
    }

    @Test
    void shouldSwallowMonitorFailure() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThat(client.beat()).isFalse();
    }
}
