package com.forecastmonitor.client;

import com.forecastmonitor.dto.ReportPayload;
import com.forecastmonitor.exception.NotificationDeliveryException;
import com.forecastmonitor.model.ForecastRef;
import com.forecastmonitor.scheduler.TaskType;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.*;

class NotificationClientTest {

    private static WireMockServer wireMock;

    private NotificationClient client;
    private final ForecastRef forecast = new ForecastRef(UUID.randomUUID(), "Q3 sales", "ARIMA Model");

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    @BeforeEach
    void setUp() {
        client = new NotificationClient();
        ReflectionTestUtils.setField(client, "enabled", true);
        ReflectionTestUtils.setField(client, "baseUrl", "http://localhost:" + wireMock.port());
        ReflectionTestUtils.setField(client, "timeoutSeconds", 2);
        ReflectionTestUtils.setField(client, "defaultRecipients", List.of("ops@example.com"));
        client.init();
    }

    private ReportPayload report() {
        return ReportPayload.builder()
            .reportType(TaskType.DAILY_REPORT).title("Daily Performance Report - 2024-05-15")
            .periodStart(Instant.parse("2024-05-15T00:00:00Z")).generatedAt(Instant.parse("2024-05-15T10:00:00Z"))
            .totalForecasts(3).forecastsWithData(2).averageAccuracy(88.2).performanceBand("excellent")
            .modelAccuracy(Map.of()).recommendations(List.of("Continue monitoring forecast accuracy"))
            .build();
    }

    @Test
    void postAlert_sendsForecastAndAccuracy() {
        wireMock.stubFor(post(urlEqualTo("/alerts")).willReturn(aResponse().withStatus(202)));

        StepVerifier.create(client.postAlert(forecast, 61.5)).verifyComplete();

        wireMock.verify(postRequestedFor(urlEqualTo("/alerts"))
            .withRequestBody(matchingJsonPath("$.forecast_id", equalTo(forecast.id().toString())))
            .withRequestBody(matchingJsonPath("$.accuracy", equalTo("61.5")))
            .withRequestBody(matchingJsonPath("$.recipients[0]", equalTo("ops@example.com"))));
    }

    @Test
    void postReport_serverError_mapsToDeliveryException() {
        wireMock.stubFor(post(urlEqualTo("/reports")).willReturn(aResponse().withStatus(500).withBody("boom")));

        StepVerifier.create(client.postReport(report(), List.of("lead@example.com")))
            .expectError(NotificationDeliveryException.class)
            .verify();
    }

    @Test
    void sendReport_serializesPayload() {
        wireMock.stubFor(post(urlEqualTo("/reports")).willReturn(aResponse().withStatus(200)));

        client.sendReport(report(), List.of("lead@example.com"));

        wireMock.verify(postRequestedFor(urlEqualTo("/reports"))
            .withRequestBody(matchingJsonPath("$.report.reportType", equalTo("daily_report")))
            .withRequestBody(matchingJsonPath("$.report.performanceBand", equalTo("excellent")))
            .withRequestBody(matchingJsonPath("$.recipients[0]", equalTo("lead@example.com"))));
    }

    @Test
    void sendAlert_rejected_throws() {
        wireMock.stubFor(post(urlEqualTo("/alerts")).willReturn(aResponse().withStatus(400).withBody("bad payload")));

        assertThatThrownBy(() -> client.sendAlert(forecast, 40.0))
            .isInstanceOf(NotificationDeliveryException.class)
            .hasMessageContaining("4xx");
    }

    @Test
    void disabled_sendsNothing() {
        ReflectionTestUtils.setField(client, "enabled", false);

        client.sendAlert(forecast, 10.0);
        client.sendReport(report(), List.of());

        wireMock.verify(0, postRequestedFor(anyUrl()));
    }
}
