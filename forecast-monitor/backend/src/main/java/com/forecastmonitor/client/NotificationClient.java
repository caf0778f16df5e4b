package com.forecastmonitor.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forecastmonitor.dto.ReportPayload;
import com.forecastmonitor.exception.NotificationDeliveryException;
import com.forecastmonitor.model.ForecastRef;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Delivers alerts and reports to a webhook endpoint as JSON.
 *
 * <p>With {@code notifications.enabled=false} nothing is sent and messages are only logged.
 */
@Slf4j
@Component
public class NotificationClient implements NotificationSink {

    @Value("${notifications.enabled:false}")
    private boolean enabled;

    @Value("${notifications.webhook.base-url:http://localhost:8089}")
    private String baseUrl;

    @Value("${notifications.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${notifications.recipients:}")
    private List<String> defaultRecipients = List.of();

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("NotificationClient initialised | enabled={} | url={}", enabled, baseUrl);
    }

    @Override
    public void sendAlert(ForecastRef forecast, double accuracy) {
        if (!enabled) {
            log.info("Notifications disabled, alert not sent | forecastId={} | accuracy={}", forecast.id(), accuracy);
            return;
        }
        await(postAlert(forecast, accuracy), "alert for forecast " + forecast.id());
        log.info("Alert sent | forecastId={} | accuracy={}", forecast.id(), accuracy);
    }

    @Override
    public void sendReport(ReportPayload payload, List<String> recipients) {
        List<String> to = (recipients == null || recipients.isEmpty()) ? defaultRecipients : recipients;
        if (!enabled) {
            log.info("Notifications disabled, report not sent | type={} | recipients={}", payload.getReportType(), to.size());
            return;
        }
        await(postReport(payload, to), payload.getReportType() + " report");
        log.info("Report sent | type={} | recipients={}", payload.getReportType(), to.size());
    }

    public Mono<Void> postAlert(ForecastRef forecast, double accuracy) {
        ObjectNode body = mapper.createObjectNode();
        body.put("forecast_id", String.valueOf(forecast.id()));
        body.put("forecast_title", forecast.title());
        body.put("model_name", forecast.modelName());
        body.put("accuracy", accuracy);
        body.set("recipients", mapper.valueToTree(defaultRecipients));
        return post("/alerts", body);
    }

    public Mono<Void> postReport(ReportPayload payload, List<String> recipients) {
        ObjectNode body = mapper.createObjectNode();
        body.set("report", mapper.valueToTree(payload));
        body.set("recipients", mapper.valueToTree(recipients));
        return post("/reports", body);
    }

    private Mono<Void> post(String path, JsonNode body) {
        return webClient.post().uri(path)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new NotificationDeliveryException("Webhook rejected " + path + " (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new NotificationDeliveryException("Webhook unavailable for " + path + " (5xx): " + b)))
            .bodyToMono(Void.class)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) ->
                    new NotificationDeliveryException("Webhook unreachable for " + path, sig.failure())))
            .onErrorMap(WebClientRequestException.class,
                ex -> new NotificationDeliveryException("Webhook unreachable for " + path, ex));
    }

    private void await(Mono<Void> call, String what) {
        try {
            call.block(Duration.ofSeconds(timeoutSeconds + 1L));
        } catch (NotificationDeliveryException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new NotificationDeliveryException("Failed to deliver " + what + ": " + ex.getMessage(), ex);
        }
    }
}
