package com.openmarket.notification.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;

/**
 * Email transport backed by the Resend HTTP API ({@code POST /emails}).
 * Timeouts come from the underlying HTTP client.
 */
@Slf4j
public class ResendEmailTransport implements EmailTransport {

    private static final String PROVIDER = "resend";

    private final RestClient restClient;
    private final String from;

    public ResendEmailTransport(RestClient restClient, String from) {
        this.restClient = restClient;
        this.from = from;
    }

    @Override
    public TransportResult send(String to, String subject, String html, String text) {
        try {
            ResendEmailResponse response = restClient.post()
                    .uri("/emails")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new ResendEmailRequest(from, List.of(to), subject, html, text))
                    .retrieve()
                    .body(ResendEmailResponse.class);
            if (response == null || response.id() == null) {
                return TransportResult.failed(new TransportError(PROVIDER, "Resend returned no message id"));
            }
            log.debug("Resend accepted email, id={}", response.id());
            return TransportResult.sent(response.id());
        } catch (RestClientException e) {
            log.error("Resend rejected email: {}", e.getMessage());
            return TransportResult.failed(TransportError.from(PROVIDER, e));
        }
    }

    public record ResendEmailRequest(String from, List<String> to, String subject, String html, String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResendEmailResponse(String id) {
    }
}
