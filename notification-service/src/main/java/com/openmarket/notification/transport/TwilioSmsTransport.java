package com.openmarket.notification.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * SMS transport backed by the Twilio Messages API.
 */
@Slf4j
public class TwilioSmsTransport implements SmsTransport {

    private static final String PROVIDER = "twilio";

    private final RestClient restClient;
    private final String accountSid;
    private final String from;

    public TwilioSmsTransport(RestClient restClient, String accountSid, String from) {
        this.restClient = restClient;
        this.accountSid = accountSid;
        this.from = from;
    }

    @Override
    public TransportResult send(String to, String body) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("To", to);
        form.add("From", from);
        form.add("Body", body);
        try {
            TwilioMessageResponse response = restClient.post()
                    .uri("/2010-04-01/Accounts/{accountSid}/Messages.json", accountSid)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(TwilioMessageResponse.class);
            if (response == null || response.sid() == null) {
                return TransportResult.failed(new TransportError(PROVIDER, "Twilio returned no message sid"));
            }
            log.debug("Twilio accepted SMS, sid={}", response.sid());
            return TransportResult.sent(response.sid());
        } catch (RestClientException e) {
            log.error("Twilio rejected SMS: {}", e.getMessage());
            return TransportResult.failed(TransportError.from(PROVIDER, e));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TwilioMessageResponse(String sid, String status) {
    }
}
