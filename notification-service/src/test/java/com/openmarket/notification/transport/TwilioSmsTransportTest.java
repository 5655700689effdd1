package com.openmarket.notification.transport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TwilioSmsTransportTest {

    private MockRestServiceServer server;
    private TwilioSmsTransport transport;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.twilio.test");
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new TwilioSmsTransport(builder.build(), "AC123", "+15550009999");
    }

    @Test
    @DisplayName("sends a form-encoded message and returns the Twilio SID")
    void send_ok() {
        MultiValueMap<String, String> expectedForm = new LinkedMultiValueMap<>();
        expectedForm.add("To", "+15550001111");
        expectedForm.add("From", "+15550009999");
        expectedForm.add("Body", "Your business is approved");

        server.expect(requestTo("https://api.twilio.test/2010-04-01/Accounts/AC123/Messages.json"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formData(expectedForm))
                .andRespond(withSuccess("{\"sid\":\"SM42\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        TransportResult result = transport.send("+15550001111", "Your business is approved");

        assertThat(result.externalId()).isEqualTo("SM42");
        server.verify();
    }

    @Test
    @DisplayName("Twilio outage becomes a failed result")
    void send_serverError() {
        server.expect(requestTo("https://api.twilio.test/2010-04-01/Accounts/AC123/Messages.json"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        TransportResult result = transport.send("+15550001111", "hi");

        assertThat(result.isSent()).isFalse();
        assertThat(result.error().provider()).isEqualTo("twilio");
    }
}
