package com.openmarket.notification.config;

import com.openmarket.notification.transport.EmailTransport;
import com.openmarket.notification.transport.ResendEmailTransport;
import com.openmarket.notification.transport.SandboxEmailTransport;
import com.openmarket.notification.transport.SandboxSmsTransport;
import com.openmarket.notification.transport.SmsTransport;
import com.openmarket.notification.transport.TwilioSmsTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Selects the email and SMS transports.
 * Without provider credentials the sandbox transports are used: they log and report success.
 */
@Slf4j
@Configuration
public class TransportConfig {

    @Bean
    public EmailTransport emailTransport(
            RestClient.Builder restClientBuilder,
            @Value("${notification.email.resend.api-key:}") String apiKey,
            @Value("${notification.email.resend.base-url:https://api.resend.com}") String baseUrl,
            @Value("${notification.email.from:Marketplace <notifications@openmarket.local>}") String from) {
        if (!StringUtils.hasText(apiKey)) {
            log.warn("notification.email.resend.api-key not set - emails are logged, not delivered");
            return new SandboxEmailTransport();
        }
        RestClient restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .build();
        return new ResendEmailTransport(restClient, from);
    }

    @Bean
    public SmsTransport smsTransport(
            RestClient.Builder restClientBuilder,
            @Value("${notification.sms.twilio.account-sid:}") String accountSid,
            @Value("${notification.sms.twilio.auth-token:}") String authToken,
            @Value("${notification.sms.twilio.base-url:https://api.twilio.com}") String baseUrl,
            @Value("${notification.sms.from:}") String from) {
        if (!StringUtils.hasText(accountSid) || !StringUtils.hasText(authToken)) {
            log.warn("notification.sms.twilio credentials not set - SMS are logged, not delivered");
            return new SandboxSmsTransport();
        }
        RestClient restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeaders(headers -> headers.setBasicAuth(accountSid, authToken))
                .build();
        return new TwilioSmsTransport(restClient, accountSid, from);
    }
}
