package com.openmarket.notification.service;

import com.openmarket.common.exception.ConfigurationException;
import com.openmarket.common.exception.ResourceNotFoundException;
import com.openmarket.notification.config.NotificationProperties;
import com.openmarket.notification.domain.model.Channel;
import com.openmarket.notification.domain.model.NotificationTemplate;
import com.openmarket.notification.domain.model.NotificationType;
import com.openmarket.notification.domain.model.UserNotificationPreference;
import com.openmarket.notification.domain.repository.NotificationTemplateRepository;
import com.openmarket.notification.domain.repository.UserNotificationPreferenceRepository;
import com.openmarket.notification.transport.EmailTransport;
import com.openmarket.notification.transport.SmsTransport;
import com.openmarket.notification.transport.TransportError;
import com.openmarket.notification.transport.TransportResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Sends one notification to one user over every channel their preferences allow.
 * <p>
 * Flow:
 * 1. Load preferences and resolve the recipient (unknown user aborts)
 * 2. Load the active template (missing template aborts)
 * 3. Resolve channels; stop here during quiet hours
 * 4. Render, send and log each channel independently and concurrently
 * <p>
 * Transport failures never escape: they are logged as FAILED rows and reported in the result.
 * There is no retry.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final UserNotificationPreferenceRepository preferenceRepository;
    private final NotificationTemplateRepository templateRepository;
    private final ContactResolver contactResolver;
    private final ChannelResolver channelResolver;
    private final QuietHoursPolicy quietHoursPolicy;
    private final TemplateRenderer templateRenderer;
    private final EmailTransport emailTransport;
    private final SmsTransport smsTransport;
    private final DeliveryLogger deliveryLogger;
    private final Executor notificationExecutor;
    private final NotificationProperties properties;

    public NotificationDispatcher(UserNotificationPreferenceRepository preferenceRepository,
                                  NotificationTemplateRepository templateRepository,
                                  ContactResolver contactResolver,
                                  ChannelResolver channelResolver,
                                  QuietHoursPolicy quietHoursPolicy,
                                  TemplateRenderer templateRenderer,
                                  EmailTransport emailTransport,
                                  SmsTransport smsTransport,
                                  DeliveryLogger deliveryLogger,
                                  @Qualifier("notificationExecutor") Executor notificationExecutor,
                                  NotificationProperties properties) {
        this.preferenceRepository = preferenceRepository;
        this.templateRepository = templateRepository;
        this.contactResolver = contactResolver;
        this.channelResolver = channelResolver;
        this.quietHoursPolicy = quietHoursPolicy;
        this.templateRenderer = templateRenderer;
        this.emailTransport = emailTransport;
        this.smsTransport = smsTransport;
        this.deliveryLogger = deliveryLogger;
        this.notificationExecutor = notificationExecutor;
        this.properties = properties;
    }

    /**
     * @throws ResourceNotFoundException when the user is unknown to the identity service
     * @throws ConfigurationException when no active template exists for the type
     */
    public DispatchResult dispatch(String userId, NotificationType type,
                                   Map<String, ?> templateVariables, Map<String, Object> metadata) {
        log.info("Dispatching {} notification to user {}", type.getKey(), userId);

        UserNotificationPreference preference = loadPreference(userId);
        ResolvedContact contact = contactResolver.resolve(userId, preference);
        NotificationTemplate template = templateRepository.findFirstByTemplateKeyAndActiveTrue(type.getKey())
                .orElseThrow(() -> new ConfigurationException("No active notification template: " + type.getKey()));

        ChannelSelection channels = channelResolver.resolve(type, preference);
        DispatchContext context = new DispatchContext(userId, type,
                templateVariables != null ? templateVariables : Map.of(),
                metadata != null ? metadata : Map.of());

        if (quietHoursPolicy.isQuietTime(preference)) {
            log.info("Quiet hours active for user {}, skipping {} notification", userId, type.getKey());
            return suppress(context, channels, contact, template);
        }

        Map<Channel, CompletableFuture<ChannelOutcome>> attempts = new EnumMap<>(Channel.class);
        if (channels.email() && contact.email() != null) {
            attempts.put(Channel.EMAIL, submit(Channel.EMAIL, () -> sendEmail(context, template, contact.email())));
        }
        if (channels.sms() && contact.phone() != null) {
            attempts.put(Channel.SMS, submit(Channel.SMS, () -> sendSms(context, template, contact.phone())));
        }

        if (attempts.isEmpty()) {
            log.info("No channel enabled with a recipient for user {} ({})", userId, type.getKey());
            return new DispatchResult(userId, type, DispatchResult.Status.NO_CHANNELS, List.of());
        }

        List<ChannelOutcome> outcomes = await(attempts);
        DispatchResult result = new DispatchResult(userId, type, DispatchResult.Status.DISPATCHED, outcomes);
        log.info("Dispatched {} notification to user {}: {} sent, {} failed",
                type.getKey(), userId, result.sentCount(), result.failedCount());
        return result;
    }

    private UserNotificationPreference loadPreference(String userId) {
        try {
            return preferenceRepository.findByUserId(userId).orElse(null);
        } catch (DataAccessException e) {
            log.error("Preference lookup failed for user {}, using defaults", userId, e);
            return null;
        }
    }

    private CompletableFuture<ChannelOutcome> submit(Channel channel, Supplier<ChannelOutcome> attempt) {
        CompletableFuture<ChannelOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(attempt, notificationExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Notification pool saturated, sending {} on the caller thread", channel.getValue());
            future = CompletableFuture.completedFuture(attempt.get());
        }
        return future.exceptionally(ex -> {
            log.error("{} attempt failed unexpectedly", channel.getValue(), ex);
            return ChannelOutcome.failed(channel, ex.getMessage());
        });
    }

    private List<ChannelOutcome> await(Map<Channel, CompletableFuture<ChannelOutcome>> attempts) {
        Duration timeout = properties.getDispatch().getAwaitTimeout();
        boolean bounded = timeout != null && !timeout.isZero() && !timeout.isNegative();
        long deadline = bounded ? System.nanoTime() + timeout.toNanos() : 0L;

        List<ChannelOutcome> outcomes = new ArrayList<>(attempts.size());
        for (Map.Entry<Channel, CompletableFuture<ChannelOutcome>> attempt : attempts.entrySet()) {
            if (!bounded) {
                outcomes.add(attempt.getValue().join());
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                outcomes.add(attempt.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                log.warn("{} attempt still running after {}", attempt.getKey().getValue(), timeout);
                outcomes.add(ChannelOutcome.pending(attempt.getKey()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(ChannelOutcome.pending(attempt.getKey()));
            } catch (ExecutionException e) {
                outcomes.add(ChannelOutcome.failed(attempt.getKey(), e.getCause().getMessage()));
            }
        }
        return outcomes;
    }

    private ChannelOutcome sendEmail(DispatchContext context, NotificationTemplate template, String recipient) {
        String subject = templateRenderer.render(template.getEmailSubject(), context.variables());
        String html = templateRenderer.render(template.getEmailBodyHtml(), context.variables());
        String text = templateRenderer.render(template.getEmailBodyText(), context.variables());

        TransportResult result = invoke(Channel.EMAIL, () -> emailTransport.send(recipient, subject, html, text));
        if (!result.isSent()) {
            log.error("Email notification {} failed for user {}: {}",
                    context.type().getKey(), context.userId(), result.errorMessage());
        }
        deliveryLogger.recordAttempt(context, Channel.EMAIL, recipient, subject, text, result);
        return ChannelOutcome.of(Channel.EMAIL, result);
    }

    private ChannelOutcome sendSms(DispatchContext context, NotificationTemplate template, String recipient) {
        if (!StringUtils.hasText(template.getSmsBody())) {
            log.warn("No SMS body in template {}, skipping SMS", template.getTemplateKey());
            return ChannelOutcome.skipped(Channel.SMS, "template has no SMS body");
        }
        String body = templateRenderer.render(template.getSmsBody(), context.variables());

        TransportResult result = invoke(Channel.SMS, () -> smsTransport.send(recipient, body));
        if (!result.isSent()) {
            log.error("SMS notification {} failed for user {}: {}",
                    context.type().getKey(), context.userId(), result.errorMessage());
        }
        deliveryLogger.recordAttempt(context, Channel.SMS, recipient, null, body, result);
        return ChannelOutcome.of(Channel.SMS, result);
    }

    private TransportResult invoke(Channel channel, Supplier<TransportResult> send) {
        try {
            TransportResult result = send.get();
            return result != null
                    ? result
                    : TransportResult.failed(new TransportError(channel.getValue(), "Transport returned no result"));
        } catch (RuntimeException e) {
            log.error("{} transport threw", channel.getValue(), e);
            return TransportResult.failed(TransportError.from(channel.getValue(), e));
        }
    }

    private DispatchResult suppress(DispatchContext context, ChannelSelection channels,
                                    ResolvedContact contact, NotificationTemplate template) {
        List<ChannelOutcome> outcomes = new ArrayList<>(2);
        if (channels.email() && contact.email() != null) {
            outcomes.add(ChannelOutcome.suppressed(Channel.EMAIL));
            if (properties.getQuietHours().isAuditSuppressed()) {
                deliveryLogger.recordSuppressed(context, Channel.EMAIL, contact.email());
            }
        }
        if (channels.sms() && contact.phone() != null && StringUtils.hasText(template.getSmsBody())) {
            outcomes.add(ChannelOutcome.suppressed(Channel.SMS));
            if (properties.getQuietHours().isAuditSuppressed()) {
                deliveryLogger.recordSuppressed(context, Channel.SMS, contact.phone());
            }
        }
        return new DispatchResult(context.userId(), context.type(), DispatchResult.Status.SUPPRESSED, outcomes);
    }
}
