package com.studio.access.service;

import com.studio.access.config.AccessProperties;
import com.studio.access.exception.InvalidSecretRequestException;
import com.studio.access.exception.RecordStoreException;
import com.studio.access.exception.RejectionReason;
import com.studio.access.exception.SecretRejectedException;
import com.studio.access.service.trigger.TriggerConfirmation;
import com.studio.access.service.trigger.TriggerEmitter;
import com.studio.access.service.trigger.TriggerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one verification: resolve the secret, consume the record, then ask for the door to
 * open.
 *
 * <p>The record is consumed only after the window check accepted it, and the door event is
 * requested only after this request won the consume. A failed door event does not turn
 * into a failed verification: the holder was entitled and the secret is already spent, so
 * the scanner gets success and operators get a {@code [CRITICAL]} log line plus the
 * {@code door.access.trigger.failures} counter.
 *
 * <p>Nothing here holds a lock or a transaction while the trigger is emitted.
 */
@Service
public class VerificationService {

    private static final Logger log = LoggerFactory.getLogger(VerificationService.class);

    private final SecretResolver secretResolver;
    private final SecretInvalidator secretInvalidator;
    private final TriggerEmitter triggerEmitter;
    private final VerificationMetrics metrics;
    private final AccessProperties.Trigger triggerSettings;
    private final Clock clock;

    public VerificationService(SecretResolver secretResolver,
                               SecretInvalidator secretInvalidator,
                               TriggerEmitter triggerEmitter,
                               VerificationMetrics metrics,
                               AccessProperties properties,
                               Clock clock) {
        this.secretResolver = secretResolver;
        this.secretInvalidator = secretInvalidator;
        this.triggerEmitter = triggerEmitter;
        this.metrics = metrics;
        this.triggerSettings = properties.getTrigger();
        this.clock = clock;
    }

    public VerificationResult verify(String qrSecret) {
        if (qrSecret == null || qrSecret.isBlank()) {
            metrics.recordOutcome(VerificationMetrics.BAD_REQUEST);
            throw new InvalidSecretRequestException("Missing qrSecret");
        }

        MatchedRecord match;
        try {
            VerificationOutcome outcome = secretResolver.resolve(qrSecret);
            match = outcome.match();
            switch (outcome.decision()) {
                case NOT_FOUND -> throw reject(RejectionReason.NOT_FOUND, qrSecret, null);
                case REJECTED_EXPIRED -> throw reject(RejectionReason.OUTSIDE_WINDOW, qrSecret, match);
                case REJECTED_INACTIVE -> throw reject(RejectionReason.INACTIVE, qrSecret, match);
                case ACCEPTED -> log.debug("Secret {} accepted for {} {}", mask(qrSecret),
                    match.kind().label(), match.recordId());
            }

            if (!secretInvalidator.invalidate(match)) {
                throw reject(RejectionReason.ALREADY_CONSUMED, qrSecret, match);
            }
        } catch (RecordStoreException ex) {
            metrics.recordOutcome(VerificationMetrics.INFRA_ERROR);
            throw ex;
        }

        boolean confirmed = emitTrigger(match);
        metrics.recordOutcome(VerificationMetrics.SUCCESS);
        log.info("Secret {} verified and consumed for {} {} ({})", mask(qrSecret), match.kind().label(),
            match.recordId(), match.holder());
        return new VerificationResult(match.kind(), match.recordId(), true, confirmed);
    }

    private boolean emitTrigger(MatchedRecord match) {
        Instant now = clock.instant();
        TriggerEvent event = new TriggerEvent(
            triggerSettings.getActionLabel(),
            "Triggered by " + match.kind().label() + " ID: " + match.recordId()
                + " for user " + match.holder() + ".",
            now,
            now.plus(triggerSettings.getEventSpan()),
            "trigger-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8),
            triggerSettings.getRoomId());

        Optional<TriggerConfirmation> confirmation;
        try {
            confirmation = triggerEmitter.emit(event);
        } catch (RuntimeException ex) {
            reportTriggerFailure(event, match, ex);
            return false;
        }
        if (confirmation.isEmpty()) {
            reportTriggerFailure(event, match, null);
            return false;
        }
        return true;
    }

    private void reportTriggerFailure(TriggerEvent event, MatchedRecord match, Exception cause) {
        metrics.recordTriggerFailure();
        log.error("[CRITICAL] Failed to create trigger event {} for {} {}. Door will not open.",
            event.eventId(), match.kind().label(), match.recordId(), cause);
    }

    private SecretRejectedException reject(RejectionReason reason, String qrSecret, MatchedRecord match) {
        metrics.recordOutcome(reason == RejectionReason.NOT_FOUND
            ? VerificationMetrics.NOT_FOUND : VerificationMetrics.REJECTED);
        if (match == null) {
            log.info("Secret {} rejected: {}", mask(qrSecret), reason);
            return new SecretRejectedException(reason, null);
        }
        log.info("Secret {} rejected: {} ({} {})", mask(qrSecret), reason, match.kind().label(), match.recordId());
        return new SecretRejectedException(reason, match.kind());
    }

    static String mask(String secret) {
        if (secret.length() <= 4) {
            return "****";
        }
        return secret.substring(0, 4) + "****";
    }
}
