package com.studio.access.unit.service;

import com.studio.access.config.AccessProperties;
import com.studio.access.entity.Reservation;
import com.studio.access.entity.TemporaryAccess;
import com.studio.access.entity.TemporaryAccessStatus;
import com.studio.access.exception.InvalidSecretRequestException;
import com.studio.access.exception.RecordStoreException;
import com.studio.access.exception.RejectionReason;
import com.studio.access.exception.SecretRejectedException;
import com.studio.access.service.MatchedRecord;
import com.studio.access.service.RecordKind;
import com.studio.access.service.SecretInvalidator;
import com.studio.access.service.SecretResolver;
import com.studio.access.service.VerificationMetrics;
import com.studio.access.service.VerificationOutcome;
import com.studio.access.service.VerificationOutcome.Decision;
import com.studio.access.service.VerificationResult;
import com.studio.access.service.VerificationService;
import com.studio.access.service.trigger.TriggerConfirmation;
import com.studio.access.service.trigger.TriggerEmitter;
import com.studio.access.service.trigger.TriggerEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class VerificationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T06:00:00Z");

    @Mock
    private SecretResolver secretResolver;

    @Mock
    private SecretInvalidator secretInvalidator;

    @Mock
    private TriggerEmitter triggerEmitter;

    private SimpleMeterRegistry meterRegistry;

    private VerificationService verificationService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        verificationService = new VerificationService(secretResolver, secretInvalidator, triggerEmitter,
            new VerificationMetrics(meterRegistry), new AccessProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void verify_blankSecret_isRejectedBeforeLookup() {
        assertThatThrownBy(() -> verificationService.verify("  "))
            .isInstanceOf(InvalidSecretRequestException.class);
        assertThatThrownBy(() -> verificationService.verify(null))
            .isInstanceOf(InvalidSecretRequestException.class);

        verifyNoInteractions(secretResolver, secretInvalidator, triggerEmitter);
        assertThat(outcomeCount("bad_request")).isEqualTo(2.0);
    }

    @Test
    void verify_unknownSecret_isNotFound() {
        when(secretResolver.resolve("qs-unknown")).thenReturn(VerificationOutcome.notFound());

        assertThatThrownBy(() -> verificationService.verify("qs-unknown"))
            .isInstanceOf(SecretRejectedException.class)
            .extracting(ex -> ((SecretRejectedException) ex).getReason())
            .isEqualTo(RejectionReason.NOT_FOUND);

        verifyNoInteractions(secretInvalidator, triggerEmitter);
    }

    @Test
    void verify_outsideWindow_isRejectedWithoutInvalidation() {
        when(secretResolver.resolve("qs-res"))
            .thenReturn(VerificationOutcome.of(Decision.REJECTED_EXPIRED, reservationMatch()));

        assertThatThrownBy(() -> verificationService.verify("qs-res"))
            .isInstanceOf(SecretRejectedException.class)
            .satisfies(ex -> {
                SecretRejectedException rejected = (SecretRejectedException) ex;
                assertThat(rejected.getReason()).isEqualTo(RejectionReason.OUTSIDE_WINDOW);
                assertThat(rejected.getKind()).isEqualTo(RecordKind.RESERVATION);
            });

        verifyNoInteractions(secretInvalidator, triggerEmitter);
        assertThat(outcomeCount("rejected")).isEqualTo(1.0);
    }

    @Test
    void verify_inactiveGrant_isRejectedAsInactive() {
        when(secretResolver.resolve("qs-temp"))
            .thenReturn(VerificationOutcome.of(Decision.REJECTED_INACTIVE, temporaryMatch()));

        assertThatThrownBy(() -> verificationService.verify("qs-temp"))
            .isInstanceOf(SecretRejectedException.class)
            .extracting(ex -> ((SecretRejectedException) ex).getReason())
            .isEqualTo(RejectionReason.INACTIVE);

        verifyNoInteractions(secretInvalidator, triggerEmitter);
    }

    @Test
    void verify_lostInvalidationRace_isRejectedAndNoTriggerEmitted() {
        MatchedRecord match = reservationMatch();
        when(secretResolver.resolve("qs-res")).thenReturn(VerificationOutcome.of(Decision.ACCEPTED, match));
        when(secretInvalidator.invalidate(match)).thenReturn(false);

        assertThatThrownBy(() -> verificationService.verify("qs-res"))
            .isInstanceOf(SecretRejectedException.class)
            .extracting(ex -> ((SecretRejectedException) ex).getReason())
            .isEqualTo(RejectionReason.ALREADY_CONSUMED);

        verifyNoInteractions(triggerEmitter);
    }

    @Test
    void verify_acceptedSecret_isConsumedAndTriggersDoor() {
        MatchedRecord match = reservationMatch();
        when(secretResolver.resolve("qs-res")).thenReturn(VerificationOutcome.of(Decision.ACCEPTED, match));
        when(secretInvalidator.invalidate(match)).thenReturn(true);
        when(triggerEmitter.emit(any())).thenReturn(Optional.of(new TriggerConfirmation("trigger1", false)));

        VerificationResult result = verificationService.verify("qs-res");

        assertThat(result.kind()).isEqualTo(RecordKind.RESERVATION);
        assertThat(result.recordId()).isEqualTo("R-1");
        assertThat(result.triggerAttempted()).isTrue();
        assertThat(result.triggerConfirmed()).isTrue();

        ArgumentCaptor<TriggerEvent> captor = ArgumentCaptor.forClass(TriggerEvent.class);
        verify(triggerEmitter).emit(captor.capture());
        TriggerEvent event = captor.getValue();
        assertThat(event.summary()).isEqualTo("OPEN_DOOR");
        assertThat(event.roomId()).isEqualTo("door_control");
        assertThat(event.description()).contains("reservation").contains("R-1").contains("alice");
        assertThat(event.start()).isEqualTo(NOW);
        assertThat(event.end()).isEqualTo(NOW.plus(Duration.ofMinutes(1)));
        assertThat(event.eventId()).startsWith("trigger-" + NOW.toEpochMilli() + "-");

        assertThat(outcomeCount("success")).isEqualTo(1.0);
        assertThat(meterRegistry.counter("door.access.trigger.failures").count()).isZero();
    }

    @Test
    void verify_whenTriggerNotConfirmed_stillSucceedsAndLogsCriticalOnce(CapturedOutput output) {
        MatchedRecord match = temporaryMatch();
        when(secretResolver.resolve("qs-temp")).thenReturn(VerificationOutcome.of(Decision.ACCEPTED, match));
        when(secretInvalidator.invalidate(match)).thenReturn(true);
        when(triggerEmitter.emit(any())).thenReturn(Optional.empty());

        VerificationResult result = verificationService.verify("qs-temp");

        assertThat(result.triggerAttempted()).isTrue();
        assertThat(result.triggerConfirmed()).isFalse();
        assertThat(meterRegistry.counter("door.access.trigger.failures").count()).isEqualTo(1.0);
        assertThat(output.getAll().split("\\[CRITICAL]", -1)).hasSize(2);
    }

    @Test
    void verify_whenTriggerThrows_stillSucceeds() {
        MatchedRecord match = temporaryMatch();
        when(secretResolver.resolve("qs-temp")).thenReturn(VerificationOutcome.of(Decision.ACCEPTED, match));
        when(secretInvalidator.invalidate(match)).thenReturn(true);
        when(triggerEmitter.emit(any())).thenThrow(new ResourceAccessException("calendar unreachable"));

        VerificationResult result = verificationService.verify("qs-temp");

        assertThat(result.kind()).isEqualTo(RecordKind.TEMPORARY_ACCESS);
        assertThat(result.triggerConfirmed()).isFalse();
        assertThat(meterRegistry.counter("door.access.trigger.failures").count()).isEqualTo(1.0);
        assertThat(outcomeCount("success")).isEqualTo(1.0);
    }

    @Test
    void verify_whenStoreFails_propagatesInfraError() {
        when(secretResolver.resolve("qs-res")).thenThrow(new RecordStoreException("store down"));

        assertThatThrownBy(() -> verificationService.verify("qs-res"))
            .isInstanceOf(RecordStoreException.class);

        verify(secretInvalidator, never()).invalidate(any());
        assertThat(outcomeCount("infra_error")).isEqualTo(1.0);
    }

    private double outcomeCount(String outcome) {
        return meterRegistry.counter("door.access.verifications", "outcome", outcome).count();
    }

    private MatchedRecord reservationMatch() {
        Reservation reservation = new Reservation();
        reservation.setId("R-1");
        reservation.setUserName("alice");
        reservation.setQrSecret("qs-res");
        return new MatchedRecord.ReservationMatch(reservation);
    }

    private MatchedRecord temporaryMatch() {
        TemporaryAccess access = new TemporaryAccess();
        access.setId("qs-temp");
        access.setUserEmail("bob@example.com");
        access.setStatus(TemporaryAccessStatus.ACTIVE);
        return new MatchedRecord.TemporaryAccessMatch(access);
    }
}
