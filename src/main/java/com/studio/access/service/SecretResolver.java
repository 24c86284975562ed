package com.studio.access.service;

import com.studio.access.entity.Reservation;
import com.studio.access.entity.TemporaryAccess;
import com.studio.access.entity.TemporaryAccessStatus;
import com.studio.access.exception.RecordStoreException;
import com.studio.access.repository.ReservationRepository;
import com.studio.access.repository.TemporaryAccessRepository;
import com.studio.access.service.VerificationOutcome.Decision;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Finds the record a presented secret belongs to and judges it against the clock.
 *
 * <p>Reservations are searched first and a reservation match is final: if its window is
 * closed the secret is rejected even when a temporary grant with the same id exists.
 * Temporary grants are only consulted when no reservation carries the secret. Read-only.
 */
@Service
@RequiredArgsConstructor
public class SecretResolver {

    private final ReservationRepository reservationRepository;
    private final TemporaryAccessRepository temporaryAccessRepository;
    private final WindowEvaluator windowEvaluator;
    private final Clock clock;

    public VerificationOutcome resolve(String secret) {
        Instant now = clock.instant();

        Optional<Reservation> reservation = lookup(() -> reservationRepository.findByQrSecret(secret),
            RecordKind.RESERVATION);
        if (reservation.isPresent()) {
            MatchedRecord match = new MatchedRecord.ReservationMatch(reservation.get());
            Decision decision = windowEvaluator.isOpen(match, now) ? Decision.ACCEPTED : Decision.REJECTED_EXPIRED;
            return VerificationOutcome.of(decision, match);
        }

        Optional<TemporaryAccess> access = lookup(() -> temporaryAccessRepository.findById(secret),
            RecordKind.TEMPORARY_ACCESS);
        if (access.isPresent()) {
            MatchedRecord match = new MatchedRecord.TemporaryAccessMatch(access.get());
            if (access.get().getStatus() != TemporaryAccessStatus.ACTIVE) {
                return VerificationOutcome.of(Decision.REJECTED_INACTIVE, match);
            }
            Decision decision = windowEvaluator.isOpen(match, now) ? Decision.ACCEPTED : Decision.REJECTED_EXPIRED;
            return VerificationOutcome.of(decision, match);
        }

        return VerificationOutcome.notFound();
    }

    private static <T> Optional<T> lookup(Supplier<Optional<T>> query, RecordKind kind) {
        try {
            return query.get();
        } catch (DataAccessException | TransactionException ex) {
            throw new RecordStoreException("Lookup in " + kind.label() + " records failed", ex);
        }
    }
}
