package com.studio.access.service;

import com.studio.access.entity.Reservation;
import com.studio.access.entity.TemporaryAccessStatus;
import com.studio.access.exception.RecordStoreException;
import com.studio.access.repository.ReservationRepository;
import com.studio.access.repository.TemporaryAccessRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;

/**
 * Consumes a matched record so its secret cannot open the door again.
 *
 * <p>Each variant is consumed by one conditional UPDATE guarded on the value that was
 * read during resolution. When two requests race on the same secret the database lets
 * exactly one UPDATE match; the other sees zero affected rows and this method returns
 * {@code false}.
 */
@Service
@RequiredArgsConstructor
public class SecretInvalidator {

    private final ReservationRepository reservationRepository;
    private final TemporaryAccessRepository temporaryAccessRepository;
    private final Clock clock;

    /**
     * @return {@code true} if this call consumed the record, {@code false} if it had
     *         already been consumed by someone else
     */
    public boolean invalidate(MatchedRecord match) {
        Instant now = clock.instant();
        int updated;
        try {
            if (match instanceof MatchedRecord.ReservationMatch r) {
                Reservation reservation = r.reservation();
                String secret = reservation.getQrSecret();
                updated = reservationRepository.consumeSecret(reservation.getId(), secret, tombstone(secret, now), now);
            } else if (match instanceof MatchedRecord.TemporaryAccessMatch t) {
                updated = temporaryAccessRepository.transitionStatus(t.access().getId(),
                    TemporaryAccessStatus.ACTIVE, TemporaryAccessStatus.EXPIRED, now);
            } else {
                throw new IllegalStateException("Unhandled record variant " + match.getClass().getName());
            }
        } catch (DataAccessException | TransactionException ex) {
            throw new RecordStoreException("Consuming " + match.kind().label() + " " + match.recordId() + " failed", ex);
        }
        return updated > 0;
    }

    static String tombstone(String secret, Instant now) {
        return Reservation.TOMBSTONE_PREFIX + now.toEpochMilli() + "_" + secret;
    }
}
