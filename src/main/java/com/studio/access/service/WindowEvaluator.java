package com.studio.access.service;

import com.studio.access.config.AccessProperties;
import com.studio.access.entity.Reservation;
import com.studio.access.entity.TemporaryAccess;
import com.studio.access.exception.MalformedRecordException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.function.Function;

/**
 * Decides whether "now" falls inside the interval a record permits. No I/O; every input
 * is passed in.
 *
 * <p>A stored date or time that does not parse raises {@link MalformedRecordException}.
 * It never counts as inside the window.
 */
@Component
public class WindowEvaluator {

    private final ZoneId zone;
    private final Duration reservationGrace;

    public WindowEvaluator(AccessProperties properties) {
        this.zone = properties.getZoneId();
        this.reservationGrace = properties.getReservationGrace();
    }

    public boolean isOpen(MatchedRecord match, Instant now) {
        if (match instanceof MatchedRecord.ReservationMatch r) {
            return reservationWindow(r.reservation()).contains(now);
        }
        if (match instanceof MatchedRecord.TemporaryAccessMatch t) {
            return temporaryAccessWindow(t.access()).contains(now);
        }
        throw new IllegalStateException("Unhandled record variant " + match.getClass().getName());
    }

    /**
     * {@code date + startTime} to {@code date + endTime}, with the end moved to the next
     * day when it is earlier than the start, then widened by the grace period.
     */
    public AccessWindow reservationWindow(Reservation reservation) {
        String id = reservation.getId();
        LocalDate date = parse(RecordKind.RESERVATION, id, "date", reservation.getDate(), LocalDate::parse);
        LocalTime startTime = parse(RecordKind.RESERVATION, id, "startTime", reservation.getStartTime(),
            LocalTime::parse);
        LocalTime endTime = parse(RecordKind.RESERVATION, id, "endTime", reservation.getEndTime(),
            LocalTime::parse);

        LocalDate endDate = endTime.isBefore(startTime) ? date.plusDays(1) : date;
        Instant start = date.atTime(startTime).atZone(zone).toInstant();
        Instant end = endDate.atTime(endTime).atZone(zone).toInstant();
        return new AccessWindow(start, end).widen(reservationGrace);
    }

    public AccessWindow temporaryAccessWindow(TemporaryAccess access) {
        String id = access.getId();
        Instant validFrom = parse(RecordKind.TEMPORARY_ACCESS, id, "validFrom", access.getValidFrom(),
            value -> OffsetDateTime.parse(value).toInstant());
        Instant validUntil = parse(RecordKind.TEMPORARY_ACCESS, id, "validUntil", access.getValidUntil(),
            value -> OffsetDateTime.parse(value).toInstant());
        return new AccessWindow(validFrom, validUntil);
    }

    private static <T> T parse(RecordKind kind, String recordId, String field, String value,
                               Function<String, T> parser) {
        if (value == null || value.isBlank()) {
            throw new MalformedRecordException(kind, recordId, field, value, null);
        }
        try {
            return parser.apply(value.trim());
        } catch (DateTimeParseException ex) {
            throw new MalformedRecordException(kind, recordId, field, value, ex);
        }
    }
}
