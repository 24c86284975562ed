package com.studio.access.service;

import com.studio.access.entity.Reservation;
import com.studio.access.entity.TemporaryAccess;

/**
 * The record a secret resolved to. Exactly one of the two variants; callers branch on
 * the variant rather than probing fields.
 */
public sealed interface MatchedRecord permits MatchedRecord.ReservationMatch, MatchedRecord.TemporaryAccessMatch {

    RecordKind kind();

    String recordId();

    /** Human identifier of whoever holds the secret. */
    String holder();

    record ReservationMatch(Reservation reservation) implements MatchedRecord {

        @Override
        public RecordKind kind() {
            return RecordKind.RESERVATION;
        }

        @Override
        public String recordId() {
            return reservation.getId();
        }

        @Override
        public String holder() {
            return reservation.getUserName();
        }
    }

    record TemporaryAccessMatch(TemporaryAccess access) implements MatchedRecord {

        @Override
        public RecordKind kind() {
            return RecordKind.TEMPORARY_ACCESS;
        }

        @Override
        public String recordId() {
            return access.getId();
        }

        @Override
        public String holder() {
            return access.getUserEmail();
        }
    }
}
