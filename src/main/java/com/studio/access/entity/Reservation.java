package com.studio.access.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A booked room slot whose QR secret opens the door during the booking.
 *
 * <p>{@link #date}, {@link #startTime} and {@link #endTime} are kept as the literal
 * strings written by the booking flow ({@code yyyy-MM-dd} and {@code HH:mm}) and are
 * interpreted as wall clock time in the configured access zone. An {@code endTime}
 * earlier than {@code startTime} means the booking runs past midnight.
 *
 * <p><strong>Consumption</strong>: once the secret is verified, {@link #qrSecret} is
 * overwritten with a tombstone {@code USED_<epochMillis>_<secret>}. The tombstone keeps
 * the original value traceable but can never equal a live secret. This is the terminal
 * event of the record; it is never deleted by this service.
 */
@Entity
@Table(name = "reservations")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Reservation extends BaseEntity {

    public static final String TOMBSTONE_PREFIX = "USED_";

    /** Booking reference number. */
    @Id
    @Column(name = "id", nullable = false, length = 64)
    private String id;

    @Column(name = "room_id", length = 32)
    private String roomId;

    @Column(name = "user_name", length = 100)
    private String userName;

    @Column(name = "user_email", length = 255)
    private String userEmail;

    @Column(name = "booking_date", length = 10)
    private String date;

    @Column(name = "start_time", length = 8)
    private String startTime;

    @Column(name = "end_time", length = 8)
    private String endTime;

    @Column(name = "qr_secret", nullable = false, length = 512)
    private String qrSecret;
}
