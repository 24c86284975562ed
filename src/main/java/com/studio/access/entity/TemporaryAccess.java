package com.studio.access.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An ad-hoc access grant. The {@link #id} doubles as the QR secret.
 *
 * <p>{@link #validFrom} and {@link #validUntil} are ISO-8601 instants with an offset
 * (usually {@code Z}), stored as text by the issuing flow. No grace period is applied
 * to them.
 */
@Entity
@Table(name = "temporary_access")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class TemporaryAccess extends BaseEntity {

    @Id
    @Column(name = "id", nullable = false, length = 255)
    private String id;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "user_email", length = 255)
    private String userEmail;

    @Column(name = "valid_from", length = 40)
    private String validFrom;

    @Column(name = "valid_until", length = 40)
    private String validUntil;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TemporaryAccessStatus status;
}
