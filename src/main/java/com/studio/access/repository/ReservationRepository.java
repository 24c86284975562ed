package com.studio.access.repository;

import com.studio.access.entity.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface ReservationRepository extends JpaRepository<Reservation, String> {

    /**
     * Secrets are assumed unique among live records. A second match surfaces as
     * {@code IncorrectResultSizeDataAccessException}.
     */
    Optional<Reservation> findByQrSecret(String qrSecret);

    /**
     * Replaces the secret with {@code tombstone} only while the row still carries
     * {@code expectedSecret}. Returns the number of rows changed: 0 means another
     * request consumed the secret first.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reservation r SET r.qrSecret = :tombstone, r.updatedAt = :now "
        + "WHERE r.id = :id AND r.qrSecret = :expectedSecret")
    int consumeSecret(@Param("id") String id,
                      @Param("expectedSecret") String expectedSecret,
                      @Param("tombstone") String tombstone,
                      @Param("now") Instant now);
}
