package com.studio.access.repository;

import com.studio.access.entity.TemporaryAccess;
import com.studio.access.entity.TemporaryAccessStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface TemporaryAccessRepository extends JpaRepository<TemporaryAccess, String> {

    /**
     * Compare-and-set on {@code status}. Returns 1 when this call moved the grant from
     * {@code expected} to {@code target}, 0 when the guard no longer held.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TemporaryAccess t SET t.status = :target, t.updatedAt = :now "
        + "WHERE t.id = :id AND t.status = :expected")
    int transitionStatus(@Param("id") String id,
                         @Param("expected") TemporaryAccessStatus expected,
                         @Param("target") TemporaryAccessStatus target,
                         @Param("now") Instant now);
}
