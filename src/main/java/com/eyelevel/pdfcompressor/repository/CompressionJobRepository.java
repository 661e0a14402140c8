package com.eyelevel.pdfcompressor.repository;

import com.eyelevel.pdfcompressor.model.CompressionJob;
import com.eyelevel.pdfcompressor.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link CompressionJob} entity.
 */
@Repository
public interface CompressionJobRepository extends JpaRepository<CompressionJob, UUID> {

    /**
     * Conditionally moves a job from {@code expectedStatus} to {@code newStatus} in a single statement.
     * The row count tells the caller whether it won the race: {@code 1} for the winner, {@code 0} for everyone else.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CompressionJob j SET j.status = :newStatus, j.updatedAt = :now "
           + "WHERE j.id = :id AND j.status = :expectedStatus")
    int updateStatusIfExpected(@Param("id") UUID id,
                               @Param("newStatus") JobStatus newStatus,
                               @Param("expectedStatus") JobStatus expectedStatus,
                               @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM CompressionJob j WHERE j.id = :id")
    Optional<CompressionJob> findByIdForUpdate(@Param("id") UUID id);

    Page<CompressionJob> findByPrincipalId(UUID principalId, Pageable pageable);

    long countByPrincipalId(UUID principalId);

    /**
     * Finds jobs stuck in one of the given statuses whose last update is older than the threshold.
     * Used by {@link com.eyelevel.pdfcompressor.scheduler.StaleJobRecoveryScheduler}.
     */
    List<CompressionJob> findByStatusInAndUpdatedAtBefore(Collection<JobStatus> statuses, Instant threshold);
}
