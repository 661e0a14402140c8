package com.eyelevel.pdfcompressor.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One compression request's full lifecycle record.
 * <p>
 * {@code completedAt} is set if and only if the status is terminal, and {@code compressedSizeBytes}
 * is only ever populated for {@link JobStatus#COMPLETED} jobs. Status and timestamps are mutated
 * exclusively through {@link com.eyelevel.pdfcompressor.service.job.JobStore}.
 */
@Entity
@Table(name = "compression_jobs", indexes = @Index(name = "ix_compression_jobs_user_id", columnList = "user_id"))
@Data
public class CompressionJob {

    public static final int ORIGINAL_FILENAME_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Principal principal;

    /**
     * Read-only mirror of the owning principal's id, usable without initializing the lazy association.
     */
    @Column(name = "user_id", insertable = false, updatable = false)
    private UUID principalId;

    @Column(nullable = false, length = ORIGINAL_FILENAME_LENGTH)
    private String originalFilename;

    @Column(nullable = false)
    private long originalSizeBytes;

    @Column
    private Long compressedSizeBytes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CompressionProfile compressionLevel;

    @Column(nullable = false)
    private boolean preserveImages;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(length = 4000)
    private String errorMessage;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    @Column
    private Instant completedAt;
}
