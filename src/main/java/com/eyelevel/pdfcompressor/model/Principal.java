package com.eyelevel.pdfcompressor.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The resolved identity of a caller. Created lazily on first use and never deleted by the pipeline.
 * Deleting a principal cascades to all of its {@link CompressionJob}s.
 */
@Entity
@Table(name = "users")
@Data
public class Principal {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true, length = 320)
    private String email;

    @Column(nullable = false, length = 200)
    private String fullName;

    @Column(nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @OneToMany(mappedBy = "principal", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<CompressionJob> jobs = new ArrayList<>();
}
