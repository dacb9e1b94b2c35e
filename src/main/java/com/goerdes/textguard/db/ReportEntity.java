package com.goerdes.textguard.db;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The ranked matches produced for one submission, serialized as JSON. Immutable.
 */
@Entity
@Table(name = "report")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportEntity {

    @Id
    @GeneratedValue
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long submissionId;

    @Lob
    @Column(nullable = false, updatable = false)
    private String matchesJson;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

}
