package com.goerdes.textguard.db;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Audit record of one check request. Created once, never updated.
 */
@Entity
@Table(name = "submission")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"text", "sketch"})
public class SubmissionEntity {

    @Id
    @GeneratedValue
    private Long id;

    @Column(nullable = false)
    private String userRef;

    @Lob
    @Column(nullable = false)
    private String text;

    @Lob
    @Column(nullable = false)
    private byte[] sketch;

    private double plagiarismScore;

    private String sourceFilename;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

}
