package com.goerdes.textguard.db;

import com.goerdes.textguard.model.PageOrigin;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

import static jakarta.persistence.EnumType.STRING;

/**
 * A stored candidate document: a crawled web page or a locally indexed text.
 * Text and sketch are always written in the same row, so a page is never visible half-inserted.
 */
@Entity
@Table(name = "page", uniqueConstraints = @UniqueConstraint(columnNames = "url"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"text", "sketch"})
public class PageEntity {

    @Id
    @GeneratedValue
    private Long id;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(nullable = false, length = 2048)
    private String label;

    @Column(nullable = false)
    private String domain;

    @Enumerated(STRING)
    @Column(nullable = false)
    private PageOrigin origin;

    @Lob
    @Column(nullable = false)
    private String text;

    @Column(nullable = false, length = 64)
    private String contentHash;

    @Lob
    @Column(nullable = false)
    private byte[] sketch;

    private int wordCount;

    @Column(nullable = false)
    private Instant fetchedAt;

}
