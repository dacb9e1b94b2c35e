package com.goerdes.textguard.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goerdes.textguard.components.MinHashProvider;
import com.goerdes.textguard.components.PageCache;
import com.goerdes.textguard.components.Shingler;
import com.goerdes.textguard.db.PageEntity;
import com.goerdes.textguard.db.PageRepo;
import com.goerdes.textguard.db.ReportEntity;
import com.goerdes.textguard.db.ReportRepo;
import com.goerdes.textguard.db.SubmissionEntity;
import com.goerdes.textguard.db.SubmissionRepo;
import com.goerdes.textguard.index.BandedIndex;
import com.goerdes.textguard.index.IndexSnapshotStore;
import com.goerdes.textguard.model.Candidate;
import com.goerdes.textguard.model.MatchResult;
import com.goerdes.textguard.model.PageOrigin;
import com.goerdes.textguard.model.PageSummary;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static com.goerdes.textguard.utils.ByteUtils.computeSha256;
import static com.goerdes.textguard.utils.ByteUtils.packIntsToBytes;
import static com.goerdes.textguard.utils.ByteUtils.unpackBytesToInts;

/**
 * Owns the durable corpus: the page table, the in-memory {@link BandedIndex} with its snapshot,
 * the page cache and the append-only submission and report tables.
 * <p>
 * Page mutations are serialized by one lock that spans the database commit, the index update
 * and the snapshot flush. A page becomes visible in the index only after its row (text and
 * sketch together) is committed, so readers resolving index ids never see half a page.
 */
@Service
@RequiredArgsConstructor
public class CorpusStore {

    private static final Logger log = LoggerFactory.getLogger(CorpusStore.class);

    public static final String LOCAL_URL_PREFIX = "corpus://";
    public static final String LOCAL_DOMAIN = "local";

    private final PageRepo pageRepo;
    private final SubmissionRepo submissionRepo;
    private final ReportRepo reportRepo;
    private final BandedIndex index;
    private final IndexSnapshotStore snapshotStore;
    private final PageCache pageCache;
    private final MinHashProvider minHashProvider;
    private final Shingler shingler;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final ReentrantLock mutationLock = new ReentrantLock(true);

    /**
     * Brings the index in line with the page table: pages missing from the index are re-inserted
     * from their stored sketches and index entries without a row are dropped.
     */
    @PostConstruct
    public void init() {
        mutationLock.lock();
        try {
            Set<Long> stored = new HashSet<>();
            int restored = 0;
            for (PageEntity page : pageRepo.findAll()) {
                stored.add(page.getId());
                if (!index.contains(page.getId())) {
                    int[] sketch = unpackBytesToInts(page.getSketch());
                    if (sketch.length != minHashProvider.permutations()) {
                        sketch = minHashProvider.sketch(shingler.shingles(page.getText()));
                    }
                    index.insert(page.getId(), sketch);
                    restored++;
                }
            }
            int dropped = 0;
            for (Long id : index.documentIds()) {
                if (!stored.contains(id)) {
                    index.remove(id);
                    dropped++;
                }
            }
            if (restored > 0 || dropped > 0) {
                log.info("Reconciled index with page table: {} restored, {} dropped", restored, dropped);
                flush();
            }
            log.info("Corpus ready: {} pages indexed", index.size());
        } finally {
            mutationLock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Flushing index snapshot on shutdown");
        flush();
    }

    /**
     * Inserts or replaces the page stored under the URL and updates the index.
     *
     * @return the stored page
     */
    public PageEntity upsertPage(String url, String label, String domain, PageOrigin origin, String text) {
        List<String> tokens = shingler.tokens(text);
        int[] sketch = minHashProvider.sketch(shingler.shingles(tokens));
        String contentHash = computeSha256(text);

        mutationLock.lock();
        try {
            PageEntity saved = transactionTemplate.execute(status -> {
                PageEntity page = pageRepo.findByUrl(url).orElseGet(PageEntity::new);
                page.setUrl(url);
                page.setLabel(label);
                page.setDomain(domain);
                page.setOrigin(origin);
                page.setText(text);
                page.setContentHash(contentHash);
                page.setSketch(packIntsToBytes(sketch));
                page.setWordCount(tokens.size());
                page.setFetchedAt(clock.instant());
                return pageRepo.save(page);
            });
            index.insert(saved.getId(), sketch);
            flush();
            log.debug("Stored page {} ({}) with {} words", saved.getId(), url, tokens.size());
            return saved;
        } finally {
            mutationLock.unlock();
        }
    }

    public Optional<Candidate> candidate(long pageId) {
        return pageRepo.findById(pageId).map(CorpusStore::toCandidate);
    }

    public Optional<Long> findIdByUrl(String url) {
        return pageRepo.findByUrl(url).map(PageEntity::getId);
    }

    public List<PageSummary> listPages() {
        return pageRepo.findAll().stream()
                .map(p -> new PageSummary(p.getId(), p.getLabel(), p.getUrl(), p.getDomain(),
                        p.getOrigin(), p.getWordCount(), p.getFetchedAt()))
                .toList();
    }

    /**
     * Empties the index, the page table and the page cache as one step with respect to other
     * corpus mutations. Submissions and reports are kept.
     */
    public void clear() {
        mutationLock.lock();
        try {
            index.clear();
            transactionTemplate.executeWithoutResult(status -> pageRepo.deleteAllInBatch());
            try {
                pageCache.clear();
            } catch (RuntimeException e) {
                log.error("Failed to clear page cache: {}", e.getMessage());
            }
            flush();
            log.info("Corpus cleared");
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Appends the audit record for a check. Storage failures are logged and yield empty.
     */
    public Optional<Long> recordSubmission(String userRef, String text, int[] sketch,
                                           double plagiarismScore, String sourceFilename) {
        try {
            SubmissionEntity saved = submissionRepo.save(SubmissionEntity.builder()
                    .userRef(userRef)
                    .text(text)
                    .sketch(packIntsToBytes(sketch))
                    .plagiarismScore(plagiarismScore)
                    .sourceFilename(sourceFilename)
                    .createdAt(clock.instant())
                    .build());
            return Optional.of(saved.getId());
        } catch (RuntimeException e) {
            log.error("Failed to persist submission: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Appends the report of a submission. Storage failures are logged and yield empty.
     */
    public Optional<Long> recordReport(Long submissionId, List<MatchResult> matches) {
        if (submissionId == null) {
            return Optional.empty();
        }
        try {
            ReportEntity saved = reportRepo.save(ReportEntity.builder()
                    .submissionId(submissionId)
                    .matchesJson(mapper.writeValueAsString(matches))
                    .createdAt(clock.instant())
                    .build());
            return Optional.of(saved.getId());
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to persist report for submission {}: {}", submissionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes the index snapshot. Failures are logged; the in-memory index stays authoritative.
     */
    public void flush() {
        try {
            snapshotStore.save(index);
        } catch (IOException e) {
            log.error("Failed to write index snapshot {}: {}", snapshotStore.path(), e.getMessage());
        }
    }

    public int indexedCount() {
        return index.size();
    }

    static Candidate toCandidate(PageEntity page) {
        return new Candidate(page.getId(), page.getLabel(), page.getUrl(), page.getOrigin(), page.getText());
    }
}
