package com.goerdes.textguard.services;

import com.goerdes.textguard.components.MinHashProvider;
import com.goerdes.textguard.components.Shingler;
import com.goerdes.textguard.db.PageEntity;
import com.goerdes.textguard.exception.InvalidInputException;
import com.goerdes.textguard.index.BandedIndex;
import com.goerdes.textguard.model.Candidate;
import com.goerdes.textguard.model.CheckOptions;
import com.goerdes.textguard.model.ExtractionResult;
import com.goerdes.textguard.model.FetchOutcome;
import com.goerdes.textguard.model.MatchReport;
import com.goerdes.textguard.model.PageOrigin;
import com.goerdes.textguard.model.PageSummary;
import com.goerdes.textguard.model.ScoringResult;
import com.goerdes.textguard.utils.TimeBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.goerdes.textguard.model.FetchOutcome.Status.BLOCKED;
import static com.goerdes.textguard.model.FetchOutcome.Status.FAILED;
import static com.goerdes.textguard.model.FetchOutcome.Status.FETCHED;
import static com.goerdes.textguard.model.FetchOutcome.Status.SKIPPED;
import static com.goerdes.textguard.services.CorpusStore.LOCAL_DOMAIN;
import static com.goerdes.textguard.services.CorpusStore.LOCAL_URL_PREFIX;

/**
 * Entry point for checking submissions against the corpus and the web, and for maintaining
 * the local corpus.
 */
@Service
public class PlagiarismCheckService {

    private static final Logger log = LoggerFactory.getLogger(PlagiarismCheckService.class);

    private final Shingler shingler;
    private final MinHashProvider minHashProvider;
    private final BandedIndex index;
    private final CorpusStore corpusStore;
    private final CandidateDiscovery discovery;
    private final CrawlCacheManager crawler;
    private final CandidateScorer scorer;
    private final TextHandlerRegistry handlerRegistry;
    private final Duration checkBudget;
    private final int maxChars;

    public PlagiarismCheckService(Shingler shingler,
                                  MinHashProvider minHashProvider,
                                  BandedIndex index,
                                  CorpusStore corpusStore,
                                  CandidateDiscovery discovery,
                                  CrawlCacheManager crawler,
                                  CandidateScorer scorer,
                                  TextHandlerRegistry handlerRegistry,
                                  @Value("${textguard.check.budget:60s}") Duration checkBudget,
                                  @Value("${textguard.input.max-chars:500000}") int maxChars) {
        this.shingler = shingler;
        this.minHashProvider = minHashProvider;
        this.index = index;
        this.corpusStore = corpusStore;
        this.discovery = discovery;
        this.crawler = crawler;
        this.scorer = scorer;
        this.handlerRegistry = handlerRegistry;
        this.checkBudget = checkBudget;
        this.maxChars = maxChars;
    }

    /**
     * Checks the text against locally indexed documents and, when enabled, discovered web pages.
     *
     * @throws InvalidInputException if the text is blank or too long
     */
    public MatchReport checkText(String text, CheckOptions options) {
        return check(text, null, options);
    }

    /**
     * Extracts the document's text and checks it like {@link #checkText}.
     *
     * @throws InvalidInputException if the file type is unsupported or no text can be extracted
     */
    public MatchReport checkDocument(byte[] content, String filename, CheckOptions options) {
        return check(extract(content, filename), filename, options);
    }

    /**
     * Stores the text under {@code corpus://<label>}, replacing an earlier document with the same label.
     *
     * @return the page id
     */
    public long indexText(String text, String label) {
        validate(text);
        String name = label == null || label.isBlank() ? "unnamed" : label.trim();
        PageEntity page = corpusStore.upsertPage(LOCAL_URL_PREFIX + name, name, LOCAL_DOMAIN, PageOrigin.LOCAL, text);
        log.info("Indexed '{}' as page {}", name, page.getId());
        return page.getId();
    }

    public long indexDocument(byte[] content, String filename) {
        return indexText(extract(content, filename), filename);
    }

    public void clearCorpus() {
        corpusStore.clear();
    }

    public List<PageSummary> listDocuments() {
        return corpusStore.listPages();
    }

    private MatchReport check(String text, String sourceFilename, CheckOptions options) {
        validate(text);
        CheckOptions opts = options == null ? CheckOptions.defaults() : options;
        TimeBudget budget = new TimeBudget(checkBudget);

        List<String> tokens = shingler.tokens(text);
        Set<String> queryShingles = shingler.shingles(tokens);
        int[] sketch = minHashProvider.sketch(queryShingles);
        if (queryShingles.isEmpty()) {
            log.info("Submission has no shingles, nothing to compare");
            return record(opts, text, sketch, sourceFilename, ScoringResult.empty(), List.of(), false);
        }

        List<Candidate> candidates = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (Long id : index.query(sketch)) {
            // ids whose row is gone were cleared concurrently
            corpusStore.candidate(id).ifPresent(c -> {
                seen.add(c.docId());
                candidates.add(c);
            });
        }
        log.debug("Index returned {} candidates", candidates.size());

        List<FetchOutcome> outcomes = List.of();
        if (opts.isWebSearch() && !budget.exhausted()) {
            List<String> urls = discovery.discover(tokens, opts.getMaxPhrases(), opts.getMaxCandidateUrls(), budget);
            outcomes = crawler.visitAll(urls, budget);
            for (FetchOutcome outcome : outcomes) {
                if (!outcome.hasText()) {
                    continue;
                }
                if (outcome.pageId() != null && !seen.add(outcome.pageId())) {
                    continue;
                }
                candidates.add(new Candidate(outcome.pageId(), outcome.url(), outcome.url(), PageOrigin.WEB, outcome.text()));
            }
        }
        boolean partial = budget.exhausted() || outcomes.stream().anyMatch(o -> o.status() == SKIPPED);

        ScoringResult scoring = scorer.score(queryShingles, text, candidates, opts.isUseSemantic(), opts.getTopK());
        log.info("Checked submission of {} tokens: {} candidates, {} matches, score {}",
                tokens.size(), scoring.candidatesCount(), scoring.matches().size(), scoring.plagiarismScore());
        return record(opts, text, sketch, sourceFilename, scoring, outcomes, partial);
    }

    private MatchReport record(CheckOptions opts, String text, int[] sketch, String sourceFilename,
                               ScoringResult scoring, List<FetchOutcome> outcomes, boolean partial) {
        Optional<Long> submissionId = corpusStore.recordSubmission(
                opts.getUserRef(), text, sketch, scoring.plagiarismScore(), sourceFilename);
        Optional<Long> reportId = corpusStore.recordReport(submissionId.orElse(null), scoring.matches());

        return MatchReport.builder()
                .submissionId(submissionId.orElse(null))
                .reportId(reportId.orElse(null))
                .plagiarismScore(scoring.plagiarismScore())
                .plagiarismPercent(scoring.plagiarismPercent())
                .matches(scoring.matches())
                .candidatesCount(scoring.candidatesCount())
                .urlsFetched(count(outcomes, FETCHED))
                .urlsBlocked(count(outcomes, BLOCKED))
                .urlsFailed(count(outcomes, FAILED))
                .partial(partial)
                .build();
    }

    private String extract(byte[] content, String filename) {
        ExtractionResult result = handlerRegistry.extract(filename, content);
        if (!result.isOk()) {
            throw new InvalidInputException("Cannot read '" + filename + "': " + result.failure() + " (" + result.detail() + ")");
        }
        return result.text();
    }

    private void validate(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("No text provided");
        }
        if (text.length() > maxChars) {
            throw new InvalidInputException("Text exceeds " + maxChars + " characters");
        }
    }

    private static int count(List<FetchOutcome> outcomes, FetchOutcome.Status status) {
        return (int) outcomes.stream().filter(o -> o.status() == status).count();
    }
}
