package com.goerdes.textguard.services;

import com.goerdes.textguard.components.Shingler;
import com.goerdes.textguard.components.semantic.SemanticSimilarity;
import com.goerdes.textguard.model.Candidate;
import com.goerdes.textguard.model.MatchResult;
import com.goerdes.textguard.model.ScoringResult;
import com.goerdes.textguard.utils.ShingleUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Re-scores index and crawl candidates with exact Jaccard similarity, optionally blended with a
 * semantic score, and decides which candidates count as matches.
 * <p>
 * A candidate is accepted when {@code jaccard > jaccardThreshold} or
 * {@code semantic > semanticThreshold}. Sketches are never used for the reported score.
 */
@Service
public class CandidateScorer {

    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);

    private final Shingler shingler;
    private final ObjectProvider<SemanticSimilarity> semanticProvider;

    private final double jaccardWeight;
    private final double semanticWeight;
    private final double jaccardThreshold;
    private final double semanticThreshold;
    private final int semanticWindow;

    public CandidateScorer(Shingler shingler,
                           ObjectProvider<SemanticSimilarity> semanticProvider,
                           @Value("${textguard.scorer.jaccard-weight:0.6}") double jaccardWeight,
                           @Value("${textguard.scorer.semantic-weight:0.4}") double semanticWeight,
                           @Value("${textguard.scorer.jaccard-threshold:0.15}") double jaccardThreshold,
                           @Value("${textguard.scorer.semantic-threshold:0.6}") double semanticThreshold,
                           @Value("${textguard.scorer.semantic-window:2000}") int semanticWindow) {
        this.shingler = shingler;
        this.semanticProvider = semanticProvider;
        this.jaccardWeight = jaccardWeight;
        this.semanticWeight = semanticWeight;
        this.jaccardThreshold = jaccardThreshold;
        this.semanticThreshold = semanticThreshold;
        this.semanticWindow = semanticWindow;
    }

    /**
     * Scores every candidate against the query.
     *
     * @param queryShingles the query's shingle set
     * @param queryText     the query text, used for the semantic window
     * @param candidates    candidates from the index and the crawler
     * @param useSemantic   blend in the semantic collaborator when one is available
     * @param topK          maximum number of matches returned
     * @return accepted matches and the aggregate score
     */
    public ScoringResult score(Set<String> queryShingles, String queryText, List<Candidate> candidates,
                               boolean useSemantic, int topK) {
        if (queryShingles.isEmpty() || candidates.isEmpty()) {
            return new ScoringResult(List.of(), 0.0, candidates.size());
        }

        SemanticSimilarity semantic = useSemantic ? semanticProvider.getIfAvailable() : null;
        if (useSemantic && semantic == null) {
            log.debug("Semantic scoring requested but no SemanticSimilarity is available, using Jaccard only");
        }

        List<MatchResult> accepted = new ArrayList<>();
        Set<String> matchedShingles = new HashSet<>();

        for (Candidate candidate : candidates) {
            try {
                Set<String> candidateShingles = shingler.shingles(candidate.text());
                double jaccard = ShingleUtils.jaccard(queryShingles, candidateShingles);
                Double semanticScore = semantic == null ? null : semanticScore(semantic, queryText, candidate);

                boolean accept = jaccard > jaccardThreshold
                        || (semanticScore != null && semanticScore > semanticThreshold);
                log.debug("Candidate {} ({}): jaccard={}, semantic={}, accepted={}",
                        candidate.docId(), candidate.label(), jaccard, semanticScore, accept);
                if (!accept) {
                    continue;
                }

                Set<String> overlap = ShingleUtils.intersection(queryShingles, candidateShingles);
                matchedShingles.addAll(overlap);
                accepted.add(toMatch(candidate, jaccard, semanticScore, overlap.size()));
            } catch (RuntimeException e) {
                log.warn("Skipping candidate {} after scoring failure: {}", candidate.label(), e.getMessage());
            }
        }

        accepted.sort(Comparator.comparingDouble(MatchResult::getCombinedScore).reversed());
        List<MatchResult> top = accepted.size() > topK ? new ArrayList<>(accepted.subList(0, Math.max(0, topK))) : accepted;

        double score = Math.min(1.0, Math.max(0.0, (double) matchedShingles.size() / queryShingles.size()));
        return new ScoringResult(top, score, candidates.size());
    }

    /**
     * Combined ranking score: the weighted blend when a semantic score exists, otherwise the
     * Jaccard value alone.
     */
    public double combine(double jaccard, Double semantic) {
        return semantic == null ? jaccard : jaccardWeight * jaccard + semanticWeight * semantic;
    }

    private Double semanticScore(SemanticSimilarity semantic, String queryText, Candidate candidate) {
        try {
            double s = semantic.similarity(window(queryText), window(candidate.text()));
            if (Double.isNaN(s)) {
                return null;
            }
            return Math.min(1.0, Math.max(0.0, s));
        } catch (RuntimeException e) {
            log.warn("Semantic scoring failed for {}, falling back to Jaccard: {}", candidate.label(), e.getMessage());
            return null;
        }
    }

    private String window(String text) {
        return text.length() <= semanticWindow ? text : text.substring(0, semanticWindow);
    }

    private MatchResult toMatch(Candidate candidate, double jaccard, Double semanticScore, int overlap) {
        MatchResult match = new MatchResult();
        match.setDocId(candidate.docId());
        match.setLabel(candidate.label());
        match.setUrl(candidate.url());
        match.setOrigin(candidate.origin());
        match.setJaccard(Math.round(jaccard * 100_000.0) / 100_000.0);
        match.setSemantic(semanticScore);
        match.setMatchedShingles(overlap);
        match.setCombinedScore(combine(jaccard, semanticScore));
        return match;
    }

}
