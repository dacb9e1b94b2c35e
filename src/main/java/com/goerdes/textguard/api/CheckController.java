package com.goerdes.textguard.api;

import com.goerdes.textguard.exception.TextProcessingException;
import com.goerdes.textguard.model.CheckOptions;
import com.goerdes.textguard.model.MatchReport;
import com.goerdes.textguard.model.PageSummary;
import com.goerdes.textguard.services.PlagiarismCheckService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class CheckController {

    private final PlagiarismCheckService checkService;

    /**
     * Checks the submitted text against the local corpus and discovered web pages.
     *
     * @param text         the text to check
     * @param userId       optional caller reference stored with the submission
     * @param maxPhrases   optional number of phrases sent to web search
     * @param maxUrls      optional cap on crawled URLs
     * @param useSemantic  blend in semantic similarity when available
     * @param topK         optional number of ranked matches
     * @param webSearch    set to false to check the local corpus only
     * @return the match report
     * @throws TextProcessingException if the text is blank or too long
     */
    @PostMapping("/check-text")
    public ResponseEntity<MatchReport> checkText(
            @RequestParam("text") String text,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "max_phrases", required = false) Integer maxPhrases,
            @RequestParam(value = "max_urls", required = false) Integer maxUrls,
            @RequestParam(value = "use_semantic", defaultValue = "false") boolean useSemantic,
            @RequestParam(value = "top_k", required = false) Integer topK,
            @RequestParam(value = "web_search", defaultValue = "true") boolean webSearch
    ) {
        CheckOptions options = options(userId, maxPhrases, maxUrls, useSemantic, topK, webSearch);
        return ResponseEntity.ok(checkService.checkText(text, options));
    }

    /**
     * Extracts the uploaded document's text and checks it like {@code /check-text}.
     *
     * @throws IOException if the upload cannot be read
     */
    @PostMapping("/check-file")
    public ResponseEntity<MatchReport> checkFile(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "max_phrases", required = false) Integer maxPhrases,
            @RequestParam(value = "max_urls", required = false) Integer maxUrls,
            @RequestParam(value = "use_semantic", defaultValue = "false") boolean useSemantic,
            @RequestParam(value = "top_k", required = false) Integer topK,
            @RequestParam(value = "web_search", defaultValue = "true") boolean webSearch
    ) throws IOException {
        CheckOptions options = options(userId, maxPhrases, maxUrls, useSemantic, topK, webSearch);
        return ResponseEntity.ok(checkService.checkDocument(file.getBytes(), file.getOriginalFilename(), options));
    }

    @PostMapping("/index-text")
    public ResponseEntity<Map<String, Object>> indexText(
            @RequestParam("text") String text,
            @RequestParam(value = "label", defaultValue = "text") String label
    ) {
        long id = checkService.indexText(text, label);
        return ResponseEntity.ok(Map.of("docId", id, "label", label));
    }

    @PostMapping("/index-file")
    public ResponseEntity<Map<String, Object>> indexFile(@RequestParam("file") MultipartFile file) throws IOException {
        long id = checkService.indexDocument(file.getBytes(), file.getOriginalFilename());
        return ResponseEntity.ok(Map.of("docId", id, "label", String.valueOf(file.getOriginalFilename())));
    }

    /**
     * Removes every indexed document and cached page. Submissions and reports are kept.
     */
    @PostMapping("/clear-index")
    public ResponseEntity<Void> clearIndex() {
        checkService.clearCorpus();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/list-docs")
    public ResponseEntity<List<PageSummary>> listDocs() {
        return ResponseEntity.ok(checkService.listDocuments());
    }

    @ExceptionHandler(TextProcessingException.class)
    public ResponseEntity<String> onError(TextProcessingException ex) {
        return ResponseEntity.badRequest().body(ex.getMessage());
    }

    private static CheckOptions options(String userId, Integer maxPhrases, Integer maxUrls,
                                        boolean useSemantic, Integer topK, boolean webSearch) {
        CheckOptions.CheckOptionsBuilder builder = CheckOptions.builder()
                .useSemantic(useSemantic)
                .webSearch(webSearch);
        if (userId != null && !userId.isBlank()) {
            builder.userRef(userId);
        }
        if (maxPhrases != null) {
            builder.maxPhrases(maxPhrases);
        }
        if (maxUrls != null) {
            builder.maxCandidateUrls(maxUrls);
        }
        if (topK != null) {
            builder.topK(topK);
        }
        return builder.build();
    }

}
