package com.smartexpense.categorizer.controller;

import com.smartexpense.categorizer.model.ModelSnapshot;
import com.smartexpense.categorizer.service.CategorizationService;
import com.smartexpense.categorizer.service.KeywordLexicon;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and liveness endpoints. {@code /health} also touches the store, so a broken database
 * surfaces here as a 500.
 */
@RestController
public class HealthController {

    private final CategorizationService service;
    private final KeywordLexicon lexicon;

    public HealthController(CategorizationService service, KeywordLexicon lexicon) {
        this.service = service;
        this.lexicon = lexicon;
    }

    @GetMapping("/")
    public ResponseEntity<String> root() {
        return ResponseEntity.ok("ExpenseCategorizer API running");
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        ModelSnapshot snapshot = service.modelSnapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("lexiconCategories", lexicon.asMap().size());
        body.put("trainedDocs", snapshot.totalDocs());
        body.put("vocabSize", snapshot.vocabSize());
        return ResponseEntity.ok(body);
    }
}
