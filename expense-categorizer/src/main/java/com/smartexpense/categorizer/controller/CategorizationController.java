package com.smartexpense.categorizer.controller;

import com.smartexpense.categorizer.dto.PredictRequest;
import com.smartexpense.categorizer.dto.TrainRequest;
import com.smartexpense.categorizer.model.ImportSummary;
import com.smartexpense.categorizer.model.ModelSnapshot;
import com.smartexpense.categorizer.model.Suggestion;
import com.smartexpense.categorizer.service.CategorizationService;
import com.smartexpense.categorizer.service.TrainingDataService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/ml")
public class CategorizationController {

    private final CategorizationService service;
    private final TrainingDataService trainingDataService;

    public CategorizationController(CategorizationService service, TrainingDataService trainingDataService) {
        this.service = service;
        this.trainingDataService = trainingDataService;
    }

    /**
     * Suggest a category for an uncategorized transaction. Always answers 200; a suggestion
     * without a category means neither engine was confident.
     */
    @PostMapping(value = "/predict", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Suggestion predict(@RequestBody PredictRequest request) {
        if (request.getText() != null && !request.getText().isBlank()) {
            return service.predict(request.getText());
        }
        return service.predict(request.getNote(), request.getMerchant());
    }

    /**
     * Learn from a category the user set or edited.
     */
    @PostMapping(value = "/train", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> train(@Valid @RequestBody TrainRequest request) {
        double weight = request.getWeight() == null ? 1 : request.getWeight();
        if (request.getText() != null && !request.getText().isBlank()) {
            service.train(request.getTransactionId(), request.getText(), request.getCategory(), weight);
        } else {
            service.trainOnTransaction(request.getTransactionId(), request.getNote(), request.getMerchant(),
                    request.getCategory(), weight);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Upload a labelled export (form-data key 'file'). Supports .csv, .xlsx, .xls
     */
    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> importFile(@RequestParam("file") MultipartFile file) {
        try {
            ImportSummary summary = trainingDataService.importTrainingFile(file);
            return ResponseEntity.ok(summary);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Rejected training import {}: {}", file.getOriginalFilename(), e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/training-examples/export")
    public ResponseEntity<?> exportTrainingExamples() {
        try {
            byte[] bytes = trainingDataService.exportTrainingExamplesCsv();
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType("text/csv"));
            headers.setContentDisposition(ContentDisposition.attachment().filename("training_examples.csv").build());
            return ResponseEntity.ok().headers(headers).body(bytes);
        } catch (IOException e) {
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/model")
    public ModelSnapshot model() {
        return service.modelSnapshot();
    }

    /**
     * Forget everything learned so far (privacy wipe). The keyword lexicon is unaffected.
     */
    @DeleteMapping("/model")
    public ResponseEntity<Void> resetModel() {
        service.resetModel();
        return ResponseEntity.noContent().build();
    }
}
