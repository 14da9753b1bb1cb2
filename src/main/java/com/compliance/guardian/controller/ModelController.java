package com.compliance.guardian.controller;

import com.compliance.guardian.engine.classifier.ClassifierModel;
import com.compliance.guardian.engine.classifier.ClassifierModelHolder;
import com.compliance.guardian.exception.ModelTrainingException;
import com.compliance.guardian.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Naive Bayes classifier training and metadata")
public class ModelController {

    private final ModelTrainingService trainingService;
    private final ClassifierModelHolder modelHolder;

    public ModelController(ModelTrainingService trainingService, ClassifierModelHolder modelHolder) {
        this.trainingService = trainingService;
        this.modelHolder = modelHolder;
    }

    @Operation(summary = "Retrain the classifier",
            description = "Trains on resolved cases (CLOSED = policy violation, FALSE_POSITIVE = benign) and " +
                    "on imported emails carrying a category label. The new model is persisted and becomes " +
                    "active immediately. Returns 422 and keeps the current model if the data is insufficient.")
    @PostMapping("/train")
    public ResponseEntity<?> train() {
        try {
            ClassifierModel model = trainingService.retrainFromHistory();
            return ResponseEntity.ok(metadata(model));
        } catch (ModelTrainingException e) {
            return ResponseEntity.unprocessableEntity()
                    .body(Map.of("error", e.getMessage(), "type", "MODEL_TRAINING"));
        }
    }

    @Operation(summary = "Get active model metadata",
            description = "Version, vocabulary size, classes, training samples and training timestamp.")
    @GetMapping("/active")
    public ResponseEntity<?> getActiveModel() {
        return modelHolder.current()
                .<ResponseEntity<?>>map(model -> ResponseEntity.ok(metadata(model)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static Map<String, Object> metadata(ClassifierModel model) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", model.getVersion());
        metadata.put("vocabularySize", model.getVocabularySize());
        metadata.put("classes", model.getClasses());
        metadata.put("trainingSamples", model.getTrainingSamples());
        metadata.put("trainedAt", model.getTrainedAt());
        return metadata;
    }
}
