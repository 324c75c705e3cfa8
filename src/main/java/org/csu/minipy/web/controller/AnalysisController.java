package org.csu.minipy.web.controller;

import jakarta.validation.Valid;
import org.csu.minipy.web.dto.AnalysisRequest;
import org.csu.minipy.web.dto.AnalysisResponse;
import org.csu.minipy.web.service.AnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
public class AnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
        logger.info("Received analysis request (length: {} chars)", request.code().length());

        try {
            AnalysisResponse response = analysisService.analyze(request.normalizedCode());
            logger.info("Analysis completed - Success: {}", response.success());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Unexpected error during analysis: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(AnalysisResponse.requestError("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("MiniPy analyzer is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AnalysisResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");
        e.getBindingResult().getFieldErrors().forEach(error ->
                errorMessage.append(error.getField())
                        .append(" - ")
                        .append(error.getDefaultMessage())
                        .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);
        return ResponseEntity.badRequest().body(AnalysisResponse.requestError(errorMessage.toString()));
    }
}
