package com.handcoach.orchestrator.controller;

import com.handcoach.common.exception.InvalidHandException;
import com.handcoach.common.model.HandRecord;
import com.handcoach.orchestrator.service.AnalysisReport;
import com.handcoach.orchestrator.service.HandAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/hands")
public class HandAnalysisController {

    private final HandAnalysisService handAnalysisService;

    public HandAnalysisController(HandAnalysisService handAnalysisService) {
        this.handAnalysisService = handAnalysisService;
    }

    @PostMapping("/analyze")
    public Mono<ResponseEntity<AnalysisReport>> analyze(@RequestBody HandRecord record) {
        return handAnalysisService.analyze(record).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(InvalidHandException.class)
    public ResponseEntity<Map<String, String>> invalidHand(InvalidHandException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
