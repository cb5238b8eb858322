package com.oracle.brokencalc.controller;

import com.oracle.brokencalc.model.BrokenKeysRequest;
import com.oracle.brokencalc.model.BrokenKeysResponse;
import com.oracle.brokencalc.model.EquivalenceRequest;
import com.oracle.brokencalc.model.SignatureReport;
import com.oracle.brokencalc.model.SignatureRequest;
import com.oracle.brokencalc.model.SolvabilityRequest;
import com.oracle.brokencalc.model.SolvabilityResponse;
import com.oracle.brokencalc.model.UniquenessRequest;
import com.oracle.brokencalc.model.UniquenessResponse;
import com.oracle.brokencalc.model.ValidateRequest;
import com.oracle.brokencalc.model.ValidationResult;
import com.oracle.brokencalc.service.BrokenKeyService;
import com.oracle.brokencalc.service.EquationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/calculator")
@RequiredArgsConstructor
@Slf4j
public class CalculatorController {

    private final EquationService equationService;
    private final BrokenKeyService brokenKeyService;

    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@Valid @RequestBody ValidateRequest request) {
        log.info("Received validate request for target {}", request.getTarget());
        return ResponseEntity.ok(equationService.validate(request.getEquation(), request.getTarget()));
    }

    @PostMapping("/equivalence")
    public ResponseEntity<Map<String, Object>> equivalence(@Valid @RequestBody EquivalenceRequest request) {
        log.info("Received equivalence request");
        boolean equivalent = equationService.areEquivalent(request.getFirst(), request.getSecond());
        Map<String, Object> body = Map.of(
            "equivalent", equivalent,
            "unique", !equivalent
        );
        return ResponseEntity.ok(body);
    }

    @PostMapping("/uniqueness")
    public ResponseEntity<UniquenessResponse> uniqueness(@Valid @RequestBody UniquenessRequest request) {
        log.info("Received uniqueness request against {} accepted equation(s)",
                request.getAccepted() == null ? 0 : request.getAccepted().size());
        return ResponseEntity.ok(equationService.checkUniqueness(request.getCandidate(), request.getAccepted()));
    }

    @PostMapping("/signature")
    public ResponseEntity<SignatureReport> signature(@Valid @RequestBody SignatureRequest request) {
        log.info("Received signature request");
        return ResponseEntity.ok(equationService.signature(request.getEquation()));
    }

    @PostMapping("/broken-keys")
    public ResponseEntity<BrokenKeysResponse> brokenKeys(@Valid @RequestBody BrokenKeysRequest request) {
        log.info("Received broken-keys request for target {} (count {})", request.getTarget(), request.getCount());
        return ResponseEntity.ok(brokenKeyService.generate(request.getTarget(), request.getCount(), request.getSeed()));
    }

    @PostMapping("/solvability")
    public ResponseEntity<SolvabilityResponse> solvability(@Valid @RequestBody SolvabilityRequest request) {
        log.info("Received solvability request for target {}", request.getTarget());
        return ResponseEntity.ok(brokenKeyService.checkSolvable(request.getTarget(), request.getBrokenKeys()));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Broken Calculator"
        ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Rejected request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of(
                "error", message,
                "type", e.getClass().getSimpleName()
            ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of(
                "error", "Malformed request body",
                "type", e.getClass().getSimpleName()
            ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e) {
        log.error("Unhandled exception: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of(
                "error", String.valueOf(e.getMessage()),
                "type", e.getClass().getSimpleName()
            ));
    }
}
