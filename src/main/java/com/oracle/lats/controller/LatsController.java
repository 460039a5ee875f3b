package com.oracle.lats.controller;

import com.oracle.lats.model.LatsRequest;
import com.oracle.lats.model.LatsResponse;
import com.oracle.lats.search.SearchAbortedException;
import com.oracle.lats.service.LatsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/lats")
@RequiredArgsConstructor
@Slf4j
public class LatsController {

    private final LatsService latsService;

    @PostMapping("/search")
    public ResponseEntity<LatsResponse> search(@Valid @RequestBody LatsRequest request) {
        log.info("Received LATS search request");
        try {
            return ResponseEntity.ok(latsService.search(request));
        } catch (SearchAbortedException e) {
            log.error("Search aborted: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(LatsResponse.builder()
                            .searchId(request.getSearchId())
                            .problem(request.getProblem())
                            .terminationState("ABORTED")
                            .metrics(e.getMetrics() != null ? e.getMetrics().toMap() : Map.of())
                            .error(e.getMessage())
                            .build());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(LatsResponse.builder()
                            .searchId(request.getSearchId())
                            .problem(request.getProblem())
                            .error(e.getMessage())
                            .build());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(LatsResponse.builder()
                            .searchId(request.getSearchId())
                            .problem(request.getProblem())
                            .error("Validation error: " + e.getMessage())
                            .build());
        }
    }

    @PostMapping("/search/{searchId}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String searchId) {
        if (latsService.cancel(searchId)) {
            return ResponseEntity.accepted().body(Map.of("searchId", searchId, "status", "CANCELLING"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("searchId", searchId, "status", "NOT_RUNNING"));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "Spring AI LATS"
        ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> fields = e.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        fe -> fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid",
                        (a, b) -> a, LinkedHashMap::new));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Validation failed");
        body.put("fields", fields);
        return ResponseEntity.badRequest().body(body);
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
