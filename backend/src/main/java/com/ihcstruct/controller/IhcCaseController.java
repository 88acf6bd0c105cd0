package com.ihcstruct.controller;

import com.ihcstruct.dto.mapper.CaseOutputMapper;
import com.ihcstruct.dto.request.BatchCaseRequest;
import com.ihcstruct.dto.request.IhcCaseRequest;
import com.ihcstruct.dto.response.CaseOutput;
import com.ihcstruct.dto.response.MarkerDefinitionDto;
import com.ihcstruct.service.IhcStructuringService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for structuring IHC findings.
 * A case always comes back 200 with its own status; 400 is only for malformed requests.
 */
@RestController
@RequestMapping("/api/ihc")
@RequiredArgsConstructor
@Slf4j
public class IhcCaseController {

    private final IhcStructuringService structuringService;
    private final CaseOutputMapper caseOutputMapper;

    /**
     * Structure a single case.
     */
    @PostMapping("/cases")
    public ResponseEntity<CaseOutput> structureCase(@Valid @RequestBody IhcCaseRequest request) {
        log.info("Structuring case: {}", request.inputId());
        CaseOutput output = structuringService.process(request);
        log.info("Case {} finished with status {}", output.inputId(), output.status().getValue());
        return ResponseEntity.ok(output);
    }

    /**
     * Structure several independent cases. Outputs keep the request order.
     */
    @PostMapping("/cases/batch")
    public ResponseEntity<List<CaseOutput>> structureBatch(@Valid @RequestBody BatchCaseRequest request) {
        log.info("Structuring batch of {} cases", request.cases().size());
        return ResponseEntity.ok(structuringService.processAll(request.cases()));
    }

    /**
     * List the loaded marker dictionary.
     */
    @GetMapping("/markers")
    public ResponseEntity<List<MarkerDefinitionDto>> getMarkers() {
        return ResponseEntity.ok(caseOutputMapper.toDefinitionDtos(structuringService.getMarkerDictionary()));
    }

    // ========================================================================
    // Exception Handling
    // ========================================================================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .collect(Collectors.joining("; "));
        log.warn("Rejected case request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }
}
