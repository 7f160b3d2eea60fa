package org.leafline.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.leafline.model.dto.ReadingProgress;
import org.leafline.model.dto.request.ReadingProgressRequest;
import org.leafline.service.progress.ReadingProgressService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/library/progress")
@Tag(name = "Reading Progress", description = "Endpoints for saving and restoring the caller's reading position")
public class ReadingProgressController {

    private final ReadingProgressService readingProgressService;

    @Operation(summary = "Get reading progress", description = "The caller's saved position in a book. Empty when nothing has been saved.")
    @ApiResponse(responseCode = "200", description = "Progress returned")
    @GetMapping
    public ResponseEntity<ReadingProgress> getProgress(
            @Parameter(description = "ID of the book") @RequestParam Long bookId) {
        return ResponseEntity.ok(readingProgressService.getProgress(bookId));
    }

    @Operation(summary = "Save reading progress", description = "Upsert the caller's position. Absent fields keep their stored values; read time is added.")
    @ApiResponse(responseCode = "200", description = "Progress saved")
    @PostMapping
    public ReadingProgress saveProgress(
            @Parameter(description = "Progress update") @Valid @RequestBody ReadingProgressRequest request) {
        return readingProgressService.saveProgress(request);
    }
}
