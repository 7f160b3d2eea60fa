package org.leafline.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.leafline.model.dto.Highlight;
import org.leafline.model.dto.request.CreateHighlightRequest;
import org.leafline.model.dto.request.UpdateHighlightRequest;
import org.leafline.service.book.HighlightService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/highlights")
@Tag(name = "Highlights", description = "Endpoints for managing text highlights and their notes")
public class HighlightController {

    private final HighlightService highlightService;

    @Operation(summary = "Get highlights for a book", description = "All of the caller's highlights in a book, oldest first.")
    @ApiResponse(responseCode = "200", description = "Highlights returned successfully")
    @GetMapping("/book/{bookId}")
    public List<Highlight> getHighlightsForBook(
            @Parameter(description = "ID of the book") @PathVariable Long bookId) {
        return highlightService.getHighlightsForBook(bookId);
    }

    @Operation(summary = "Create a highlight")
    @ApiResponse(responseCode = "200", description = "Highlight created successfully")
    @PostMapping
    public Highlight createHighlight(
            @Parameter(description = "Highlight creation request") @Valid @RequestBody CreateHighlightRequest request) {
        return highlightService.createHighlight(request);
    }

    @Operation(summary = "Update a highlight", description = "Change the note or color of a highlight.")
    @ApiResponse(responseCode = "200", description = "Highlight updated successfully")
    @PutMapping("/{highlightId}")
    public Highlight updateHighlight(
            @Parameter(description = "ID of the highlight") @PathVariable Long highlightId,
            @Parameter(description = "Highlight update request") @Valid @RequestBody UpdateHighlightRequest request) {
        return highlightService.updateHighlight(highlightId, request);
    }

    @Operation(summary = "Delete a highlight")
    @ApiResponse(responseCode = "204", description = "Highlight deleted successfully")
    @DeleteMapping("/{highlightId}")
    public ResponseEntity<Void> deleteHighlight(
            @Parameter(description = "ID of the highlight") @PathVariable Long highlightId) {
        highlightService.deleteHighlight(highlightId);
        return ResponseEntity.noContent().build();
    }
}
