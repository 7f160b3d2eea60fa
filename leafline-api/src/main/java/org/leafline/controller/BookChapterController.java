package org.leafline.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.leafline.model.dto.request.ParseChaptersRequest;
import org.leafline.model.dto.response.ChapterLocationResponse;
import org.leafline.model.dto.response.ChapterMetadataResponse;
import org.leafline.model.dto.response.ChapterWindowResponse;
import org.leafline.model.dto.response.ParseChaptersResponse;
import org.leafline.service.reader.ChapterParseService;
import org.leafline.service.reader.ChapterWindowService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/library/chapters")
@Tag(name = "Book Chapters", description = "Endpoints for segmenting EPUBs and reading them chapter by chapter")
public class BookChapterController {

    private final ChapterWindowService chapterWindowService;
    private final ChapterParseService chapterParseService;

    @Operation(summary = "Get chapter metadata", description = "Chapter table of a parsed book without chapter HTML, plus the book's collected styles.")
    @ApiResponse(responseCode = "200", description = "Metadata returned successfully")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "Book has not been parsed yet")
    @GetMapping("/meta")
    public ChapterMetadataResponse getChapterMetadata(
            @Parameter(description = "ID of the book") @RequestParam Long bookId) {
        return chapterWindowService.getMetadata(bookId);
    }

    @Operation(summary = "Get a window of chapters",
            description = "Chapters from..to inclusive, with HTML. Defaults to the first ten chapters; ranges wider than twenty chapters are cut to twenty.")
    @ApiResponse(responseCode = "200", description = "Chapters returned successfully")
    @ApiResponse(responseCode = "400", description = "Invalid range")
    @GetMapping
    public ChapterWindowResponse getChapters(
            @Parameter(description = "ID of the book") @RequestParam Long bookId,
            @Parameter(description = "First chapter index, inclusive") @RequestParam(required = false) Integer from,
            @Parameter(description = "Last chapter index, inclusive") @RequestParam(required = false) Integer to) {
        return chapterWindowService.getWindow(bookId, from, to);
    }

    @Operation(summary = "Locate a reading position", description = "Resolve a saved location anchor to the chapter containing it.")
    @ApiResponse(responseCode = "200", description = "Location resolved")
    @GetMapping("/locate")
    public ChapterLocationResponse locate(
            @Parameter(description = "ID of the book") @RequestParam Long bookId,
            @Parameter(description = "Location anchor, e.g. char:1200 or page:3/10") @RequestParam(required = false) String location) {
        return chapterWindowService.locate(bookId, location);
    }

    @Operation(summary = "Parse a book into chapters", description = "Segment an uploaded EPUB. A no-op for books already parsed unless force is set.")
    @ApiResponse(responseCode = "200", description = "Book parsed or already parsed")
    @ApiResponse(responseCode = "422", description = "File is not a readable EPUB")
    @PostMapping("/parse")
    public ParseChaptersResponse parseChapters(
            @Parameter(description = "Parse request") @Valid @RequestBody ParseChaptersRequest request) {
        return chapterParseService.parseForCurrentUser(request.getBookId(), request.isForce());
    }
}
