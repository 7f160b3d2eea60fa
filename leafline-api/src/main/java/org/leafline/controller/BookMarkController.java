package org.leafline.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.leafline.model.dto.BookMark;
import org.leafline.model.dto.request.CreateBookMarkRequest;
import org.leafline.model.dto.request.UpdateBookMarkRequest;
import org.leafline.service.book.BookMarkService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/bookmarks")
@Tag(name = "Bookmarks", description = "Endpoints for managing bookmarks")
public class BookMarkController {

    private final BookMarkService bookMarkService;

    @Operation(summary = "Get bookmarks for a book", description = "All of the caller's bookmarks in a book, newest first.")
    @ApiResponse(responseCode = "200", description = "Bookmarks returned successfully")
    @GetMapping("/book/{bookId}")
    public List<BookMark> getBookmarksForBook(
            @Parameter(description = "ID of the book") @PathVariable Long bookId) {
        return bookMarkService.getBookmarksForBook(bookId);
    }

    @Operation(summary = "Create a bookmark")
    @ApiResponse(responseCode = "200", description = "Bookmark created successfully")
    @ApiResponse(responseCode = "409", description = "A bookmark already exists at this location")
    @PostMapping
    public BookMark createBookmark(
            @Parameter(description = "Bookmark creation request") @Valid @RequestBody CreateBookMarkRequest request) {
        return bookMarkService.createBookmark(request);
    }

    @Operation(summary = "Update a bookmark")
    @ApiResponse(responseCode = "200", description = "Bookmark updated successfully")
    @PutMapping("/{bookmarkId}")
    public BookMark updateBookmark(
            @Parameter(description = "ID of the bookmark") @PathVariable Long bookmarkId,
            @Parameter(description = "Bookmark update request") @Valid @RequestBody UpdateBookMarkRequest request) {
        return bookMarkService.updateBookmark(bookmarkId, request);
    }

    @Operation(summary = "Delete a bookmark")
    @ApiResponse(responseCode = "204", description = "Bookmark deleted successfully")
    @DeleteMapping("/{bookmarkId}")
    public ResponseEntity<Void> deleteBookmark(
            @Parameter(description = "ID of the bookmark") @PathVariable Long bookmarkId) {
        bookMarkService.deleteBookmark(bookmarkId);
        return ResponseEntity.noContent().build();
    }
}
