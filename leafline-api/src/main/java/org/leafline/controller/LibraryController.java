package org.leafline.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.leafline.model.dto.Book;
import org.leafline.model.dto.response.LibraryPageResponse;
import org.leafline.service.book.LibraryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/library/books")
@Tag(name = "Library", description = "Endpoints for browsing the shared library and removing uploaded books")
public class LibraryController {

    private final LibraryService libraryService;

    @Operation(summary = "List books", description = "Page through the shared library. When the caller is known, each book carries their reading progress.")
    @ApiResponse(responseCode = "200", description = "Books returned successfully")
    @GetMapping
    public LibraryPageResponse listBooks(
            @Parameter(description = "Case-insensitive match on title or author") @RequestParam(required = false) String search,
            @Parameter(description = "recent, added or title") @RequestParam(defaultValue = "recent") String sort,
            @Parameter(description = "1-based page number") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "Page size, at most 50") @RequestParam(defaultValue = "20") int limit) {
        return libraryService.listBooks(search, sort, page, limit);
    }

    @Operation(summary = "Get a book")
    @ApiResponse(responseCode = "200", description = "Book returned successfully")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @GetMapping("/{bookId}")
    public Book getBook(@Parameter(description = "ID of the book") @PathVariable Long bookId) {
        return libraryService.getBook(bookId);
    }

    @Operation(summary = "Delete a book", description = "Remove a book with its chapters, progress, highlights and bookmarks.")
    @ApiResponse(responseCode = "204", description = "Book deleted successfully")
    @DeleteMapping("/{bookId}")
    public ResponseEntity<Void> deleteBook(@Parameter(description = "ID of the book") @PathVariable Long bookId) {
        libraryService.deleteBook(bookId);
        return ResponseEntity.noContent().build();
    }
}
