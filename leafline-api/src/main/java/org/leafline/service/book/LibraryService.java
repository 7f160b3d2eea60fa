package org.leafline.service.book;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.config.security.service.AuthenticationService;
import org.leafline.exception.ApiError;
import org.leafline.mapper.BookMapper;
import org.leafline.mapper.ReadingProgressMapper;
import org.leafline.model.dto.Book;
import org.leafline.model.dto.ReadingProgress;
import org.leafline.model.dto.response.LibraryPageResponse;
import org.leafline.model.entity.BookEntity;
import org.leafline.model.enums.LibrarySort;
import org.leafline.repository.BookMarkRepository;
import org.leafline.repository.BookRepository;
import org.leafline.repository.HighlightRepository;
import org.leafline.repository.ReadingProgressRepository;
import org.leafline.service.progress.ReadingProgressService;
import org.leafline.service.reader.ChapterStore;
import org.leafline.service.storage.BlobStore;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class LibraryService {

    private final BookRepository bookRepository;
    private final ReadingProgressRepository progressRepository;
    private final HighlightRepository highlightRepository;
    private final BookMarkRepository bookMarkRepository;
    private final ChapterStore chapterStore;
    private final ReadingProgressService progressService;
    private final AuthenticationService authenticationService;
    private final BlobStore blobStore;
    private final BookMapper bookMapper;
    private final ReadingProgressMapper progressMapper;

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 50;

    /**
     * One page of the shared library. Anonymous callers get the books alone; a known caller
     * also gets their own progress on each book. Search matches title or author, ignoring case.
     */
    @Transactional(readOnly = true)
    public LibraryPageResponse listBooks(String search, String sort, int page, int limit) {
        LibrarySort order = LibrarySort.fromValue(sort);
        int pageNumber = Math.max(1, page);
        int pageSize = Math.min(MAX_PAGE_SIZE, Math.max(1, limit));
        Pageable pageable = PageRequest.of(pageNumber - 1, pageSize, order.toSort());

        String term = search == null ? "" : search.trim();
        Page<BookEntity> result = term.isEmpty()
                ? bookRepository.findAll(pageable)
                : bookRepository.findByTitleContainingIgnoreCaseOrAuthorContainingIgnoreCase(term, term, pageable);

        List<Long> bookIds = result.getContent().stream().map(BookEntity::getId).toList();
        Map<Long, ReadingProgress> progress = authenticationService.findAuthenticatedUser()
                .map(user -> progressService.fetchUserProgress(user.getId(), bookIds))
                .orElse(Collections.emptyMap());

        List<Book> books = new ArrayList<>(result.getContent().size());
        for (BookEntity entity : result.getContent()) {
            Book book = toDto(entity);
            book.setProgress(progress.get(entity.getId()));
            books.add(book);
        }
        if (order == LibrarySort.RECENT) {
            books.sort(Comparator.comparing(LibraryService::lastActivity, Comparator.nullsLast(Comparator.reverseOrder())));
        }

        return new LibraryPageResponse(books,
                new LibraryPageResponse.Pagination(pageNumber, pageSize, result.getTotalElements(), result.getTotalPages()));
    }

    @Transactional(readOnly = true)
    public Book getBook(Long bookId) {
        BookEntity entity = bookRepository.findById(bookId)
                .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));
        Book book = toDto(entity);
        authenticationService.findAuthenticatedUser()
                .flatMap(user -> progressRepository.findByUserIdAndBookId(user.getId(), bookId))
                .map(progressMapper::toDto)
                .ifPresent(book::setProgress);
        return book;
    }

    /**
     * Removes the book with its chapters, progress and annotations. Stored blobs (the upload,
     * cover and re-hosted assets) are left in place.
     */
    @Transactional
    public void deleteBook(Long bookId) {
        Long userId = authenticationService.getAuthenticatedUser().getId();
        BookEntity book = findOwnedBook(bookId, userId);
        chapterStore.deleteChapters(bookId);
        progressRepository.deleteByBookId(bookId);
        highlightRepository.deleteByBookId(bookId);
        bookMarkRepository.deleteByBookId(bookId);
        bookRepository.deleteById(book.getId());
        log.info("Deleted book {} for user {}", bookId, userId);
    }

    private static Instant lastActivity(Book book) {
        if (book.getProgress() != null && book.getProgress().getLastReadAt() != null) {
            return book.getProgress().getLastReadAt();
        }
        return book.getCreatedAt();
    }

    public Book toDto(BookEntity entity) {
        Book book = bookMapper.toBook(entity);
        if (entity.getCoverKey() != null) {
            book.setCoverUrl(blobStore.publicUrl(entity.getCoverKey()));
        }
        return book;
    }

    private BookEntity findOwnedBook(Long bookId, Long userId) {
        return bookRepository.findByIdAndUserId(bookId, userId)
                .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));
    }
}
