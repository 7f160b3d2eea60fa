package org.leafline.service.book;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.config.security.service.AuthenticationService;
import org.leafline.exception.ApiError;
import org.leafline.mapper.BookMarkMapper;
import org.leafline.model.dto.BookMark;
import org.leafline.model.dto.request.CreateBookMarkRequest;
import org.leafline.model.dto.request.UpdateBookMarkRequest;
import org.leafline.model.entity.BookEntity;
import org.leafline.model.entity.BookMarkEntity;
import org.leafline.repository.BookMarkRepository;
import org.leafline.repository.BookRepository;
import org.leafline.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class BookMarkService {

    private final BookMarkRepository bookMarkRepository;
    private final BookRepository bookRepository;
    private final UserRepository userRepository;
    private final AuthenticationService authenticationService;
    private final BookMarkMapper mapper;

    @Transactional(readOnly = true)
    public List<BookMark> getBookmarksForBook(Long bookId) {
        Long userId = getCurrentUserId();
        return bookMarkRepository.findByBookIdAndUserIdOrderByCreatedAtDesc(bookId, userId)
                .stream()
                .map(mapper::toDto)
                .toList();
    }

    @Transactional
    public BookMark createBookmark(CreateBookMarkRequest request) {
        Long userId = getCurrentUserId();
        BookEntity book = findBook(request.getBookId());
        if (bookMarkRepository.existsByLocationAndBookIdAndUserId(request.getLocation(), request.getBookId(), userId)) {
            throw ApiError.BOOKMARK_EXISTS.createException(request.getLocation());
        }

        BookMarkEntity bookmark = BookMarkEntity.builder()
                .location(request.getLocation())
                .title(request.getTitle())
                .note(request.getNote())
                .color(request.getColor())
                .book(book)
                .user(userRepository.getReferenceById(userId))
                .build();

        log.info("Creating bookmark for book {} by user {}", request.getBookId(), userId);
        return mapper.toDto(bookMarkRepository.save(bookmark));
    }

    @Transactional
    public BookMark updateBookmark(Long bookmarkId, UpdateBookMarkRequest request) {
        BookMarkEntity bookmark = findBookmarkByIdAndUser(bookmarkId);
        Optional.ofNullable(request.getTitle()).ifPresent(bookmark::setTitle);
        Optional.ofNullable(request.getNote()).ifPresent(bookmark::setNote);
        Optional.ofNullable(request.getColor()).ifPresent(bookmark::setColor);
        log.info("Updating bookmark {}", bookmarkId);
        return mapper.toDto(bookMarkRepository.save(bookmark));
    }

    @Transactional
    public void deleteBookmark(Long bookmarkId) {
        BookMarkEntity bookmark = findBookmarkByIdAndUser(bookmarkId);
        log.info("Deleting bookmark {}", bookmarkId);
        bookMarkRepository.delete(bookmark);
    }

    private Long getCurrentUserId() {
        return authenticationService.getAuthenticatedUser().getId();
    }

    private BookMarkEntity findBookmarkByIdAndUser(Long bookmarkId) {
        return bookMarkRepository.findByIdAndUserId(bookmarkId, getCurrentUserId())
                .orElseThrow(() -> new EntityNotFoundException("Bookmark not found: " + bookmarkId));
    }

    private BookEntity findBook(Long bookId) {
        return bookRepository.findById(bookId)
                .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));
    }
}
