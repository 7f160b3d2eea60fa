package org.leafline.service.book;

import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.config.security.service.AuthenticationService;
import org.leafline.exception.ApiError;
import org.leafline.mapper.HighlightMapper;
import org.leafline.model.dto.Highlight;
import org.leafline.model.dto.request.CreateHighlightRequest;
import org.leafline.model.dto.request.UpdateHighlightRequest;
import org.leafline.model.entity.BookEntity;
import org.leafline.model.entity.HighlightEntity;
import org.leafline.repository.BookRepository;
import org.leafline.repository.HighlightRepository;
import org.leafline.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class HighlightService {

    static final String DEFAULT_COLOR = "#FFFF00";

    private final HighlightRepository highlightRepository;
    private final BookRepository bookRepository;
    private final UserRepository userRepository;
    private final AuthenticationService authenticationService;
    private final HighlightMapper mapper;

    @Transactional(readOnly = true)
    public List<Highlight> getHighlightsForBook(Long bookId) {
        Long userId = getCurrentUserId();
        return highlightRepository.findByBookIdAndUserIdOrderByCreatedAtAsc(bookId, userId)
                .stream()
                .map(mapper::toDto)
                .toList();
    }

    @Transactional
    public Highlight createHighlight(CreateHighlightRequest request) {
        Long userId = getCurrentUserId();
        BookEntity book = findBook(request.getBookId());

        HighlightEntity highlight = HighlightEntity.builder()
                .location(request.getLocation())
                .text(request.getText())
                .note(request.getNote())
                .color(request.getColor() != null ? request.getColor() : DEFAULT_COLOR)
                .book(book)
                .user(userRepository.getReferenceById(userId))
                .build();

        log.info("Creating highlight for book {} by user {}", request.getBookId(), userId);
        return mapper.toDto(highlightRepository.save(highlight));
    }

    @Transactional
    public Highlight updateHighlight(Long highlightId, UpdateHighlightRequest request) {
        HighlightEntity highlight = findHighlightByIdAndUser(highlightId);
        Optional.ofNullable(request.getNote()).ifPresent(highlight::setNote);
        Optional.ofNullable(request.getColor()).ifPresent(highlight::setColor);
        log.info("Updating highlight {}", highlightId);
        return mapper.toDto(highlightRepository.save(highlight));
    }

    @Transactional
    public void deleteHighlight(Long highlightId) {
        HighlightEntity highlight = findHighlightByIdAndUser(highlightId);
        log.info("Deleting highlight {}", highlightId);
        highlightRepository.delete(highlight);
    }

    private Long getCurrentUserId() {
        return authenticationService.getAuthenticatedUser().getId();
    }

    private HighlightEntity findHighlightByIdAndUser(Long highlightId) {
        return highlightRepository.findByIdAndUserId(highlightId, getCurrentUserId())
                .orElseThrow(() -> new EntityNotFoundException("Highlight not found: " + highlightId));
    }

    private BookEntity findBook(Long bookId) {
        return bookRepository.findById(bookId)
                .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));
    }
}
