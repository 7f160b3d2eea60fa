package org.leafline.service.progress;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.config.security.service.AuthenticationService;
import org.leafline.exception.ApiError;
import org.leafline.mapper.ReadingProgressMapper;
import org.leafline.model.dto.ReadingProgress;
import org.leafline.model.dto.request.ReadingProgressRequest;
import org.leafline.model.entity.BookEntity;
import org.leafline.model.entity.ReadingProgressEntity;
import org.leafline.repository.BookRepository;
import org.leafline.repository.ReadingProgressRepository;
import org.leafline.repository.UserRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
@Service
public class ReadingProgressService {

    private final ReadingProgressRepository progressRepository;
    private final BookRepository bookRepository;
    private final UserRepository userRepository;
    private final AuthenticationService authenticationService;
    private final ReadingProgressMapper mapper;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    @Transactional(readOnly = true)
    public ReadingProgress getProgress(Long bookId) {
        Long userId = authenticationService.getAuthenticatedUser().getId();
        findBook(bookId);
        return progressRepository.findByUserIdAndBookId(userId, bookId)
                .map(mapper::toDto)
                .orElse(null);
    }

    /**
     * Upserts the caller's position. Only the fields present in the request overwrite stored
     * values; read time is accumulated, never replaced.
     * <p>
     * Saves for one (user, book) pair may arrive concurrently from the debounce, periodic and
     * unload flushes of a client. The row is created first in its own transaction, tolerating a
     * concurrent insert, and the update then runs against a row locked for write.
     */
    public ReadingProgress saveProgress(ReadingProgressRequest request) {
        Long userId = authenticationService.getAuthenticatedUser().getId();
        Long bookId = findBook(request.getBookId()).getId();

        createProgressIfAbsent(userId, bookId);

        return transactionTemplate.execute(status -> {
            ReadingProgressEntity progress = progressRepository.findByUserIdAndBookIdForUpdate(userId, bookId)
                    .orElseThrow(() -> ApiError.GENERIC_NOT_FOUND.createException("Reading progress for book " + bookId));

            if (request.getCurrentLocation() != null) {
                progress.setCurrentLocation(request.getCurrentLocation());
            }
            if (request.getPercentage() != null) {
                progress.setPercentage(request.getPercentage());
            }
            long delta = request.getReadTimeDelta() == null ? 0L : Math.max(0L, request.getReadTimeDelta());
            long previous = progress.getTotalReadTime() == null ? 0L : progress.getTotalReadTime();
            progress.setTotalReadTime(previous + delta);
            progress.setLastReadAt(clock.instant());

            log.debug("Saving progress for book {} by user {}: {}%", bookId, userId, progress.getPercentage());
            return mapper.toDto(progressRepository.save(progress));
        });
    }

    private void createProgressIfAbsent(Long userId, Long bookId) {
        if (progressRepository.existsByUserIdAndBookId(userId, bookId)) {
            return;
        }
        try {
            transactionTemplate.executeWithoutResult(status -> progressRepository.saveAndFlush(
                    ReadingProgressEntity.builder()
                            .user(userRepository.getReferenceById(userId))
                            .book(bookRepository.getReferenceById(bookId))
                            .totalReadTime(0L)
                            .build()));
        } catch (DataIntegrityViolationException e) {
            log.debug("Progress for book {} and user {} was created by a concurrent save", bookId, userId);
        }
    }

    public Map<Long, ReadingProgress> fetchUserProgress(Long userId, Collection<Long> bookIds) {
        if (bookIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return progressRepository.findByUserIdAndBookIdIn(userId, bookIds).stream()
                .collect(Collectors.toMap(ReadingProgressEntity::getBookId, mapper::toDto));
    }

    private BookEntity findBook(Long bookId) {
        return bookRepository.findById(bookId)
                .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));
    }
}
