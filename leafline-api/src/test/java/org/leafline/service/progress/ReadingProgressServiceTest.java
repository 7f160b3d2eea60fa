package org.leafline.service.progress;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.leafline.config.security.service.AuthenticationService;
import org.leafline.exception.APIException;
import org.leafline.mapper.ReadingProgressMapper;
import org.leafline.model.dto.LeaflineUser;
import org.leafline.model.dto.ReadingProgress;
import org.leafline.model.dto.request.ReadingProgressRequest;
import org.leafline.model.entity.BookEntity;
import org.leafline.model.entity.LeaflineUserEntity;
import org.leafline.model.entity.ReadingProgressEntity;
import org.leafline.repository.BookRepository;
import org.leafline.repository.ReadingProgressRepository;
import org.leafline.repository.UserRepository;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReadingProgressServiceTest {

    private static final Long USER_ID = 1L;
    private static final Long BOOK_ID = 10L;
    private static final Instant NOW = Instant.parse("2026-04-02T12:00:00Z");

    @Mock
    private ReadingProgressRepository progressRepository;
    @Mock
    private BookRepository bookRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private AuthenticationService authenticationService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ReadingProgressService service;
    private BookEntity book;

    @BeforeEach
    void setUp() {
        service = new ReadingProgressService(progressRepository, bookRepository, userRepository,
                authenticationService, Mappers.getMapper(ReadingProgressMapper.class), Clock.fixed(NOW, ZoneOffset.UTC),
                new TransactionTemplate(transactionManager));
        book = BookEntity.builder().id(BOOK_ID).title("Book").build();
    }

    private void authenticate() {
        when(authenticationService.getAuthenticatedUser())
                .thenReturn(LeaflineUser.builder().id(USER_ID).username("reader").build());
    }

    @Test
    void saveProgress_createsRowOnFirstSave() {
        authenticate();
        ReadingProgressEntity created = ReadingProgressEntity.builder().book(book).bookId(BOOK_ID).totalReadTime(0L).build();
        when(bookRepository.findById(BOOK_ID)).thenReturn(Optional.of(book));
        when(progressRepository.existsByUserIdAndBookId(USER_ID, BOOK_ID)).thenReturn(false);
        when(userRepository.getReferenceById(USER_ID)).thenReturn(LeaflineUserEntity.builder().id(USER_ID).build());
        when(bookRepository.getReferenceById(BOOK_ID)).thenReturn(book);
        when(progressRepository.findByUserIdAndBookIdForUpdate(USER_ID, BOOK_ID)).thenReturn(Optional.of(created));
        when(progressRepository.save(created)).thenReturn(created);

        ReadingProgress result = service.saveProgress(ReadingProgressRequest.builder()
                .bookId(BOOK_ID)
                .currentLocation("char:120")
                .percentage(42.5f)
                .readTimeDelta(30L)
                .build());

        ArgumentCaptor<ReadingProgressEntity> inserted = ArgumentCaptor.forClass(ReadingProgressEntity.class);
        verify(progressRepository).saveAndFlush(inserted.capture());
        assertEquals(0L, inserted.getValue().getTotalReadTime());
        assertEquals(BOOK_ID, result.getBookId());
        assertEquals("char:120", result.getCurrentLocation());
        assertEquals(42.5f, result.getPercentage());
        assertEquals(30L, result.getTotalReadTime());
        assertEquals(NOW, result.getLastReadAt());
    }

    @Test
    void saveProgress_concurrentInsertFallsThroughToUpdate() {
        authenticate();
        ReadingProgressEntity existing = ReadingProgressEntity.builder().book(book).bookId(BOOK_ID).totalReadTime(10L).build();
        when(bookRepository.findById(BOOK_ID)).thenReturn(Optional.of(book));
        when(progressRepository.existsByUserIdAndBookId(USER_ID, BOOK_ID)).thenReturn(false);
        when(progressRepository.saveAndFlush(any(ReadingProgressEntity.class)))
                .thenThrow(new DataIntegrityViolationException("uk_reading_progress_user_book"));
        when(progressRepository.findByUserIdAndBookIdForUpdate(USER_ID, BOOK_ID)).thenReturn(Optional.of(existing));
        when(progressRepository.save(existing)).thenReturn(existing);

        ReadingProgress result = service.saveProgress(ReadingProgressRequest.builder()
                .bookId(BOOK_ID).percentage(5f).readTimeDelta(2L).build());

        assertEquals(12L, result.getTotalReadTime());
        assertEquals(5f, result.getPercentage());
        verify(transactionManager).rollback(any());
    }

    @Test
    void saveProgress_keepsFieldsMissingFromRequestAndAccumulatesReadTime() {
        authenticate();
        ReadingProgressEntity existing = ReadingProgressEntity.builder()
                .book(book)
                .currentLocation("char:50")
                .percentage(10f)
                .totalReadTime(100L)
                .lastReadAt(NOW.minusSeconds(3600))
                .build();
        when(bookRepository.findById(BOOK_ID)).thenReturn(Optional.of(book));
        when(progressRepository.existsByUserIdAndBookId(USER_ID, BOOK_ID)).thenReturn(true);
        when(progressRepository.findByUserIdAndBookIdForUpdate(USER_ID, BOOK_ID)).thenReturn(Optional.of(existing));
        when(progressRepository.save(existing)).thenReturn(existing);

        ReadingProgress result = service.saveProgress(ReadingProgressRequest.builder()
                .bookId(BOOK_ID)
                .percentage(20f)
                .readTimeDelta(15L)
                .build());

        assertEquals("char:50", result.getCurrentLocation());
        assertEquals(20f, result.getPercentage());
        assertEquals(115L, result.getTotalReadTime());
        assertEquals(NOW, result.getLastReadAt());
        verify(progressRepository, never()).saveAndFlush(any());
        verify(userRepository, never()).getReferenceById(any());
    }

    @Test
    void saveProgress_negativeOrMissingDeltaDoesNotReduceReadTime() {
        authenticate();
        ReadingProgressEntity existing = ReadingProgressEntity.builder().book(book).totalReadTime(40L).build();
        when(bookRepository.findById(BOOK_ID)).thenReturn(Optional.of(book));
        when(progressRepository.existsByUserIdAndBookId(USER_ID, BOOK_ID)).thenReturn(true);
        when(progressRepository.findByUserIdAndBookIdForUpdate(USER_ID, BOOK_ID)).thenReturn(Optional.of(existing));
        when(progressRepository.save(existing)).thenReturn(existing);

        service.saveProgress(ReadingProgressRequest.builder().bookId(BOOK_ID).readTimeDelta(-20L).build());
        service.saveProgress(ReadingProgressRequest.builder().bookId(BOOK_ID).build());

        assertEquals(40L, existing.getTotalReadTime());
    }

    @Test
    void saveProgress_acceptsBookUploadedByAnotherUser() {
        authenticate();
        BookEntity shared = BookEntity.builder().id(BOOK_ID).userId(99L).title("Shared").build();
        ReadingProgressEntity existing = ReadingProgressEntity.builder().book(shared).bookId(BOOK_ID).totalReadTime(0L).build();
        when(bookRepository.findById(BOOK_ID)).thenReturn(Optional.of(shared));
        when(progressRepository.existsByUserIdAndBookId(USER_ID, BOOK_ID)).thenReturn(true);
        when(progressRepository.findByUserIdAndBookIdForUpdate(USER_ID, BOOK_ID)).thenReturn(Optional.of(existing));
        when(progressRepository.save(existing)).thenReturn(existing);

        ReadingProgress result = service.saveProgress(ReadingProgressRequest.builder().bookId(BOOK_ID).percentage(7f).build());

        assertEquals(7f, result.getPercentage());
    }

    @Test
    void saveProgress_rejectsMissingBook() {
        authenticate();
        when(bookRepository.findById(BOOK_ID)).thenReturn(Optional.empty());

        ReadingProgressRequest request = ReadingProgressRequest.builder().bookId(BOOK_ID).percentage(5f).build();
        assertThrows(APIException.class, () -> service.saveProgress(request));
        verify(progressRepository, never()).save(any());
        verifyNoInteractions(transactionManager);
    }

    @Test
    void getProgress_returnsNullWhenNothingSaved() {
        authenticate();
        when(bookRepository.findById(BOOK_ID)).thenReturn(Optional.of(book));
        when(progressRepository.findByUserIdAndBookId(USER_ID, BOOK_ID)).thenReturn(Optional.empty());

        assertNull(service.getProgress(BOOK_ID));
    }

    @Test
    void fetchUserProgress_keysByBookId() {
        BookEntity other = BookEntity.builder().id(11L).build();
        ReadingProgressEntity first = ReadingProgressEntity.builder().book(book).bookId(BOOK_ID).percentage(1f).build();
        ReadingProgressEntity second = ReadingProgressEntity.builder().book(other).bookId(11L).percentage(2f).build();
        when(progressRepository.findByUserIdAndBookIdIn(USER_ID, Set.of(BOOK_ID, 11L))).thenReturn(List.of(first, second));

        Map<Long, ReadingProgress> result = service.fetchUserProgress(USER_ID, Set.of(BOOK_ID, 11L));

        assertEquals(2, result.size());
        assertEquals(1f, result.get(BOOK_ID).getPercentage());
        assertEquals(2f, result.get(11L).getPercentage());
    }

    @Test
    void fetchUserProgress_emptyBookIdsSkipsQuery() {
        assertTrue(service.fetchUserProgress(USER_ID, Set.of()).isEmpty());
        verifyNoInteractions(progressRepository);
    }
}
