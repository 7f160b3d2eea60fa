package org.leafline.service.book;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.leafline.config.security.service.AuthenticationService;
import org.leafline.exception.APIException;
import org.leafline.mapper.BookMapper;
import org.leafline.mapper.ReadingProgressMapper;
import org.leafline.model.dto.Book;
import org.leafline.model.dto.LeaflineUser;
import org.leafline.model.dto.ReadingProgress;
import org.leafline.model.dto.response.LibraryPageResponse;
import org.leafline.model.entity.BookEntity;
import org.leafline.model.enums.BookFormat;
import org.leafline.repository.BookMarkRepository;
import org.leafline.repository.BookRepository;
import org.leafline.repository.HighlightRepository;
import org.leafline.repository.ReadingProgressRepository;
import org.leafline.service.progress.ReadingProgressService;
import org.leafline.service.reader.ChapterStore;
import org.leafline.service.storage.BlobStore;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LibraryServiceTest {

    private static final Long USER_ID = 1L;

    @Mock
    private BookRepository bookRepository;
    @Mock
    private ReadingProgressRepository progressRepository;
    @Mock
    private HighlightRepository highlightRepository;
    @Mock
    private BookMarkRepository bookMarkRepository;
    @Mock
    private ChapterStore chapterStore;
    @Mock
    private ReadingProgressService progressService;
    @Mock
    private AuthenticationService authenticationService;
    @Mock
    private BlobStore blobStore;

    private LibraryService service;

    @BeforeEach
    void setUp() {
        service = new LibraryService(bookRepository, progressRepository, highlightRepository, bookMarkRepository,
                chapterStore, progressService, authenticationService, blobStore,
                Mappers.getMapper(BookMapper.class), Mappers.getMapper(ReadingProgressMapper.class));
    }

    private static LeaflineUser reader() {
        return LeaflineUser.builder().id(USER_ID).username("reader").build();
    }

    private static BookEntity book(long id, String coverKey) {
        return BookEntity.builder()
                .id(id)
                .userId(99L)
                .createdAt(Instant.parse("2026-01-0" + id + "T00:00:00Z"))
                .title("Book " + id)
                .format(BookFormat.EPUB)
                .fileName("book" + id + ".epub")
                .coverKey(coverKey)
                .totalChapters(4)
                .parsedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }

    @Test
    void listBooks_attachesCallersProgressAndCoverUrl() {
        when(authenticationService.findAuthenticatedUser()).thenReturn(Optional.of(reader()));
        when(bookRepository.findAll(any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(book(1L, "covers/1.jpg"), book(2L, null))));
        when(progressService.fetchUserProgress(USER_ID, List.of(1L, 2L)))
                .thenReturn(Map.of(1L, ReadingProgress.builder().bookId(1L).percentage(33f).build()));
        when(blobStore.publicUrl("covers/1.jpg")).thenReturn("/api/v1/blobs/covers/1.jpg");

        LibraryPageResponse page = service.listBooks(null, "added", 1, 20);

        List<Book> books = page.getList();
        assertThat(books).hasSize(2);
        assertThat(books.get(0).getCoverUrl()).isEqualTo("/api/v1/blobs/covers/1.jpg");
        assertThat(books.get(0).getProgress().getPercentage()).isEqualTo(33f);
        assertThat(books.get(0).isParsed()).isTrue();
        assertThat(books.get(1).getCoverUrl()).isNull();
        assertThat(books.get(1).getProgress()).isNull();
        assertThat(page.getPagination().getTotal()).isEqualTo(2);
    }

    @Test
    void listBooks_anonymousCallerGetsBooksWithoutProgress() {
        when(authenticationService.findAuthenticatedUser()).thenReturn(Optional.empty());
        when(bookRepository.findAll(any(Pageable.class))).thenReturn(new PageImpl<>(List.of(book(1L, null))));

        LibraryPageResponse page = service.listBooks(null, null, 1, 20);

        assertThat(page.getList()).hasSize(1);
        assertThat(page.getList().get(0).getProgress()).isNull();
        verifyNoInteractions(progressService);
    }

    @Test
    void listBooks_clampsPagingAndSearchesTitleOrAuthor() {
        when(authenticationService.findAuthenticatedUser()).thenReturn(Optional.empty());
        when(bookRepository.findByTitleContainingIgnoreCaseOrAuthorContainingIgnoreCase(eq("tolkien"), eq("tolkien"), any(Pageable.class)))
                .thenReturn(Page.empty());

        LibraryPageResponse page = service.listBooks("  tolkien ", "title", 0, 500);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(bookRepository).findByTitleContainingIgnoreCaseOrAuthorContainingIgnoreCase(eq("tolkien"), eq("tolkien"), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isZero();
        assertThat(pageable.getValue().getPageSize()).isEqualTo(LibraryService.MAX_PAGE_SIZE);
        assertThat(pageable.getValue().getSort().getOrderFor("title")).isNotNull();
        assertThat(page.getPagination().getPage()).isEqualTo(1);
        assertThat(page.getPagination().getLimit()).isEqualTo(LibraryService.MAX_PAGE_SIZE);
        verify(bookRepository, never()).findAll(any(Pageable.class));
    }

    @Test
    void listBooks_recentOrdersByCallersLastReadThenUploadTime() {
        when(authenticationService.findAuthenticatedUser()).thenReturn(Optional.of(reader()));
        when(bookRepository.findAll(any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(book(3L, null), book(2L, null), book(1L, null))));
        when(progressService.fetchUserProgress(USER_ID, List.of(3L, 2L, 1L)))
                .thenReturn(Map.of(1L, ReadingProgress.builder().bookId(1L)
                        .lastReadAt(Instant.parse("2026-03-01T00:00:00Z")).build()));

        LibraryPageResponse page = service.listBooks(null, "recent", 1, 20);

        assertThat(page.getList()).extracting(Book::getId).containsExactly(1L, 3L, 2L);
    }

    @Test
    void getBook_isVisibleToOtherReadersWithTheirProgress() {
        when(bookRepository.findById(1L)).thenReturn(Optional.of(book(1L, null)));
        when(authenticationService.findAuthenticatedUser()).thenReturn(Optional.of(reader()));
        when(progressRepository.findByUserIdAndBookId(USER_ID, 1L)).thenReturn(Optional.empty());

        Book book = service.getBook(1L);

        assertThat(book.getId()).isEqualTo(1L);
        assertThat(book.getProgress()).isNull();
    }

    @Test
    void getBook_unknownBookIsNotFound() {
        when(bookRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getBook(5L)).isInstanceOf(APIException.class);
    }

    @Test
    void deleteBook_removesDependentRowsBeforeBook() {
        when(authenticationService.getAuthenticatedUser()).thenReturn(reader());
        when(bookRepository.findByIdAndUserId(1L, USER_ID)).thenReturn(Optional.of(book(1L, null)));

        service.deleteBook(1L);

        InOrder order = inOrder(chapterStore, progressRepository, highlightRepository, bookMarkRepository, bookRepository);
        order.verify(chapterStore).deleteChapters(1L);
        order.verify(progressRepository).deleteByBookId(1L);
        order.verify(highlightRepository).deleteByBookId(1L);
        order.verify(bookMarkRepository).deleteByBookId(1L);
        order.verify(bookRepository).deleteById(1L);
        verifyNoInteractions(blobStore);
    }
}
