package org.leafline.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.leafline.model.dto.Book;
import org.leafline.model.dto.response.LibraryPageResponse;
import org.leafline.service.book.LibraryService;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LibraryControllerTest {

    @Mock
    private LibraryService libraryService;

    @InjectMocks
    private LibraryController controller;

    @Test
    void listBooks_passesQueryThrough() {
        LibraryPageResponse expected = new LibraryPageResponse(
                List.of(Book.builder().id(1L).title("Dune").build()),
                new LibraryPageResponse.Pagination(2, 10, 11, 2));
        when(libraryService.listBooks("dune", "title", 2, 10)).thenReturn(expected);

        LibraryPageResponse result = controller.listBooks("dune", "title", 2, 10);

        assertSame(expected, result);
        assertEquals(2, result.getPagination().getTotalPages());
    }

    @Test
    void getBook_delegatesToService() {
        Book book = Book.builder().id(4L).title("Emma").build();
        when(libraryService.getBook(4L)).thenReturn(book);

        assertSame(book, controller.getBook(4L));
    }

    @Test
    void deleteBook_returnsNoContent() {
        ResponseEntity<Void> response = controller.deleteBook(4L);

        assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode());
        verify(libraryService).deleteBook(4L);
    }
}
