package org.leafline.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.leafline.model.dto.Chapter;
import org.leafline.model.dto.request.ParseChaptersRequest;
import org.leafline.model.dto.response.ChapterLocationResponse;
import org.leafline.model.dto.response.ChapterMetadataResponse;
import org.leafline.model.dto.response.ChapterWindowResponse;
import org.leafline.model.dto.response.ParseChaptersResponse;
import org.leafline.service.reader.ChapterParseService;
import org.leafline.service.reader.ChapterWindowService;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookChapterControllerTest {

    @Mock
    private ChapterWindowService chapterWindowService;
    @Mock
    private ChapterParseService chapterParseService;

    @InjectMocks
    private BookChapterController controller;

    private final Long bookId = 1L;

    @Test
    void getChapterMetadata_delegatesToService() {
        ChapterMetadataResponse expected = ChapterMetadataResponse.builder().totalChapters(3).totalCharacters(900).build();
        when(chapterWindowService.getMetadata(bookId)).thenReturn(expected);

        ChapterMetadataResponse result = controller.getChapterMetadata(bookId);

        assertSame(expected, result);
        verify(chapterWindowService).getMetadata(bookId);
    }

    @Test
    void getChapters_passesOptionalBoundsThrough() {
        ChapterWindowResponse window = new ChapterWindowResponse(List.of(Chapter.builder().chapterIndex(0).html("<p/>").build()));
        when(chapterWindowService.getWindow(bookId, null, null)).thenReturn(window);

        ChapterWindowResponse result = controller.getChapters(bookId, null, null);

        assertEquals(1, result.getChapters().size());
        verify(chapterWindowService).getWindow(bookId, null, null);
    }

    @Test
    void locate_returnsResolvedChapter() {
        when(chapterWindowService.locate(bookId, "char:10")).thenReturn(new ChapterLocationResponse(2, 10, 3));

        ChapterLocationResponse result = controller.locate(bookId, "char:10");

        assertEquals(2, result.getChapterIndex());
    }

    @Test
    void parseChapters_usesCallerScopedParse() {
        ParseChaptersResponse expected = ParseChaptersResponse.builder().bookId(bookId).totalChapters(4).build();
        when(chapterParseService.parseForCurrentUser(bookId, true)).thenReturn(expected);

        ParseChaptersResponse result = controller.parseChapters(new ParseChaptersRequest(bookId, true));

        assertSame(expected, result);
        verify(chapterParseService, never()).parse(anyLong(), anyBoolean());
    }
}
