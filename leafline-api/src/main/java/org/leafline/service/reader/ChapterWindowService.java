package org.leafline.service.reader;

import lombok.RequiredArgsConstructor;
import org.leafline.config.AppProperties;
import org.leafline.exception.ApiError;
import org.leafline.mapper.BookChapterMapper;
import org.leafline.model.dto.ChapterMeta;
import org.leafline.model.dto.response.ChapterLocationResponse;
import org.leafline.model.dto.response.ChapterMetadataResponse;
import org.leafline.model.dto.response.ChapterWindowResponse;
import org.leafline.model.entity.BookEntity;
import org.leafline.repository.BookRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Serves a parsed book to the reader: the chapter table once, then bounded windows of
 * chapter markup as the reader scrolls.
 */
@Service
@RequiredArgsConstructor
public class ChapterWindowService {

    private static final Pattern CHAR_LOCATION = Pattern.compile("^char:(\\d+)$");
    private static final Pattern PAGE_LOCATION = Pattern.compile("^page:(\\d+)/(\\d+)$");
    private static final Pattern HIGHLIGHT_LOCATION = Pattern.compile("^hl:(\\d+):.*", Pattern.DOTALL);

    private final BookRepository bookRepository;
    private final ChapterStore chapterStore;
    private final BookChapterMapper chapterMapper;
    private final AppProperties appProperties;

    public ChapterMetadataResponse getMetadata(Long bookId) {
        BookEntity book = findParsedBook(bookId);
        List<ChapterMeta> chapters = chapterStore.findAll(bookId).stream()
                .map(chapterMapper::toMeta)
                .toList();
        return ChapterMetadataResponse.builder()
                .totalChapters(book.getTotalChapters())
                .totalCharacters(book.getTotalCharacters())
                .styles(book.getStyles() == null ? "" : book.getStyles())
                .chapters(chapters)
                .build();
    }

    /**
     * Chapters {@code from..to} inclusive. Missing bounds default to the configured window
     * starting at chapter 0; an oversized range is silently cut to the maximum window.
     */
    public ChapterWindowResponse getWindow(Long bookId, Integer from, Integer to) {
        AppProperties.Reader reader = appProperties.getReader();
        int start = from == null ? 0 : from;
        long end = to == null ? (long) start + reader.getDefaultWindowSize() - 1 : to;
        if (start < 0 || end < start) {
            throw ApiError.INVALID_CHAPTER_RANGE.createException(start, end);
        }
        end = Math.min(Math.min(end, (long) start + reader.getMaxWindowSize() - 1), Integer.MAX_VALUE);

        findParsedBook(bookId);
        return new ChapterWindowResponse(chapterStore.findRange(bookId, start, (int) end).stream()
                .map(chapterMapper::toChapter)
                .toList());
    }

    /**
     * Maps a saved reading location to the chapter that contains it, so a reader reopening
     * the book knows which window to fetch first.
     */
    public ChapterLocationResponse locate(Long bookId, String location) {
        BookEntity book = findParsedBook(bookId);
        List<ChapterMeta> chapters = chapterStore.findAll(bookId).stream()
                .map(chapterMapper::toMeta)
                .toList();
        if (chapters.isEmpty()) {
            return new ChapterLocationResponse(0, 0, 0);
        }

        String value = location == null ? "" : location.trim();
        Matcher highlight = HIGHLIGHT_LOCATION.matcher(value);
        if (highlight.matches()) {
            int index = clamp(parseLongSaturating(highlight.group(1)), 0, chapters.size() - 1);
            ChapterMeta chapter = chapters.get(index);
            return new ChapterLocationResponse(chapter.getChapterIndex(), chapter.getCharOffset(), 0);
        }

        long target = 0;
        Matcher chars = CHAR_LOCATION.matcher(value);
        Matcher page = PAGE_LOCATION.matcher(value);
        if (chars.matches()) {
            target = parseLongSaturating(chars.group(1));
        } else if (page.matches()) {
            long total = parseLongSaturating(page.group(2));
            if (total > 0) {
                double fraction = Math.min(1.0, (double) parseLongSaturating(page.group(1)) / total);
                target = (long) Math.floor(fraction * book.getTotalCharacters());
            }
        }
        return locateCharacter(chapters, target);
    }

    static ChapterLocationResponse locateCharacter(List<ChapterMeta> chapters, long target) {
        ChapterMeta match = chapters.get(chapters.size() - 1);
        for (ChapterMeta chapter : chapters) {
            if (target < (long) chapter.getCharOffset() + chapter.getCharLength()) {
                match = chapter;
                break;
            }
        }
        long inChapter = Math.max(0, Math.min(target - match.getCharOffset(), match.getCharLength()));
        return new ChapterLocationResponse(match.getChapterIndex(), match.getCharOffset() + (int) inChapter, (int) inChapter);
    }

    private BookEntity findParsedBook(Long bookId) {
        BookEntity book = bookRepository.findById(bookId)
                .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));
        if (!book.isParsed()) {
            throw ApiError.BOOK_NOT_PARSED.createException(bookId);
        }
        return book;
    }

    private static int clamp(long value, int min, int max) {
        return (int) Math.max(min, Math.min(max, value));
    }

    private static long parseLongSaturating(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
