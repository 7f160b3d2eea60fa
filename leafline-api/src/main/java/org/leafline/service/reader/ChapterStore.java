package org.leafline.service.reader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.exception.ApiError;
import org.leafline.model.entity.BookChapterEntity;
import org.leafline.model.entity.BookEntity;
import org.leafline.repository.BookChapterRepository;
import org.leafline.repository.BookRepository;
import org.leafline.util.epub.SegmentationResult;
import org.leafline.util.epub.SegmentedChapter;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists segmented chapters. Offsets are assigned here as a running sum of chapter
 * lengths, so {@code charOffset[i] = charOffset[i-1] + charLength[i-1]} holds for every
 * stored book.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChapterStore {

    private final BookChapterRepository chapterRepository;
    private final BookRepository bookRepository;

    /**
     * Replaces every chapter of the book with {@code result} and marks it parsed. Old and new
     * rows are never visible together.
     */
    @Transactional
    public BookEntity replaceChapters(Long bookId, SegmentationResult result, Instant parsedAt) {
        int removed = chapterRepository.deleteByBookId(bookId);
        BookEntity book = bookRepository.findById(bookId)
                .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));

        List<BookChapterEntity> rows = new ArrayList<>(result.chapters().size());
        int offset = 0;
        int index = 0;
        for (SegmentedChapter chapter : result.chapters()) {
            rows.add(BookChapterEntity.builder()
                    .book(book)
                    .chapterIndex(index++)
                    .href(chapter.href())
                    .html(chapter.html())
                    .charOffset(offset)
                    .charLength(chapter.charLength())
                    .build());
            offset += chapter.charLength();
        }
        chapterRepository.saveAll(rows);

        book.setTotalChapters(rows.size());
        book.setTotalCharacters(offset);
        book.setStyles(result.styles());
        book.setParsedAt(parsedAt);
        if (removed > 0) {
            log.debug("Replaced {} existing chapters of book {}", removed, bookId);
        }
        return bookRepository.save(book);
    }

    @Transactional(readOnly = true)
    public List<BookChapterEntity> findAll(Long bookId) {
        return chapterRepository.findByBookIdOrderByChapterIndexAsc(bookId);
    }

    @Transactional(readOnly = true)
    public List<BookChapterEntity> findRange(Long bookId, int from, int to) {
        return chapterRepository.findByBookIdAndChapterIndexBetweenOrderByChapterIndexAsc(bookId, from, to);
    }

    @Transactional
    public void deleteChapters(Long bookId) {
        chapterRepository.deleteByBookId(bookId);
    }
}
