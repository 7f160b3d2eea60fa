package org.leafline.service.reader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.config.security.service.AuthenticationService;
import org.leafline.exception.ApiError;
import org.leafline.model.dto.response.ParseChaptersResponse;
import org.leafline.model.entity.BookEntity;
import org.leafline.model.enums.BookFormat;
import org.leafline.repository.BookRepository;
import org.leafline.service.storage.BlobStore;
import org.leafline.util.epub.EpubChapterSegmenter;
import org.leafline.util.epub.EpubContainer;
import org.leafline.util.epub.EpubContainerReader;
import org.leafline.util.epub.EpubPackage;
import org.leafline.util.epub.EpubPackageResolver;
import org.leafline.util.epub.SegmentationResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Segments an uploaded EPUB into stored chapters. Requests for the same book are serialized
 * and the parsed state is re-read under the lock, so a second concurrent request for an
 * unparsed book becomes a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChapterParseService {

    private static final int LOCK_STRIPES = 64;

    private final BookRepository bookRepository;
    private final BlobStore blobStore;
    private final ChapterStore chapterStore;
    private final EpubResourcePublisher resourcePublisher;
    private final AuthenticationService authenticationService;
    private final Clock clock;

    private final ReentrantLock[] locks = createLocks();

    public ParseChaptersResponse parseForCurrentUser(Long bookId, boolean force) {
        Long userId = authenticationService.getAuthenticatedUser().getId();
        bookRepository.findByIdAndUserId(bookId, userId)
                .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));
        return parse(bookId, force);
    }

    public ParseChaptersResponse parse(Long bookId, boolean force) {
        ReentrantLock lock = lockFor(bookId);
        lock.lock();
        try {
            BookEntity book = bookRepository.findById(bookId)
                    .orElseThrow(() -> ApiError.BOOK_NOT_FOUND.createException(bookId));
            if (book.getFormat() != BookFormat.EPUB) {
                throw ApiError.UNSUPPORTED_BOOK_TYPE.createException(book.getFormat());
            }
            if (book.isParsed() && !force) {
                log.debug("Book {} already parsed at {}, skipping", bookId, book.getParsedAt());
                return toResponse(book, true);
            }

            long start = System.currentTimeMillis();
            EpubContainer container = EpubContainerReader.read(blobStore.get(book.getObjectKey()));
            EpubPackage pkg = EpubPackageResolver.resolve(container)
                    .orElseThrow(() -> ApiError.EPUB_NOT_PARSEABLE.createException(bookId));

            SegmentationResult result = EpubChapterSegmenter.segment(container, pkg, resourcePublisher.sinkFor(bookId, container));
            if (result.isEmpty()) {
                log.warn("Book {} produced no readable chapters from {} spine items", bookId, pkg.getSpine().size());
            }

            BookEntity parsed = chapterStore.replaceChapters(bookId, result, clock.instant());
            log.info("Parsed book {} into {} chapters ({} characters) in {} ms",
                    bookId, parsed.getTotalChapters(), parsed.getTotalCharacters(), System.currentTimeMillis() - start);
            return toResponse(parsed, false);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(Long bookId) {
        return locks[Math.floorMod(bookId.hashCode(), LOCK_STRIPES)];
    }

    private static ReentrantLock[] createLocks() {
        ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
        return stripes;
    }

    private static ParseChaptersResponse toResponse(BookEntity book, boolean alreadyParsed) {
        return ParseChaptersResponse.builder()
                .bookId(book.getId())
                .totalChapters(book.getTotalChapters())
                .totalCharacters(book.getTotalCharacters())
                .alreadyParsed(alreadyParsed)
                .build();
    }
}
