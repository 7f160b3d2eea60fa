package org.leafline.service.upload;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.config.AppProperties;
import org.leafline.config.security.service.AuthenticationService;
import org.leafline.exception.ApiError;
import org.leafline.model.dto.Book;
import org.leafline.model.dto.request.ConfirmUploadRequest;
import org.leafline.model.dto.response.CoverExtractionResponse;
import org.leafline.model.entity.BookEntity;
import org.leafline.model.enums.BookFormat;
import org.leafline.repository.BookRepository;
import org.leafline.repository.UserRepository;
import org.leafline.service.book.LibraryService;
import org.leafline.service.reader.ChapterParseService;
import org.leafline.service.storage.BlobStore;
import org.leafline.util.epub.EpubContainer;
import org.leafline.util.epub.EpubContainerReader;
import org.leafline.util.epub.EpubCover;
import org.leafline.util.epub.EpubCoverExtractor;
import org.leafline.util.epub.EpubPackage;
import org.leafline.util.epub.EpubPackageResolver;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookUploadService {

    private final BookRepository bookRepository;
    private final UserRepository userRepository;
    private final BlobStore blobStore;
    private final ChapterParseService chapterParseService;
    private final LibraryService libraryService;
    private final AuthenticationService authenticationService;
    private final AppProperties appProperties;

    /**
     * Stores a multipart upload in the blob store and registers it as a book.
     */
    public Book uploadFile(MultipartFile file) {
        validateFile(file);
        String originalFileName = getValidatedFileName(file);
        BookFormat format = BookFormat.fromFileName(originalFileName)
                .orElseThrow(() -> ApiError.INVALID_FILE_FORMAT.createException(originalFileName));
        Long userId = authenticationService.getAuthenticatedUser().getId();

        String objectName = "library/" + userId + "/" + UUID.randomUUID() + "-" + sanitizeFileName(originalFileName);
        try {
            blobStore.put(objectName, file.getBytes(), file.getContentType());
        } catch (IOException e) {
            log.error("Failed to read upload {}", originalFileName, e);
            throw ApiError.FILE_READ_ERROR.createException(e.getMessage());
        }
        log.info("Stored upload {} as {}", originalFileName, objectName);

        return confirmUpload(ConfirmUploadRequest.builder()
                .objectName(objectName)
                .filename(originalFileName)
                .format(format.getExtension())
                .fileSize(file.getSize())
                .build());
    }

    /**
     * Registers an object already present in the blob store as a book. For EPUBs, title,
     * author and cover are read from the package; extraction failures never fail the upload.
     */
    public Book confirmUpload(ConfirmUploadRequest request) {
        BookFormat format = BookFormat.fromValue(request.getFormat())
                .orElseThrow(() -> ApiError.INVALID_FILE_FORMAT.createException(request.getFormat()));
        if (!blobStore.exists(request.getObjectName())) {
            throw ApiError.FILE_NOT_FOUND.createException(request.getObjectName());
        }
        Long userId = authenticationService.getAuthenticatedUser().getId();

        BookEntity book = BookEntity.builder()
                .user(userRepository.getReferenceById(userId))
                .format(format)
                .objectKey(request.getObjectName())
                .fileName(request.getFilename())
                .fileSize(request.getFileSize())
                .title(firstNonBlank(request.getTitle()).orElse(defaultTitle(request.getFilename())))
                .author(firstNonBlank(request.getAuthor()).orElse(null))
                .build();

        if (format == BookFormat.EPUB) {
            try {
                applyEpubMetadata(book, blobStore.get(request.getObjectName()),
                        firstNonBlank(request.getTitle()).isEmpty(), firstNonBlank(request.getAuthor()).isEmpty());
            } catch (RuntimeException e) {
                log.warn("Metadata extraction failed for {}: {}", request.getObjectName(), e.getMessage());
            }
        }

        BookEntity saved = bookRepository.save(book);
        log.info("Registered {} book {} '{}' for user {}", format, saved.getId(), saved.getTitle(), userId);

        if (format == BookFormat.EPUB && appProperties.getLibrary().isParseOnUpload()) {
            try {
                chapterParseService.parse(saved.getId(), false);
            } catch (RuntimeException e) {
                log.warn("Book {} uploaded but could not be segmented: {}", saved.getId(), e.getMessage());
            }
            saved = bookRepository.findById(saved.getId()).orElse(saved);
        }
        return libraryService.toDto(saved);
    }

    /**
     * Re-runs cover extraction for the caller's EPUBs that have none. Titles still equal to
     * the filename-derived default and empty authors are filled in on the way.
     */
    public CoverExtractionResponse extractMissingCovers() {
        Long userId = authenticationService.getAuthenticatedUser().getId();
        List<BookEntity> books = bookRepository.findByUserIdAndFormatAndCoverKeyIsNull(userId, BookFormat.EPUB);

        int updated = 0;
        for (BookEntity book : books) {
            try {
                boolean replaceTitle = defaultTitle(book.getFileName()).equals(book.getTitle());
                boolean replaceAuthor = book.getAuthor() == null || book.getAuthor().isBlank();
                applyEpubMetadata(book, blobStore.get(book.getObjectKey()), replaceTitle, replaceAuthor);
                if (book.getCoverKey() != null) {
                    bookRepository.save(book);
                    updated++;
                }
            } catch (RuntimeException e) {
                log.warn("Cover extraction failed for book {}: {}", book.getId(), e.getMessage());
            }
        }
        log.info("Extracted covers for {} of {} books of user {}", updated, books.size(), userId);
        return new CoverExtractionResponse(updated, books.size());
    }

    private void applyEpubMetadata(BookEntity book, byte[] epub, boolean replaceTitle, boolean replaceAuthor) {
        EpubContainer container = EpubContainerReader.read(epub);
        Optional<EpubPackage> pkg = EpubPackageResolver.resolve(container);
        if (pkg.isEmpty()) {
            log.debug("No package document in {}", book.getObjectKey());
            return;
        }
        if (replaceTitle) {
            firstNonBlank(pkg.get().getTitle()).ifPresent(book::setTitle);
        }
        if (replaceAuthor) {
            firstNonBlank(pkg.get().getAuthor()).ifPresent(book::setAuthor);
        }

        Optional<EpubCover> cover = EpubCoverExtractor.extract(container, pkg.get());
        if (cover.isPresent()) {
            String coverKey = coverKeyFor(book.getObjectKey(), cover.get().ext());
            blobStore.put(coverKey, cover.get().bytes(), cover.get().contentType());
            book.setCoverKey(coverKey);
            book.setCoverContentType(cover.get().contentType());
        }
    }

    static String coverKeyFor(String objectName, String ext) {
        String base = objectName.endsWith(".epub") ? objectName.substring(0, objectName.length() - 5) : objectName;
        return base + "-cover." + ext;
    }

    static String defaultTitle(String filename) {
        if (filename == null) {
            return "Untitled";
        }
        int dot = filename.lastIndexOf('.');
        String stem = dot > 0 ? filename.substring(0, dot) : filename;
        String title = stem.replace('-', ' ').replace('_', ' ').trim();
        return title.isEmpty() ? "Untitled" : title;
    }

    private static Optional<String> firstNonBlank(String value) {
        return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty());
    }

    private static String sanitizeFileName(String fileName) {
        String name = fileName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        return name.replaceAll("[^\\w.\\- ]", "_");
    }

    private void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw ApiError.GENERIC_BAD_REQUEST.createException("Uploaded file is missing or empty");
        }
    }

    private String getValidatedFileName(MultipartFile file) {
        String originalFileName = file.getOriginalFilename();
        if (originalFileName == null || originalFileName.isBlank()) {
            throw ApiError.GENERIC_BAD_REQUEST.createException("File must have a name");
        }
        return originalFileName;
    }
}
