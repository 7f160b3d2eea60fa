package org.leafline.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ApiError {
    GENERIC_NOT_FOUND(HttpStatus.NOT_FOUND, "%s"),
    GENERIC_BAD_REQUEST(HttpStatus.BAD_REQUEST, "%s"),
    GENERIC_UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "%s"),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, "Permission denied: %s"),

    BOOK_NOT_FOUND(HttpStatus.NOT_FOUND, "Book not found with ID: %s"),
    BOOK_NOT_PARSED(HttpStatus.CONFLICT, "Book %s has not been parsed into chapters yet"),
    EPUB_NOT_PARSEABLE(HttpStatus.UNPROCESSABLE_ENTITY, "Book %s is not a readable EPUB container"),
    UNSUPPORTED_BOOK_TYPE(HttpStatus.BAD_REQUEST, "Unsupported book type for this operation: %s"),
    INVALID_CHAPTER_RANGE(HttpStatus.BAD_REQUEST, "Invalid chapter range: from=%s, to=%s"),
    BOOKMARK_EXISTS(HttpStatus.CONFLICT, "A bookmark already exists at location %s"),

    INVALID_FILE_FORMAT(HttpStatus.BAD_REQUEST, "Invalid file format: %s"),
    FILE_READ_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Error reading file: %s"),
    FILE_NOT_FOUND(HttpStatus.NOT_FOUND, "File not found: %s");

    private final HttpStatus status;
    private final String message;

    ApiError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public APIException createException(Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message.replace(": %s", "").replace("%s", "");
        return new APIException(formattedMessage, status);
    }
}
