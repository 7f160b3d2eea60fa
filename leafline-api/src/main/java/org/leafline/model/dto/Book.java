package org.leafline.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.leafline.model.enums.BookFormat;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Book {
    private Long id;
    private String title;
    private String author;
    private BookFormat format;
    private String fileName;
    private Long fileSize;
    private String coverUrl;
    private Integer totalChapters;
    private Integer totalCharacters;
    private boolean parsed;
    private Instant parsedAt;
    private Instant createdAt;
    private ReadingProgress progress;
}
