package org.leafline.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Highlight {
    private Long id;
    private Long bookId;
    private Long userId;
    private String location;
    private String text;
    private String note;
    private String color;
    private Instant createdAt;
    private Instant updatedAt;
}
