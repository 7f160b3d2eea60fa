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
public class ReadingProgress {
    private Long bookId;
    private String currentLocation;
    private Float percentage;
    private Long totalReadTime;
    private Instant lastReadAt;
}
