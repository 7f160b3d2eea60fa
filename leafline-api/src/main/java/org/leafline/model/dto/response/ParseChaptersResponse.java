package org.leafline.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseChaptersResponse {
    private Long bookId;
    private Integer totalChapters;
    private Integer totalCharacters;
    private boolean alreadyParsed;
}
