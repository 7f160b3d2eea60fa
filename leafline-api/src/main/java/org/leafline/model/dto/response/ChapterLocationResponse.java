package org.leafline.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterLocationResponse {
    private Integer chapterIndex;
    private Integer charOffset;
    private Integer offsetInChapter;
}
