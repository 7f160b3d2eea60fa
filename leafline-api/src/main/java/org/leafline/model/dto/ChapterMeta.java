package org.leafline.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterMeta {
    private Integer chapterIndex;
    private String href;
    private Integer charOffset;
    private Integer charLength;
}
