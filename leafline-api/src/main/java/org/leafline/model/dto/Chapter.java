package org.leafline.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chapter {
    private Integer chapterIndex;
    private String href;
    private String html;
    private Integer charOffset;
    private Integer charLength;
}
