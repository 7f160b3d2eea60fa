package org.leafline.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.leafline.model.dto.ChapterMeta;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterMetadataResponse {
    private Integer totalChapters;
    private Integer totalCharacters;
    private String styles;
    private List<ChapterMeta> chapters;
}
