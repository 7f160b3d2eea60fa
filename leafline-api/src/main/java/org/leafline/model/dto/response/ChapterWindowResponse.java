package org.leafline.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.leafline.model.dto.Chapter;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChapterWindowResponse {
    private List<Chapter> chapters;
}
