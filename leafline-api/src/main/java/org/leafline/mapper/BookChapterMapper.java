package org.leafline.mapper;

import org.leafline.model.dto.Chapter;
import org.leafline.model.dto.ChapterMeta;
import org.leafline.model.entity.BookChapterEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface BookChapterMapper {

    ChapterMeta toMeta(BookChapterEntity entity);

    Chapter toChapter(BookChapterEntity entity);
}
