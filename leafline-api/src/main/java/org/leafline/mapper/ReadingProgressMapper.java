package org.leafline.mapper;

import org.leafline.model.dto.ReadingProgress;
import org.leafline.model.entity.ReadingProgressEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface ReadingProgressMapper {

    @Mapping(source = "book.id", target = "bookId")
    ReadingProgress toDto(ReadingProgressEntity entity);
}
