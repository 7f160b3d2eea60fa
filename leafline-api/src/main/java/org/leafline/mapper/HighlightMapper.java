package org.leafline.mapper;

import org.leafline.model.dto.Highlight;
import org.leafline.model.entity.HighlightEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface HighlightMapper {

    @Mapping(source = "book.id", target = "bookId")
    @Mapping(source = "user.id", target = "userId")
    Highlight toDto(HighlightEntity entity);
}
