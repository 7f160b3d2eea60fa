package org.leafline.mapper;

import org.leafline.model.dto.Book;
import org.leafline.model.entity.BookEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface BookMapper {

    @Mapping(target = "coverUrl", ignore = true)
    @Mapping(target = "progress", ignore = true)
    Book toBook(BookEntity bookEntity);
}
