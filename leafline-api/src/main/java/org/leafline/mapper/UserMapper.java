package org.leafline.mapper;

import org.leafline.model.dto.LeaflineUser;
import org.leafline.model.entity.LeaflineUserEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface UserMapper {

    LeaflineUser toDto(LeaflineUserEntity entity);
}
