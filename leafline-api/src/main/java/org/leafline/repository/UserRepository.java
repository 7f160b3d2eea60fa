package org.leafline.repository;

import org.leafline.model.entity.LeaflineUserEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepository extends JpaRepository<LeaflineUserEntity, Long> {

    Optional<LeaflineUserEntity> findByUsername(String username);
}
