package org.leafline.repository;

import org.leafline.model.entity.HighlightEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface HighlightRepository extends JpaRepository<HighlightEntity, Long> {

    List<HighlightEntity> findByBookIdAndUserIdOrderByCreatedAtAsc(Long bookId, Long userId);

    Optional<HighlightEntity> findByIdAndUserId(Long id, Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM HighlightEntity h WHERE h.bookId = :bookId")
    int deleteByBookId(@Param("bookId") Long bookId);
}
