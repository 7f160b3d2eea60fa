package org.leafline.repository;

import org.leafline.model.entity.BookMarkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface BookMarkRepository extends JpaRepository<BookMarkEntity, Long> {

    Optional<BookMarkEntity> findByIdAndUserId(Long id, Long userId);

    List<BookMarkEntity> findByBookIdAndUserIdOrderByCreatedAtDesc(Long bookId, Long userId);

    boolean existsByLocationAndBookIdAndUserId(String location, Long bookId, Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM BookMarkEntity b WHERE b.bookId = :bookId")
    int deleteByBookId(@Param("bookId") Long bookId);
}
