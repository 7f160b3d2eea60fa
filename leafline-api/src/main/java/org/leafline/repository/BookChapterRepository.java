package org.leafline.repository;

import org.leafline.model.entity.BookChapterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface BookChapterRepository extends JpaRepository<BookChapterEntity, Long> {

    List<BookChapterEntity> findByBookIdOrderByChapterIndexAsc(Long bookId);

    List<BookChapterEntity> findByBookIdAndChapterIndexBetweenOrderByChapterIndexAsc(Long bookId, Integer from, Integer to);

    long countByBookId(Long bookId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM BookChapterEntity c WHERE c.bookId = :bookId")
    int deleteByBookId(@Param("bookId") Long bookId);
}
