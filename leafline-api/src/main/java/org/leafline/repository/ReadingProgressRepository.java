package org.leafline.repository;

import jakarta.persistence.LockModeType;
import org.leafline.model.entity.ReadingProgressEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ReadingProgressRepository extends JpaRepository<ReadingProgressEntity, Long> {

    Optional<ReadingProgressEntity> findByUserIdAndBookId(Long userId, Long bookId);

    boolean existsByUserIdAndBookId(Long userId, Long bookId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM ReadingProgressEntity p WHERE p.userId = :userId AND p.bookId = :bookId")
    Optional<ReadingProgressEntity> findByUserIdAndBookIdForUpdate(@Param("userId") Long userId, @Param("bookId") Long bookId);

    List<ReadingProgressEntity> findByUserIdAndBookIdIn(Long userId, Collection<Long> bookIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ReadingProgressEntity p WHERE p.bookId = :bookId")
    int deleteByBookId(@Param("bookId") Long bookId);
}
