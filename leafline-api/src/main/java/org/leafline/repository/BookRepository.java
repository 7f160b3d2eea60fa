package org.leafline.repository;

import org.leafline.model.entity.BookEntity;
import org.leafline.model.enums.BookFormat;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface BookRepository extends JpaRepository<BookEntity, Long> {

    Page<BookEntity> findByTitleContainingIgnoreCaseOrAuthorContainingIgnoreCase(String title, String author, Pageable pageable);

    Optional<BookEntity> findByIdAndUserId(Long id, Long userId);

    List<BookEntity> findByUserIdAndFormatAndCoverKeyIsNull(Long userId, BookFormat format);
}
