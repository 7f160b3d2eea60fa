package org.leafline.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "book_chapters",
        uniqueConstraints = @UniqueConstraint(columnNames = {"book_id", "chapter_index"}))
public class BookChapterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "book_id", nullable = false)
    private BookEntity book;

    @Column(name = "book_id", insertable = false, updatable = false)
    private Long bookId;

    @Column(name = "chapter_index", nullable = false)
    private Integer chapterIndex;

    @Column(name = "href", nullable = false, length = 1000)
    private String href;

    @Column(name = "html", nullable = false, columnDefinition = "LONGTEXT")
    private String html;

    @Column(name = "char_offset", nullable = false)
    private Integer charOffset;

    @Column(name = "char_length", nullable = false)
    private Integer charLength;
}
