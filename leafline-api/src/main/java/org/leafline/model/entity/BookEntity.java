package org.leafline.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.leafline.model.enums.BookFormat;

import java.time.Instant;

@Entity
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "books")
public class BookEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private LeaflineUserEntity user;

    @Column(name = "user_id", insertable = false, updatable = false)
    private Long userId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "author", length = 500)
    private String author;

    @Enumerated(EnumType.STRING)
    @Column(name = "format", nullable = false, length = 10)
    private BookFormat format;

    @Column(name = "object_key", nullable = false, length = 1000)
    private String objectKey;

    @Column(name = "file_name", nullable = false, length = 500)
    private String fileName;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "cover_key", length = 1000)
    private String coverKey;

    @Column(name = "cover_content_type", length = 50)
    private String coverContentType;

    @Column(name = "total_chapters", nullable = false)
    @Builder.Default
    private Integer totalChapters = 0;

    @Column(name = "total_characters", nullable = false)
    @Builder.Default
    private Integer totalCharacters = 0;

    @Column(name = "styles", columnDefinition = "LONGTEXT")
    private String styles;

    @Column(name = "parsed_at")
    private Instant parsedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public boolean isParsed() {
        return parsedAt != null;
    }
}
