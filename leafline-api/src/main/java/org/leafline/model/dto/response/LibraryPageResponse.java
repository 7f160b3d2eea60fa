package org.leafline.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.leafline.model.dto.Book;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryPageResponse {
    private List<Book> list;
    private Pagination pagination;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int limit;
        private long total;
        private int totalPages;
    }
}
