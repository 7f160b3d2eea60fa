package org.leafline.model.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseChaptersRequest {

    @NotNull(message = "Book ID is required")
    private Long bookId;

    private boolean force;
}
