package org.leafline.model.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateHighlightRequest {

    @NotNull(message = "Book ID is required")
    private Long bookId;

    @NotEmpty(message = "Location is required")
    @Size(max = 2000, message = "Location must not exceed 2000 characters")
    private String location;

    @NotEmpty(message = "Text is required")
    @Size(max = 5000, message = "Text must not exceed 5000 characters")
    private String text;

    @Size(max = 5000, message = "Note must not exceed 5000 characters")
    private String note;

    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "Color must be a valid hex color (e.g., #FFFF00)")
    private String color;
}
