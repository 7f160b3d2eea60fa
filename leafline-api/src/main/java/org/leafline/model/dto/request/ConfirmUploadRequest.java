package org.leafline.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmUploadRequest {

    @NotBlank(message = "Object name is required")
    private String objectName;

    @NotBlank(message = "Filename is required")
    @Size(max = 500, message = "Filename must not exceed 500 characters")
    private String filename;

    @NotBlank(message = "Format is required")
    private String format;

    @PositiveOrZero(message = "File size must not be negative")
    private Long fileSize;

    @Size(max = 500, message = "Title must not exceed 500 characters")
    private String title;

    @Size(max = 500, message = "Author must not exceed 500 characters")
    private String author;
}
