package org.leafline.model.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
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
public class ReadingProgressRequest {

    @NotNull(message = "Book ID is required")
    private Long bookId;

    @Size(max = 2000, message = "Location must not exceed 2000 characters")
    private String currentLocation;

    @DecimalMin(value = "0", message = "Percentage must be between 0 and 100")
    @DecimalMax(value = "100", message = "Percentage must be between 0 and 100")
    private Float percentage;

    /** Whole seconds read since the previous save. */
    @PositiveOrZero(message = "Read time delta must not be negative")
    private Long readTimeDelta;
}
