package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to an image already uploaded to external storage.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TicketPhotoRequest {

    @NotBlank(message = "Photo URL is required")
    @Size(max = 1024)
    private String url;
}
