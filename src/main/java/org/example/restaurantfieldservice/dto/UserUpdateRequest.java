package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {

    @Size(max = 100)
    private String name;

    @Size(max = 30)
    private String phone;

    @Size(max = 100)
    private String specialization;

    @Size(max = 1024)
    private String avatarUrl;
}
