package org.example.restaurantfieldservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeArticleRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255)
    private String title;

    @Size(max = 500)
    private String summary;

    @NotBlank(message = "Content is required")
    private String content;

    private Set<String> tags;

    @Size(max = 1024)
    private String imageUrl;
}
