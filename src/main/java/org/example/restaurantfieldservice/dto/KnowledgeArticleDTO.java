package org.example.restaurantfieldservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeArticleDTO {

    private Long id;
    private String title;
    private String summary;
    private String content;
    private Set<String> tags;
    private Long authorId;
    private String imageUrl;
    private long viewCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
