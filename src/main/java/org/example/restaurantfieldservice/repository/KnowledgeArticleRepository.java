package org.example.restaurantfieldservice.repository;

import org.example.restaurantfieldservice.entity.KnowledgeArticle;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface KnowledgeArticleRepository extends JpaRepository<KnowledgeArticle, Long> {

    @Query("SELECT DISTINCT a FROM KnowledgeArticle a LEFT JOIN a.tags tag "
            + "WHERE (:text IS NULL OR LOWER(a.title) LIKE LOWER(CONCAT('%', :text, '%')) "
            + "OR LOWER(a.content) LIKE LOWER(CONCAT('%', :text, '%'))) "
            + "AND (:tag IS NULL OR LOWER(tag) = LOWER(:tag))")
    Page<KnowledgeArticle> search(@Param("text") String text, @Param("tag") String tag, Pageable pageable);

    @Modifying
    @Query("UPDATE KnowledgeArticle a SET a.viewCount = a.viewCount + 1 WHERE a.id = :id")
    int incrementViewCount(@Param("id") Long id);
}
