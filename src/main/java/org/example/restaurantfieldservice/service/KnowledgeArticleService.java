package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.KnowledgeArticleDTO;
import org.example.restaurantfieldservice.dto.KnowledgeArticleRequest;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.entity.KnowledgeArticle;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.KnowledgeArticleRepository;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Troubleshooting articles technicians read on site.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class KnowledgeArticleService {

    static final String TABLE = "knowledge_articles";

    private final KnowledgeArticleRepository articleRepository;
    private final ResourceMapper mapper;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public PagedResponse<KnowledgeArticleDTO> search(String text, String tag, int page, int size) {
        return PagedResponse.from(
                articleRepository.search(
                        StringUtils.hasText(text) ? text.trim() : null,
                        StringUtils.hasText(tag) ? tag.trim() : null,
                        PageRequest.of(page, size, Sort.by("updatedAt").descending())),
                mapper::toDTO);
    }

    /**
     * Reading an article counts as a view.
     */
    public KnowledgeArticleDTO getArticle(Long id) {
        if (articleRepository.incrementViewCount(id) == 0) {
            throw new ResourceNotFoundException("Knowledge article", id);
        }
        return mapper.toDTO(findArticle(id));
    }

    public KnowledgeArticleDTO createArticle(KnowledgeArticleRequest request, SessionContext session) {
        KnowledgeArticle article = new KnowledgeArticle();
        article.setAuthorId(session.getUserId());
        article.setViewCount(0L);
        apply(article, request);
        KnowledgeArticle saved = articleRepository.save(article);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.INSERT));
        log.info("📚 Article created - id: {}, title: {}", saved.getId(), saved.getTitle());
        return mapper.toDTO(saved);
    }

    public KnowledgeArticleDTO updateArticle(Long id, KnowledgeArticleRequest request, SessionContext session) {
        KnowledgeArticle article = findArticle(id);
        if (!session.getUserId().equals(article.getAuthorId()) && !session.isManagerOrAdmin()) {
            throw new PermissionDeniedException("Permission denied: only the author or a manager can edit article " + id);
        }
        apply(article, request);
        KnowledgeArticle saved = articleRepository.save(article);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        return mapper.toDTO(saved);
    }

    private KnowledgeArticle findArticle(Long id) {
        return articleRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Knowledge article", id));
    }

    private void apply(KnowledgeArticle article, KnowledgeArticleRequest request) {
        article.setTitle(request.getTitle().trim());
        article.setSummary(request.getSummary());
        article.setContent(request.getContent());
        article.setImageUrl(request.getImageUrl());
        Set<String> tags = request.getTags() == null ? new LinkedHashSet<>() : request.getTags().stream()
                .filter(StringUtils::hasText)
                .map(t -> t.trim().toLowerCase())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        article.setTags(tags);
    }
}
