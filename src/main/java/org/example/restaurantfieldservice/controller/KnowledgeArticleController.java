package org.example.restaurantfieldservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.KnowledgeArticleDTO;
import org.example.restaurantfieldservice.dto.KnowledgeArticleRequest;
import org.example.restaurantfieldservice.dto.PagedResponse;
import org.example.restaurantfieldservice.service.KnowledgeArticleService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeArticleController {

    private final KnowledgeArticleService articleService;

    @GetMapping
    public ResponseEntity<PagedResponse<KnowledgeArticleDTO>> search(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String tag,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            SessionContext session) {
        return ResponseEntity.ok(articleService.search(q, tag, page, size));
    }

    /**
     * Counts as a view.
     */
    @GetMapping("/{id:\\d+}")
    public ResponseEntity<KnowledgeArticleDTO> getArticle(@PathVariable Long id, SessionContext session) {
        return ResponseEntity.ok(articleService.getArticle(id));
    }

    @PostMapping
    public ResponseEntity<KnowledgeArticleDTO> createArticle(@Valid @RequestBody KnowledgeArticleRequest request,
                                                             SessionContext session) {
        log.info("POST /api/knowledge - {}", request.getTitle());
        return new ResponseEntity<>(articleService.createArticle(request, session), HttpStatus.CREATED);
    }

    @PutMapping("/{id:\\d+}")
    public ResponseEntity<KnowledgeArticleDTO> updateArticle(@PathVariable Long id,
                                                             @Valid @RequestBody KnowledgeArticleRequest request,
                                                             SessionContext session) {
        log.info("PUT /api/knowledge/{}", id);
        return ResponseEntity.ok(articleService.updateArticle(id, request, session));
    }
}
