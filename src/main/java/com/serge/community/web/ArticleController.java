package com.serge.community.web;

import com.serge.community.access.AccessDecision;
import com.serge.community.access.Action;
import com.serge.community.access.Actor;
import com.serge.community.access.PermissionEvaluator;
import com.serge.community.domain.Account;
import com.serge.community.domain.Article;
import com.serge.community.repo.ArticleRepository;
import com.serge.community.service.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/articles")
@RequiredArgsConstructor
public class ArticleController {
    private static final Logger log = LoggerFactory.getLogger(ArticleController.class);
    private final ArticleRepository articleRepository;
    private final SessionService sessions;
    private final PermissionEvaluator permissions;
    private final Clock clock;

    @GetMapping
    public List<ArticleDto> latest(@RequestParam(defaultValue = "0") int page,
                                   @RequestParam(defaultValue = "20") int size,
                                   @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        return articleRepository.findAllByOrderByPublishedAtDesc(PageRequest.of(Math.max(page, 0), NewsController.clampSize(size)))
                .stream().map(a -> ArticleDto.from(a, permissions.allows(actor, Action.EDIT_ARTICLE, a)))
                .collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        Article a = articleRepository.findById(id).orElse(null);
        if (a == null) return ApiResponses.notFound("No such article");
        Actor actor = sessions.resolveActor(jwt);
        return ResponseEntity.ok(ArticleDto.from(a, permissions.allows(actor, Action.EDIT_ARTICLE, a)));
    }

    @PostMapping
    @Transactional
    public ResponseEntity<?> create(@RequestBody @Valid ArticleReq req, @AuthenticationPrincipal Jwt jwt) {
        Optional<Account> me = sessions.resolveAccount(jwt);
        AccessDecision d = permissions.canPerform(me.map(Actor::of).orElse(null), Action.CREATE_ARTICLE);
        if (!d.allowed()) return ApiResponses.denied(d);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Article a = Article.builder()
                .author(me.get())
                .title(req.getTitle().trim())
                .body(req.getBody())
                .publishedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        articleRepository.save(a);
        log.info("articles.create id={} author={}", a.getId(), me.get().getId());
        return ResponseEntity.status(201).body(ArticleDto.from(a, true));
    }

    @PutMapping("/{id}")
    @Transactional
    public ResponseEntity<?> edit(@PathVariable UUID id, @RequestBody @Valid ArticleReq req,
                                  @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        Article a = articleRepository.findById(id).orElse(null);
        if (a == null) return ApiResponses.notFound("No such article");
        AccessDecision d = permissions.canPerform(actor, Action.EDIT_ARTICLE, a);
        if (!d.allowed()) return ApiResponses.denied(d);
        a.setTitle(req.getTitle().trim());
        a.setBody(req.getBody());
        a.setUpdatedAt(OffsetDateTime.now(clock));
        articleRepository.save(a);
        log.info("articles.edit id={} by={}", id, actor.id());
        return ResponseEntity.ok(ArticleDto.from(a, true));
    }

    @Data
    public static class ArticleReq {
        @NotBlank @Size(max = 255)
        private String title;
        @NotBlank
        private String body;
    }

    @Data
    public static class ArticleDto {
        private UUID id;
        private String title;
        private String body;
        private UUID authorId;
        private String authorUsername;
        private OffsetDateTime publishedAt;
        private OffsetDateTime updatedAt;
        private boolean canEdit;

        public static ArticleDto from(Article a, boolean canEdit) {
            ArticleDto d = new ArticleDto();
            d.id = a.getId();
            d.title = a.getTitle();
            d.body = a.getBody();
            d.authorId = a.getAuthor().getId();
            d.authorUsername = a.getAuthor().getUsername();
            d.publishedAt = a.getPublishedAt();
            d.updatedAt = a.getUpdatedAt();
            d.canEdit = canEdit;
            return d;
        }
    }
}
