package com.serge.community.web;

import com.serge.community.access.AccessDecision;
import com.serge.community.access.Action;
import com.serge.community.access.Actor;
import com.serge.community.access.PermissionEvaluator;
import com.serge.community.domain.Account;
import com.serge.community.domain.Article;
import com.serge.community.domain.Comment;
import com.serge.community.repo.ArticleRepository;
import com.serge.community.repo.CommentRepository;
import com.serge.community.service.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
@RequestMapping("/api")
@RequiredArgsConstructor
public class CommentController {
    private static final Logger log = LoggerFactory.getLogger(CommentController.class);
    private final CommentRepository commentRepository;
    private final ArticleRepository articleRepository;
    private final SessionService sessions;
    private final PermissionEvaluator permissions;
    private final Clock clock;

    @GetMapping("/articles/{articleId}/comments")
    public ResponseEntity<?> list(@PathVariable UUID articleId, @AuthenticationPrincipal Jwt jwt) {
        if (!articleRepository.existsById(articleId)) return ApiResponses.notFound("No such article");
        Actor actor = sessions.resolveActor(jwt);
        List<CommentDto> out = commentRepository.findByArticleIdOrderByCreatedAtAsc(articleId).stream()
                .map(c -> CommentDto.from(c, permissions.allows(actor, Action.EDIT_COMMENT, c)))
                .collect(Collectors.toList());
        return ResponseEntity.ok(out);
    }

    @PostMapping("/articles/{articleId}/comments")
    @Transactional
    public ResponseEntity<?> create(@PathVariable UUID articleId, @RequestBody @Valid CommentReq req,
                                    @AuthenticationPrincipal Jwt jwt) {
        Optional<Account> me = sessions.resolveAccount(jwt);
        AccessDecision d = permissions.canPerform(me.map(Actor::of).orElse(null), Action.CREATE_COMMENT);
        if (!d.allowed()) return ApiResponses.denied(d);
        Article article = articleRepository.findById(articleId).orElse(null);
        if (article == null) return ApiResponses.notFound("No such article");
        OffsetDateTime now = OffsetDateTime.now(clock);
        Comment c = Comment.builder()
                .author(me.get())
                .article(article)
                .body(req.getBody())
                .createdAt(now)
                .updatedAt(now)
                .build();
        commentRepository.save(c);
        log.info("comments.create id={} articleId={} author={}", c.getId(), articleId, me.get().getId());
        return ResponseEntity.status(201).body(CommentDto.from(c, true));
    }

    @PutMapping("/comments/{id}")
    @Transactional
    public ResponseEntity<?> edit(@PathVariable UUID id, @RequestBody @Valid CommentReq req,
                                  @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        Comment c = commentRepository.findById(id).orElse(null);
        if (c == null) return ApiResponses.notFound("No such comment");
        AccessDecision d = permissions.canPerform(actor, Action.EDIT_COMMENT, c);
        if (!d.allowed()) return ApiResponses.denied(d);
        c.setBody(req.getBody());
        c.setUpdatedAt(OffsetDateTime.now(clock));
        commentRepository.save(c);
        log.info("comments.edit id={} by={}", id, actor.id());
        return ResponseEntity.ok(CommentDto.from(c, true));
    }

    @Data
    public static class CommentReq {
        @NotBlank @Size(max = 10000)
        private String body;
    }

    @Data
    public static class CommentDto {
        private UUID id;
        private UUID articleId;
        private UUID authorId;
        private String authorUsername;
        private String body;
        private OffsetDateTime createdAt;
        private boolean canEdit;

        public static CommentDto from(Comment c, boolean canEdit) {
            CommentDto d = new CommentDto();
            d.id = c.getId();
            d.articleId = c.getArticle().getId();
            d.authorId = c.getAuthor().getId();
            d.authorUsername = c.getAuthor().getUsername();
            d.body = c.getBody();
            d.createdAt = c.getCreatedAt();
            d.canEdit = canEdit;
            return d;
        }
    }
}
