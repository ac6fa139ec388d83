package com.serge.community.web;

import com.serge.community.access.AccessDecision;
import com.serge.community.access.Action;
import com.serge.community.access.Actor;
import com.serge.community.access.PermissionEvaluator;
import com.serge.community.domain.Account;
import com.serge.community.domain.News;
import com.serge.community.repo.NewsRepository;
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
@RequestMapping("/api/news")
@RequiredArgsConstructor
public class NewsController {
    private static final Logger log = LoggerFactory.getLogger(NewsController.class);
    private final NewsRepository newsRepository;
    private final SessionService sessions;
    private final PermissionEvaluator permissions;
    private final Clock clock;

    @GetMapping
    public List<NewsDto> approved(@RequestParam(defaultValue = "0") int page,
                                  @RequestParam(defaultValue = "20") int size,
                                  @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        return newsRepository.findByApprovedOrderByCreatedAtDesc(true, PageRequest.of(Math.max(page, 0), clampSize(size)))
                .stream().map(n -> view(actor, n))
                .collect(Collectors.toList());
    }

    @GetMapping("/pending")
    public ResponseEntity<?> pending(@AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        AccessDecision d = permissions.canPerform(actor, Action.APPROVE_NEWS);
        if (!d.allowed()) return ApiResponses.denied(d);
        List<NewsDto> out = newsRepository.findByApprovedOrderByCreatedAtDesc(false, PageRequest.of(0, 100))
                .stream().map(n -> view(actor, n))
                .collect(Collectors.toList());
        return ResponseEntity.ok(out);
    }

    @PostMapping
    @Transactional
    public ResponseEntity<?> create(@RequestBody @Valid NewsReq req, @AuthenticationPrincipal Jwt jwt) {
        Optional<Account> me = sessions.resolveAccount(jwt);
        Actor actor = me.map(Actor::of).orElse(null);
        AccessDecision d = permissions.canPerform(actor, Action.CREATE_NEWS);
        if (!d.allowed()) return ApiResponses.denied(d);
        OffsetDateTime now = OffsetDateTime.now(clock);
        News n = News.builder()
                .author(me.get())
                .title(req.getTitle().trim())
                .body(req.getBody())
                .approved(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
        newsRepository.save(n);
        log.info("news.create id={} author={}", n.getId(), actor.id());
        return ResponseEntity.status(201).body(view(actor, n));
    }

    @PutMapping("/{id}")
    @Transactional
    public ResponseEntity<?> edit(@PathVariable UUID id, @RequestBody @Valid NewsReq req,
                                  @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        News n = newsRepository.findById(id).orElse(null);
        if (n == null) return ApiResponses.notFound("No such news");
        AccessDecision d = permissions.canPerform(actor, Action.EDIT_NEWS, n);
        if (!d.allowed()) return ApiResponses.denied(d);
        n.setTitle(req.getTitle().trim());
        n.setBody(req.getBody());
        n.setUpdatedAt(OffsetDateTime.now(clock));
        newsRepository.save(n);
        log.info("news.edit id={} by={}", id, actor.id());
        return ResponseEntity.ok(view(actor, n));
    }

    @PostMapping("/{id}/approve")
    @Transactional
    public ResponseEntity<?> approve(@PathVariable UUID id, @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        AccessDecision d = permissions.canPerform(actor, Action.APPROVE_NEWS);
        if (!d.allowed()) return ApiResponses.denied(d);
        News n = newsRepository.findById(id).orElse(null);
        if (n == null) return ApiResponses.notFound("No such news");
        n.setApproved(true);
        n.setUpdatedAt(OffsetDateTime.now(clock));
        newsRepository.save(n);
        log.info("news.approve id={} by={}", id, actor.id());
        return ResponseEntity.ok(view(actor, n));
    }

    private NewsDto view(Actor actor, News n) {
        return NewsDto.from(n,
                permissions.allows(actor, Action.EDIT_NEWS, n),
                !n.isApproved() && permissions.allows(actor, Action.APPROVE_NEWS));
    }

    static int clampSize(int size) {
        return Math.max(1, Math.min(size, 100));
    }

    @Data
    public static class NewsReq {
        @NotBlank @Size(max = 255)
        private String title;
        @NotBlank
        private String body;
    }

    @Data
    public static class NewsDto {
        private UUID id;
        private String title;
        private String body;
        private boolean approved;
        private UUID authorId;
        private String authorUsername;
        private OffsetDateTime createdAt;
        private boolean canEdit;
        private boolean canApprove;

        public static NewsDto from(News n, boolean canEdit, boolean canApprove) {
            NewsDto d = new NewsDto();
            d.id = n.getId();
            d.title = n.getTitle();
            d.body = n.getBody();
            d.approved = n.isApproved();
            d.authorId = n.getAuthor().getId();
            d.authorUsername = n.getAuthor().getUsername();
            d.createdAt = n.getCreatedAt();
            d.canEdit = canEdit;
            d.canApprove = canApprove;
            return d;
        }
    }
}
