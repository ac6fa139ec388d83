package com.serge.community.web;

import com.serge.community.access.AccessDecision;
import com.serge.community.access.Action;
import com.serge.community.access.Actor;
import com.serge.community.access.PermissionEvaluator;
import com.serge.community.domain.Account;
import com.serge.community.domain.Tip;
import com.serge.community.repo.TipRepository;
import com.serge.community.service.SessionService;
import com.serge.community.service.TipChangedEvent;
import com.serge.community.service.TipFeedService;
import com.serge.community.service.TipFeedService.TipItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
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
@RequestMapping("/api/tips")
@RequiredArgsConstructor
public class TipController {
    private static final Logger log = LoggerFactory.getLogger(TipController.class);
    private final TipRepository tipRepository;
    private final TipFeedService tipFeed;
    private final SessionService sessions;
    private final PermissionEvaluator permissions;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    @GetMapping
    public List<TipDto> latest(@RequestParam(defaultValue = "10") int limit,
                               @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        return tipFeed.latest(limit).stream()
                .map(t -> TipDto.from(t, permissions.canPerformOnOwner(actor, Action.EDIT_TIP, t.authorId()).allowed()))
                .collect(Collectors.toList());
    }

    @PostMapping
    @Transactional
    public ResponseEntity<?> create(@RequestBody @Valid TipReq req, @AuthenticationPrincipal Jwt jwt) {
        Optional<Account> me = sessions.resolveAccount(jwt);
        AccessDecision d = permissions.canPerform(me.map(Actor::of).orElse(null), Action.CREATE_TIP);
        if (!d.allowed()) return ApiResponses.denied(d);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Tip t = Tip.builder()
                .author(me.get())
                .body(req.getBody())
                .publishedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        tipRepository.save(t);
        events.publishEvent(new TipChangedEvent(t.getId()));
        log.info("tips.create id={} author={}", t.getId(), me.get().getId());
        return ResponseEntity.status(201).body(TipDto.from(TipItem.of(t), true));
    }

    @PutMapping("/{id}")
    @Transactional
    public ResponseEntity<?> edit(@PathVariable UUID id, @RequestBody @Valid TipReq req,
                                  @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        Tip t = tipRepository.findById(id).orElse(null);
        if (t == null) return ApiResponses.notFound("No such tip");
        AccessDecision d = permissions.canPerform(actor, Action.EDIT_TIP, t);
        if (!d.allowed()) return ApiResponses.denied(d);
        t.setBody(req.getBody());
        t.setUpdatedAt(OffsetDateTime.now(clock));
        tipRepository.save(t);
        events.publishEvent(new TipChangedEvent(t.getId()));
        log.info("tips.edit id={} by={}", id, actor.id());
        return ResponseEntity.ok(TipDto.from(TipItem.of(t), true));
    }

    @Data
    public static class TipReq {
        @NotBlank @Size(max = 2000)
        private String body;
    }

    @Data
    public static class TipDto {
        private UUID id;
        private UUID authorId;
        private String authorUsername;
        private String body;
        private String publishedAt;
        private boolean canEdit;

        public static TipDto from(TipItem t, boolean canEdit) {
            TipDto d = new TipDto();
            d.id = t.id();
            d.authorId = t.authorId();
            d.authorUsername = t.authorUsername();
            d.body = t.body();
            d.publishedAt = t.publishedAt();
            d.canEdit = canEdit;
            return d;
        }
    }
}
