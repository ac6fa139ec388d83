package com.serge.community.web;

import com.serge.community.access.Action;
import com.serge.community.access.Actor;
import com.serge.community.access.PermissionEvaluator;
import com.serge.community.domain.Account;
import com.serge.community.repo.AccountRepository;
import com.serge.community.repo.ArticleRepository;
import com.serge.community.service.PresenceTracker;
import com.serge.community.service.ProfileService;
import com.serge.community.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/blog")
@RequiredArgsConstructor
public class BlogController {
    private final AccountRepository accountRepository;
    private final ArticleRepository articleRepository;
    private final SessionService sessions;
    private final PermissionEvaluator permissions;
    private final PresenceTracker presence;
    private final ProfileService profiles;

    @GetMapping("/{username}")
    public ResponseEntity<?> blog(@PathVariable String username, @AuthenticationPrincipal Jwt jwt) {
        Account user = accountRepository.findByUsername(username).orElse(null);
        if (user == null) return ApiResponses.notFound("No such user");
        Actor actor = sessions.resolveActor(jwt);
        // the owner viewing their own blog gets the "write a post" controls
        boolean isAuthor = actor != null && actor.id().equals(user.getId());
        List<ArticleController.ArticleDto> posts = articleRepository.findByAuthorOrderByPublishedAtDesc(user).stream()
                .map(a -> ArticleController.ArticleDto.from(a, permissions.allows(actor, Action.EDIT_ARTICLE, a)))
                .collect(Collectors.toList());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", AccountController.AccountDto.from(user, presence.isOnline(user), profiles.avatarUrl(user)));
        body.put("isAuthor", isAuthor);
        body.put("posts", posts);
        return ResponseEntity.ok(body);
    }
}
