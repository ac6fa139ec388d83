package com.serge.community.web;

import com.serge.community.access.Actor;
import com.serge.community.access.PermissionEvaluator;
import com.serge.community.domain.Account;
import com.serge.community.domain.News;
import com.serge.community.domain.RoleName;
import com.serge.community.repo.NewsRepository;
import com.serge.community.service.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class NewsControllerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final String BODY = "{\"title\":\" Release 2.0 \",\"body\":\"It shipped.\"}";

    @Mock
    private NewsRepository news;
    @Mock
    private SessionService sessions;

    private MockMvc mvc;
    private Account owner;
    private News pendingItem;

    @BeforeEach
    void setUp() {
        NewsController controller = new NewsController(news, sessions, new PermissionEvaluator(), CLOCK);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
        owner = Account.builder().id(UUID.randomUUID()).username("owner").build();
        OffsetDateTime created = OffsetDateTime.now(CLOCK).minusHours(2);
        pendingItem = News.builder().id(UUID.randomUUID()).author(owner).title("Draft").body("Draft body")
                .approved(false).createdAt(created).updatedAt(created).build();
    }

    private static Actor as(RoleName... roles) {
        return new Actor(UUID.randomUUID(), Set.of(roles));
    }

    @Test
    void newNewsIsStoredUnapproved() throws Exception {
        when(sessions.resolveAccount(any())).thenReturn(Optional.of(owner));

        mvc.perform(post("/api/news").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.title").value("Release 2.0"))
                .andExpect(jsonPath("$.approved").value(false))
                .andExpect(jsonPath("$.canEdit").value(true))
                .andExpect(jsonPath("$.canApprove").value(false));

        ArgumentCaptor<News> saved = ArgumentCaptor.forClass(News.class);
        verify(news).save(saved.capture());
        assertThat(saved.getValue().isApproved()).isFalse();
        assertThat(saved.getValue().getAuthor()).isSameAs(owner);
    }

    @Test
    void plainMemberCannotSeePendingQueue() throws Exception {
        when(sessions.resolveActor(any())).thenReturn(as());

        mvc.perform(get("/api/news/pending"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    void anonymousCannotSeePendingQueue() throws Exception {
        mvc.perform(get("/api/news/pending"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void moderatorSeesPendingQueueWithApproveFlag() throws Exception {
        when(sessions.resolveActor(any())).thenReturn(as(RoleName.MODERATOR));
        when(news.findByApprovedOrderByCreatedAtDesc(eq(false), any(Pageable.class))).thenReturn(List.of(pendingItem));

        mvc.perform(get("/api/news/pending"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].title").value("Draft"))
                .andExpect(jsonPath("$[0].canApprove").value(true))
                .andExpect(jsonPath("$[0].canEdit").value(false));
    }

    @Test
    void moderatorApproves() throws Exception {
        when(sessions.resolveActor(any())).thenReturn(as(RoleName.MODERATOR));
        when(news.findById(pendingItem.getId())).thenReturn(Optional.of(pendingItem));

        mvc.perform(post("/api/news/{id}/approve", pendingItem.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved").value(true))
                .andExpect(jsonPath("$.canApprove").value(false));

        assertThat(pendingItem.isApproved()).isTrue();
        verify(news).save(pendingItem);
    }

    @Test
    void plainMemberCannotApprove() throws Exception {
        when(sessions.resolveActor(any())).thenReturn(as());

        mvc.perform(post("/api/news/{id}/approve", pendingItem.getId()))
                .andExpect(status().isForbidden());

        assertThat(pendingItem.isApproved()).isFalse();
        verify(news, never()).save(any());
    }

    @Test
    void onlyTheAuthorEditsNews() throws Exception {
        when(sessions.resolveActor(any())).thenReturn(as(RoleName.ADMINISTRATOR, RoleName.MODERATOR));
        when(news.findById(pendingItem.getId())).thenReturn(Optional.of(pendingItem));

        mvc.perform(put("/api/news/{id}", pendingItem.getId()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isForbidden());

        assertThat(pendingItem.getTitle()).isEqualTo("Draft");
        verify(news, never()).save(any());
    }

    @Test
    void authorEditsOwnNews() throws Exception {
        when(sessions.resolveActor(any())).thenReturn(Actor.of(owner));
        when(news.findById(pendingItem.getId())).thenReturn(Optional.of(pendingItem));

        mvc.perform(put("/api/news/{id}", pendingItem.getId()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Release 2.0"))
                .andExpect(jsonPath("$.canEdit").value(true));

        assertThat(pendingItem.getUpdatedAt()).isEqualTo(OffsetDateTime.now(CLOCK));
    }
}
