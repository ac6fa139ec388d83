package com.serge.community.web;

import com.serge.community.access.Actor;
import com.serge.community.access.PermissionEvaluator;
import com.serge.community.domain.Account;
import com.serge.community.domain.Article;
import com.serge.community.domain.Comment;
import com.serge.community.domain.RoleName;
import com.serge.community.repo.ArticleRepository;
import com.serge.community.repo.CommentRepository;
import com.serge.community.service.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CommentControllerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final String BODY = "{\"body\":\"Agreed, with one caveat.\"}";

    @Mock
    private CommentRepository comments;
    @Mock
    private ArticleRepository articles;
    @Mock
    private SessionService sessions;

    private MockMvc mvc;
    private Account author;
    private Article article;
    private Comment comment;

    @BeforeEach
    void setUp() {
        CommentController controller = new CommentController(comments, articles, sessions, new PermissionEvaluator(), CLOCK);
        mvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
        author = Account.builder().id(UUID.randomUUID()).username("bob").build();
        OffsetDateTime created = OffsetDateTime.now(CLOCK).minusMinutes(30);
        article = Article.builder().id(UUID.randomUUID()).author(author).title("T").body("B")
                .publishedAt(created).createdAt(created).updatedAt(created).build();
        comment = Comment.builder().id(UUID.randomUUID()).author(author).article(article).body("First!")
                .createdAt(created).updatedAt(created).build();
    }

    @Test
    void moderatorEditsSomeoneElsesComment() throws Exception {
        when(sessions.resolveActor(any())).thenReturn(new Actor(UUID.randomUUID(), Set.of(RoleName.MODERATOR)));
        when(comments.findById(comment.getId())).thenReturn(Optional.of(comment));

        mvc.perform(put("/api/comments/{id}", comment.getId()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.body").value("Agreed, with one caveat."))
                .andExpect(jsonPath("$.articleId").value(article.getId().toString()));

        assertThat(comment.getUpdatedAt()).isEqualTo(OffsetDateTime.now(CLOCK));
        verify(comments).save(comment);
    }

    @Test
    void librarianCannotEditSomeoneElsesComment() throws Exception {
        when(sessions.resolveActor(any())).thenReturn(new Actor(UUID.randomUUID(), Set.of(RoleName.LIBRARIAN)));
        when(comments.findById(comment.getId())).thenReturn(Optional.of(comment));

        mvc.perform(put("/api/comments/{id}", comment.getId()).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isForbidden());

        assertThat(comment.getBody()).isEqualTo("First!");
        verify(comments, never()).save(any());
    }

    @Test
    void listFlagsEditableCommentsForModerator() throws Exception {
        when(articles.existsById(article.getId())).thenReturn(true);
        when(sessions.resolveActor(any())).thenReturn(new Actor(UUID.randomUUID(), Set.of(RoleName.MODERATOR)));
        when(comments.findByArticleIdOrderByCreatedAtAsc(article.getId())).thenReturn(List.of(comment));

        mvc.perform(get("/api/articles/{id}/comments", article.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].authorUsername").value("bob"))
                .andExpect(jsonPath("$[0].canEdit").value(true));
    }

    @Test
    void commentsOfMissingArticleAreNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(articles.existsById(id)).thenReturn(false);

        mvc.perform(get("/api/articles/{id}/comments", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void memberCommentsOnArticle() throws Exception {
        Account me = Account.builder().id(UUID.randomUUID()).username("carol").build();
        when(sessions.resolveAccount(any())).thenReturn(Optional.of(me));
        when(articles.findById(article.getId())).thenReturn(Optional.of(article));

        mvc.perform(post("/api/articles/{id}/comments", article.getId())
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.authorUsername").value("carol"))
                .andExpect(jsonPath("$.canEdit").value(true));

        verify(comments).save(any(Comment.class));
    }
}
