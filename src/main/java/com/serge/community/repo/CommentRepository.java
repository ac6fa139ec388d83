package com.serge.community.repo;

import com.serge.community.domain.Comment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CommentRepository extends JpaRepository<Comment, UUID> {
    List<Comment> findByArticleIdOrderByCreatedAtAsc(UUID articleId);
}
