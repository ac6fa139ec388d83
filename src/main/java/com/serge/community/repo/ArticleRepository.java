package com.serge.community.repo;

import com.serge.community.domain.Account;
import com.serge.community.domain.Article;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ArticleRepository extends JpaRepository<Article, UUID> {
    List<Article> findAllByOrderByPublishedAtDesc(Pageable page);

    List<Article> findByAuthorOrderByPublishedAtDesc(Account author);
}
