package com.serge.community.repo;

import com.serge.community.domain.News;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface NewsRepository extends JpaRepository<News, UUID> {
    List<News> findByApprovedOrderByCreatedAtDesc(boolean approved, Pageable page);
}
