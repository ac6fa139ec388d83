package com.serge.community.repo;

import com.serge.community.domain.Tip;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TipRepository extends JpaRepository<Tip, UUID> {
    List<Tip> findAllByOrderByPublishedAtDesc(Pageable page);
}
