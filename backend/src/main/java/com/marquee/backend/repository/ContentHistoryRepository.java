package com.marquee.backend.repository;

import com.marquee.backend.model.ContentHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ContentHistoryRepository extends JpaRepository<ContentHistory, Long> {
    List<ContentHistory> findAllByOrderByGeneratedAtDesc(Pageable pageable);
}
