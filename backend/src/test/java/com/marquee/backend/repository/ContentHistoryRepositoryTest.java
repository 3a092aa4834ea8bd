package com.marquee.backend.repository;

import com.marquee.backend.model.ContentHistory;
import com.marquee.backend.model.UpdateType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ContentHistoryRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ContentHistoryRepository repository;

    @Test
    void newestEntriesComeFirst() {
        entityManager.persist(entry("FIRST", "2024-03-15T08:00:00Z"));
        entityManager.persist(entry("THIRD", "2024-03-15T10:00:00Z"));
        entityManager.persist(entry("SECOND", "2024-03-15T09:00:00Z"));
        entityManager.flush();

        assertThat(repository.findAllByOrderByGeneratedAtDesc(PageRequest.of(0, 2)))
                .extracting(ContentHistory::getText)
                .containsExactly("THIRD", "SECOND");
    }

    private static ContentHistory entry(String text, String generatedAt) {
        return ContentHistory.builder()
                .text(text)
                .updateType(UpdateType.MAJOR)
                .status(ContentHistory.Status.SUCCESS)
                .generatedAt(Instant.parse(generatedAt))
                .generatorId("haiku")
                .build();
    }
}
