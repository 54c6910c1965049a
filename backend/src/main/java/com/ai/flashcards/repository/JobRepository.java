package com.ai.flashcards.repository;

import com.ai.flashcards.model.Job;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for flashcard jobs.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, String> {

    /**
     * All jobs of a user, most recent first.
     */
    List<Job> findByUserIdOrderByCreatedAtDesc(String userId);
}
