package com.example.feedsync.repository;

import com.example.feedsync.model.DeadLetter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

public interface DeadLetterRepository extends JpaRepository<DeadLetter, Long> {

    Optional<DeadLetter> findByItemId(String itemId);

    @Transactional
    long deleteByItemId(String itemId);
}
