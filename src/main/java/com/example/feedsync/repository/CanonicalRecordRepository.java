package com.example.feedsync.repository;

import com.example.feedsync.model.CanonicalRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CanonicalRecordRepository extends JpaRepository<CanonicalRecord, String> {

    List<CanonicalRecord> findByChannelIdAndPublishedAtBetweenOrderByPublishedAtDesc(
            String channelId, Instant from, Instant to);

    List<CanonicalRecord> findAllByOrderByPublishedAtDesc(Pageable pageable);
}
