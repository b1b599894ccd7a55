package com.campusagent.backend.repository;

import com.campusagent.backend.model.IntentKind;
import com.campusagent.backend.model.QueryLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface QueryLogRepository extends MongoRepository<QueryLog, String> {

    List<QueryLog> findByOrderByCreatedAtDesc(Pageable pageable);

    long countByIntent(IntentKind intent);

    long countBySuccessFalse();

    long countByCreatedAtAfter(Instant since);
}
