package com.campusagent.backend.repository;

import com.campusagent.backend.model.CatalogEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

/**
 * Repository for catalog entries.
 */
@Repository
public interface CatalogEntryRepository extends MongoRepository<CatalogEntry, String> {

    Page<CatalogEntry> findByCategory(String category, Pageable pageable);

    @Query(value = "{ 'embedding.0': { $exists: true } }", count = true)
    long countWithEmbedding();
}
