package com.apicatalog.collectionsync.repository;

import com.apicatalog.collectionsync.model.SyncRunRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncRunRecordRepository extends MongoRepository<SyncRunRecord, String> {

    List<SyncRunRecord> findTop20ByOrderByStartedAtDesc();

    Optional<SyncRunRecord> findFirstByOrderByStartedAtDesc();
}
