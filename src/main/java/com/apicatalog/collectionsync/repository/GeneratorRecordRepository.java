package com.apicatalog.collectionsync.repository;

import com.apicatalog.collectionsync.dto.ExtractionScope;
import com.apicatalog.collectionsync.model.GeneratorRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GeneratorRecordRepository extends MongoRepository<GeneratorRecord, String> {

    Optional<GeneratorRecord> findByGenerationTypeAndTargetName(ExtractionScope.Type generationType, String targetName);

    List<GeneratorRecord> findByTargetName(String targetName);

    List<GeneratorRecord> findByStatus(GeneratorRecord.Status status);
}
