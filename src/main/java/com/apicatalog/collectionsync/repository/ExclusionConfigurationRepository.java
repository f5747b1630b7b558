package com.apicatalog.collectionsync.repository;

import com.apicatalog.collectionsync.model.ExclusionConfiguration;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ExclusionConfigurationRepository extends MongoRepository<ExclusionConfiguration, String> {

    Optional<ExclusionConfiguration> findByConfigTypeAndActive(String configType, boolean active);

    List<ExclusionConfiguration> findByActive(boolean active);
}
