package com.locplat.translation.repository;

import com.locplat.translation.model.FieldConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FieldConfigRepository extends JpaRepository<FieldConfigEntity, Long> {
    /**
     * Finds the config stored for a client and collection.
     */
    Optional<FieldConfigEntity> findByClientIdAndCollectionName(String clientId, String collectionName);

    /**
     * Loads all configs of a client, used for cache warming.
     */
    List<FieldConfigEntity> findAllByClientId(String clientId);
}
