package com.sandstormtracker.repository.mongo;

import com.sandstormtracker.model.mongo.Server;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

// ========== Server Repository ==========
@Repository
public interface ServerRepository extends MongoRepository<Server, String> {

    Optional<Server> findByExternalId(String externalId);
}
