package com.sandstormtracker.repository.mongo;

import com.sandstormtracker.model.mongo.Player;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

// ========== Player Repository ==========
@Repository
public interface PlayerRepository extends MongoRepository<Player, String> {

    Optional<Player> findByPlatformId(String platformId);

    Optional<Player> findFirstByNameOrderByUpdatedAtDesc(String name);
}
