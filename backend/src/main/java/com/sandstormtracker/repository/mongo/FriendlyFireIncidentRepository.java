package com.sandstormtracker.repository.mongo;

import com.sandstormtracker.model.mongo.FriendlyFireIncident;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

// ========== Friendly Fire Incident Repository ==========
@Repository
public interface FriendlyFireIncidentRepository extends MongoRepository<FriendlyFireIncident, String> {

    Optional<FriendlyFireIncident> findFirstByMatchIdAndKillerIdOrderByTimestampDesc(String matchId, String killerId);

    long countByMatchIdAndKillerId(String matchId, String killerId);
}
