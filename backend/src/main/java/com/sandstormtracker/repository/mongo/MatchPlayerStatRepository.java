package com.sandstormtracker.repository.mongo;

import com.sandstormtracker.model.mongo.MatchPlayerStat;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

// ========== Match Player Stat Repository ==========
@Repository
public interface MatchPlayerStatRepository extends MongoRepository<MatchPlayerStat, String> {

    Optional<MatchPlayerStat> findByMatchIdAndPlayerId(String matchId, String playerId);

    List<MatchPlayerStat> findByMatchId(String matchId);
}
