package com.sandstormtracker.repository.mongo;

import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.MatchStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

// ========== Match Repository ==========
@Repository
public interface MatchRepository extends MongoRepository<Match, String> {

    List<Match> findByServerIdAndStatusOrderByStartTimeAsc(String serverId, MatchStatus status);

    Optional<Match> findFirstByServerIdOrderByStartTimeDesc(String serverId);
}
