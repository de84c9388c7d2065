package com.sandstormtracker.service.store;

import com.sandstormtracker.dto.stats.PlayerTotals;
import com.sandstormtracker.dto.stats.WeaponTotals;
import com.sandstormtracker.event.WeaponType;
import com.sandstormtracker.model.mongo.FriendlyFireIncident;
import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.MatchPlayerStat;
import com.sandstormtracker.model.mongo.MatchStatus;
import com.sandstormtracker.model.mongo.MatchWeaponStat;
import com.sandstormtracker.model.mongo.Player;
import com.sandstormtracker.model.mongo.PlayerMatchStatus;
import com.sandstormtracker.model.mongo.Server;
import com.sandstormtracker.repository.mongo.FriendlyFireIncidentRepository;
import com.sandstormtracker.repository.mongo.MatchPlayerStatRepository;
import com.sandstormtracker.repository.mongo.MatchRepository;
import com.sandstormtracker.repository.mongo.PlayerRepository;
import com.sandstormtracker.repository.mongo.ServerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.aggregation.GroupOperation;
import org.springframework.data.mongodb.core.aggregation.ProjectionOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.group;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.match;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.newAggregation;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.project;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.sort;

/**
 * MongoDB backed {@link StatStore}.
 * <p>
 * Counters use single-document {@code $inc} / {@code $max} updates, so each
 * (match, player) key has one atomic writer at the database level.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoStatStore implements StatStore {

    private static final FindAndModifyOptions UPSERT_RETURN_NEW = FindAndModifyOptions.options().upsert(true).returnNew(true);

    private final MongoTemplate mongoTemplate;
    private final ServerRepository serverRepository;
    private final MatchRepository matchRepository;
    private final PlayerRepository playerRepository;
    private final MatchPlayerStatRepository matchPlayerStatRepository;
    private final FriendlyFireIncidentRepository friendlyFireIncidentRepository;

    // ========== Servers ==========

    @Override
    public Server registerServer(String externalId, String name, String logPath) {
        LocalDateTime now = LocalDateTime.now();
        Update update = new Update()
            .set("name", name)
            .set("logPath", logPath)
            .set("updatedAt", now)
            .setOnInsert("createdAt", now);
        Server server = mongoTemplate.findAndModify(byServer(externalId), update, UPSERT_RETURN_NEW, Server.class);
        log.info("Registered server {} ({})", externalId, logPath);
        return server;
    }

    @Override
    public Optional<Server> findServer(String externalId) {
        return serverRepository.findByExternalId(externalId);
    }

    @Override
    public void saveReadOffset(String externalId, LocalDateTime logFileCreationTime, long offset) {
        mongoTemplate.updateFirst(byServer(externalId), new Update()
            .set("offset", offset)
            .set("logFileCreationTime", logFileCreationTime)
            .set("updatedAt", LocalDateTime.now()), Server.class);
    }

    @Override
    public void saveAppliedOffset(String externalId, long appliedOffset) {
        mongoTemplate.updateFirst(byServer(externalId), new Update().set("appliedOffset", appliedOffset), Server.class);
    }

    @Override
    public void saveLogFileCreationTime(String externalId, LocalDateTime logFileCreationTime) {
        mongoTemplate.updateFirst(byServer(externalId), new Update()
            .set("logFileCreationTime", logFileCreationTime)
            .set("updatedAt", LocalDateTime.now()), Server.class);
    }

    // ========== Matches ==========

    @Override
    public List<Match> findOngoingMatches(String serverId) {
        return matchRepository.findByServerIdAndStatusOrderByStartTimeAsc(serverId, MatchStatus.ONGOING);
    }

    @Override
    public Optional<Match> findMatch(String matchId) {
        return matchRepository.findById(matchId);
    }

    @Override
    public Optional<Match> findLatestMatch(String serverId) {
        return matchRepository.findFirstByServerIdOrderByStartTimeDesc(serverId);
    }

    @Override
    public Match createMatch(Match match) {
        match.setCreatedAt(LocalDateTime.now());
        match.setUpdatedAt(LocalDateTime.now());

        Match saved = matchRepository.save(match);
        log.info("Created match {} on {}: {} ({})", saved.getId(), saved.getServerId(), saved.getMap(), saved.getScenario());

        return saved;
    }

    @Override
    public void endMatch(String matchId, MatchStatus status, LocalDateTime endTime) {
        Query query = new Query(Criteria.where("_id").is(matchId).and("status").is(MatchStatus.ONGOING));
        mongoTemplate.updateFirst(query, new Update()
            .set("status", status)
            .set("endTime", endTime)
            .set("updatedAt", LocalDateTime.now()), Match.class);
    }

    @Override
    public void updateMatchDetails(String matchId, Integer maxPlayers, String lighting) {
        Update update = new Update().set("updatedAt", LocalDateTime.now());
        if (maxPlayers != null) {
            update.set("maxPlayers", maxPlayers);
        }
        if (lighting != null) {
            update.set("lighting", lighting);
        }
        mongoTemplate.updateFirst(byId(matchId), update, Match.class);
    }

    @Override
    public void incrementRound(String matchId, Integer winnerTeam) {
        Update update = new Update().inc("round", 1).set("updatedAt", LocalDateTime.now());
        if (winnerTeam != null) {
            update.set("winnerTeam", winnerTeam);
        }
        mongoTemplate.updateFirst(byId(matchId), update, Match.class);
    }

    @Override
    public void incrementRoundObjective(String matchId) {
        mongoTemplate.updateFirst(byId(matchId), new Update().inc("roundObjective", 1), Match.class);
    }

    // ========== Players ==========

    @Override
    public Optional<Player> findPlayerByPlatformId(String platformId) {
        return playerRepository.findByPlatformId(platformId);
    }

    @Override
    public Optional<Player> findPlayerByName(String name) {
        return playerRepository.findFirstByNameOrderByUpdatedAtDesc(name);
    }

    @Override
    public Optional<Player> findPlayer(String playerId) {
        return playerRepository.findById(playerId);
    }

    @Override
    public Player upsertPlayer(String platformId, String name) {
        LocalDateTime now = LocalDateTime.now();
        Update update = new Update()
            .set("name", name)
            .set("updatedAt", now)
            .setOnInsert("createdAt", now);
        Query query = new Query(Criteria.where("platformId").is(platformId));
        return mongoTemplate.findAndModify(query, update, UPSERT_RETURN_NEW, Player.class);
    }

    // ========== Match player stats ==========

    @Override
    public Optional<MatchPlayerStat> findStat(String matchId, String playerId) {
        return matchPlayerStatRepository.findByMatchIdAndPlayerId(matchId, playerId);
    }

    @Override
    public List<MatchPlayerStat> findStats(String matchId) {
        return matchPlayerStatRepository.findByMatchId(matchId);
    }

    @Override
    public void ensureStat(String matchId, String playerId, Integer team, LocalDateTime at) {
        LocalDateTime now = LocalDateTime.now();
        Update update = new Update()
            .setOnInsert("currentlyConnected", true)
            .setOnInsert("sessionCount", 1)
            .setOnInsert("status", PlayerMatchStatus.ONGOING)
            .setOnInsert("firstJoinedAt", at)
            .setOnInsert("createdAt", now)
            .set("updatedAt", now);
        if (team != null) {
            update.set("team", team);
        }
        mongoTemplate.upsert(byStat(matchId, playerId), update, MatchPlayerStat.class);
    }

    @Override
    public void joinMatch(String matchId, String playerId, Integer team, LocalDateTime at) {
        // reconnect of an existing, disconnected row counts a new session
        Query disconnected = byStat(matchId, playerId).addCriteria(Criteria.where("currentlyConnected").ne(true));
        mongoTemplate.updateFirst(disconnected, new Update()
            .set("currentlyConnected", true)
            .set("status", PlayerMatchStatus.ONGOING)
            .inc("sessionCount", 1), MatchPlayerStat.class);

        ensureStat(matchId, playerId, team, at);

        Query withoutFirstJoin = byStat(matchId, playerId).addCriteria(Criteria.where("firstJoinedAt").is(null));
        mongoTemplate.updateFirst(withoutFirstJoin, new Update().set("firstJoinedAt", at), MatchPlayerStat.class);
    }

    @Override
    public void leaveMatch(String matchId, String playerId, LocalDateTime at) {
        mongoTemplate.updateFirst(byStat(matchId, playerId), new Update()
            .set("currentlyConnected", false)
            .set("status", PlayerMatchStatus.DISCONNECTED)
            .set("lastLeftAt", at)
            .set("updatedAt", LocalDateTime.now()), MatchPlayerStat.class);
    }

    @Override
    public void closeAllStats(String matchId, PlayerMatchStatus status, LocalDateTime at) {
        Query query = new Query(Criteria.where("matchId").is(matchId).and("currentlyConnected").is(true));
        mongoTemplate.updateMulti(query, new Update()
            .set("currentlyConnected", false)
            .set("status", status)
            .set("lastLeftAt", at)
            .set("updatedAt", LocalDateTime.now()), MatchPlayerStat.class);
    }

    @Override
    public void incrementStat(String matchId, String playerId, StatCounter counter) {
        mongoTemplate.upsert(byStat(matchId, playerId), new Update()
            .inc(counter.getField(), 1)
            .set("updatedAt", LocalDateTime.now()), MatchPlayerStat.class);
    }

    @Override
    public void updateScore(String matchId, String playerId, int score, long totalPlayTime) {
        mongoTemplate.updateFirst(byStat(matchId, playerId), new Update()
            .set("score", score)
            .max("totalPlayTime", totalPlayTime)
            .set("updatedAt", LocalDateTime.now()), MatchPlayerStat.class);
    }

    // ========== Weapons ==========

    @Override
    public void incrementWeaponKills(String matchId, String playerId, String weaponName, WeaponType weaponType) {
        Query query = new Query(Criteria.where("matchId").is(matchId)
            .and("playerId").is(playerId)
            .and("weaponName").is(weaponName)
            .and("weaponType").is(weaponType));
        mongoTemplate.upsert(query, new Update().inc("kills", 1), MatchWeaponStat.class);
    }

    @Override
    public List<WeaponTotals> weaponTotals(String playerId) {
        GroupOperation byWeapon = group("weaponName").sum("kills").as("kills");
        ProjectionOperation shape = project("kills").and("weaponName").previousOperation();

        Aggregation aggregation = newAggregation(
            match(Criteria.where("playerId").is(playerId)),
            byWeapon,
            sort(Sort.by(Sort.Direction.DESC, "kills")),
            shape
        );

        AggregationResults<WeaponTotals> results =
            mongoTemplate.aggregate(aggregation, MatchWeaponStat.class, WeaponTotals.class);
        return results.getMappedResults();
    }

    // ========== Friendly fire ==========

    @Override
    public void recordFriendlyFire(FriendlyFireIncident incident) {
        friendlyFireIncidentRepository.save(incident);
    }

    @Override
    public Optional<FriendlyFireIncident> findLastFriendlyFire(String matchId, String killerId) {
        return friendlyFireIncidentRepository.findFirstByMatchIdAndKillerIdOrderByTimestampDesc(matchId, killerId);
    }

    @Override
    public long countFriendlyFire(String matchId, String killerId) {
        return friendlyFireIncidentRepository.countByMatchIdAndKillerId(matchId, killerId);
    }

    // ========== Aggregates ==========

    @Override
    public Optional<PlayerTotals> playerTotals(String playerId) {
        return aggregateTotals(Criteria.where("playerId").is(playerId)).stream().findFirst();
    }

    @Override
    public List<PlayerTotals> allPlayerTotals() {
        return aggregateTotals(new Criteria());
    }

    private List<PlayerTotals> aggregateTotals(Criteria filter) {
        GroupOperation byPlayer = group("playerId")
            .sum("kills").as("kills")
            .sum("deaths").as("deaths")
            .sum("score").as("score")
            .sum("totalPlayTime").as("totalPlayTime");

        ProjectionOperation shape = project("kills", "deaths", "score", "totalPlayTime")
            .and("playerId").previousOperation();

        Aggregation aggregation = newAggregation(match(filter), byPlayer, shape);

        AggregationResults<PlayerTotals> results =
            mongoTemplate.aggregate(aggregation, MatchPlayerStat.class, PlayerTotals.class);
        return results.getMappedResults();
    }

    // ========== Queries ==========

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static Query byServer(String externalId) {
        return new Query(Criteria.where("externalId").is(externalId));
    }

    private static Query byStat(String matchId, String playerId) {
        return new Query(Criteria.where("matchId").is(matchId).and("playerId").is(playerId));
    }
}
