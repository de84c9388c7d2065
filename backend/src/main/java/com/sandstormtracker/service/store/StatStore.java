package com.sandstormtracker.service.store;

import com.sandstormtracker.dto.stats.PlayerTotals;
import com.sandstormtracker.dto.stats.WeaponTotals;
import com.sandstormtracker.event.WeaponType;
import com.sandstormtracker.model.mongo.FriendlyFireIncident;
import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.MatchPlayerStat;
import com.sandstormtracker.model.mongo.MatchStatus;
import com.sandstormtracker.model.mongo.Player;
import com.sandstormtracker.model.mongo.PlayerMatchStatus;
import com.sandstormtracker.model.mongo.Server;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Match and stat persistence as seen by the ingestion pipeline.
 * <p>
 * Every method keyed by a unique key is an upsert or a find-one on that key.
 * Counter updates are atomic per (match, player) so log-driven writes and score
 * reconciliation can interleave without lost updates.
 */
public interface StatStore {

    // ========== Servers ==========

    Server registerServer(String externalId, String name, String logPath);

    Optional<Server> findServer(String externalId);

    void saveReadOffset(String externalId, LocalDateTime logFileCreationTime, long offset);

    void saveAppliedOffset(String externalId, long appliedOffset);

    void saveLogFileCreationTime(String externalId, LocalDateTime logFileCreationTime);

    // ========== Matches ==========

    /** Ongoing matches for a server, oldest first. More than one is an invariant violation. */
    List<Match> findOngoingMatches(String serverId);

    Optional<Match> findMatch(String matchId);

    /** Most recently started match of the server in any status. */
    Optional<Match> findLatestMatch(String serverId);

    Match createMatch(Match match);

    void endMatch(String matchId, MatchStatus status, LocalDateTime endTime);

    void updateMatchDetails(String matchId, Integer maxPlayers, String lighting);

    void incrementRound(String matchId, Integer winnerTeam);

    void incrementRoundObjective(String matchId);

    // ========== Players ==========

    Optional<Player> findPlayerByPlatformId(String platformId);

    Optional<Player> findPlayerByName(String name);

    Optional<Player> findPlayer(String playerId);

    Player upsertPlayer(String platformId, String name);

    // ========== Match player stats ==========

    Optional<MatchPlayerStat> findStat(String matchId, String playerId);

    List<MatchPlayerStat> findStats(String matchId);

    /** Creates the row as connected with one session if missing; leaves an existing row alone. */
    void ensureStat(String matchId, String playerId, Integer team, LocalDateTime at);

    /** Connects the player, counting a new session unless the row is already connected. */
    void joinMatch(String matchId, String playerId, Integer team, LocalDateTime at);

    void leaveMatch(String matchId, String playerId, LocalDateTime at);

    /** Disconnects every still connected row of the match and sets its status. Rows that already left keep theirs. */
    void closeAllStats(String matchId, PlayerMatchStatus status, LocalDateTime at);

    void incrementStat(String matchId, String playerId, StatCounter counter);

    /** Sets score and raises play time; play time never decreases. */
    void updateScore(String matchId, String playerId, int score, long totalPlayTime);

    // ========== Weapons ==========

    void incrementWeaponKills(String matchId, String playerId, String weaponName, WeaponType weaponType);

    List<WeaponTotals> weaponTotals(String playerId);

    // ========== Friendly fire ==========

    void recordFriendlyFire(FriendlyFireIncident incident);

    Optional<FriendlyFireIncident> findLastFriendlyFire(String matchId, String killerId);

    long countFriendlyFire(String matchId, String killerId);

    // ========== Aggregates ==========

    Optional<PlayerTotals> playerTotals(String playerId);

    List<PlayerTotals> allPlayerTotals();
}
