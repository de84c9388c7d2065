package com.sandstormtracker.support;

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
import com.sandstormtracker.service.store.StatCounter;
import com.sandstormtracker.service.store.StatStore;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link StatStore} kept in maps, with the same upsert semantics as the Mongo adapter.
 */
public final class InMemoryStatStore implements StatStore {

    private final AtomicInteger ids = new AtomicInteger();
    private final Map<String, Server> servers = new LinkedHashMap<>();
    private final Map<String, Match> matches = new LinkedHashMap<>();
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final Map<String, MatchPlayerStat> stats = new LinkedHashMap<>();
    private final Map<String, MatchWeaponStat> weapons = new LinkedHashMap<>();
    private final List<FriendlyFireIncident> incidents = new ArrayList<>();

    // ========== Servers ==========

    @Override
    public synchronized Server registerServer(String externalId, String name, String logPath) {
        Server server = servers.computeIfAbsent(externalId, id -> Server.builder()
            .id(nextId("srv"))
            .externalId(id)
            .createdAt(LocalDateTime.now())
            .build());
        server.setName(name);
        server.setLogPath(logPath);
        return server;
    }

    @Override
    public synchronized Optional<Server> findServer(String externalId) {
        return Optional.ofNullable(servers.get(externalId));
    }

    @Override
    public synchronized void saveReadOffset(String externalId, LocalDateTime logFileCreationTime, long offset) {
        findServer(externalId).ifPresent(server -> {
            server.setOffset(offset);
            server.setLogFileCreationTime(logFileCreationTime);
        });
    }

    @Override
    public synchronized void saveAppliedOffset(String externalId, long appliedOffset) {
        findServer(externalId).ifPresent(server -> server.setAppliedOffset(appliedOffset));
    }

    @Override
    public synchronized void saveLogFileCreationTime(String externalId, LocalDateTime logFileCreationTime) {
        findServer(externalId).ifPresent(server -> server.setLogFileCreationTime(logFileCreationTime));
    }

    // ========== Matches ==========

    @Override
    public synchronized List<Match> findOngoingMatches(String serverId) {
        return matches.values().stream()
            .filter(match -> match.getServerId().equals(serverId) && match.getStatus() == MatchStatus.ONGOING)
            .sorted(Comparator.comparing(Match::getStartTime))
            .toList();
    }

    @Override
    public synchronized Optional<Match> findMatch(String matchId) {
        return Optional.ofNullable(matches.get(matchId));
    }

    @Override
    public synchronized Optional<Match> findLatestMatch(String serverId) {
        return matches.values().stream()
            .filter(match -> match.getServerId().equals(serverId))
            .max(Comparator.comparing(Match::getStartTime));
    }

    @Override
    public synchronized Match createMatch(Match match) {
        match.setId(nextId("match"));
        match.setCreatedAt(LocalDateTime.now());
        match.setUpdatedAt(LocalDateTime.now());
        matches.put(match.getId(), match);
        return match;
    }

    @Override
    public synchronized void endMatch(String matchId, MatchStatus status, LocalDateTime endTime) {
        findMatch(matchId)
            .filter(match -> match.getStatus() == MatchStatus.ONGOING)
            .ifPresent(match -> {
                match.setStatus(status);
                match.setEndTime(endTime);
            });
    }

    @Override
    public synchronized void updateMatchDetails(String matchId, Integer maxPlayers, String lighting) {
        findMatch(matchId).ifPresent(match -> {
            if (maxPlayers != null) {
                match.setMaxPlayers(maxPlayers);
            }
            if (lighting != null) {
                match.setLighting(lighting);
            }
        });
    }

    @Override
    public synchronized void incrementRound(String matchId, Integer winnerTeam) {
        findMatch(matchId).ifPresent(match -> {
            match.setRound(match.getRound() + 1);
            if (winnerTeam != null) {
                match.setWinnerTeam(winnerTeam);
            }
        });
    }

    @Override
    public synchronized void incrementRoundObjective(String matchId) {
        findMatch(matchId).ifPresent(match -> match.setRoundObjective(match.getRoundObjective() + 1));
    }

    // ========== Players ==========

    @Override
    public synchronized Optional<Player> findPlayerByPlatformId(String platformId) {
        return players.values().stream().filter(player -> player.getPlatformId().equals(platformId)).findFirst();
    }

    @Override
    public synchronized Optional<Player> findPlayerByName(String name) {
        return players.values().stream()
            .filter(player -> name.equals(player.getName()))
            .max(Comparator.comparing(Player::getUpdatedAt));
    }

    @Override
    public synchronized Optional<Player> findPlayer(String playerId) {
        return Optional.ofNullable(players.get(playerId));
    }

    @Override
    public synchronized Player upsertPlayer(String platformId, String name) {
        Player player = findPlayerByPlatformId(platformId).orElseGet(() -> {
            Player created = Player.builder()
                .id(nextId("player"))
                .platformId(platformId)
                .createdAt(LocalDateTime.now())
                .build();
            players.put(created.getId(), created);
            return created;
        });
        player.setName(name);
        player.setUpdatedAt(LocalDateTime.now());
        return player;
    }

    // ========== Match player stats ==========

    @Override
    public synchronized Optional<MatchPlayerStat> findStat(String matchId, String playerId) {
        return Optional.ofNullable(stats.get(key(matchId, playerId)));
    }

    @Override
    public synchronized List<MatchPlayerStat> findStats(String matchId) {
        return stats.values().stream().filter(stat -> stat.getMatchId().equals(matchId)).toList();
    }

    @Override
    public synchronized void ensureStat(String matchId, String playerId, Integer team, LocalDateTime at) {
        MatchPlayerStat stat = stats.computeIfAbsent(key(matchId, playerId), k -> MatchPlayerStat.builder()
            .id(nextId("stat"))
            .matchId(matchId)
            .playerId(playerId)
            .currentlyConnected(true)
            .sessionCount(1)
            .status(PlayerMatchStatus.ONGOING)
            .firstJoinedAt(at)
            .createdAt(LocalDateTime.now())
            .build());
        if (team != null) {
            stat.setTeam(team);
        }
    }

    @Override
    public synchronized void joinMatch(String matchId, String playerId, Integer team, LocalDateTime at) {
        findStat(matchId, playerId)
            .filter(stat -> !stat.isCurrentlyConnected())
            .ifPresent(stat -> {
                stat.setCurrentlyConnected(true);
                stat.setStatus(PlayerMatchStatus.ONGOING);
                stat.setSessionCount(stat.getSessionCount() + 1);
            });
        ensureStat(matchId, playerId, team, at);
        MatchPlayerStat stat = stats.get(key(matchId, playerId));
        if (stat.getFirstJoinedAt() == null) {
            stat.setFirstJoinedAt(at);
        }
    }

    @Override
    public synchronized void leaveMatch(String matchId, String playerId, LocalDateTime at) {
        findStat(matchId, playerId).ifPresent(stat -> {
            stat.setCurrentlyConnected(false);
            stat.setStatus(PlayerMatchStatus.DISCONNECTED);
            stat.setLastLeftAt(at);
        });
    }

    @Override
    public synchronized void closeAllStats(String matchId, PlayerMatchStatus status, LocalDateTime at) {
        findStats(matchId).stream().filter(MatchPlayerStat::isCurrentlyConnected).forEach(stat -> {
            stat.setCurrentlyConnected(false);
            stat.setStatus(status);
            stat.setLastLeftAt(at);
        });
    }

    @Override
    public synchronized void incrementStat(String matchId, String playerId, StatCounter counter) {
        MatchPlayerStat stat = stats.computeIfAbsent(key(matchId, playerId), k -> MatchPlayerStat.builder()
            .id(nextId("stat"))
            .matchId(matchId)
            .playerId(playerId)
            .build());
        switch (counter) {
            case KILLS -> stat.setKills(stat.getKills() + 1);
            case ASSISTS -> stat.setAssists(stat.getAssists() + 1);
            case DEATHS -> stat.setDeaths(stat.getDeaths() + 1);
            case FRIENDLY_FIRE_KILLS -> stat.setFriendlyFireKills(stat.getFriendlyFireKills() + 1);
            case OBJECTIVES_CAPTURED -> stat.setObjectivesCaptured(stat.getObjectivesCaptured() + 1);
            case OBJECTIVES_DESTROYED -> stat.setObjectivesDestroyed(stat.getObjectivesDestroyed() + 1);
        }
    }

    @Override
    public synchronized void updateScore(String matchId, String playerId, int score, long totalPlayTime) {
        findStat(matchId, playerId).ifPresent(stat -> {
            stat.setScore(score);
            stat.setTotalPlayTime(Math.max(stat.getTotalPlayTime(), totalPlayTime));
        });
    }

    // ========== Weapons ==========

    @Override
    public synchronized void incrementWeaponKills(String matchId, String playerId, String weaponName,
                                                  WeaponType weaponType) {
        MatchWeaponStat stat = weapons.computeIfAbsent(key(matchId, playerId, weaponName, weaponType.name()),
            k -> MatchWeaponStat.builder()
                .id(nextId("weapon"))
                .matchId(matchId)
                .playerId(playerId)
                .weaponName(weaponName)
                .weaponType(weaponType)
                .build());
        stat.setKills(stat.getKills() + 1);
    }

    @Override
    public synchronized List<WeaponTotals> weaponTotals(String playerId) {
        Map<String, Long> byWeapon = weapons.values().stream()
            .filter(stat -> stat.getPlayerId().equals(playerId))
            .collect(Collectors.groupingBy(MatchWeaponStat::getWeaponName, LinkedHashMap::new,
                Collectors.summingLong(MatchWeaponStat::getKills)));
        return byWeapon.entrySet().stream()
            .map(entry -> new WeaponTotals(entry.getKey(), entry.getValue()))
            .sorted(Comparator.comparingLong(WeaponTotals::getKills).reversed())
            .toList();
    }

    // ========== Friendly fire ==========

    @Override
    public synchronized void recordFriendlyFire(FriendlyFireIncident incident) {
        incident.setId(nextId("ff"));
        incidents.add(incident);
    }

    @Override
    public synchronized Optional<FriendlyFireIncident> findLastFriendlyFire(String matchId, String killerId) {
        return incidents.stream()
            .filter(incident -> incident.getMatchId().equals(matchId) && incident.getKillerId().equals(killerId))
            .max(Comparator.comparing(FriendlyFireIncident::getTimestamp));
    }

    @Override
    public synchronized long countFriendlyFire(String matchId, String killerId) {
        return incidents.stream()
            .filter(incident -> incident.getMatchId().equals(matchId) && incident.getKillerId().equals(killerId))
            .count();
    }

    // ========== Aggregates ==========

    @Override
    public synchronized Optional<PlayerTotals> playerTotals(String playerId) {
        List<MatchPlayerStat> rows = stats.values().stream()
            .filter(stat -> stat.getPlayerId().equals(playerId))
            .toList();
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PlayerTotals.builder()
            .playerId(playerId)
            .kills(rows.stream().mapToLong(MatchPlayerStat::getKills).sum())
            .deaths(rows.stream().mapToLong(MatchPlayerStat::getDeaths).sum())
            .score(rows.stream().mapToLong(MatchPlayerStat::getScore).sum())
            .totalPlayTime(rows.stream().mapToLong(MatchPlayerStat::getTotalPlayTime).sum())
            .build());
    }

    @Override
    public synchronized List<PlayerTotals> allPlayerTotals() {
        return stats.values().stream()
            .map(MatchPlayerStat::getPlayerId)
            .distinct()
            .map(this::playerTotals)
            .flatMap(Optional::stream)
            .toList();
    }

    // ========== Test helpers ==========

    public synchronized List<Match> matches() {
        return new ArrayList<>(matches.values());
    }

    public synchronized List<FriendlyFireIncident> incidents() {
        return new ArrayList<>(incidents);
    }

    /** Stat row of the player with this platform id, or a zeroed row if there is none. */
    public synchronized MatchPlayerStat stat(String matchId, String platformId) {
        return findPlayerByPlatformId(platformId)
            .flatMap(player -> findStat(matchId, player.getId()))
            .orElseGet(MatchPlayerStat::new);
    }

    public synchronized int weaponKills(String matchId, String platformId, String weaponName) {
        return findPlayerByPlatformId(platformId)
            .map(player -> weapons.values().stream()
                .filter(stat -> stat.getMatchId().equals(matchId)
                    && stat.getPlayerId().equals(player.getId())
                    && stat.getWeaponName().equals(weaponName))
                .mapToInt(MatchWeaponStat::getKills)
                .sum())
            .orElse(0);
    }

    private String nextId(String prefix) {
        return prefix + "-" + ids.incrementAndGet();
    }

    private static String key(String... parts) {
        return String.join("|", parts);
    }
}
