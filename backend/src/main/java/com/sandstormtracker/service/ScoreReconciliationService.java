package com.sandstormtracker.service;

import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.MatchPlayerStat;
import com.sandstormtracker.model.mongo.MatchStatus;
import com.sandstormtracker.model.mongo.Player;
import com.sandstormtracker.service.rcon.CommandSender;
import com.sandstormtracker.service.rcon.RconException;
import com.sandstormtracker.service.rcon.RconPlayer;
import com.sandstormtracker.service.rcon.RconPlayerListDecoder;
import com.sandstormtracker.service.store.StatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Pulls authoritative scores from the server over RCON and writes them onto the
 * current match's stat rows. Never creates players; unknown platform ids are skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScoreReconciliationService {

    // a match that ended this recently still gets the final scoreboard
    static final Duration ENDED_MATCH_GRACE = Duration.ofMinutes(2);

    private final CommandSender commandSender;
    private final RconPlayerListDecoder decoder;
    private final StatStore statStore;
    private final StatWriteService statWriteService;
    private final Clock clock;

    public void reconcile(String serverId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Match> target = targetMatch(serverId, now);
        if (target.isEmpty()) {
            log.debug("[{}] No match to reconcile scores for", serverId);
            return;
        }
        Match match = target.get();

        List<RconPlayer> players;
        try {
            players = decoder.decode(commandSender.sendCommand(serverId, RconPlayerListDecoder.LIST_PLAYERS));
        } catch (RconException e) {
            log.warn("[{}] Score reconciliation skipped: {}", serverId, e.getMessage());
            return;
        }

        LocalDateTime playTimeEnd = match.getEndTime() != null && match.getEndTime().isBefore(now)
            ? match.getEndTime()
            : now;

        int updated = 0;
        for (RconPlayer rconPlayer : players) {
            Optional<Player> player = statStore.findPlayerByPlatformId(rconPlayer.platformId());
            if (player.isEmpty()) {
                log.debug("[{}] RCON player {} ({}) is not known yet", serverId, rconPlayer.name(), rconPlayer.platformId());
                continue;
            }
            String playerId = player.get().getId();
            Optional<MatchPlayerStat> stat = statStore.findStat(match.getId(), playerId);
            if (stat.isEmpty()) {
                continue;
            }

            long playTime = playTimeSeconds(stat.get(), playTimeEnd);
            statWriteService.execute("updateScore", serverId,
                () -> statStore.updateScore(match.getId(), playerId, rconPlayer.score(), playTime));
            updated++;
        }
        log.debug("[{}] Reconciled {} of {} RCON players for match {}", serverId, updated, players.size(), match.getId());
    }

    private Optional<Match> targetMatch(String serverId, LocalDateTime now) {
        List<Match> ongoing = statStore.findOngoingMatches(serverId);
        if (!ongoing.isEmpty()) {
            return Optional.of(ongoing.get(ongoing.size() - 1));
        }
        return statStore.findLatestMatch(serverId)
            .filter(match -> match.getStatus() == MatchStatus.FINISHED)
            .filter(match -> match.getEndTime() != null
                && !match.getEndTime().isBefore(now.minus(ENDED_MATCH_GRACE)));
    }

    private static long playTimeSeconds(MatchPlayerStat stat, LocalDateTime end) {
        LocalDateTime start = stat.getFirstJoinedAt() != null ? stat.getFirstJoinedAt() : stat.getCreatedAt();
        if (start == null || start.isAfter(end)) {
            return 0;
        }
        return Duration.between(start, end).getSeconds();
    }
}
