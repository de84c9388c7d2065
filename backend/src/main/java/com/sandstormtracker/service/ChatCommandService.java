package com.sandstormtracker.service;

import com.sandstormtracker.dto.stats.PlayerTotals;
import com.sandstormtracker.dto.stats.WeaponTotals;
import com.sandstormtracker.event.ChatCommandEvent;
import com.sandstormtracker.model.mongo.Player;
import com.sandstormtracker.service.rcon.CommandSender;
import com.sandstormtracker.service.rcon.RconException;
import com.sandstormtracker.service.store.StatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

// ========== Chat Command Service ==========
// In-game "!" commands answered with lifetime stats through RCON "say".
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatCommandService {

    static final int TOP_LIMIT = 3;
    static final long MIN_RANKED_PLAY_SECONDS = 60;

    private final StatStore statStore;
    private final CommandSender commandSender;

    @Async("rconExecutor")
    public void respond(String serverId, ChatCommandEvent event) {
        String reply = reply(event);
        try {
            commandSender.sendCommand(serverId, "say " + reply);
            log.debug("[{}] Answered {} for {}", serverId, event.command(), event.name());
        } catch (RconException e) {
            log.warn("[{}] Could not answer {} for {}: {}", serverId, event.command(), event.name(), e.getMessage());
        }
    }

    String reply(ChatCommandEvent event) {
        Optional<Player> player = findPlayer(event);
        return switch (event.command()) {
            case KDR -> kdr(event.name(), player);
            case STATS -> stats(event.name(), player);
            case TOP -> top();
            case GUNS -> guns(event.name(), player);
        };
    }

    private String kdr(String name, Optional<Player> player) {
        PlayerTotals totals = player.flatMap(p -> statStore.playerTotals(p.getId()))
            .orElseGet(PlayerTotals::new);
        return String.format(Locale.ROOT, "%s: %d kills, %d deaths, K/D: %.2f",
            name, totals.getKills(), totals.getDeaths(), totals.killDeathRatio());
    }

    private String stats(String name, Optional<Player> player) {
        Optional<PlayerTotals> own = player.flatMap(p -> statStore.playerTotals(p.getId()));
        if (own.isEmpty()) {
            return name + ": No stats available yet!";
        }
        PlayerTotals totals = own.get();

        List<PlayerTotals> ranking = rankByScorePerMinute(statStore.allPlayerTotals());
        int rank = IntStream.range(0, ranking.size())
            .filter(i -> ranking.get(i).getPlayerId().equals(totals.getPlayerId()))
            .findFirst()
            .orElse(ranking.size()) + 1;

        long hours = totals.getTotalPlayTime() / 3600;
        long minutes = (totals.getTotalPlayTime() % 3600) / 60;
        return String.format(Locale.ROOT, "%s: Score: %d, Time: %dh%dm, Score/Min: %.1f, Rank: #%d/%d",
            name, totals.getScore(), hours, minutes, totals.scorePerMinute(), rank, Math.max(ranking.size(), rank));
    }

    private String top() {
        List<PlayerTotals> ranked = rankByScorePerMinute(statStore.allPlayerTotals()).stream()
            .filter(totals -> totals.getTotalPlayTime() >= MIN_RANKED_PLAY_SECONDS)
            .limit(TOP_LIMIT)
            .toList();

        StringBuilder reply = new StringBuilder("Top 3 Players by Score/Min:");
        for (int i = 0; i < ranked.size(); i++) {
            PlayerTotals totals = ranked.get(i);
            String playerName = statStore.findPlayer(totals.getPlayerId())
                .map(Player::getName)
                .orElse(totals.getPlayerId());
            reply.append(String.format(Locale.ROOT, " | #%d: %s - %.1f score/min",
                i + 1, playerName, totals.scorePerMinute()));
        }
        return reply.toString();
    }

    private String guns(String name, Optional<Player> player) {
        List<WeaponTotals> weapons = player.map(p -> statStore.weaponTotals(p.getId())).orElse(List.of());
        if (weapons.isEmpty()) {
            return name + ": No weapon stats available yet!";
        }
        String listed = IntStream.range(0, Math.min(TOP_LIMIT, weapons.size()))
            .mapToObj(i -> "#" + (i + 1) + ": " + weapons.get(i).getWeaponName() + " (" + weapons.get(i).getKills() + ")")
            .collect(Collectors.joining(", "));
        return name + "'s Top Weapons: " + listed;
    }

    private Optional<Player> findPlayer(ChatCommandEvent event) {
        if (event.platformId() != null && !event.platformId().isBlank()) {
            Optional<Player> byPlatform = statStore.findPlayerByPlatformId(event.platformId());
            if (byPlatform.isPresent()) {
                return byPlatform;
            }
        }
        return statStore.findPlayerByName(event.name());
    }

    private static List<PlayerTotals> rankByScorePerMinute(List<PlayerTotals> totals) {
        return totals.stream()
            .sorted(Comparator.comparingDouble(PlayerTotals::scorePerMinute).reversed())
            .toList();
    }
}
