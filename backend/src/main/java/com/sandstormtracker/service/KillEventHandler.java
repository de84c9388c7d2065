package com.sandstormtracker.service;

import com.sandstormtracker.event.KillEvent;
import com.sandstormtracker.event.PlayerRef;
import com.sandstormtracker.model.mongo.FriendlyFireIncident;
import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.MatchPlayerStat;
import com.sandstormtracker.model.mongo.Player;
import com.sandstormtracker.parser.WeaponNames;
import com.sandstormtracker.service.store.StatCounter;
import com.sandstormtracker.service.store.StatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Scoring rules for one kill line.
 * <ul>
 *   <li>first attacker on the opposing team: kill and weapon kill for the attacker</li>
 *   <li>first attacker is the victim: suicide, the death is the only change</li>
 *   <li>first attacker on the victim's team: friendly fire, no kill or weapon credit. A bot
 *   teammate counts as an ordinary kill.</li>
 *   <li>every further attacker: one assist and one weapon kill, whatever the first attacker did</li>
 * </ul>
 * Bots are never credited and never become players. A player victim always takes the death.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KillEventHandler {

    private final StatStore statStore;
    private final StatWriteService statWriteService;
    private final PlayerService playerService;

    public void handle(String serverId, Match match, KillEvent event) {
        List<PlayerRef> attackers = event.attackers();
        PlayerRef victim = event.victim();
        LocalDateTime at = event.timestamp();

        Optional<Player> victimPlayer = playerService.resolve(serverId, victim);
        PlayerRef primary = attackers.isEmpty() ? null : attackers.get(0);

        boolean suicide = primary != null && isSuicide(primary, victim);
        if (suicide) {
            log.debug("[{}] {} killed themselves with {}", serverId, victim.name(), event.weapon());
        } else if (primary != null) {
            playerService.resolve(serverId, primary).ifPresent(killer -> {
                if (victimPlayer.isPresent() && sameTeam(primary, victim)) {
                    credit(serverId, match, killer, primary.team(), StatCounter.FRIENDLY_FIRE_KILLS, at);
                    recordFriendlyFire(serverId, match, killer, victimPlayer.get(), primary, victim, event);
                } else {
                    credit(serverId, match, killer, primary.team(), StatCounter.KILLS, at);
                    creditWeapon(serverId, match, killer, event);
                }
            });
        }

        for (PlayerRef assistant : attackers.subList(Math.min(1, attackers.size()), attackers.size())) {
            playerService.resolve(serverId, assistant).ifPresent(player -> {
                credit(serverId, match, player, assistant.team(), StatCounter.ASSISTS, at);
                creditWeapon(serverId, match, player, event);
            });
        }

        victimPlayer.ifPresent(player -> credit(serverId, match, player, victim.team(), StatCounter.DEATHS, at));
        if (!suicide) {
            log.debug("[{}] Kill applied: {} -> {} with {}", serverId,
                primary != null ? primary.name() : "?", victim.name(), event.weapon());
        }
    }

    private void credit(String serverId, Match match, Player player, int team, StatCounter counter, LocalDateTime at) {
        Integer knownTeam = team >= 0 ? team : null;
        statWriteService.execute("ensureStat", serverId,
            () -> statStore.ensureStat(match.getId(), player.getId(), knownTeam, at));
        statWriteService.execute("increment " + counter, serverId,
            () -> statStore.incrementStat(match.getId(), player.getId(), counter));
    }

    private void creditWeapon(String serverId, Match match, Player player, KillEvent event) {
        statWriteService.execute("incrementWeaponKills", serverId,
            () -> statStore.incrementWeaponKills(match.getId(), player.getId(), event.weapon(), event.weaponType()));
    }

    private void recordFriendlyFire(String serverId, Match match, Player killer, Player victim,
                                    PlayerRef killerRef, PlayerRef victimRef, KillEvent event) {
        LocalDateTime at = event.timestamp();
        Double sinceLast = statStore.findLastFriendlyFire(match.getId(), killer.getId())
            .map(previous -> seconds(previous.getTimestamp(), at))
            .orElse(null);
        int killerKills = statStore.findStat(match.getId(), killer.getId())
            .map(MatchPlayerStat::getKills)
            .orElse(0);
        long previousIncidents = statStore.countFriendlyFire(match.getId(), killer.getId());

        FriendlyFireIncident incident = FriendlyFireIncident.builder()
            .matchId(match.getId())
            .serverId(serverId)
            .killerId(killer.getId())
            .victimId(victim.getId())
            .weapon(event.weapon())
            .weaponType(event.weaponType())
            .timestamp(at)
            .killerTeam(killerRef.team())
            .victimTeam(victimRef.team())
            .timeSinceMatchStartSeconds(match.getStartTime() != null ? seconds(match.getStartTime(), at) : null)
            .timeSinceLastFfSeconds(sinceLast)
            .killerTotalKillsInMatch(killerKills)
            .killerFfCountInMatch((int) previousIncidents + 1)
            .explosiveWeapon(WeaponNames.isExplosive(event.weapon(), event.weaponType()))
            .vehicleWeapon(WeaponNames.isVehicle(event.weapon(), event.weaponType()))
            .map(match.getMap())
            .mode(match.getMode())
            .build();

        statWriteService.execute("recordFriendlyFire", serverId, () -> statStore.recordFriendlyFire(incident));
        log.debug("[{}] Friendly fire: {} killed teammate {} with {}", serverId, killerRef.name(), victimRef.name(),
            event.weapon());
    }

    private static boolean isSuicide(PlayerRef attacker, PlayerRef victim) {
        if (attacker.isBot() || victim.isBot()) {
            return false;
        }
        return attacker.platformId().equals(victim.platformId());
    }

    private static boolean sameTeam(PlayerRef attacker, PlayerRef victim) {
        return attacker.hasTeam() && victim.hasTeam() && attacker.team() == victim.team();
    }

    private static double seconds(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }
}
