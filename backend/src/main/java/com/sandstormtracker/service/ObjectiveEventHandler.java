package com.sandstormtracker.service;

import com.sandstormtracker.event.ObjectiveEvent;
import com.sandstormtracker.event.PlayerRef;
import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.Player;
import com.sandstormtracker.service.store.StatCounter;
import com.sandstormtracker.service.store.StatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

// ========== Objective Event Handler ==========
// Every credited player gets the full capture/destroy credit.
@Service
@RequiredArgsConstructor
@Slf4j
public class ObjectiveEventHandler {

    private final StatStore statStore;
    private final StatWriteService statWriteService;
    private final PlayerService playerService;

    public void handle(String serverId, Match match, ObjectiveEvent event) {
        StatCounter counter = event.captured() ? StatCounter.OBJECTIVES_CAPTURED : StatCounter.OBJECTIVES_DESTROYED;

        int credited = 0;
        for (PlayerRef ref : event.players()) {
            Optional<Player> player = playerService.resolve(serverId, ref);
            if (player.isEmpty()) {
                continue;
            }
            String playerId = player.get().getId();
            Integer team = ref.hasTeam() ? ref.team() : Integer.valueOf(event.forTeam());
            statWriteService.execute("ensureStat", serverId,
                () -> statStore.ensureStat(match.getId(), playerId, team, event.timestamp()));
            statWriteService.execute("increment " + counter, serverId,
                () -> statStore.incrementStat(match.getId(), playerId, counter));
            credited++;
        }

        statWriteService.execute("incrementRoundObjective", serverId,
            () -> statStore.incrementRoundObjective(match.getId()));
        log.debug("[{}] Objective {} {} for team {}, {} players credited", serverId, event.objectiveId(),
            event.captured() ? "captured" : "destroyed", event.forTeam(), credited);
    }
}
