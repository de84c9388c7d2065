package com.sandstormtracker.service;

import com.sandstormtracker.config.TrackerProperties;
import com.sandstormtracker.event.ChatCommandEvent;
import com.sandstormtracker.event.GameEvent;
import com.sandstormtracker.event.KillEvent;
import com.sandstormtracker.event.LoginRequestEvent;
import com.sandstormtracker.event.MapChangeEvent;
import com.sandstormtracker.event.ObjectiveEvent;
import com.sandstormtracker.event.PlayerDisconnectEvent;
import com.sandstormtracker.event.PlayerJoinEvent;
import com.sandstormtracker.event.PlayerLeaveEvent;
import com.sandstormtracker.event.PlayerRegisterEvent;
import com.sandstormtracker.event.RoundEndEvent;
import com.sandstormtracker.event.RoundStartEvent;
import com.sandstormtracker.model.mongo.Match;
import com.sandstormtracker.model.mongo.MatchStatus;
import com.sandstormtracker.model.mongo.Player;
import com.sandstormtracker.model.mongo.PlayerMatchStatus;
import com.sandstormtracker.parser.ServerContext;
import com.sandstormtracker.service.store.StatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Applies parsed events to match state, one server at a time and in log order.
 * <p>
 * In catch-up mode the same transitions run, but nothing talks to the game server:
 * no score reconciliation and no chat replies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameEventHandler {

    private final StatStore statStore;
    private final StatWriteService statWriteService;
    private final MatchService matchService;
    private final PlayerService playerService;
    private final KillEventHandler killEventHandler;
    private final ObjectiveEventHandler objectiveEventHandler;
    private final ChatCommandService chatCommandService;
    private final ScoreDebouncer scoreDebouncer;
    private final TrackerProperties properties;

    public void handle(ServerContext context, GameEvent event, boolean catchup) {
        String serverId = context.getServerId();
        ScoreUpdate update = switch (event.type()) {
            case LOG_FILE_OPEN -> onLogFileOpen(context, event.timestamp());
            case LOGIN_REQUEST -> onLoginRequest(context, (LoginRequestEvent) event);
            case PLAYER_REGISTER -> onRegister(context, (PlayerRegisterEvent) event);
            case PLAYER_JOIN -> onJoin(context, (PlayerJoinEvent) event);
            case PLAYER_LEAVE -> onLeave(serverId, (PlayerLeaveEvent) event);
            case PLAYER_DISCONNECT -> onDisconnect(serverId, (PlayerDisconnectEvent) event);
            case KILL -> onKill(context, (KillEvent) event);
            case OBJECTIVE_CAPTURED, OBJECTIVE_DESTROYED -> onObjective(context, (ObjectiveEvent) event);
            case ROUND_START -> onRoundStart(serverId, (RoundStartEvent) event);
            case ROUND_END -> onRoundEnd(serverId, (RoundEndEvent) event);
            case MAP_LOAD, MAP_TRAVEL -> onMapChange(context, (MapChangeEvent) event);
            case GAME_OVER -> onGameOver(serverId, event.timestamp());
            case CHAT_COMMAND -> onChatCommand(serverId, (ChatCommandEvent) event, catchup);
        };

        if (!catchup) {
            requestScoreUpdate(serverId, update);
        }
    }

    // ========== Match lifecycle ==========

    private ScoreUpdate onLogFileOpen(ServerContext context, LocalDateTime openedAt) {
        String serverId = context.getServerId();
        // a fresh log says nothing about which map is up until it loads one
        context.setLastMapChange(null);
        statWriteService.execute("saveLogFileCreationTime", serverId,
            () -> statStore.saveLogFileCreationTime(serverId, openedAt));
        matchService.endActiveMatch(serverId, MatchStatus.CRASHED, PlayerMatchStatus.DISCONNECTED, openedAt)
            .ifPresent(crashed -> log.info("[{}] New log file opened at {}, match {} marked as crashed",
                serverId, openedAt, crashed.getId()));
        return ScoreUpdate.NONE;
    }

    private ScoreUpdate onMapChange(ServerContext context, MapChangeEvent event) {
        String serverId = context.getServerId();
        context.setLastMapChange(event);
        matchService.startMatch(serverId, event).ifPresent(match ->
            log.info("[{}] {} {} ({}), match {}", serverId, event.travel() ? "Travel to" : "Loaded",
                event.map(), event.scenario(), match.getId()));
        return ScoreUpdate.NONE;
    }

    private ScoreUpdate onRoundStart(String serverId, RoundStartEvent event) {
        log.debug("[{}] Round {} started", serverId, event.round());
        return ScoreUpdate.NONE;
    }

    private ScoreUpdate onRoundEnd(String serverId, RoundEndEvent event) {
        Optional<Match> match = activeMatch(serverId, event);
        if (match.isEmpty()) {
            return ScoreUpdate.NONE;
        }
        String matchId = match.get().getId();
        statWriteService.execute("incrementRound", serverId,
            () -> statStore.incrementRound(matchId, event.winnerTeam()));
        log.info("[{}] Round over in match {}: team {} won ({})", serverId, matchId, event.winnerTeam(),
            event.reason());
        return ScoreUpdate.IMMEDIATE;
    }

    private ScoreUpdate onGameOver(String serverId, LocalDateTime at) {
        Optional<Match> ended = matchService.endActiveMatch(serverId, MatchStatus.FINISHED,
            PlayerMatchStatus.FINISHED, at);
        if (ended.isEmpty()) {
            log.debug("[{}] Game over without an ongoing match", serverId);
            return ScoreUpdate.NONE;
        }
        return ScoreUpdate.IMMEDIATE;
    }

    // ========== Connections ==========

    private ScoreUpdate onLoginRequest(ServerContext context, LoginRequestEvent event) {
        context.rememberLogin(event.name(), event.platformId());
        log.debug("[{}] Login request from {} ({} {})", context.getServerId(), event.name(), event.platform(),
            event.platformId());
        return ScoreUpdate.NONE;
    }

    private ScoreUpdate onRegister(ServerContext context, PlayerRegisterEvent event) {
        String serverId = context.getServerId();
        Optional<Player> player = playerService.register(context, event.platformId());
        Optional<Match> match = activeMatch(serverId, event);
        if (player.isPresent() && match.isPresent()) {
            join(serverId, match.get(), player.get(), null, event.timestamp());
        }
        return ScoreUpdate.NONE;
    }

    private ScoreUpdate onJoin(ServerContext context, PlayerJoinEvent event) {
        String serverId = context.getServerId();
        Optional<Player> player = playerService.resolveByName(context, event.name());
        if (player.isEmpty()) {
            log.debug("[{}] Join of unknown player {} ignored", serverId, event.name());
            return ScoreUpdate.NONE;
        }
        activeMatch(serverId, event).ifPresent(match ->
            join(serverId, match, player.get(), event.team(), event.timestamp()));
        return ScoreUpdate.NONE;
    }

    private ScoreUpdate onLeave(String serverId, PlayerLeaveEvent event) {
        Optional<Player> player = statStore.findPlayerByName(event.name());
        player.ifPresent(p -> leave(serverId, p, event));
        return ScoreUpdate.NONE;
    }

    private ScoreUpdate onDisconnect(String serverId, PlayerDisconnectEvent event) {
        Optional<Player> player = statStore.findPlayerByPlatformId(event.platformId());
        player.ifPresent(p -> leave(serverId, p, event));
        return ScoreUpdate.NONE;
    }

    private void join(String serverId, Match match, Player player, Integer team, LocalDateTime at) {
        statWriteService.execute("joinMatch", serverId,
            () -> statStore.joinMatch(match.getId(), player.getId(), team, at));
        log.debug("[{}] {} joined match {}", serverId, player.getName(), match.getId());
    }

    private void leave(String serverId, Player player, GameEvent event) {
        activeMatch(serverId, event).ifPresent(match -> {
            statWriteService.execute("leaveMatch", serverId,
                () -> statStore.leaveMatch(match.getId(), player.getId(), event.timestamp()));
            log.debug("[{}] {} left match {}", serverId, player.getName(), match.getId());
        });
    }

    // ========== Scoring ==========

    private ScoreUpdate onKill(ServerContext context, KillEvent event) {
        Optional<Match> match = reopenedMatch(context, event);
        if (match.isEmpty()) {
            return ScoreUpdate.NONE;
        }
        killEventHandler.handle(context.getServerId(), match.get(), event);
        return ScoreUpdate.DEBOUNCED;
    }

    private ScoreUpdate onObjective(ServerContext context, ObjectiveEvent event) {
        Optional<Match> match = reopenedMatch(context, event);
        if (match.isEmpty()) {
            return ScoreUpdate.NONE;
        }
        objectiveEventHandler.handle(context.getServerId(), match.get(), event);
        return ScoreUpdate.FIXED_DELAY;
    }

    private ScoreUpdate onChatCommand(String serverId, ChatCommandEvent event, boolean catchup) {
        if (!catchup) {
            chatCommandService.respond(serverId, event);
        }
        return ScoreUpdate.NONE;
    }

    private void requestScoreUpdate(String serverId, ScoreUpdate update) {
        switch (update) {
            case DEBOUNCED -> scoreDebouncer.trigger(serverId);
            case FIXED_DELAY -> scoreDebouncer.triggerFixed(serverId, properties.getScores().getObjectiveDelay());
            case IMMEDIATE -> scoreDebouncer.executeImmediately(serverId);
            case NONE -> {
                // nothing score related happened
            }
        }
    }

    private Optional<Match> activeMatch(String serverId, GameEvent event) {
        Optional<Match> match = matchService.getActiveMatch(serverId);
        if (match.isEmpty()) {
            log.debug("[{}] {} at {} outside of any match", serverId, event.type(), event.timestamp());
        }
        return match;
    }

    private Optional<Match> reopenedMatch(ServerContext context, GameEvent event) {
        Optional<Match> match = matchService.getOrReopenMatch(context, event.timestamp());
        if (match.isEmpty()) {
            log.debug("[{}] {} at {} after the game ended, waiting for the next map", context.getServerId(),
                event.type(), event.timestamp());
        }
        return match;
    }

    private enum ScoreUpdate {
        NONE,
        DEBOUNCED,
        FIXED_DELAY,
        IMMEDIATE
    }
}
