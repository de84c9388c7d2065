package com.sandstormtracker.parser;

import com.sandstormtracker.config.TrackerProperties;
import com.sandstormtracker.event.ChatCommand;
import com.sandstormtracker.event.ChatCommandEvent;
import com.sandstormtracker.event.EventType;
import com.sandstormtracker.event.GameEvent;
import com.sandstormtracker.event.GameOverEvent;
import com.sandstormtracker.event.KillEvent;
import com.sandstormtracker.event.LogFileOpenEvent;
import com.sandstormtracker.event.LoginRequestEvent;
import com.sandstormtracker.event.MapChangeEvent;
import com.sandstormtracker.event.ObjectiveEvent;
import com.sandstormtracker.event.PlayerDisconnectEvent;
import com.sandstormtracker.event.PlayerJoinEvent;
import com.sandstormtracker.event.PlayerLeaveEvent;
import com.sandstormtracker.event.PlayerRef;
import com.sandstormtracker.event.PlayerRegisterEvent;
import com.sandstormtracker.event.RoundEndEvent;
import com.sandstormtracker.event.RoundStartEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps one raw log line to at most one {@link GameEvent}.
 * <p>
 * Unknown lines are ignored silently. A line that matches a known category but
 * cannot be turned into an event is logged as a parse miss and dropped. Never throws.
 * <p>
 * Order matters: map changes are checked first, objectives before kills.
 */
@Component
@Slf4j
public class LogLineParser {

    private static final String PREFIX = "^\\[(" + LogTimestamps.TIMESTAMP + ")\\]\\[\\s*\\d+\\]";

    private static final Pattern MAP_LOAD = Pattern.compile(PREFIX
        + "LogLoad: LoadMap: /Game/Maps/([^/]+)/[^?]+\\?.*Scenario=([^?&]+).*MaxPlayers=(\\d+).*Lighting=([^?&\\s]+)");
    private static final Pattern MAP_TRAVEL = Pattern.compile(PREFIX
        + "LogGameMode: ProcessServerTravel: ([^?\\s]+)\\?.*Scenario=([^?&\\s]+)");
    private static final Pattern MAX_PLAYERS = Pattern.compile("MaxPlayers=(\\d+)");
    private static final Pattern LIGHTING = Pattern.compile("Lighting=([^?&\\s]+)");

    private static final Pattern OBJECTIVE_CAPTURED = Pattern.compile(PREFIX
        + "LogGameplayEvents: Display: Objective (\\d+) was captured for team (\\d+) from team (\\d+) by (.+)\\.");
    private static final Pattern OBJECTIVE_DESTROYED = Pattern.compile(PREFIX
        + "LogGameplayEvents: Display: Objective (\\d+) owned by team (\\d+) was destroyed for team (\\d+) by (.+)\\.");
    private static final Pattern OBJECTIVE_PLAYER = Pattern.compile(
        "(?:^|\\s*[,+]\\s*)([^\\[,+]+?)\\[([^\\],]*)(?:,\\s*team (\\d+))?\\]");

    private static final Pattern KILL = Pattern.compile(PREFIX
        + "LogGameplayEvents: Display: (.+?) killed ([^\\[]+)\\[([^,\\]]*), team (\\d+)\\] with (.+)$");
    private static final Pattern KILLER = Pattern.compile("^(.+?)\\[([^,\\]]*), team (\\d+)\\]$");

    private static final Pattern LOGIN = Pattern.compile(PREFIX
        + "LogNet: Login request: .*?\\?Name=([^?]+?)(?:\\?\\S*)?\\s+userId: ([^:\\s]+):(\\S+)\\s+platform: (\\S+)");
    private static final Pattern REGISTER = Pattern.compile(PREFIX
        + "LogEOSAntiCheat: Display: ServerRegisterClient: Client: \\((\\d+)\\) Result: \\(EOS_Success\\)");
    private static final Pattern JOIN = Pattern.compile(PREFIX + "LogNet: Join succeeded: (.+)$");
    private static final Pattern JOIN_TEAM = Pattern.compile(PREFIX
        + "LogGameMode: Display: Player \\d+ '([^']+)' joined team (\\d+)");
    private static final Pattern LEAVE = Pattern.compile(PREFIX + "LogRcon: .* << say See you later, (.+)!$");
    private static final Pattern DISCONNECT = Pattern.compile(PREFIX
        + "LogEOSAntiCheat: Display: ServerUnregisterClient: UserId \\((\\d+)\\), Result: \\(EOS_Success\\)");

    private static final Pattern ROUND_START = Pattern.compile(PREFIX
        + "LogGameplayEvents: Display: (?:Pre-)?round (\\d+) started");
    private static final Pattern ROUND_END = Pattern.compile(PREFIX
        + "Log(?:GameMode|GameplayEvents): Display: Round (?:(\\d+) )?O\\s*ver: Team (\\d+) won \\(win reason: (.+)\\)");
    private static final Pattern GAME_OVER = Pattern.compile(PREFIX
        + "(?:LogSession: Display: AINSGameSession::HandleMatchHasEnded|LogGameplayEvents: Display: Game over)");

    private static final Pattern CHAT_COMMAND = Pattern.compile(PREFIX
        + "LogChat: Display: ([^(]+)\\((\\d+)\\) Global Chat: (!\\S+)(?:\\s+(.*))?$");

    private static final Pattern RCON_ACTIVITY = Pattern.compile(PREFIX + "LogRcon: ");

    private final List<Rule> rules = List.of(
        new Rule("map load", MAP_LOAD, this::mapLoad),
        new Rule("map travel", MAP_TRAVEL, this::mapTravel),
        new Rule("objective captured", OBJECTIVE_CAPTURED, m -> objective(EventType.OBJECTIVE_CAPTURED, m)),
        new Rule("objective destroyed", OBJECTIVE_DESTROYED, m -> objective(EventType.OBJECTIVE_DESTROYED, m)),
        new Rule("kill", KILL, this::kill),
        new Rule("login", LOGIN, this::login),
        new Rule("register", REGISTER, m -> Optional.of(new PlayerRegisterEvent(ts(m), m.group(2)))),
        new Rule("join", JOIN, m -> Optional.of(new PlayerJoinEvent(ts(m), m.group(2).trim(), null))),
        new Rule("join team", JOIN_TEAM,
            m -> Optional.of(new PlayerJoinEvent(ts(m), m.group(2).trim(), Integer.parseInt(m.group(3))))),
        new Rule("leave", LEAVE, m -> Optional.of(new PlayerLeaveEvent(ts(m), m.group(2).trim()))),
        new Rule("disconnect", DISCONNECT, m -> Optional.of(new PlayerDisconnectEvent(ts(m), m.group(2)))),
        new Rule("round start", ROUND_START, m -> Optional.of(new RoundStartEvent(ts(m), Integer.parseInt(m.group(2))))),
        new Rule("round end", ROUND_END, this::roundEnd),
        new Rule("game over", GAME_OVER, m -> Optional.of(new GameOverEvent(ts(m)))),
        new Rule("chat command", CHAT_COMMAND, this::chatCommand)
    );

    private final Duration disconnectSuppressionWindow;

    @Autowired
    public LogLineParser(TrackerProperties properties) {
        this(properties.getWatcher().getDisconnectSuppressionWindow());
    }

    public LogLineParser(Duration disconnectSuppressionWindow) {
        this.disconnectSuppressionWindow = disconnectSuppressionWindow;
    }

    public Optional<GameEvent> parse(String rawLine, ServerContext context) {
        if (rawLine == null) {
            return Optional.empty();
        }
        String line = stripLineEnd(LogTimestamps.stripBom(rawLine));
        if (line.isEmpty()) {
            return Optional.empty();
        }

        if (line.startsWith("Log file open")) {
            Optional<GameEvent> opened = LogTimestamps.fromLogOpenLine(line).map(LogFileOpenEvent::new);
            if (opened.isEmpty()) {
                log.warn("[{}] Parse miss (log file open): {}", context.getServerId(), line);
            }
            return opened;
        }
        if (!line.startsWith("[")) {
            return Optional.empty();
        }

        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(line);
            if (!matcher.find()) {
                continue;
            }
            Optional<GameEvent> event;
            try {
                event = rule.builder().apply(matcher);
            } catch (RuntimeException e) {
                log.warn("[{}] Parse miss ({}): {} - {}", context.getServerId(), rule.name(), line, e.getMessage());
                return Optional.empty();
            }
            return event.flatMap(value -> applyContext(value, context));
        }
        return Optional.empty();
    }

    /**
     * True for any line written by the RCON subsystem, used as a liveness marker.
     */
    public static boolean isRconActivity(String line) {
        return line != null && RCON_ACTIVITY.matcher(line).find();
    }

    private Optional<GameEvent> applyContext(GameEvent event, ServerContext context) {
        switch (event.type()) {
            case MAP_TRAVEL -> context.setLastMapTravelAt(event.timestamp());
            case PLAYER_DISCONNECT, PLAYER_LEAVE -> {
                if (withinTravelGrace(event.timestamp(), context)) {
                    log.debug("[{}] Suppressing {} shortly after map travel", context.getServerId(), event.type());
                    return Optional.empty();
                }
            }
            default -> {
                // no context needed
            }
        }
        return Optional.of(event);
    }

    private boolean withinTravelGrace(LocalDateTime at, ServerContext context) {
        LocalDateTime travelAt = context.getLastMapTravelAt();
        if (travelAt == null || at.isBefore(travelAt)) {
            return false;
        }
        return !at.isAfter(travelAt.plus(disconnectSuppressionWindow));
    }

    // ========== Builders ==========

    private Optional<GameEvent> mapLoad(Matcher m) {
        String scenario = m.group(3);
        return Optional.of(new MapChangeEvent(EventType.MAP_LOAD, ts(m), m.group(2), scenario,
            Scenarios.mode(scenario), Scenarios.playerTeam(scenario),
            Integer.parseInt(m.group(4)), m.group(5)));
    }

    private Optional<GameEvent> mapTravel(Matcher m) {
        String scenario = m.group(3);
        String line = m.group(0);
        Matcher maxPlayers = MAX_PLAYERS.matcher(line);
        Matcher lighting = LIGHTING.matcher(line);
        return Optional.of(new MapChangeEvent(EventType.MAP_TRAVEL, ts(m), m.group(2), scenario,
            Scenarios.mode(scenario), Scenarios.playerTeam(scenario),
            maxPlayers.find() ? Integer.valueOf(maxPlayers.group(1)) : null,
            lighting.find() ? lighting.group(1) : null));
    }

    private Optional<GameEvent> objective(EventType type, Matcher m) {
        List<PlayerRef> players = objectivePlayers(m.group(5));
        if (players.isEmpty()) {
            throw new IllegalArgumentException("no credited players");
        }
        int objectiveId = Integer.parseInt(m.group(2));
        int first = Integer.parseInt(m.group(3));
        int second = Integer.parseInt(m.group(4));
        // captured: "for team <first> from team <second>"; destroyed: "owned by team <first> ... for team <second>"
        return type == EventType.OBJECTIVE_CAPTURED
            ? Optional.of(new ObjectiveEvent(type, ts(m), objectiveId, second, first, players))
            : Optional.of(new ObjectiveEvent(type, ts(m), objectiveId, first, second, players));
    }

    private Optional<GameEvent> kill(Matcher m) {
        String killerSection = m.group(2).trim();
        List<PlayerRef> attackers = new ArrayList<>();
        if (!"?".equals(killerSection)) {
            for (String part : killerSection.split(" \\+ ")) {
                Matcher killer = KILLER.matcher(part.trim());
                if (killer.matches()) {
                    attackers.add(new PlayerRef(killer.group(1).trim(), killer.group(2).trim(),
                        Integer.parseInt(killer.group(3))));
                }
            }
            if (attackers.isEmpty()) {
                throw new IllegalArgumentException("unreadable killer section '" + killerSection + "'");
            }
        }
        PlayerRef victim = new PlayerRef(m.group(3).trim(), m.group(4).trim(), Integer.parseInt(m.group(5)));
        String rawWeapon = m.group(6).trim();
        return Optional.of(new KillEvent(ts(m), attackers, victim, rawWeapon,
            WeaponNames.clean(rawWeapon), WeaponNames.typeOf(rawWeapon)));
    }

    private Optional<GameEvent> login(Matcher m) {
        return Optional.of(new LoginRequestEvent(ts(m), m.group(2).trim(), m.group(4), m.group(5)));
    }

    private Optional<GameEvent> roundEnd(Matcher m) {
        Integer round = m.group(2) != null ? Integer.valueOf(m.group(2)) : null;
        return Optional.of(new RoundEndEvent(ts(m), round, Integer.valueOf(m.group(3)), m.group(4).trim()));
    }

    private Optional<GameEvent> chatCommand(Matcher m) {
        String token = m.group(4);
        Optional<ChatCommand> command = ChatCommand.fromToken(token);
        if (command.isEmpty()) {
            log.debug("Ignoring unknown chat command {}", token);
            return Optional.empty();
        }
        String arguments = m.group(5) != null ? m.group(5).trim() : "";
        return Optional.of(new ChatCommandEvent(ts(m), m.group(2).trim(), m.group(3), command.get(), arguments));
    }

    static List<PlayerRef> objectivePlayers(String section) {
        List<PlayerRef> players = new ArrayList<>();
        Matcher matcher = OBJECTIVE_PLAYER.matcher(section);
        while (matcher.find()) {
            int team = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : PlayerRef.NO_TEAM;
            players.add(new PlayerRef(matcher.group(1).trim(), matcher.group(2).trim(), team));
        }
        return players;
    }

    private static LocalDateTime ts(Matcher m) {
        return LogTimestamps.parse(m.group(1));
    }

    private static String stripLineEnd(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) {
            end--;
        }
        return line.substring(0, end);
    }

    private record Rule(String name, Pattern pattern, Function<Matcher, Optional<GameEvent>> builder) {}
}
