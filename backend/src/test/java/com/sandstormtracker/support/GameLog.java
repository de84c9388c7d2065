package com.sandstormtracker.support;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Builders for game server log lines in the exact shapes the server writes them.
 */
public final class GameLog {

    private static final DateTimeFormatter LINE = DateTimeFormatter.ofPattern("yyyy.MM.dd-HH.mm.ss:SSS");
    private static final DateTimeFormatter OPEN = DateTimeFormatter.ofPattern("MM/dd/yy HH:mm:ss");

    private GameLog() {}

    public static String line(LocalDateTime at, String body) {
        return "[" + LINE.format(at) + "][  0]" + body;
    }

    public static String logOpen(LocalDateTime at) {
        return "Log file open, " + OPEN.format(at);
    }

    public static String mapLoad(LocalDateTime at, String map, String scenario) {
        return line(at, "LogLoad: LoadMap: /Game/Maps/" + map + "/" + map + "?Name=Player?Scenario=" + scenario
            + "?MaxPlayers=8?Lighting=Day");
    }

    public static String mapTravel(LocalDateTime at, String map, String scenario) {
        return line(at, "LogGameMode: ProcessServerTravel: " + map + "?Scenario=" + scenario + "?Game=");
    }

    public static String login(LocalDateTime at, String name, String platformId) {
        return line(at, "LogNet: Login request: ?Name=" + name + " userId: SteamNWI:" + platformId + " platform: SteamNWI");
    }

    public static String register(LocalDateTime at, String platformId) {
        return line(at, "LogEOSAntiCheat: Display: ServerRegisterClient: Client: (" + platformId + ") Result: (EOS_Success)");
    }

    public static String join(LocalDateTime at, String name) {
        return line(at, "LogNet: Join succeeded: " + name);
    }

    public static String disconnect(LocalDateTime at, String platformId) {
        return line(at, "LogEOSAntiCheat: Display: ServerUnregisterClient: UserId (" + platformId + "), Result: (EOS_Success)");
    }

    public static String kill(LocalDateTime at, String killers, String victim, String weapon) {
        return line(at, "LogGameplayEvents: Display: " + killers + " killed " + victim + " with " + weapon);
    }

    public static String roundOver(LocalDateTime at, int round, int winner) {
        return line(at, "LogGameplayEvents: Display: Round " + round + " Over: Team " + winner
            + " won (win reason: Elimination)");
    }

    public static String gameOver(LocalDateTime at) {
        return line(at, "LogGameplayEvents: Display: Game over");
    }

    public static String rcon(LocalDateTime at, String command) {
        return line(at, "LogRcon: 127.0.0.1:58877 << " + command);
    }
}
