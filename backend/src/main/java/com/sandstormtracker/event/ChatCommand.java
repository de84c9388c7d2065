package com.sandstormtracker.event;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum ChatCommand {
    KDR("!kdr"),
    STATS("!stats"),
    TOP("!top"),
    GUNS("!guns", "!weapons");

    private final List<String> tokens;

    ChatCommand(String... tokens) {
        this.tokens = List.of(tokens);
    }

    public List<String> getTokens() {
        return tokens;
    }

    public static Optional<ChatCommand> fromToken(String token) {
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(command -> command.tokens.contains(normalized))
            .findFirst();
    }
}
