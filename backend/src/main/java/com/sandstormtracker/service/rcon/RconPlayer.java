package com.sandstormtracker.service.rcon;

/**
 * One row of the {@code listplayers} table that belongs to a real player.
 */
public record RconPlayer(String name, String platformId, String netId, int score) {}
