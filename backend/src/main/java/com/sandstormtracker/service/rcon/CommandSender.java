package com.sandstormtracker.service.rcon;

/**
 * Sends one admin console command to a game server and returns its text response.
 */
public interface CommandSender {

    String sendCommand(String serverId, String command) throws RconException;
}
