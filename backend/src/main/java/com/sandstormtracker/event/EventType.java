package com.sandstormtracker.event;

public enum EventType {
    LOG_FILE_OPEN,
    LOGIN_REQUEST,
    PLAYER_REGISTER,
    PLAYER_JOIN,
    PLAYER_LEAVE,
    PLAYER_DISCONNECT,
    KILL,
    OBJECTIVE_CAPTURED,
    OBJECTIVE_DESTROYED,
    ROUND_START,
    ROUND_END,
    MAP_LOAD,
    MAP_TRAVEL,
    GAME_OVER,
    CHAT_COMMAND
}
