package com.sandstormtracker.model.mongo;

public enum PlayerMatchStatus {
    ONGOING,
    DISCONNECTED,
    FINISHED
}
