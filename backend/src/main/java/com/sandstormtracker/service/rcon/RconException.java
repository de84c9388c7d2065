package com.sandstormtracker.service.rcon;

import java.io.IOException;

public class RconException extends IOException {

    public RconException(String message) {
        super(message);
    }

    public RconException(String message, Throwable cause) {
        super(message, cause);
    }
}
