package com.sandstormtracker.watcher;

/**
 * Edge notifications for a server's log activity. Each edge fires once per transition.
 */
public interface ServerActivityListener {

    void onActive(String serverId);

    void onInactive(String serverId);
}
