package io.taskrelay.registry;

public enum ConnectionState {
    CONNECTED,
    DISCONNECTED
}
