package com.shelfmark.app.thumbnail;

public enum DaemonState {
    IDLE,
    POLLING,
    DISPATCHING,
    RENDERING,
    UPDATING
}
