package com.ragkit.store;

public enum StoreState {
    UNINITIALIZED,
    CONNECTED,
    READY,
    RESETTING,
    BROKEN
}
