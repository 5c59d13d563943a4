package com.questrail.bacnet.internal.time;

import java.time.Instant;

public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
