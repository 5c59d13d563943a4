package com.questrail.bacnet.device;

/**
 * Lifecycle of a {@link LocalDevice}. Transitions only move forward:
 * {@code UNINITIALIZED → INITIALIZED → TERMINATED}. A failed bind moves an
 * uninitialized device straight to {@code TERMINATED}.
 */
public enum LocalDeviceState
{
    UNINITIALIZED,
    INITIALIZED,
    TERMINATED
}
