package com.chicu.opsdash.common.enums;

/**
 * Состояния live-канала.
 *
 * CONNECTING → STREAMING → POLLING, из любого состояния → CLOSED.
 */
public enum ChannelMode {
    CONNECTING,
    STREAMING,
    POLLING,
    CLOSED;

    public boolean isLive() {
        return this == STREAMING;
    }
}
