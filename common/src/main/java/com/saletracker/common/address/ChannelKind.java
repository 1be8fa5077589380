package com.saletracker.common.address;

public enum ChannelKind {
    DIRECT,
    GROUP,
    UNKNOWN
}
