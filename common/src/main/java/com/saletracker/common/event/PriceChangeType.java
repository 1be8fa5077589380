package com.saletracker.common.event;

public enum PriceChangeType {
    BECAME_FREE,
    INCREASE,
    DECREASE
}
