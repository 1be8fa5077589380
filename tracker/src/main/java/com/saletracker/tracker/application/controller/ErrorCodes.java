package com.saletracker.tracker.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String STORAGE_ERROR = "STORAGE_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
