package com.saletracker.common.event;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreLinks {

    public static final String APP_PAGE_BASE = "https://store.steampowered.com/app/";

    public static String appPage(long appId) {
        return APP_PAGE_BASE + appId;
    }
}
