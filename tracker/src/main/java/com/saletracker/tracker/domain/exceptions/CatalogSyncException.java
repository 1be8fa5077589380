package com.saletracker.tracker.domain.exceptions;

public class CatalogSyncException extends RuntimeException {

    private CatalogSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /** {@code detail} must already be free of credentials; the transport cause is not attached. */
    public static CatalogSyncException transport(long cursor, String detail) {
        return new CatalogSyncException("Catalog page request failed at cursor " + cursor + ": " + detail, null);
    }

    public static CatalogSyncException malformedResponse(long cursor, String detail) {
        return new CatalogSyncException("Malformed catalog page at cursor " + cursor + ": " + detail, null);
    }

    public static CatalogSyncException malformedResponse(long cursor, Throwable cause) {
        return new CatalogSyncException("Malformed catalog page at cursor " + cursor, cause);
    }

    public static CatalogSyncException stalledCursor(long cursor) {
        return new CatalogSyncException("Catalog source reported more results without advancing past cursor " + cursor, null);
    }

    public static CatalogSyncException interrupted(long cursor, InterruptedException cause) {
        return new CatalogSyncException("Catalog sync interrupted at cursor " + cursor, cause);
    }
}
