package com.questrail.spooltag.bridge.internal;

/**
 * JSON envelope field names shared by the encoder and decoder.
 */
public final class EnvelopeFields
{
    public static final String ACTION = "action";
    public static final String REQUEST_ID = "request_id";
    public static final String KEYS = "keys";
    public static final String BLOCKS = "blocks";
    public static final String UID = "uid";
    public static final String CONNECTED = "connected";
    public static final String DEVICE = "device";
    public static final String SUCCESS = "success";
    public static final String BLOCKS_WRITTEN = "blocks_written";
    public static final String ERROR = "error";
    public static final String MESSAGE = "message";
    public static final String UNREADABLE_SECTORS = "unreadable_sectors";

    private EnvelopeFields() {}
}
