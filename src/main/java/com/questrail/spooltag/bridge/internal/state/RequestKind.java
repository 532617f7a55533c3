package com.questrail.spooltag.bridge.internal.state;

/** Kind of tag operation a request asks for. */
public enum RequestKind {
    READ,
    WRITE
}
