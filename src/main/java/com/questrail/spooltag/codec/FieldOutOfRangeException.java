package com.questrail.spooltag.codec;

/**
 * Indicates that a record field cannot be represented in its fixed on-tag slot.
 *
 * <p>The encoder fails rather than saturating or wrapping. {@link #field()}
 * names the offending field.</p>
 */
public final class FieldOutOfRangeException extends RuntimeException
{
    private final String field;

    public FieldOutOfRangeException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
