package com.questrail.spooltag.crypto;

/**
 * Indicates input that key derivation refuses to process, such as an empty uid.
 */
public final class InvalidInputException extends RuntimeException
{
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
