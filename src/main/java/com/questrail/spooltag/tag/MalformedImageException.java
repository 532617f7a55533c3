package com.questrail.spooltag.tag;

/**
 * Indicates that a tag image (or a block within it) does not have the fixed
 * 64 x 16 byte shape.
 *
 * This typically reflects:
 * <ul>
 *   <li>A block list with a count other than 64</li>
 *   <li>A block whose length is not 16 bytes</li>
 *   <li>A dump whose total size is not 1024 bytes</li>
 * </ul>
 */
public final class MalformedImageException extends RuntimeException
{
    public MalformedImageException(String message) {
        super(message);
    }

    public MalformedImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
