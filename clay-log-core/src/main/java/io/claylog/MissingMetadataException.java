package io.claylog;

/**
 * Thrown by {@link ClayLog#meta} when the metadata map is {@code null} or empty.
 * Forking with nothing to add is treated as a caller bug.
 */
public class MissingMetadataException extends IllegalArgumentException {

    public MissingMetadataException(String message) {
        super(message);
    }
}
