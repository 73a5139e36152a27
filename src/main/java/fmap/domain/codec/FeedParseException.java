package fmap.domain.codec;

/**
 * Thrown when a telemetry or job document cannot be read at all
 * @since 15/10/2026
 */
public class FeedParseException extends Exception {
    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
