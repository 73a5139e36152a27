package fmap.common;

/**
 * Web Server Parameters
 * @since 14/10/2026
 */
public final class ServerConstants {
    private ServerConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final int SERVER_PORT = 8080;
    public static final String SERVER_IP = "0.0.0.0";
}
