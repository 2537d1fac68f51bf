package pl.marcinmilkowski.line_search.server;

import java.nio.charset.StandardCharsets;

/**
 * The three replies a client can receive, one newline-terminated ASCII line each.
 */
public enum Response {
    EXISTS("STRING EXISTS\n"),
    NOT_FOUND("STRING NOT FOUND\n"),
    ERROR("ERROR\n");

    private final String line;
    private final byte[] wire;

    Response(String line) {
        this.line = line;
        this.wire = line.getBytes(StandardCharsets.US_ASCII);
    }

    public static Response of(boolean found) {
        return found ? EXISTS : NOT_FOUND;
    }

    /**
     * The reply without its trailing newline, as clients print it.
     */
    public String text() {
        return line.substring(0, line.length() - 1);
    }

    byte[] wireBytes() {
        return wire.clone();
    }
}
