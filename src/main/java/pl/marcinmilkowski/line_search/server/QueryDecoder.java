package pl.marcinmilkowski.line_search.server;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Turns the single chunk read from a client into a query string.
 *
 * The chunk is decoded strictly as UTF-8 and trailing NUL padding is removed.
 * When the chunk filled the read buffer the query may have been cut in the
 * middle of a multi-byte character; that incomplete tail is dropped first so
 * a truncated query still decodes.
 */
final class QueryDecoder {

    private QueryDecoder() {
    }

    /**
     * @param buffer    bytes read from the socket
     * @param length    number of valid bytes in {@code buffer}
     * @param truncated whether the read may have cut the query short
     * @return the query, possibly empty
     * @throws CharacterCodingException if the bytes are not valid UTF-8
     */
    static String decode(byte[] buffer, int length, boolean truncated) throws CharacterCodingException {
        int end = Math.max(0, length);
        if (truncated) {
            end = completeSequenceEnd(buffer, end);
        }
        String decoded = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(buffer, 0, end))
            .toString();
        return stripTrailingNuls(decoded);
    }

    static String stripTrailingNuls(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '\0') {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * End offset after removing an incomplete UTF-8 sequence at the tail, if any.
     */
    static int completeSequenceEnd(byte[] buffer, int length) {
        // walk back over at most three continuation bytes to the lead byte
        int i = length - 1;
        int continuation = 0;
        while (i >= 0 && continuation < 3 && (buffer[i] & 0xC0) == 0x80) {
            i--;
            continuation++;
        }
        if (i < 0) {
            return length;
        }
        int lead = buffer[i] & 0xFF;
        int expected;
        if (lead < 0x80) {
            return length;
        } else if ((lead & 0xE0) == 0xC0) {
            expected = 1;
        } else if ((lead & 0xF0) == 0xE0) {
            expected = 2;
        } else if ((lead & 0xF8) == 0xF0) {
            expected = 3;
        } else {
            return length;
        }
        return continuation < expected ? i : length;
    }
}
