package diodescout.parser;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Collects the bytes received from the device until a line feed arrives.
 * Carriage returns are dropped, so both LF and CRLF terminated lines are accepted.
 * Bytes are decoded as ISO-8859-1, each byte becomes exactly one char.
 */
public class LineAssembler {
    public static final byte CARRIAGE_RETURN = '\r';
    public static final byte LINE_FEED = '\n';

    private final ByteArrayOutputStream currentLine = new ByteArrayOutputStream();

    /**
     * @param b the received byte
     * @return the completed line (without terminator) if `b` is a line feed, `Optional.empty()` otherwise
     */
    public Optional<String> accept(byte b) {
        if (b == LINE_FEED) {
            String line = this.currentLine.toString(StandardCharsets.ISO_8859_1);
            this.currentLine.reset();
            return Optional.of(line);
        }

        if (b != CARRIAGE_RETURN)
            this.currentLine.write(b);

        return Optional.empty();
    }

    public int pendingLength() {
        return this.currentLine.size();
    }
}
