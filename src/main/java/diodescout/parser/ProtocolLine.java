package diodescout.parser;

import java.util.regex.Pattern;

/**
 * A line of the DiodeScout protocol, classified after trimming.
 *
 * <p>The device sends a bare `*` to open a series, one `voltage current` pair per line
 * and a bare `#` to close the series. Lines starting with `*` followed by anything else
 * (e.g. `* AVCC = 5.0`) carry metadata.</p>
 */
public class ProtocolLine {
    public static final String SERIES_START = "*";
    public static final String SERIES_END = "#";

    // plain decimal literal: no NaN, no Infinity, no hex and no java type suffix
    private static final Pattern DECIMAL_PATTERN =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    public enum LineType {
        EMPTY,
        SERIES_START,
        METADATA,
        SERIES_END,
        DATA,
        MALFORMED
    }

    private final LineType type;
    private final String content;
    private final double voltageVolt;
    private final double currentMilliAmp;

    private ProtocolLine(LineType type, String content, double voltageVolt, double currentMilliAmp) {
        this.type = type;
        this.content = content;
        this.voltageVolt = voltageVolt;
        this.currentMilliAmp = currentMilliAmp;
    }

    private ProtocolLine(LineType type, String content) {
        this(type, content, 0, 0);
    }

    public static ProtocolLine classify(String rawLine) {
        String line = rawLine.trim();
        if (line.isEmpty())
            return new ProtocolLine(LineType.EMPTY, line);
        if (line.equals(SERIES_START))
            return new ProtocolLine(LineType.SERIES_START, line);
        if (line.startsWith(SERIES_START))
            return new ProtocolLine(LineType.METADATA, line);
        if (line.equals(SERIES_END))
            return new ProtocolLine(LineType.SERIES_END, line);

        return parseDataLine(line);
    }

    // tokens after the second one are ignored, values out of the double range are malformed
    private static ProtocolLine parseDataLine(String line) {
        String[] tokens = WHITESPACE_PATTERN.split(line);
        if (tokens.length < 2
                || !DECIMAL_PATTERN.matcher(tokens[0]).matches()
                || !DECIMAL_PATTERN.matcher(tokens[1]).matches())
            return new ProtocolLine(LineType.MALFORMED, line);

        double voltageVolt = Double.parseDouble(tokens[0]);
        double currentMilliAmp = Double.parseDouble(tokens[1]);
        if (!Double.isFinite(voltageVolt) || !Double.isFinite(currentMilliAmp))
            return new ProtocolLine(LineType.MALFORMED, line);

        return new ProtocolLine(LineType.DATA, line, voltageVolt, currentMilliAmp);
    }

    public LineType getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    public double getVoltageVolt() {
        assert this.type == LineType.DATA;
        return voltageVolt;
    }

    public double getCurrentMilliAmp() {
        assert this.type == LineType.DATA;
        return currentMilliAmp;
    }

    @Override
    public String toString() {
        return "ProtocolLine{" +
                "type=" + type +
                ", content='" + content + '\'' +
                '}';
    }
}
