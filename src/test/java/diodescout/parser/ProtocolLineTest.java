package diodescout.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

public class ProtocolLineTest {
    @Test
    public void givenBlankLines_WhenClassified_ThenTheyAreEmpty() {
        assertThat(ProtocolLine.classify("").getType()).isEqualTo(ProtocolLine.LineType.EMPTY);
        assertThat(ProtocolLine.classify(" \t ").getType()).isEqualTo(ProtocolLine.LineType.EMPTY);
    }

    @Test
    public void givenSentinelsSurroundedBySpaces_WhenClassified_ThenTheyOpenAndCloseSeries() {
        assertThat(ProtocolLine.classify("  *\t").getType()).isEqualTo(ProtocolLine.LineType.SERIES_START);
        assertThat(ProtocolLine.classify(" # ").getType()).isEqualTo(ProtocolLine.LineType.SERIES_END);
    }

    @ParameterizedTest
    @ValueSource(strings = {"* AVCC = 5.0", "**", "*#", "* 1.0 2.0"})
    public void givenLinesStartingWithStar_WhenNotABareStar_ThenTheyAreMetadata(String line) {
        assertThat(ProtocolLine.classify(line).getType()).isEqualTo(ProtocolLine.LineType.METADATA);
    }

    @Test
    public void givenADataLine_WhenClassified_ThenBothValuesAreParsed() {
        ProtocolLine line = ProtocolLine.classify("0.6512\t  12.5");

        assertThat(line.getType()).isEqualTo(ProtocolLine.LineType.DATA);
        assertThat(line.getVoltageVolt()).isEqualTo(0.6512);
        assertThat(line.getCurrentMilliAmp()).isEqualTo(12.5);
    }

    @Test
    public void givenADataLineWithSignsAndExponents_WhenClassified_ThenBothValuesAreParsed() {
        ProtocolLine line = ProtocolLine.classify("-1.5e-1 +.25");

        assertThat(line.getType()).isEqualTo(ProtocolLine.LineType.DATA);
        assertThat(line.getVoltageVolt()).isEqualTo(-0.15);
        assertThat(line.getCurrentMilliAmp()).isEqualTo(0.25);
    }

    @Test
    public void givenADataLineWithMoreThanTwoTokens_WhenClassified_ThenTheFirstTwoAreUsed() {
        ProtocolLine line = ProtocolLine.classify("1 2 3");

        assertThat(line.getType()).isEqualTo(ProtocolLine.LineType.DATA);
        assertThat(line.getVoltageVolt()).isEqualTo(1.0);
        assertThat(line.getCurrentMilliAmp()).isEqualTo(2.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.0", "abc def", "1.0 x", "x 1.0", "1,5 2,5", "NaN 1.0",
            "1.0 Infinity", "0x1p3 1.0", "1.0f 2.0", "1.0;2.0", ".", "1e999 1.0", "1.0 -1e400"})
    public void givenLinesNotMadeOfTwoNumbers_WhenClassified_ThenTheyAreMalformed(String line) {
        assertThat(ProtocolLine.classify(line).getType()).isEqualTo(ProtocolLine.LineType.MALFORMED);
    }
}
