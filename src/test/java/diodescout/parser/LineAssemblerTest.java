package diodescout.parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class LineAssemblerTest {
    private final LineAssembler assembler = new LineAssembler();

    private List<String> feed(String text) {
        List<String> lines = new ArrayList<>();
        for (char c : text.toCharArray())
            assembler.accept((byte) c).ifPresent(lines::add);
        return lines;
    }

    @Test
    public void givenLfAndCrlfTerminatedLines_WhenFed_ThenLinesAreReturnedWithoutTerminators() {
        assertThat(feed("first\nsecond\r\n\nthird")).containsExactly("first", "second", "");
        assertThat(assembler.pendingLength()).isEqualTo(5);
    }

    @Test
    public void givenCarriageReturnsInTheMiddle_WhenFed_ThenTheyAreDropped() {
        assertThat(feed("1.0\r 2.0\r\r\n")).containsExactly("1.0 2.0");
    }

    @Test
    public void givenAByteThatIsNotATerminator_WhenAccepted_ThenNoLineIsReturned() {
        Optional<String> line = assembler.accept((byte) '*');

        assertThat(line).isEmpty();
        assertThat(assembler.pendingLength()).isEqualTo(1);
    }

    @Test
    public void givenNonAsciiBytes_WhenFed_ThenEachByteBecomesOneChar() {
        assembler.accept((byte) 0xB5);
        Optional<String> line = assembler.accept(LineAssembler.LINE_FEED);

        assertThat(line).contains("µ");
    }
}
