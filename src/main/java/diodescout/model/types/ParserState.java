package diodescout.model.types;

public enum ParserState {
    IDLE,
    RECEIVING_SERIES
}
