package diodescout.model.types;

/**
 * Outcome of feeding one byte to the parser.
 */
public enum ParseResult {
    NOTHING,
    SERIES_COMPLETED
}
