package diodescout.model;

import diodescout.exceptions.SeriesIndexOutOfRangeException;
import diodescout.export.CsvSeriesExporter;
import diodescout.export.PythonScriptExporter;
import diodescout.export.SeriesExporter;
import diodescout.model.types.MeasurementPoint;
import diodescout.model.types.MeasurementSeries;
import diodescout.model.types.ParseResult;
import diodescout.model.types.ParserState;
import diodescout.parser.LineAssembler;
import diodescout.parser.ProtocolLine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Stores the completed measurement series and parses the byte stream of the device.
 *
 * <p>Bytes are pushed one at a time with {@link #processReceivedChar(byte)}, so the chunking
 * of the serial reads does not matter. The class is not thread safe: if bytes are delivered
 * by a thread different from the one reading the series, access must be serialized
 * externally (see {@link diodescout.acquisition.AcquisitionSession}).</p>
 */
public class MeasurementDataManager {
    private static final Logger logger = LogManager.getLogger(MeasurementDataManager.class.getName());

    private final LineAssembler lineAssembler = new LineAssembler();
    private final List<MeasurementSeries> completedSeries = new ArrayList<>();
    // null while idle, the series being received otherwise
    private MeasurementSeries receivingSeries;

    private final SeriesExporter csvExporter;
    private final SeriesExporter pythonExporter;

    public MeasurementDataManager() {
        this(new CsvSeriesExporter(), new PythonScriptExporter());
    }

    public MeasurementDataManager(SeriesExporter csvExporter, SeriesExporter pythonExporter) {
        this.csvExporter = csvExporter;
        this.pythonExporter = pythonExporter;
    }

    public int seriesCount() {
        return completedSeries.size();
    }

    public List<MeasurementSeries> allSeries() {
        return Collections.unmodifiableList(completedSeries);
    }

    public MeasurementSeries series(int index) {
        if (index < 0 || index >= completedSeries.size())
            throw new SeriesIndexOutOfRangeException(index, completedSeries.size());
        return completedSeries.get(index);
    }

    public void removeAllSeries() {
        completedSeries.clear();
    }

    public void removeLastSeries() {
        if (!completedSeries.isEmpty())
            completedSeries.remove(completedSeries.size() - 1);
    }

    public int tempSeriesSize() {
        return receivingSeries == null ? 0 : receivingSeries.size();
    }

    public ParserState getParserState() {
        return receivingSeries == null ? ParserState.IDLE : ParserState.RECEIVING_SERIES;
    }

    /**
     * @return the greatest voltage among the completed series and the one being received,
     * 0 if there are no points
     */
    public double getMaxVoltage() {
        return this.getMax(MeasurementPoint::getVoltageVolt);
    }

    /**
     * @return the greatest current among the completed series and the one being received,
     * 0 if there are no points
     */
    public double getMaxCurrent() {
        return this.getMax(MeasurementPoint::getCurrentMilliAmp);
    }

    private double getMax(ToDoubleFunction<MeasurementPoint> axis) {
        double max = 0.0;
        for (MeasurementSeries series : completedSeries)
            max = Math.max(max, maxOfSeries(series, axis));
        if (receivingSeries != null)
            max = Math.max(max, maxOfSeries(receivingSeries, axis));
        return max;
    }

    private static double maxOfSeries(MeasurementSeries series, ToDoubleFunction<MeasurementPoint> axis) {
        return series.getPoints().stream().mapToDouble(axis).max().orElse(0.0);
    }

    public ParseResult processReceivedChar(byte b) {
        Optional<String> line = lineAssembler.accept(b);
        if (line.isPresent())
            return this.handleCompletedLine(line.get());
        return ParseResult.NOTHING;
    }

    public ParseResult processReceivedChar(char c) {
        return this.processReceivedChar((byte) c);
    }

    /**
     * feed `length` bytes starting at `offset`, one at a time
     * @return the number of series completed by the chunk
     */
    public int processReceivedBytes(byte[] chunk, int offset, int length) {
        int completed = 0;
        for (int i = offset; i < offset + length; i++) {
            if (this.processReceivedChar(chunk[i]) == ParseResult.SERIES_COMPLETED)
                completed++;
        }
        return completed;
    }

    private ParseResult handleCompletedLine(String rawLine) {
        ProtocolLine line = ProtocolLine.classify(rawLine);

        switch (line.getType()) {
            case SERIES_START:
                if (receivingSeries != null && !receivingSeries.isEmpty())
                    logger.warn("New series started, discarding {} points of the incomplete one",
                            receivingSeries.size());
                receivingSeries = new MeasurementSeries();
                return ParseResult.NOTHING;
            case SERIES_END:
                if (receivingSeries == null || receivingSeries.isEmpty())
                    return ParseResult.NOTHING;
                completedSeries.add(receivingSeries);
                logger.info("Series {} completed with {} points", completedSeries.size(), receivingSeries.size());
                receivingSeries = null;
                return ParseResult.SERIES_COMPLETED;
            case DATA:
                if (receivingSeries != null)
                    receivingSeries.addPoint(line.getVoltageVolt(), line.getCurrentMilliAmp());
                return ParseResult.NOTHING;
            case METADATA:
                logger.debug("Metadata line received: {}", line.getContent());
                return ParseResult.NOTHING;
            case MALFORMED:
                logger.trace("Malformed line ignored: {}", line.getContent());
                return ParseResult.NOTHING;
            default:
                return ParseResult.NOTHING;
        }
    }

    public boolean exportCsv(Path filePath) {
        return csvExporter.export(this.allSeries(), filePath);
    }

    public boolean exportPython(Path filePath) {
        return pythonExporter.export(this.allSeries(), filePath);
    }
}
