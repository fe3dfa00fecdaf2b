package diodescout.export;

import diodescout.model.types.MeasurementSeries;

import java.nio.file.Path;
import java.util.List;

public interface SeriesExporter {
    /**
     * write all the series to `destination`, replacing it if it exists
     * @return false if the destination cannot be written
     */
    boolean export(List<MeasurementSeries> seriesList, Path destination);
}
