package diodescout.export;

import diodescout.model.types.MeasurementPoint;
import diodescout.model.types.MeasurementSeries;
import diodescout.util.ConfigurationManager;
import diodescout.util.NumberFormatUtil;

import java.io.IOException;
import java.io.Writer;
import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;

/**
 * Tabular export. Every series becomes a block:
 * <pre>
 * Series 1
 * Voltage (V);Current (mA)
 * 0,100000;0,000000
 * ...
 * </pre>
 * followed by a blank line. Numbers use the decimal and grouping symbols of the configured locale.
 */
public class CsvSeriesExporter extends AbstractFileExporter {
    public static final String DELIMITER = ";";
    public static final String SERIES_HEADER_PREFIX = "Series ";
    public static final String COLUMN_HEADER = "Voltage (V)" + DELIMITER + "Current (mA)";

    private final Locale locale;

    public CsvSeriesExporter() {
        this(ConfigurationManager.getInstance().getCsvExportLocale());
    }

    public CsvSeriesExporter(Locale locale) {
        this.locale = locale;
    }

    public Locale getLocale() {
        return locale;
    }

    @Override
    protected void writeSeries(List<MeasurementSeries> seriesList, Writer writer) throws IOException {
        NumberFormat localizedFormat = NumberFormatUtil.getLocalizedFormat(this.locale);

        for (int i = 0; i < seriesList.size(); i++) {
            writer.write(SERIES_HEADER_PREFIX + (i + 1) + "\n");
            writer.write(COLUMN_HEADER + "\n");

            for (MeasurementPoint p : seriesList.get(i).getPoints()) {
                writer.write(NumberFormatUtil.formatLocalized(localizedFormat, p.getVoltageVolt()));
                writer.write(DELIMITER);
                writer.write(NumberFormatUtil.formatLocalized(localizedFormat, p.getCurrentMilliAmp()));
                writer.write("\n");
            }

            writer.write("\n");
        }
    }
}
