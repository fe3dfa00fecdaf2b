package diodescout.export;

import diodescout.model.types.MeasurementPoint;
import diodescout.model.types.MeasurementSeries;
import diodescout.util.NumberFormatUtil;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Exports the series as a runnable matplotlib script, one pair of lists per series.
 */
public class PythonScriptExporter extends AbstractFileExporter {
    private static final String HEADER =
            "#!/usr/bin/env python3\n" +
            "import matplotlib.pyplot as plt\n\n" +
            "series = []\n\n";
    private static final String PLOT_SECTION =
            "for i, (v, c) in enumerate(series):\n" +
            "    plt.plot(v, c, label=f'Series {i+1}')\n\n" +
            "plt.xlabel('Volt (V)')\n" +
            "plt.ylabel('Milliampere (mA)')\n" +
            "plt.legend()\n" +
            "plt.grid(True)\n" +
            "plt.show()\n";

    @Override
    protected void writeSeries(List<MeasurementSeries> seriesList, Writer writer) throws IOException {
        writer.write(HEADER);

        for (int i = 0; i < seriesList.size(); i++) {
            MeasurementSeries series = seriesList.get(i);
            int idx = i + 1;

            writer.write("# Series " + idx + "\n");
            writer.write("voltage_" + idx + " = " +
                    toPythonList(series, MeasurementPoint::getVoltageVolt) + "\n");
            writer.write("current_" + idx + " = " +
                    toPythonList(series, MeasurementPoint::getCurrentMilliAmp) + "\n");
            writer.write("series.append((voltage_" + idx + ", current_" + idx + "))\n\n");
        }

        writer.write(PLOT_SECTION);
    }

    private static String toPythonList(MeasurementSeries series, ToDoubleFunction<MeasurementPoint> axis) {
        return series.getPoints().stream()
                .map(p -> NumberFormatUtil.formatFixed(axis.applyAsDouble(p)))
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
