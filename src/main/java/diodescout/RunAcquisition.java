package diodescout;

import diodescout.acquisition.AcquisitionListener;
import diodescout.acquisition.AcquisitionSession;
import diodescout.model.MeasurementDataManager;
import diodescout.util.AxisRangeUtil;
import diodescout.util.ConfigurationManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads the measurement series sent by the device until the stream ends, then exports them.
 * Usage: RunAcquisition [device-or-file [csv-file [python-file]]], stdin is read if no device is given.
 */
public class RunAcquisition {
    private static final Logger logger = LogManager.getLogger(RunAcquisition.class.getName());

    public static void main(String[] args) throws IOException, InterruptedException {
        ConfigurationManager configurationManager = ConfigurationManager.getInstance();
        Path csvPath = Paths.get(args.length > 1 ? args[1] : configurationManager.getCsvExportFileName());
        Path pythonPath = Paths.get(args.length > 2 ? args[2] : configurationManager.getPythonExportFileName());

        InputStream source = args.length > 0 ? new FileInputStream(args[0]) : System.in;
        MeasurementDataManager dataManager = new MeasurementDataManager();

        AcquisitionListener listener = new AcquisitionListener() {
            @Override
            public void onLineReceived(int tempSeriesSize) {
                if (tempSeriesSize > 0)
                    logger.debug("Receiving data, {} points", tempSeriesSize);
            }

            @Override
            public void onSeriesCompleted(int seriesCount) {
                // called while holding the lock of the data manager
                logger.info("Ready, {} series received (axes: 0-{} V, 0-{} mA)", seriesCount,
                        AxisRangeUtil.getVoltageAxisMax(dataManager),
                        AxisRangeUtil.getCurrentAxisMax(dataManager));
            }
        };

        try (AcquisitionSession session = new AcquisitionSession(source, dataManager, listener,
                new AcquisitionSession.SessionConfig())) {
            session.start();
            session.awaitTermination();

            if (!session.exportCsv(csvPath))
                logger.error("CSV export failed");
            if (!session.exportPython(pythonPath))
                logger.error("Python export failed");
        }
    }
}
