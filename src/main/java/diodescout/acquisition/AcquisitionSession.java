package diodescout.acquisition;

import diodescout.model.MeasurementDataManager;
import diodescout.model.types.MeasurementSeries;
import diodescout.util.ConfigurationManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds a byte source to a {@link MeasurementDataManager}. Bytes are read by a background thread;
 * every method of this class locks the data manager, so it can be called from any thread.
 */
public class AcquisitionSession implements Closeable {
    private static final ConfigurationManager configurationManager = ConfigurationManager.getInstance();
    private static final Logger logger = LogManager.getLogger(AcquisitionSession.class.getName());

    private final InputStream source;
    private final MeasurementDataManager dataManager;
    private final SerialReaderThread readerThread;

    public AcquisitionSession(InputStream source,
                              MeasurementDataManager dataManager,
                              AcquisitionListener listener,
                              SessionConfig sessionConfig) {
        this.source = source;
        this.dataManager = dataManager;
        this.readerThread = new SerialReaderThread(source, dataManager, listener, sessionConfig.readChunkSize);
    }

    public AcquisitionSession(InputStream source, AcquisitionListener listener) {
        this(source, new MeasurementDataManager(), listener, new SessionConfig());
    }

    public void start() {
        logger.info("Starting acquisition");
        this.readerThread.start();
    }

    /**
     * wait until the source reaches the end of the stream or the session is closed
     */
    public void awaitTermination() throws InterruptedException {
        this.readerThread.join();
    }

    public boolean isRunning() {
        return this.readerThread.isAlive();
    }

    public long getReceivedBytes() {
        return this.readerThread.getReceivedBytes();
    }

    public int seriesCount() {
        synchronized (this.dataManager) {
            return this.dataManager.seriesCount();
        }
    }

    /**
     * @return a copy of the list of completed series. Completed series are never modified,
     * so they can be read without holding the lock
     */
    public List<MeasurementSeries> allSeries() {
        synchronized (this.dataManager) {
            return new ArrayList<>(this.dataManager.allSeries());
        }
    }

    public void removeLastSeries() {
        synchronized (this.dataManager) {
            this.dataManager.removeLastSeries();
        }
    }

    public void removeAllSeries() {
        synchronized (this.dataManager) {
            this.dataManager.removeAllSeries();
        }
    }

    public int tempSeriesSize() {
        synchronized (this.dataManager) {
            return this.dataManager.tempSeriesSize();
        }
    }

    public double getMaxVoltage() {
        synchronized (this.dataManager) {
            return this.dataManager.getMaxVoltage();
        }
    }

    public double getMaxCurrent() {
        synchronized (this.dataManager) {
            return this.dataManager.getMaxCurrent();
        }
    }

    public boolean exportCsv(Path filePath) {
        synchronized (this.dataManager) {
            return this.dataManager.exportCsv(filePath);
        }
    }

    public boolean exportPython(Path filePath) {
        synchronized (this.dataManager) {
            return this.dataManager.exportPython(filePath);
        }
    }

    @Override
    public void close() {
        this.readerThread.interrupt();
        // closing the stream unblocks a pending read
        try {
            this.source.close();
        } catch (IOException e) {
            logger.warn("Cannot close the serial stream", e);
        }

        try {
            this.readerThread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
        logger.info("Acquisition closed, {} series received", this.seriesCount());
    }

    public static class SessionConfig {
        private int readChunkSize = configurationManager.getReadChunkSize();

        public SessionConfig withReadChunkSize(int readChunkSize) {
            this.readChunkSize = readChunkSize;
            return this;
        }
    }
}
