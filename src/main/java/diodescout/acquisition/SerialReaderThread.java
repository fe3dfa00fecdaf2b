package diodescout.acquisition;

import diodescout.model.MeasurementDataManager;
import diodescout.model.types.ParseResult;
import diodescout.parser.LineAssembler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;

public class SerialReaderThread extends Thread {
    private static final Logger logger = LogManager.getLogger(SerialReaderThread.class.getName());

    private final InputStream source;
    private final MeasurementDataManager dataManager;
    private final AcquisitionListener listener;
    private final int readChunkSize;
    private volatile long receivedBytes = 0;
    // the interrupted flag is cleared when a blocked read is interrupted
    private volatile boolean stopRequested = false;

    /**
     * @param source the byte stream of the device
     * @param dataManager every byte is processed while holding its lock
     * @param listener notified for every line and every completed series
     * @param readChunkSize max number of bytes read at a time
     */
    public SerialReaderThread(InputStream source,
                              MeasurementDataManager dataManager,
                              AcquisitionListener listener,
                              int readChunkSize) {
        super("serial-reader");
        if (readChunkSize <= 0)
            throw new IllegalArgumentException(
                    String.format("Validation rule: readChunkSize > 0, readChunkSize = %d", readChunkSize));
        this.source = source;
        this.dataManager = dataManager;
        this.listener = listener;
        this.readChunkSize = readChunkSize;
        this.setDaemon(true);
    }

    public long getReceivedBytes() {
        return receivedBytes;
    }

    @Override
    public void run() {
        byte[] chunk = new byte[this.readChunkSize];
        try {
            int n;
            while (!this.stopRequested && (n = this.source.read(chunk)) != -1) {
                synchronized (this.dataManager) {
                    for (int i = 0; i < n; i++)
                        this.handleByte(chunk[i]);
                }
                this.receivedBytes += n;
            }
            logger.info("Serial stream ended after {} bytes", this.receivedBytes);
        } catch (IOException e) {
            if (this.stopRequested)
                logger.info("Serial reader stopped after {} bytes", this.receivedBytes);
            else
                logger.error("Reading from the serial stream failed after {} bytes", this.receivedBytes, e);
        }
    }

    @Override
    public void interrupt() {
        this.stopRequested = true;
        super.interrupt();
    }

    private void handleByte(byte b) {
        ParseResult result = this.dataManager.processReceivedChar(b);
        try {
            if (result == ParseResult.SERIES_COMPLETED)
                this.listener.onSeriesCompleted(this.dataManager.seriesCount());
            else if (b == LineAssembler.LINE_FEED)
                this.listener.onLineReceived(this.dataManager.tempSeriesSize());
        } catch (RuntimeException e) {
            // the acquisition must go on even if the listener fails
            logger.error("Acquisition listener failed", e);
        }
    }
}
