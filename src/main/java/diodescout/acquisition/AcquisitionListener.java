package diodescout.acquisition;

/**
 * Notified by the reader thread, while holding the lock of the data manager.
 */
public interface AcquisitionListener {
    // a line ended without completing a series
    void onLineReceived(int tempSeriesSize);
    void onSeriesCompleted(int seriesCount);
}
