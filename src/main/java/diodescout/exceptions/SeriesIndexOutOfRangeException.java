package diodescout.exceptions;

public class SeriesIndexOutOfRangeException extends IndexOutOfBoundsException {
    private final int index;
    private final int seriesCount;

    public SeriesIndexOutOfRangeException(int index, int seriesCount) {
        this.index = index;
        this.seriesCount = seriesCount;
    }

    public int getIndex() {
        return index;
    }

    public int getSeriesCount() {
        return seriesCount;
    }

    @Override
    public String getMessage() {
        return String.format("Cannot find series with index = %d, the number of series is %d",
                this.index, this.seriesCount);
    }
}
