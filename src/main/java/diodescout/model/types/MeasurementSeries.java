package diodescout.model.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An acquisition run: the points sent by the device between an opening `*` and a closing `#`,
 * in arrival order. Points can only be appended.
 */
public class MeasurementSeries {
    private final List<MeasurementPoint> points = new ArrayList<>();

    public void addPoint(double voltageVolt, double currentMilliAmp) {
        this.points.add(new MeasurementPoint(voltageVolt, currentMilliAmp));
    }

    /**
     * @return a read-only view of the points, it reflects points added later
     */
    public List<MeasurementPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Override
    public String toString() {
        return "MeasurementSeries{" +
                "points=" + points +
                '}';
    }
}
