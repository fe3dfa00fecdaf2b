package diodescout.model.types;

import java.util.Objects;

public class MeasurementPoint {
    private final double voltageVolt;
    private final double currentMilliAmp;

    public MeasurementPoint(double voltageVolt, double currentMilliAmp) {
        this.voltageVolt = voltageVolt;
        this.currentMilliAmp = currentMilliAmp;
    }

    public double getVoltageVolt() {
        return voltageVolt;
    }

    public double getCurrentMilliAmp() {
        return currentMilliAmp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MeasurementPoint that = (MeasurementPoint) o;
        return Double.compare(that.voltageVolt, voltageVolt) == 0 &&
                Double.compare(that.currentMilliAmp, currentMilliAmp) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(voltageVolt, currentMilliAmp);
    }

    @Override
    public String toString() {
        return "MeasurementPoint{" +
                "voltageVolt=" + voltageVolt +
                ", currentMilliAmp=" + currentMilliAmp +
                '}';
    }
}
