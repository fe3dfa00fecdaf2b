package diodescout.util;

import diodescout.model.MeasurementDataManager;

public class AxisRangeUtil {
    public static final double DEFAULT_AXIS_MAX = 1.0;

    public static double roundUpToHalf(double value) {
        return Math.ceil(value * 2.0) / 2.0;
    }

    public static double getVoltageAxisMax(MeasurementDataManager dataManager) {
        return getAxisMax(dataManager.getMaxVoltage());
    }

    public static double getCurrentAxisMax(MeasurementDataManager dataManager) {
        return getAxisMax(dataManager.getMaxCurrent());
    }

    private static double getAxisMax(double maxValue) {
        if (maxValue <= 0)
            return DEFAULT_AXIS_MAX;
        return roundUpToHalf(maxValue);
    }
}
