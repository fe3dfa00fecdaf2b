package diodescout.util;

import java.math.RoundingMode;
import java.text.NumberFormat;
import java.util.Locale;

public class NumberFormatUtil {
    public static final int FRACTION_DIGITS = 6;
    public static final String FIXED_FORMAT = "%." + FRACTION_DIGITS + "f";

    /**
     * NumberFormat is not thread safe, so a new one is created for every export
     * @param locale the locale whose decimal and grouping symbols are used
     * @return a formatter that always prints {@link #FRACTION_DIGITS} fraction digits
     */
    public static NumberFormat getLocalizedFormat(Locale locale) {
        NumberFormat format = NumberFormat.getNumberInstance(locale);
        format.setMinimumFractionDigits(FRACTION_DIGITS);
        format.setMaximumFractionDigits(FRACTION_DIGITS);
        format.setGroupingUsed(true);
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format;
    }

    public static String formatLocalized(NumberFormat localizedFormat, double value) {
        return localizedFormat.format(value);
    }

    // generated scripts must use '.' as decimal point whatever the locale of the exporting machine
    public static String formatFixed(double value) {
        return String.format(Locale.ROOT, FIXED_FORMAT, value);
    }
}
