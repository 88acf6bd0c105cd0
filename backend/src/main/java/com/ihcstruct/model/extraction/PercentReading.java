package com.ihcstruct.model.extraction;

/**
 * Percent positivity read from text. A range reads as approximate with no value.
 */
public record PercentReading(Double value, boolean approximate) {

    public static final PercentReading NONE = new PercentReading(null, false);
    public static final PercentReading APPROXIMATE = new PercentReading(null, true);

    public static PercentReading exact(double value) {
        return new PercentReading(value, false);
    }

    public boolean isPresent() {
        return value != null || approximate;
    }
}
