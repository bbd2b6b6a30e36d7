package edu.umich.andykong.shiftlocalizer.paramhandling;


public class DoubleParameter implements Parameter<Double> {
    private final String key;
    private double value;
    private final double min;
    private final double max;
    private final String description;

    public DoubleParameter(String key, double min, double max, double value, String description) {
        this.key = key;
        this.min = min;
        this.max = max;
        this.description = description;
        setValue(value);
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public Double getValue() {
        return this.value;
    }

    @Override
    public void setValue(Double value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException(String.format("%s = %s is outside [%s, %s]", key, value, min, max));
        }
        this.value = value;
    }

    @Override
    public boolean isValid(Double value) {
        return value != null && ((value >= this.min) && (value <= this.max));
    }

    @Override
    public Double parse(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " expects a number, got \"" + value + "\"", e);
        }
    }

    @Override
    public String getDescription() {
        return description;
    }
}
