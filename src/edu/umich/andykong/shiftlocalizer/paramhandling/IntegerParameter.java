package edu.umich.andykong.shiftlocalizer.paramhandling;

public class IntegerParameter implements Parameter<Integer> {
    private final String key;
    private int value;
    private final int min;
    private final int max;
    private final String description;

    public IntegerParameter(String key, int min, int max, int value, String description) {
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
    public Integer getValue() {
        return value;
    }

    @Override
    public void setValue(Integer value) throws IllegalArgumentException {
        if (!isValid(value)) {
            throw new IllegalArgumentException(String.format("%s received an invalid argument: %s", key, value));
        }
        this.value = value;
    }

    @Override
    public boolean isValid(Integer value) {
        return value != null && ((value >= min) && (value <= max));
    }

    @Override
    public Integer parse(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " expects an integer, got \"" + value + "\"", e);
        }
    }

    @Override
    public String getDescription() {
        return description;
    }
}
