package edu.umich.andykong.shiftlocalizer.paramhandling;

public class StringParameter implements Parameter<String> {
    private final String key;
    private String value;
    private final String description;

    public StringParameter(String key, String value, String description) {
        this.key = key;
        this.value = value;
        this.description = description;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public void setValue(String value) {
        if (!isValid(value))
            throw new IllegalArgumentException(key + " cannot be null");
        this.value = value;
    }

    @Override
    public boolean isValid(String value) {
        return value != null;
    }

    @Override
    public String parse(String value) {
        return value.replaceAll("['\"]", "");
    }

    @Override
    public String getDescription() {
        return description;
    }
}
