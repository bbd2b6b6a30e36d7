package edu.umich.andykong.shiftlocalizer.paramhandling;

public class BooleanParameter implements Parameter<Boolean> {
    private final String key;
    private boolean value;
    private final String description;

    public BooleanParameter(String key, boolean value, String description) {
        this.key = key;
        this.value = value;
        this.description = description;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public Boolean getValue() {
        return value;
    }

    @Override
    public void setValue(Boolean value) {
        if (!isValid(value))
            throw new IllegalArgumentException(key + " cannot be null");
        this.value = value;
    }

    @Override
    public boolean isValid(Boolean value) {
        return value != null;
    }

    // accepts true/false and the 1/0 switches of older parameter files
    @Override
    public Boolean parse(String value) {
        if (value.equalsIgnoreCase("true") || value.equals("1"))
            return true;
        if (value.equalsIgnoreCase("false") || value.equals("0"))
            return false;
        throw new IllegalArgumentException(key + " expects true or false, got \"" + value + "\"");
    }

    @Override
    public String getDescription() {
        return description;
    }
}
