package edu.umich.andykong.shiftlocalizer.paramhandling;

public interface Parameter<T> {
    String getKey();
    T getValue();
    void setValue(T value) throws IllegalArgumentException;
    boolean isValid(T value);
    T parse(String value) throws IllegalArgumentException;
    String getDescription();

    default void setValueFromString(String value) throws IllegalArgumentException {
        setValue(parse(value.trim()));
    }
}
