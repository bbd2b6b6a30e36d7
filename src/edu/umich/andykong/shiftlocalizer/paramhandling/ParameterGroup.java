package edu.umich.andykong.shiftlocalizer.paramhandling;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class ParameterGroup {
    private final String name;
    private final Map<String, Parameter<?>> parameters;

    public ParameterGroup(String name) {
        this.name = name;
        this.parameters = new LinkedHashMap<>();
    }

    public String getName() {
        return name;
    }

    public void addParam(Parameter<?> parameter) {
        if (parameters.containsKey(parameter.getKey()))
            throw new IllegalArgumentException("Parameter already exists: " + parameter.getKey());
        parameters.put(parameter.getKey(), parameter);
    }

    public boolean hasParam(String key) {
        return parameters.containsKey(key);
    }

    public Parameter<?> getParam(String key) {
        Parameter<?> parameter = parameters.get(key);
        if (parameter == null)
            throw new IllegalArgumentException("Parameter not found: " + key);
        return parameter;
    }

    public Set<String> getKeys() {
        return parameters.keySet();
    }

    @SuppressWarnings("unchecked")
    public <T> void setParamValue(String key, T value) {
        Parameter<T> parameter = (Parameter<T>) getParam(key);
        parameter.setValue(value);
    }

    public void setParamFromString(String key, String value) {
        getParam(key).setValueFromString(value);
    }

    public double getDouble(String key) {
        return (Double) getParam(key).getValue();
    }

    public int getInt(String key) {
        return (Integer) getParam(key).getValue();
    }

    public boolean getBoolean(String key) {
        return (Boolean) getParam(key).getValue();
    }

    public String getString(String key) {
        return String.valueOf(getParam(key).getValue());
    }
}
