package edu.umich.andykong.shiftlocalizer.fragments;

public enum IonSeries {
    PREFIX('b'), // N-terminal fragments
    SUFFIX('y'); // C-terminal fragments

    private final char ionType;

    IonSeries(char ionType) {
        this.ionType = ionType;
    }

    public char getIonType() {
        return ionType;
    }
}
