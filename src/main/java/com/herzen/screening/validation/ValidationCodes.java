package com.herzen.screening.validation;

public final class ValidationCodes {
    public static final String NULL_INPUT = "NULL_INPUT";
    public static final String EMPTY_VECTOR = "EMPTY_VECTOR";
    public static final String LENGTH_MISMATCH = "LENGTH_MISMATCH";
    public static final String INSTRUMENT_LENGTH = "INSTRUMENT_LENGTH";
    public static final String VALUE_OUT_OF_RANGE = "VALUE_OUT_OF_RANGE";
    public static final String NEGATIVE_TIME = "NEGATIVE_TIME";
    public static final String NON_FINITE_TIME = "NON_FINITE_TIME";
    public static final String REVERSE_INDEX_OUT_OF_RANGE = "REVERSE_INDEX_OUT_OF_RANGE";
    public static final String REFERENCE_SHAPE = "REFERENCE_SHAPE";

    private ValidationCodes() {}
}
