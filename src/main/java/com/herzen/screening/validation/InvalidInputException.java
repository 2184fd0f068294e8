package com.herzen.screening.validation;

public class InvalidInputException extends IllegalArgumentException {
    private final String code;
    private final int index;

    public InvalidInputException(String code, String message) {
        this(code, message, -1);
    }

    public InvalidInputException(String code, String message, int index) {
        super(code + ": " + message);
        this.code = code;
        this.index = index;
    }

    public String code() {
        return code;
    }

    public int index() {
        return index;
    }
}
