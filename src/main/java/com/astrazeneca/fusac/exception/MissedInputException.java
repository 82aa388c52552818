package com.astrazeneca.fusac.exception;


import java.util.Locale;

public class MissedInputException extends RuntimeException {
    public final static String MissedInputExceptionMessage = "The required %s file \"%s\" doesn't exist or can't " +
            "be read, please, check the path set with %s option.";

    public MissedInputException(String kind, String path, String option) {
            super(String.format(Locale.US, MissedInputExceptionMessage, kind, path, option));
    }
}
