package com.astrazeneca.fusac.exception;


import htsjdk.variant.variantcontext.VariantContext;

import java.util.Locale;

public class UnsupportedVariantShapeException extends RuntimeException {
    public final static String UnsupportedVariantShapeExceptionMessage = "The record %s:%d %s>%s is not a single " +
            "nucleotide substitution and will be written without UMI annotation.";

    public UnsupportedVariantShapeException(VariantContext record) {
            super(String.format(Locale.US, UnsupportedVariantShapeExceptionMessage, record.getContig(),
                    record.getStart(), record.getReference().getDisplayString(), record.getAlternateAlleles()));
    }
}
