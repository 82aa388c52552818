package com.astrazeneca.fusac.data;

/**
 * Where the UMI of a read is stored.
 */
public enum UmiPosition {
    /** Last field of the read name */
    QNAME,
    /** RX auxiliary tag */
    RX
}
