package com.robusta.sandbox.rdb;

public enum IterationSignal {
    CONTINUE,
    /** Ends the iteration without reading the remaining rows. */
    STOP
}
