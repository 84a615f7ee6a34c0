package com.hkmatrix.debug;

public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
