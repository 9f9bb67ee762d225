package com.animcurve.io;

/** Thrown when persisted curve data is missing a field or holds an invalid one. */
public final class CurveFormatException extends RuntimeException {
    public CurveFormatException(String msg)                  { super(msg); }
    public CurveFormatException(String msg, Throwable cause) { super(msg, cause); }
}
