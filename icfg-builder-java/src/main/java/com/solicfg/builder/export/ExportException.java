package com.solicfg.builder.export;

public class ExportException extends RuntimeException {
    public ExportException(String msg, Throwable cause) { super(msg, cause); }
}
