package com.contractflow.analyzer.export;

public class ExportException extends RuntimeException {
    public ExportException(String msg, Throwable cause) { super(msg, cause); }
}
