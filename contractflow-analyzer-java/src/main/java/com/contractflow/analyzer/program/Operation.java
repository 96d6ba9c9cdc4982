package com.contractflow.analyzer.program;

/**
 * One typed IR operation of a node. Call operations may carry the function the
 * front end resolved them to; low-level calls and non-call operations usually
 * carry none.
 */
public record Operation(OperationType type, Function target, String text) {

    public Operation {
        if (type == null) type = OperationType.OTHER;
        if (text == null) text = "";
    }

    public boolean isCall() {
        return type != OperationType.OTHER;
    }

    @Override
    public String toString() { return text; }
}
