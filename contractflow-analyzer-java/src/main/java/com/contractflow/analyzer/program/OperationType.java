package com.contractflow.analyzer.program;

import com.google.gson.annotations.SerializedName;

/** Front-end IR operation forms the analyzer distinguishes. */
public enum OperationType {
    @SerializedName("internal_call")   INTERNAL_CALL,
    @SerializedName("high_level_call") HIGH_LEVEL_CALL,
    @SerializedName("library_call")    LIBRARY_CALL,
    @SerializedName("low_level_call")  LOW_LEVEL_CALL,
    @SerializedName("other")           OTHER
}
