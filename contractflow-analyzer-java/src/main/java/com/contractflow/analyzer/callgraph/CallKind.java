package com.contractflow.analyzer.callgraph;

import com.google.gson.annotations.SerializedName;

public enum CallKind {
    @SerializedName("internal")   INTERNAL,
    @SerializedName("library")    LIBRARY,
    @SerializedName("high_level") HIGH_LEVEL,
    @SerializedName("low_level")  LOW_LEVEL
}
