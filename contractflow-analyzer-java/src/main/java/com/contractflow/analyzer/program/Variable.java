package com.contractflow.analyzer.program;

import com.google.gson.annotations.SerializedName;

/** Parameter or return value of a function. */
public record Variable(
    @SerializedName("name") String name,
    @SerializedName("type") String type
) {}
