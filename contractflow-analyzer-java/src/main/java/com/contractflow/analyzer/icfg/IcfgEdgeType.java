package com.contractflow.analyzer.icfg;

import com.google.gson.annotations.SerializedName;

public enum IcfgEdgeType {
    @SerializedName("intra_procedural") INTRA_PROCEDURAL,
    @SerializedName("inter_procedural") INTER_PROCEDURAL
}
