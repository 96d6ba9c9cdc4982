package com.contractflow.analyzer.program;

import com.google.gson.annotations.SerializedName;

public enum ContractKind {
    @SerializedName("contract")  CONTRACT,
    @SerializedName("abstract")  ABSTRACT,
    @SerializedName("interface") INTERFACE,
    @SerializedName("library")   LIBRARY
}
