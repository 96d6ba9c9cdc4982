package com.contractflow.analyzer.program;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Source location of a function or node as reported by the front end.
 * Every field may be absent; callers must cope with a partially filled mapping.
 */
public class SourceMapping {

    @SerializedName("filename") private final String filename;
    @SerializedName("start")    private final Integer start;
    @SerializedName("length")   private final Integer length;
    @SerializedName("lines")    private final List<Integer> lines;

    public SourceMapping(String filename, Integer start, Integer length, List<Integer> lines) {
        this.filename = filename;
        this.start = start;
        this.length = length;
        this.lines = lines != null ? List.copyOf(lines) : Collections.emptyList();
    }

    public String getFilename() { return filename; }
    public Integer getStart()   { return start; }
    public Integer getLength()  { return length; }
    public List<Integer> getLines() { return lines != null ? lines : Collections.emptyList(); }

    /** First source line, or null when the front end did not report lines. */
    public Integer firstLine() {
        List<Integer> l = getLines();
        return l.isEmpty() ? null : l.get(0);
    }
}
