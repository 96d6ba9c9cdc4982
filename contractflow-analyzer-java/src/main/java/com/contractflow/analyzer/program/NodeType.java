package com.contractflow.analyzer.program;

/**
 * Control-flow node types reported by the front end. {@link #label()} is the
 * front end's own spelling, which is also what the dump carries.
 */
public enum NodeType {
    ENTRY_POINT("ENTRY_POINT"),
    EXPRESSION("EXPRESSION"),
    RETURN("RETURN"),
    IF("IF"),
    NEW_VARIABLE("NEW VARIABLE"),
    ASSEMBLY("INLINE ASM"),
    END_IF("END_IF"),
    START_LOOP("BEGIN_LOOP"),
    END_LOOP("END_LOOP"),
    IF_LOOP("IF_LOOP"),
    BREAK("BREAK"),
    CONTINUE("CONTINUE"),
    THROW("THROW"),
    PLACEHOLDER("_"),
    TRY("TRY"),
    CATCH("CATCH"),
    OTHER_ENTRYPOINT("OTHER_ENTRYPOINT"),
    OTHER("OTHER");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /**
     * Parses either the front-end label or the enum constant name. Unknown or
     * missing values map to {@link #OTHER}.
     */
    public static NodeType fromLabel(String value) {
        if (value == null) return OTHER;
        String trimmed = value.trim();
        for (NodeType type : values()) {
            if (type.label.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return OTHER;
    }
}
