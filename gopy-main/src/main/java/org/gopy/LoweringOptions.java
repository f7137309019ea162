package org.gopy;

/**
 * Lowering switches. Defaults come from system properties so tools can flip them without code
 * changes, e.g. {@code -Dgopy.lowering.strict=true}.
 *
 * @param emitDocStrings    turn doc comments of functions and file-level structs into docstrings
 * @param attachComments    prefix lowered statements with their attached comments
 * @param strictUnsupported reject recognized-but-unsupported constructs instead of dropping them
 * @param receiverName      preferred parameter name for unnamed method receivers and {@code __init__}
 */
public record LoweringOptions(boolean emitDocStrings, boolean attachComments, boolean strictUnsupported, String receiverName) {

    public static final String DOCSTRINGS_PROPERTY = "gopy.lowering.docstrings";
    public static final String COMMENTS_PROPERTY = "gopy.lowering.comments";
    public static final String STRICT_PROPERTY = "gopy.lowering.strict";
    public static final String RECEIVER_NAME_PROPERTY = "gopy.lowering.receiverName";

    public LoweringOptions {
        if (receiverName == null || receiverName.isBlank()) {
            throw new IllegalArgumentException("receiverName must not be blank");
        }
    }

    public static LoweringOptions defaults() {
        return fromSystemProperties();
    }

    public static LoweringOptions fromSystemProperties() {
        return new LoweringOptions(
                Boolean.parseBoolean(System.getProperty(DOCSTRINGS_PROPERTY, "true")),
                Boolean.parseBoolean(System.getProperty(COMMENTS_PROPERTY, "true")),
                Boolean.parseBoolean(System.getProperty(STRICT_PROPERTY, "false")),
                System.getProperty(RECEIVER_NAME_PROPERTY, "self"));
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {

        private boolean emitDocStrings;
        private boolean attachComments;
        private boolean strictUnsupported;
        private String receiverName;

        private Builder(LoweringOptions from) {
            this.emitDocStrings = from.emitDocStrings;
            this.attachComments = from.attachComments;
            this.strictUnsupported = from.strictUnsupported;
            this.receiverName = from.receiverName;
        }

        public Builder emitDocStrings(boolean emitDocStrings) {
            this.emitDocStrings = emitDocStrings;
            return this;
        }

        public Builder attachComments(boolean attachComments) {
            this.attachComments = attachComments;
            return this;
        }

        public Builder strictUnsupported(boolean strictUnsupported) {
            this.strictUnsupported = strictUnsupported;
            return this;
        }

        public Builder receiverName(String receiverName) {
            this.receiverName = receiverName;
            return this;
        }

        public LoweringOptions build() {
            return new LoweringOptions(emitDocStrings, attachComments, strictUnsupported, receiverName);
        }
    }
}
