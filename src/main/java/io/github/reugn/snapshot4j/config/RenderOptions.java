package io.github.reugn.snapshot4j.config;

/**
 * Immutable rendering policy consulted by the value renderer and its collection handlers.
 *
 * <p><b>Defaults:</b>
 * <table border="1">
 *   <caption>Render option defaults</caption>
 *   <tr><th>Option</th><th>Default</th><th>Effect</th></tr>
 *   <tr><td>{@code sortMapKeys}</td><td>{@code true}</td>
 *       <td>Map entries ordered by the rendered text of their keys</td></tr>
 *   <tr><td>{@code deterministicSetOrder}</td><td>{@code true}</td>
 *       <td>Set elements ordered by their rendered text</td></tr>
 *   <tr><td>{@code inlineBinaryThreshold}</td><td>{@code 16}</td>
 *       <td>{@code byte[]} up to this length is written as a hex array initializer,
 *           longer arrays as a Base64 string</td></tr>
 *   <tr><td>{@code forceEnumShorthand}</td><td>{@code true}</td>
 *       <td>Enum constants reference an importable type ({@code Status.ACTIVE}) instead of
 *           the fully qualified name</td></tr>
 *   <tr><td>{@code maxDepth}</td><td>{@code 256}</td>
 *       <td>Nesting depth at which rendering fails instead of descending further</td></tr>
 * </table>
 *
 * @param sortMapKeys           order map entries by rendered key text
 * @param deterministicSetOrder order set elements by rendered element text
 * @param inlineBinaryThreshold largest {@code byte[]} length rendered inline as hex
 * @param forceEnumShorthand    reference enum constants through an importable type name
 * @param maxDepth              deepest breadcrumb path allowed
 */
public record RenderOptions(
        boolean sortMapKeys,
        boolean deterministicSetOrder,
        int inlineBinaryThreshold,
        boolean forceEnumShorthand,
        int maxDepth
) {
    static final RenderOptions DEFAULTS = new RenderOptions(true, true, 16, true, 256);

    public RenderOptions {
        if (inlineBinaryThreshold < 0) {
            throw new IllegalArgumentException("inlineBinaryThreshold must not be negative: " + inlineBinaryThreshold);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    /**
     * Returns the library defaults.
     *
     * @return default render options
     */
    public static RenderOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder(DEFAULTS);
    }

    /**
     * Starts a builder initialised from this instance.
     *
     * @return a builder holding this instance's values
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private boolean sortMapKeys;
        private boolean deterministicSetOrder;
        private int inlineBinaryThreshold;
        private boolean forceEnumShorthand;
        private int maxDepth;

        private Builder(RenderOptions base) {
            this.sortMapKeys = base.sortMapKeys;
            this.deterministicSetOrder = base.deterministicSetOrder;
            this.inlineBinaryThreshold = base.inlineBinaryThreshold;
            this.forceEnumShorthand = base.forceEnumShorthand;
            this.maxDepth = base.maxDepth;
        }

        public Builder sortMapKeys(boolean sortMapKeys) {
            this.sortMapKeys = sortMapKeys;
            return this;
        }

        public Builder deterministicSetOrder(boolean deterministicSetOrder) {
            this.deterministicSetOrder = deterministicSetOrder;
            return this;
        }

        public Builder inlineBinaryThreshold(int inlineBinaryThreshold) {
            this.inlineBinaryThreshold = inlineBinaryThreshold;
            return this;
        }

        public Builder forceEnumShorthand(boolean forceEnumShorthand) {
            this.forceEnumShorthand = forceEnumShorthand;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public RenderOptions build() {
            return new RenderOptions(sortMapKeys, deterministicSetOrder, inlineBinaryThreshold,
                    forceEnumShorthand, maxDepth);
        }
    }
}
