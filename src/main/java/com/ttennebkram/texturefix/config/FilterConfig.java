package com.ttennebkram.texturefix.config;

import com.ttennebkram.texturefix.mask.MaskBuilderRegistry;

import java.util.Objects;

/**
 * Immutable parameters for mask construction.
 *
 * Peak-notch policy reads thresholdPercentile, notchRadius and protectCenter.
 * Line-band policy reads lineWidth, protectCenter and attenuation.
 * The filtering core does not validate ranges; drivers call {@link #validate()}.
 */
public final class FilterConfig {

    public static final String DEFAULT_POLICY = "peaks";
    public static final double DEFAULT_THRESHOLD_PERCENTILE = 99.5;
    public static final int DEFAULT_NOTCH_RADIUS = 5;
    public static final int DEFAULT_PROTECT_CENTER = 20;
    public static final int DEFAULT_LINE_WIDTH = 2;
    public static final double DEFAULT_ATTENUATION = 0.99;

    private final String policy;
    private final double thresholdPercentile;
    private final int notchRadius;
    private final int protectCenter;
    private final int lineWidth;
    private final double attenuation;

    private FilterConfig(Builder builder) {
        this.policy = builder.policy;
        this.thresholdPercentile = builder.thresholdPercentile;
        this.notchRadius = builder.notchRadius;
        this.protectCenter = builder.protectCenter;
        this.lineWidth = builder.lineWidth;
        this.attenuation = builder.attenuation;
    }

    public static FilterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .policy(policy)
            .thresholdPercentile(thresholdPercentile)
            .notchRadius(notchRadius)
            .protectCenter(protectCenter)
            .lineWidth(lineWidth)
            .attenuation(attenuation);
    }

    public String getPolicy() {
        return policy;
    }

    public double getThresholdPercentile() {
        return thresholdPercentile;
    }

    public int getNotchRadius() {
        return notchRadius;
    }

    public int getProtectCenter() {
        return protectCenter;
    }

    public int getLineWidth() {
        return lineWidth;
    }

    public double getAttenuation() {
        return attenuation;
    }

    /**
     * Reject values the filtering core would turn into degenerate masks.
     *
     * @return this config
     * @throws IllegalArgumentException naming the first offending field
     */
    public FilterConfig validate() {
        if (policy == null || policy.isEmpty()) {
            throw new IllegalArgumentException("method must not be empty");
        }
        if (!MaskBuilderRegistry.hasPolicy(policy)) {
            throw new IllegalArgumentException("Unknown filter method '" + policy
                + "', expected one of " + MaskBuilderRegistry.getRegisteredPolicies());
        }
        if (Double.isNaN(thresholdPercentile) || thresholdPercentile < 0 || thresholdPercentile > 100) {
            throw new IllegalArgumentException("threshold must be within 0..100, got " + thresholdPercentile);
        }
        if (notchRadius < 0) {
            throw new IllegalArgumentException("notch radius must be >= 0, got " + notchRadius);
        }
        if (protectCenter < 0) {
            throw new IllegalArgumentException("protect center must be >= 0, got " + protectCenter);
        }
        if (lineWidth < 0) {
            throw new IllegalArgumentException("line width must be >= 0, got " + lineWidth);
        }
        if (Double.isNaN(attenuation) || attenuation < 0 || attenuation > 1) {
            throw new IllegalArgumentException("attenuation must be within 0..1, got " + attenuation);
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterConfig)) return false;
        FilterConfig that = (FilterConfig) o;
        return Double.compare(that.thresholdPercentile, thresholdPercentile) == 0
            && notchRadius == that.notchRadius
            && protectCenter == that.protectCenter
            && lineWidth == that.lineWidth
            && Double.compare(that.attenuation, attenuation) == 0
            && Objects.equals(policy, that.policy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(policy, thresholdPercentile, notchRadius, protectCenter, lineWidth, attenuation);
    }

    @Override
    public String toString() {
        return "FilterConfig{policy=" + policy
            + ", thresholdPercentile=" + thresholdPercentile
            + ", notchRadius=" + notchRadius
            + ", protectCenter=" + protectCenter
            + ", lineWidth=" + lineWidth
            + ", attenuation=" + attenuation + "}";
    }

    public static final class Builder {
        private String policy = DEFAULT_POLICY;
        private double thresholdPercentile = DEFAULT_THRESHOLD_PERCENTILE;
        private int notchRadius = DEFAULT_NOTCH_RADIUS;
        private int protectCenter = DEFAULT_PROTECT_CENTER;
        private int lineWidth = DEFAULT_LINE_WIDTH;
        private double attenuation = DEFAULT_ATTENUATION;

        private Builder() {
        }

        public Builder policy(String policy) {
            this.policy = policy;
            return this;
        }

        public Builder thresholdPercentile(double thresholdPercentile) {
            this.thresholdPercentile = thresholdPercentile;
            return this;
        }

        public Builder notchRadius(int notchRadius) {
            this.notchRadius = notchRadius;
            return this;
        }

        public Builder protectCenter(int protectCenter) {
            this.protectCenter = protectCenter;
            return this;
        }

        public Builder lineWidth(int lineWidth) {
            this.lineWidth = lineWidth;
            return this;
        }

        public Builder attenuation(double attenuation) {
            this.attenuation = attenuation;
            return this;
        }

        public FilterConfig build() {
            return new FilterConfig(this);
        }
    }
}
