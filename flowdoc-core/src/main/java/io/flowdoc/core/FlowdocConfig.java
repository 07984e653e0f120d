package io.flowdoc.core;

/// Configuration options for the Flowdoc document engine.
///
/// Controls the sampling parameters of the text-generation calls the engine makes,
/// whether rendered documents get a generator formatting pass, and the geometry of the layout algorithms. Use the {@link Builder} for
/// fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `describeTemperature`: `0.3`, `describeMaxTokens`: `2000`
/// - `summaryTemperature`: `0.2`, `summaryMaxTokens`: `500`
/// - `llmFormatting`: `false`, `formatTemperature`: `0.1`, `formatMaxTokens`: `1500`
/// - `defaultLayoutAlgorithm`: `"hierarchical"`
/// - `forceIterations`: `50`, `forceScale`: `300.0`, `forceSeed`: `42`
/// - `horizontalSpacing`: `200.0`, `verticalSpacing`: `150.0`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link FlowdocFactory}.
/// Do not modify after engine creation.
///
/// @see FlowdocFactory.Builder#config(FlowdocConfig)
public class FlowdocConfig {
    private double describeTemperature = 0.3;
    private int describeMaxTokens = 2000;
    private double summaryTemperature = 0.2;
    private int summaryMaxTokens = 500;
    private boolean llmFormatting = false;
    private double formatTemperature = 0.1;
    private int formatMaxTokens = 1500;
    private String defaultLayoutAlgorithm = "hierarchical";
    private int forceIterations = 50;
    private double forceScale = 300.0;
    private long forceSeed = 42L;
    private double horizontalSpacing = 200.0;
    private double verticalSpacing = 150.0;

    /// Creates a configuration with default values.
    public FlowdocConfig() {}

    /// Returns the sampling temperature for description-to-document generation.
    ///
    /// @return temperature in `[0, 1]`
    public double getDescribeTemperature() {
        return describeTemperature;
    }

    public void setDescribeTemperature(double describeTemperature) {
        this.describeTemperature = describeTemperature;
    }

    /// Returns the token limit for description-to-document generation.
    ///
    /// @return maximum output tokens, positive
    public int getDescribeMaxTokens() {
        return describeMaxTokens;
    }

    public void setDescribeMaxTokens(int describeMaxTokens) {
        this.describeMaxTokens = describeMaxTokens;
    }

    /// Returns the sampling temperature for change summaries.
    ///
    /// @return temperature in `[0, 1]`
    public double getSummaryTemperature() {
        return summaryTemperature;
    }

    public void setSummaryTemperature(double summaryTemperature) {
        this.summaryTemperature = summaryTemperature;
    }

    /// Returns the token limit for change summaries.
    ///
    /// @return maximum output tokens, positive
    public int getSummaryMaxTokens() {
        return summaryMaxTokens;
    }

    public void setSummaryMaxTokens(int summaryMaxTokens) {
        this.summaryMaxTokens = summaryMaxTokens;
    }

    /// Returns whether rendered documents are passed through the generator for
    /// formatting.
    ///
    /// @return `true` to ask the generator to tidy canonical text
    public boolean isLlmFormatting() {
        return llmFormatting;
    }

    public void setLlmFormatting(boolean llmFormatting) {
        this.llmFormatting = llmFormatting;
    }

    public double getFormatTemperature() {
        return formatTemperature;
    }

    public void setFormatTemperature(double formatTemperature) {
        this.formatTemperature = formatTemperature;
    }

    public int getFormatMaxTokens() {
        return formatMaxTokens;
    }

    public void setFormatMaxTokens(int formatMaxTokens) {
        this.formatMaxTokens = formatMaxTokens;
    }

    /// Returns the algorithm used when a caller does not name one.
    ///
    /// @return algorithm name, never null. One of: `"hierarchical"`, `"force_directed"`, `"grid"`
    public String getDefaultLayoutAlgorithm() {
        return defaultLayoutAlgorithm;
    }

    public void setDefaultLayoutAlgorithm(String defaultLayoutAlgorithm) {
        this.defaultLayoutAlgorithm = defaultLayoutAlgorithm;
    }

    /// Returns the number of simulation steps of the force-directed layout.
    ///
    /// @return iteration count, positive
    public int getForceIterations() {
        return forceIterations;
    }

    public void setForceIterations(int forceIterations) {
        this.forceIterations = forceIterations;
    }

    /// Returns the factor mapping normalized force-directed coordinates to pixels.
    ///
    /// @return scale factor, positive
    public double getForceScale() {
        return forceScale;
    }

    public void setForceScale(double forceScale) {
        this.forceScale = forceScale;
    }

    /// Returns the seed of the force-directed initial placement.
    ///
    /// @return random seed
    public long getForceSeed() {
        return forceSeed;
    }

    public void setForceSeed(long forceSeed) {
        this.forceSeed = forceSeed;
    }

    /// Returns the distance between neighbouring slots on one row.
    ///
    /// @return horizontal spacing in pixels
    public double getHorizontalSpacing() {
        return horizontalSpacing;
    }

    public void setHorizontalSpacing(double horizontalSpacing) {
        this.horizontalSpacing = horizontalSpacing;
    }

    /// Returns the distance between neighbouring rows.
    ///
    /// @return vertical spacing in pixels
    public double getVerticalSpacing() {
        return verticalSpacing;
    }

    public void setVerticalSpacing(double verticalSpacing) {
        this.verticalSpacing = verticalSpacing;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link FlowdocConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}.
    public static class Builder {
        private final FlowdocConfig config = new FlowdocConfig();

        public Builder describeTemperature(double describeTemperature) {
            config.describeTemperature = describeTemperature;
            return this;
        }

        public Builder describeMaxTokens(int describeMaxTokens) {
            config.describeMaxTokens = describeMaxTokens;
            return this;
        }

        public Builder summaryTemperature(double summaryTemperature) {
            config.summaryTemperature = summaryTemperature;
            return this;
        }

        public Builder summaryMaxTokens(int summaryMaxTokens) {
            config.summaryMaxTokens = summaryMaxTokens;
            return this;
        }

        public Builder llmFormatting(boolean llmFormatting) {
            config.llmFormatting = llmFormatting;
            return this;
        }

        public Builder formatTemperature(double formatTemperature) {
            config.formatTemperature = formatTemperature;
            return this;
        }

        public Builder formatMaxTokens(int formatMaxTokens) {
            config.formatMaxTokens = formatMaxTokens;
            return this;
        }

        /// Sets the algorithm used when a caller does not name one.
        ///
        /// @param defaultLayoutAlgorithm `"hierarchical"`, `"force_directed"` or `"grid"`, not null
        /// @return this builder for chaining, never null
        public Builder defaultLayoutAlgorithm(String defaultLayoutAlgorithm) {
            config.defaultLayoutAlgorithm = defaultLayoutAlgorithm;
            return this;
        }

        public Builder forceIterations(int forceIterations) {
            config.forceIterations = forceIterations;
            return this;
        }

        public Builder forceScale(double forceScale) {
            config.forceScale = forceScale;
            return this;
        }

        public Builder forceSeed(long forceSeed) {
            config.forceSeed = forceSeed;
            return this;
        }

        public Builder horizontalSpacing(double horizontalSpacing) {
            config.horizontalSpacing = horizontalSpacing;
            return this;
        }

        public Builder verticalSpacing(double verticalSpacing) {
            config.verticalSpacing = verticalSpacing;
            return this;
        }

        /// Builds and returns the configured {@link FlowdocConfig} instance.
        ///
        /// @return the configured instance, never null
        public FlowdocConfig build() {
            return config;
        }
    }
}
