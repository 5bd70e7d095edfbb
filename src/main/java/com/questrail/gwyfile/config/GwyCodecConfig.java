package com.questrail.gwyfile.config;

import com.questrail.gwyfile.observability.GwyCodecObservabilitySink;
import com.questrail.gwyfile.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for the container codec.
 */
public record GwyCodecConfig(
    GwyDecodeErrorPolicy decodeErrorPolicy,
    GwyCodecObservabilitySink observabilitySink
) {
    public GwyCodecConfig {
        Objects.requireNonNull(decodeErrorPolicy, "decodeErrorPolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Skips undecodable entities and reports nothing.
     */
    public static GwyCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private GwyDecodeErrorPolicy decodeErrorPolicy = GwyDecodeErrorPolicy.SKIP_ENTITY;
        private GwyCodecObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withDecodeErrorPolicy(GwyDecodeErrorPolicy decodeErrorPolicy) {
            this.decodeErrorPolicy = decodeErrorPolicy;
            return this;
        }

        public Builder withObservabilitySink(GwyCodecObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public GwyCodecConfig build() {
            return new GwyCodecConfig(decodeErrorPolicy, observabilitySink);
        }
    }
}
