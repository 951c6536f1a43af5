package com.questrail.poolheat.cloud.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings for the Fairland IoT cloud.
 *
 * <p>{@code courtyardId} restricts discovery to one device group ("courtyard")
 * of the account; when empty, all groups are enumerated.</p>
 */
public record FairlandEndpointConfig(
        URI baseUri,
        String countryCode,
        String phoneCode,
        Optional<String> courtyardId,
        Duration connectTimeout,
        Duration requestTimeout
) {
    public static final URI DEFAULT_BASE_URI = URI.create("https://api-eu.fairlandiot.com");

    public FairlandEndpointConfig {
        Objects.requireNonNull(baseUri, "baseUri");
        Objects.requireNonNull(countryCode, "countryCode");
        Objects.requireNonNull(phoneCode, "phoneCode");
        Objects.requireNonNull(courtyardId, "courtyardId");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");

        String scheme = baseUri.getScheme();
        if (!"https".equalsIgnoreCase(scheme) && !"http".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("baseUri must be http(s): " + baseUri);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI baseUri = DEFAULT_BASE_URI;
        private String countryCode = "DE";
        private String phoneCode = "49";
        private String courtyardId;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);

        public Builder withBaseUri(URI baseUri) {
            this.baseUri = baseUri;
            return this;
        }

        public Builder withCountryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public Builder withPhoneCode(String phoneCode) {
            this.phoneCode = phoneCode;
            return this;
        }

        public Builder withCourtyardId(String courtyardId) {
            this.courtyardId = courtyardId;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public FairlandEndpointConfig build() {
            return new FairlandEndpointConfig(baseUri, countryCode, phoneCode,
                    Optional.ofNullable(courtyardId), connectTimeout, requestTimeout);
        }
    }
}
