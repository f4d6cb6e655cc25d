package com.keyforge.node.credential;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plaintext root credential pair handed to a node. Fields other than the key and secret are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeCredentials(
        @JsonProperty("userKey") String userKey,
        @JsonProperty("userSecret") String userSecret
) {

    @JsonCreator
    public NodeCredentials {
        if (userKey == null || userKey.isBlank()) {
            throw new IllegalArgumentException("User key cannot be null or blank");
        }
        if (userSecret == null || userSecret.isBlank()) {
            throw new IllegalArgumentException("User secret cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "NodeCredentials[userKey=" + userKey + ", userSecret=<redacted>]";
    }
}
