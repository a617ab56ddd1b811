package com.tessera.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Policy document as it appears on the wire, before validation. Every field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record PolicyDocumentWire(String version, List<Statement> statement) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Statement(String effect, List<String> action, List<String> resource) {
    }
}
