package com.feedwarden.gate.client;

import com.feedwarden.gate.model.ErrorKind;
import com.feedwarden.gate.model.FetchOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Typed result of one attempted fetch. Failures and blocks are ordinary results, not exceptions.
 */
@Value
@Builder
public class FetchResult {

    String sourceId;
    String url;
    FetchOutcome outcome;
    ErrorKind errorKind;        // null on success
    boolean probe;

    byte[] body;                // null on 304, hard block or no response
    @Builder.Default
    Map<String, List<String>> headers = Map.of();
    FetchMetadata metadata;

    public boolean isSuccess() {
        return outcome == FetchOutcome.SUCCESS;
    }

    public boolean isNotModified() {
        return isSuccess() && metadata.statusCode() != null && metadata.statusCode() == 304;
    }
}
