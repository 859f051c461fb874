package com.feedwarden.gate.client;

import com.feedwarden.gate.config.IngestionGateProperties;
import com.feedwarden.gate.model.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Conservative heuristics that map a raw response onto a fetch outcome.
 *
 * Challenge pages are backed off from, never worked around.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutcomeClassifier {

    private final IngestionGateProperties properties;
    private final Clock clock;

    public Classification classify(TransportResponse response) {
        if (response == null) {
            return Classification.transientError(ErrorKind.NETWORK_TIMEOUT);
        }
        IngestionGateProperties.Client cfg = properties.getClient();
        int status = response.statusCode();

        if (status == 304) {
            return Classification.success();
        }
        if (status == 403 || status == 406) {
            return Classification.hardBlock();
        }
        if (status == 407) {
            // Proxy authentication failed: an egress fault, not the source refusing us
            return Classification.transientError(ErrorKind.NETWORK_TIMEOUT);
        }
        if (status == 429) {
            return Classification.softBlock(ErrorKind.SOFT_BLOCK, parseRetryAfter(response.firstHeader("Retry-After")));
        }
        if (status >= 500) {
            return Classification.transientError(ErrorKind.SERVER_ERROR);
        }
        if (status >= 400) {
            return Classification.transientError(ErrorKind.CLIENT_ERROR);
        }

        // Tar-pitting: abnormally slow answers are throttling, not success
        if (response.elapsed() != null && response.elapsed().compareTo(cfg.getSlowResponseThreshold()) > 0) {
            log.warn("Abnormal latency ({} ms). Possible throttling.", response.elapsed().toMillis());
            return Classification.softBlock(ErrorKind.SOFT_BLOCK, null);
        }

        String text = response.bodyText();
        if (text.length() < cfg.getMinBodyChars()) {
            return Classification.softBlock(ErrorKind.CONTENT_EMPTY, null);
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (text.length() < cfg.getJsRequiredWindowChars() && containsAny(lower, cfg.getJsRequiredMarkers())) {
            log.warn("JS-only placeholder detected");
            return Classification.softBlock(ErrorKind.SOFT_BLOCK, null);
        }
        if (text.length() < cfg.getChallengeWindowChars() && containsAny(lower, cfg.getChallengeMarkers())) {
            log.warn("Challenge page detected");
            return Classification.softBlock(ErrorKind.SOFT_BLOCK, null);
        }

        return Classification.success();
    }

    /**
     * Retry-After as delta-seconds or an HTTP-date. Null when absent, malformed or in the past.
     */
    Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) return null;
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            long seconds = trimmed.length() > 9 ? 999_999_999L : Long.parseLong(trimmed);
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration until = Duration.between(clock.instant(), at.toInstant());
            return until.isNegative() || until.isZero() ? null : until;
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Retry-After header: {}", value);
            return null;
        }
    }

    private static boolean containsAny(String text, Iterable<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
