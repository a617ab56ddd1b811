package com.tessera.observability;

import io.micrometer.core.instrument.Timer;

import java.util.Locale;

/**
 * Counters for security-relevant outcomes of the credential engine.
 * <p>
 * Tag values are enum-like reason codes only. Subjects, token ids and link parameters are
 * never used as tags.
 */
public final class SecurityMetrics {

    public static final String TOKEN_REJECTIONS = "tessera.token.rejections";
    public static final String LINK_REJECTIONS = "tessera.link.rejections";
    public static final String AUTHZ_DECISIONS = "tessera.authz.decisions";
    public static final String SECRET_RESOLUTIONS = "tessera.secret.resolutions";
    public static final String KEY_RELOADS = "tessera.keys.reload";

    private final MetricFactory metrics;

    public SecurityMetrics(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    /** Records a rejected credential, tagged with the failure reason. */
    public void tokenRejected(Enum<?> reason) {
        metrics.counter(TOKEN_REJECTIONS, "Credentials rejected during validation",
                "reason", tagValue(reason)).increment();
    }

    /** Records a rejected signed link, tagged with the failure reason. */
    public void linkRejected(Enum<?> reason) {
        metrics.counter(LINK_REJECTIONS, "Signed links rejected during validation",
                "reason", tagValue(reason)).increment();
    }

    /** Records an authorization decision. */
    public void authorizationDecided(Enum<?> decision) {
        metrics.counter(AUTHZ_DECISIONS, "Authorization decisions",
                "decision", tagValue(decision)).increment();
    }

    /**
     * Records the outcome of a secret lookup.
     *
     * @param outcome {@code "resolved"} or a failure kind
     */
    public void secretResolution(String outcome) {
        metrics.counter(SECRET_RESOLUTIONS, "Secret lookups by outcome",
                "outcome", outcome.toLowerCase(Locale.ROOT)).increment();
    }

    /** Timer for key material loads, tagged with the outcome. */
    public Timer keyReload(String outcome) {
        return metrics.timer(KEY_RELOADS, "Key material load duration", "outcome", outcome);
    }

    private static String tagValue(Enum<?> value) {
        return value == null ? "unknown" : value.name().toLowerCase(Locale.ROOT);
    }
}
