package com.questrail.cot.observability;

import java.time.Instant;

/**
 * A configuration choice that weakens the security or compatibility posture.
 *
 * <p>These are not errors: the client proceeds. They exist so that disabling a
 * verification step can never go unnoticed.</p>
 */
public record CotSecurityWarning(
    Instant timestamp,
    String message
) {
}
