package at.sv.minihub.integration;

import java.time.Duration;

/**
 * @param serviceCallTimeout maximum time an integration may take to handle a service call
 * @param retryDelay         first delay after a failed run of a backoff task
 * @param maxBackoff         upper bound of the exponentially growing retry delay
 */
public record IntegrationSettings(Duration serviceCallTimeout, Duration retryDelay, Duration maxBackoff) {
}
