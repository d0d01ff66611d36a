package at.sv.minihub.integration;

import java.time.Duration;

/**
 * @param scanInterval      pause between two scan cycles
 * @param scanDuration      how long each cycle listens for devices
 * @param connectionTimeout maximum time to refresh a single device
 */
public record ScanSettings(Duration scanInterval, Duration scanDuration, Duration connectionTimeout) {
}
