package com.aiwriter.schedule.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Scheduling behavior of the pipeline.
 *
 * <p>
 * Configuration prefix: {@code contentsched.scheduling}
 * </p>
 */
@ConfigurationProperties(prefix = "contentsched.scheduling")
public class SchedulingProperties {

    /**
     * Zone in which the naive schedule fields are interpreted and fire expressions are rendered.
     *
     * <p>Blank means the JVM default zone.</p>
     */
    private String zone;

    /** Subject the change feed relay publishes to and the change feed consumer reads. */
    private String changeFeedSubject = "changefeed.scheduled-content";

    /** First token of every bus subject; the full subject is {@code <prefix>.<source>.<detailType>}. */
    private String eventSubjectPrefix = "events";

    /** Key-value bucket holding pending jobs. */
    private String jobBucket = "SCHEDULED_JOBS";

    /** Storage type of the job bucket ({@code File} or {@code Memory}). */
    private String jobBucketStorage = "File";

    /** How often the job firer looks for due jobs. Bounds the firing skew. */
    private Duration fireInterval = Duration.ofSeconds(5);

    /** Whether this instance fires due jobs. */
    private boolean firerEnabled = true;

    private Registration registration = new Registration();

    /**
     * Bus subject of an event: {@code <prefix>.<source>.<detailType>}.
     */
    public String eventSubject(String source, String detailType) {
        return eventSubjectPrefix + "." + source + "." + detailType;
    }

    public ZoneId resolveZone() {
        return (zone == null || zone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
    }

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }

    public String getChangeFeedSubject() { return changeFeedSubject; }
    public void setChangeFeedSubject(String changeFeedSubject) { this.changeFeedSubject = changeFeedSubject; }

    public String getEventSubjectPrefix() { return eventSubjectPrefix; }
    public void setEventSubjectPrefix(String eventSubjectPrefix) { this.eventSubjectPrefix = eventSubjectPrefix; }

    public String getJobBucket() { return jobBucket; }
    public void setJobBucket(String jobBucket) { this.jobBucket = jobBucket; }

    public String getJobBucketStorage() { return jobBucketStorage; }
    public void setJobBucketStorage(String jobBucketStorage) { this.jobBucketStorage = jobBucketStorage; }

    public Duration getFireInterval() { return fireInterval; }
    public void setFireInterval(Duration fireInterval) { this.fireInterval = fireInterval; }

    public boolean isFirerEnabled() { return firerEnabled; }
    public void setFirerEnabled(boolean firerEnabled) { this.firerEnabled = firerEnabled; }

    public Registration getRegistration() { return registration; }
    public void setRegistration(Registration registration) { this.registration = registration; }

    /**
     * Retry policy for transient job creation failures.
     */
    public static class Registration {

        /** Retries after the first attempt. {@code 0} disables retrying. */
        private int maxRetries = 3;

        /** Backoff before the first retry; doubles on each further retry. */
        private Duration firstBackoff = Duration.ofMillis(500);

        /** Upper bound of a single backoff. */
        private Duration maxBackoff = Duration.ofSeconds(5);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getFirstBackoff() { return firstBackoff; }
        public void setFirstBackoff(Duration firstBackoff) { this.firstBackoff = firstBackoff; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }
}
