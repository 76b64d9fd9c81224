package com.aiwriter.schedule.jetstream.scheduler;

import com.aiwriter.schedule.core.model.ScheduleJob;
import com.aiwriter.schedule.core.port.JobCreation;
import com.aiwriter.schedule.core.port.JobSchedulerClient;
import com.aiwriter.schedule.core.port.SchedulerServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStreamApiException;
import io.nats.client.KeyValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;
import java.util.regex.Pattern;

/**
 * =====================================================================
 * JetStreamJobSchedulerClient
 * =====================================================================
 *
 * PURPOSE
 * -------
 * {@link JobSchedulerClient} backed by a JetStream key-value bucket. Each
 * job is one key, {@code <groupRef>.<name>}, holding a {@link StoredJob}.
 * {@link JobFirer} is the other half: it fires and removes due jobs.
 *
 * CREATE-ONLY
 * -----------
 * {@link KeyValue#create(String, byte[])} only succeeds when the key has no
 * live value. A taken key surfaces as API error 10071 ("wrong last
 * sequence"), reported as {@link JobCreation#ALREADY_EXISTS}; the stored job
 * stays as it was.
 *
 * FAILURE CLASSIFICATION
 * ----------------------
 * - I/O errors (timeouts, connection loss) → transient
 * - other API errors, invalid key or target subject → permanent
 */
public class JetStreamJobSchedulerClient implements JobSchedulerClient {

    private static final Logger log = LoggerFactory.getLogger(JetStreamJobSchedulerClient.class);

    /**
     * JetStream API error code for "wrong last sequence", returned when a create-only
     * write finds an existing value.
     */
    static final int JS_WRONG_LAST_SEQUENCE_ERR = 10071;

    private static final Pattern VALID_KEY = Pattern.compile("[-/_=.a-zA-Z0-9]+");
    private static final Pattern VALID_SUBJECT = Pattern.compile("[^\\s*>]+");

    private final KeyValue jobs;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JetStreamJobSchedulerClient(KeyValue jobs, ObjectMapper mapper, Clock clock) {
        this.jobs = jobs;
        this.mapper = mapper;
        this.clock = clock;
    }

    static String keyOf(String groupRef, String name) {
        return groupRef + "." + name;
    }

    @Override
    public Mono<JobCreation> createJob(ScheduleJob job) {
        return Mono.defer(() -> {
                    String key = keyOf(job.target().groupRef(), job.name());
                    validate(key, job);
                    byte[] value = serialize(job);
                    return Mono.fromCallable(() -> create(key, value));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private JobCreation create(String key, byte[] value) {
        try {
            long revision = jobs.create(key, value);
            log.debug("Stored job key={} revision={}", key, revision);
            return JobCreation.CREATED;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() == JS_WRONG_LAST_SEQUENCE_ERR) {
                return JobCreation.ALREADY_EXISTS;
            }
            throw SchedulerServiceException.permanentFailure("job bucket rejected key=" + key + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw SchedulerServiceException.transientFailure("job bucket unavailable key=" + key + ": " + e.getMessage(), e);
        }
    }

    private void validate(String key, ScheduleJob job) {
        if (!VALID_KEY.matcher(key).matches()) {
            throw SchedulerServiceException.permanentFailure("invalid job key: " + key, null);
        }
        String target = job.target().targetRef();
        if (!VALID_SUBJECT.matcher(target).matches() || target.startsWith(".") || target.endsWith(".")) {
            throw SchedulerServiceException.permanentFailure("invalid target subject: " + target, null);
        }
    }

    private byte[] serialize(ScheduleJob job) {
        try {
            return mapper.writeValueAsBytes(StoredJob.of(job, clock.instant()));
        } catch (JsonProcessingException e) {
            throw SchedulerServiceException.permanentFailure("job not serializable name=" + job.name(), e);
        }
    }
}
