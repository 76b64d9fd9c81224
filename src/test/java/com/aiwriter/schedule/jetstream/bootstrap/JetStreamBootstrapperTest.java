package com.aiwriter.schedule.jetstream.bootstrap;

import com.aiwriter.schedule.jetstream.config.JetStreamBootstrapProperties;
import com.aiwriter.schedule.jetstream.config.JetStreamStreamsProperties;
import com.aiwriter.schedule.jetstream.config.JetStreamStreamsProperties.StreamSpec;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.KeyValueManagement;
import io.nats.client.api.KeyValueConfiguration;
import io.nats.client.api.KeyValueStatus;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JetStreamBootstrapperTest {

    private final JetStreamManagement jsm = mock(JetStreamManagement.class);
    private final ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
    private final JetStreamStreamsProperties streams = new JetStreamStreamsProperties();
    private final JetStreamBootstrapProperties bootstrap = new JetStreamBootstrapProperties();

    private static JetStreamApiException notFound() {
        JetStreamApiException e = mock(JetStreamApiException.class);
        when(e.getApiErrorCode()).thenReturn(10059);
        return e;
    }

    @Test
    void stream_spec_maps_to_work_queue_with_duplicate_window() {
        StreamConfiguration config = JetStreamBootstrapper.toStreamConfig(StreamSpec.defaultsEvents());

        assertThat(config.getName()).isEqualTo("SCHEDULED_CONTENT_EVENTS");
        assertThat(config.getSubjects()).containsExactly("events.>");
        assertThat(config.getRetentionPolicy()).isEqualTo(RetentionPolicy.WorkQueue);
        assertThat(config.getStorageType()).isEqualTo(StorageType.File);
        assertThat(config.getMaxAge()).isEqualTo(Duration.ofDays(7));
        assertThat(config.getDuplicateWindow()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void stream_spec_without_subjects_is_rejected() {
        StreamSpec spec = StreamSpec.defaultsDispatch();
        spec.setSubjects(List.of());

        assertThatThrownBy(() -> JetStreamBootstrapper.toStreamConfig(spec))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CONTENT_DISPATCH");
    }

    @Test
    void policy_names_parse_leniently() {
        assertThat(JetStreamBootstrapper.parseRetentionPolicy(null)).isEqualTo(RetentionPolicy.WorkQueue);
        assertThat(JetStreamBootstrapper.parseRetentionPolicy("work-queue")).isEqualTo(RetentionPolicy.WorkQueue);
        assertThat(JetStreamBootstrapper.parseRetentionPolicy("Limits")).isEqualTo(RetentionPolicy.Limits);
        assertThat(JetStreamBootstrapper.parseStorageType(" memory ")).isEqualTo(StorageType.Memory);
        assertThatThrownBy(() -> JetStreamBootstrapper.parseStorageType("disk"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missing_streams_are_created_then_completion_is_announced() throws Exception {
        JetStreamApiException missing = notFound();
        when(jsm.getStreamInfo(anyString())).thenThrow(missing);

        new JetStreamBootstrapper(jsm, streams, bootstrap, events).run(null);

        ArgumentCaptor<StreamConfiguration> created = ArgumentCaptor.forClass(StreamConfiguration.class);
        verify(jsm, times(3)).addStream(created.capture());
        assertThat(created.getAllValues()).extracting(StreamConfiguration::getName)
                .containsExactly("CHANGE_FEED", "SCHEDULED_CONTENT_EVENTS", "CONTENT_DISPATCH");
        verify(events).publishEvent(any(JetStreamBootstrapCompleteEvent.class));
    }

    @Test
    void drifted_stream_fails_startup_when_strict() throws Exception {
        StreamSpec drifted = StreamSpec.defaultsChangeFeed();
        drifted.setMaxAge(Duration.ofDays(1));
        StreamInfo info = mock(StreamInfo.class);
        when(info.getConfiguration()).thenReturn(JetStreamBootstrapper.toStreamConfig(drifted));
        when(jsm.getStreamInfo("CHANGE_FEED")).thenReturn(info);
        bootstrap.setFailOnMismatch(true);
        bootstrap.setStreamKeys(List.of("change-feed"));

        assertThatThrownBy(() -> new JetStreamBootstrapper(jsm, streams, bootstrap, events).run(null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maxAge");
        verify(jsm, never()).addStream(any(StreamConfiguration.class));
    }

    @Test
    void missing_job_bucket_is_created_with_single_history() throws Exception {
        KeyValueManagement kvm = mock(KeyValueManagement.class);
        JetStreamApiException missing = notFound();
        when(kvm.getStatus("SCHEDULED_JOBS")).thenThrow(missing);

        JetStreamBootstrapper.ensureJobBucket(kvm, "SCHEDULED_JOBS", "memory");

        ArgumentCaptor<KeyValueConfiguration> config = ArgumentCaptor.forClass(KeyValueConfiguration.class);
        verify(kvm).create(config.capture());
        assertThat(config.getValue().getBucketName()).isEqualTo("SCHEDULED_JOBS");
        assertThat(config.getValue().getStorageType()).isEqualTo(StorageType.Memory);
        assertThat(config.getValue().getMaxHistoryPerKey()).isEqualTo(1);
    }

    @Test
    void existing_job_bucket_is_left_alone() throws Exception {
        KeyValueManagement kvm = mock(KeyValueManagement.class);
        when(kvm.getStatus("SCHEDULED_JOBS")).thenReturn(mock(KeyValueStatus.class));

        JetStreamBootstrapper.ensureJobBucket(kvm, "SCHEDULED_JOBS", "File");

        verify(kvm, never()).create(any(KeyValueConfiguration.class));
    }
}
