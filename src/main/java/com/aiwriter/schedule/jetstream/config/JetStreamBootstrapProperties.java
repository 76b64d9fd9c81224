package com.aiwriter.schedule.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * =====================================================================
 * JetStreamBootstrapProperties
 * =====================================================================
 *
 * PURPOSE ------- Controls how strictly the pipeline's JetStream resources
 * (streams and the job bucket) are validated at startup by
 * {@link com.aiwriter.schedule.jetstream.bootstrap.JetStreamBootstrapper}.
 *
 * Operators choose between safety-first (fail fast on drift) and
 * availability-first (warn and continue).
 *
 * CONFIGURATION PREFIX -------------------- contentsched.bootstrap.*
 */
@ConfigurationProperties(prefix = "contentsched.bootstrap")
public class JetStreamBootstrapProperties {

	/**
	 * Behavior when an existing stream does NOT match the desired configuration.
	 *
	 * WHEN TRUE ---------- startup fails.
	 *
	 * WHEN FALSE ----------- a warning is logged and startup continues.
	 *
	 * Neither mode modifies an existing stream.
	 *
	 * DEFAULT ------- false
	 */
	private boolean failOnMismatch = false;

	/**
	 * Optional list of logical stream keys to bootstrap on this node.
	 *
	 * If empty, all configured (enabled=true) streams are bootstrapped.
	 *
	 * Valid keys:
	 * - change-feed
	 * - events
	 * - dispatch
	 */
	private List<String> streamKeys = new ArrayList<>();

	/**
	 * Whether the job bucket is created when missing.
	 */
	private boolean createJobBucket = true;

	public boolean isFailOnMismatch() {
		return failOnMismatch;
	}

	public void setFailOnMismatch(boolean failOnMismatch) {
		this.failOnMismatch = failOnMismatch;
	}

	public List<String> getStreamKeys() {
		return streamKeys;
	}

	public void setStreamKeys(List<String> streamKeys) {
		this.streamKeys = streamKeys == null ? new ArrayList<>() : streamKeys;
	}

	public boolean isCreateJobBucket() {
		return createJobBucket;
	}

	public void setCreateJobBucket(boolean createJobBucket) {
		this.createJobBucket = createJobBucket;
	}
}
