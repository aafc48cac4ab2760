package com.rms.weather.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Stream bootstrap toggles.
 *
 * <p>Configuration prefix: {@code weather.jetstream.bootstrap}</p>
 */
@ConfigurationProperties(prefix = "weather.jetstream.bootstrap")
public class JetStreamBootstrapProperties {

	private boolean enabled = true;

	private boolean failOnMismatch = false;

	/** Keys of the streams to create/validate; empty means all enabled streams. */
	private List<String> streamKeys = new ArrayList<>();

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

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
}
