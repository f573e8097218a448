/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamfacade.common.util.Durations;

import java.time.Duration;

/**
 * Settings applied to every stream a connection creates on demand.
 * Existing streams are used as they are.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamDefaults {

    public enum Retention { LIMITS, INTEREST, WORK_QUEUE }

    public enum Storage { FILE, MEMORY }

    @JsonProperty("retention")
    private Retention retention = Retention.LIMITS;

    @JsonProperty("storage")
    private Storage storage = Storage.FILE;

    /** Zero keeps messages until another limit removes them. */
    @JsonProperty("max_age")
    private String maxAge = "0";

    @JsonProperty("duplicate_window")
    private String duplicateWindow = "2m";

    @JsonProperty("replicas")
    private int replicas = 1;

    public StreamDefaults() {}

    public Retention getRetention() { return retention; }
    public void setRetention(Retention retention) { this.retention = retention; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public String getMaxAge() { return maxAge; }
    public void setMaxAge(String maxAge) { this.maxAge = maxAge; }
    public String getDuplicateWindow() { return duplicateWindow; }
    public void setDuplicateWindow(String duplicateWindow) { this.duplicateWindow = duplicateWindow; }
    public int getReplicas() { return replicas; }
    public void setReplicas(int replicas) { this.replicas = replicas; }

    @JsonIgnore
    public Duration maxAge() { return Durations.parse(maxAge, Duration.ZERO); }

    @JsonIgnore
    public Duration duplicateWindow() { return Durations.parse(duplicateWindow, Duration.ofMinutes(2)); }
}
