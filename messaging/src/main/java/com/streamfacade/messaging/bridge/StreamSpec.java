/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

import com.streamfacade.common.config.StreamDefaults;
import com.streamfacade.common.util.Subjects;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a stream to provision.
 */
public record StreamSpec(String name,
                         List<String> subjects,
                         StreamDefaults.Retention retention,
                         StreamDefaults.Storage storage,
                         Duration maxAge,
                         Duration duplicateWindow,
                         int replicas) {

    public StreamSpec {
        Objects.requireNonNull(name, "name must not be null");
        subjects = List.copyOf(subjects);
    }

    /** A stream named {@code name} that captures every subject below it. */
    public static StreamSpec of(String name, StreamDefaults defaults) {
        return new StreamSpec(name, List.of(Subjects.allOf(name)), defaults.getRetention(),
                defaults.getStorage(), defaults.maxAge(), defaults.duplicateWindow(), defaults.getReplicas());
    }
}
