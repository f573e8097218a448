/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

import java.util.List;

/**
 * A stream as it exists on the backend.
 *
 * @param created {@code true} if this call created it
 */
public record StreamDescriptor(String name, List<String> subjects, long messageCount, boolean created) {}
