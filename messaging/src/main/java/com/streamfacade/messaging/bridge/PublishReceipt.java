/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.messaging.bridge;

/**
 * Backend acknowledgement of one publish. {@code duplicate} is set when the dedup key was
 * already seen inside the duplicate window; {@code sequence} then points at the original.
 */
public record PublishReceipt(String stream, long sequence, boolean duplicate) {}
