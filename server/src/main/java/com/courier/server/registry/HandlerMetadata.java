/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.message.Message;

import java.util.List;

public record HandlerMetadata(String name,
                              String summary,
                              String description,
                              List<String> tags,
                              List<Class<? extends Message>> documentedOutputs) {

    public HandlerMetadata {
        tags = List.copyOf(tags);
        documentedOutputs = List.copyOf(documentedOutputs);
    }
}
