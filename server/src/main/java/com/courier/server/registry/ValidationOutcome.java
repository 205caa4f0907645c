/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.message.Message;
import com.courier.common.message.ValidationError;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result of validating one inbound frame against a {@link DiscriminatedUnion}.
 */
public sealed interface ValidationOutcome permits ValidationOutcome.Valid, ValidationOutcome.Invalid {

    /** Discriminator value read from the frame, or null when it could not be read. */
    String discriminator();

    record Valid(MessageType<?> type, Message message, ObjectNode raw) implements ValidationOutcome {
        @Override
        public String discriminator() { return type.discriminator(); }
    }

    record Invalid(String discriminator, List<ValidationError> errors) implements ValidationOutcome {
        public Invalid {
            errors = List.copyOf(errors);
        }
    }
}
