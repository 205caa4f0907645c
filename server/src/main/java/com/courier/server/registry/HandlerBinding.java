/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.message.Message;
import com.courier.server.connection.Connection;

/**
 * A declaration bound into a {@link HandlerTable} under one direction.
 */
public final class HandlerBinding {

    private final Direction direction;
    private final HandlerDeclaration<?, ?> declaration;

    HandlerBinding(Direction direction, HandlerDeclaration<?, ?> declaration) {
        this.direction = direction;
        this.declaration = declaration;
    }

    public String discriminator() { return declaration.inputType().discriminator(); }
    public Direction direction() { return direction; }
    public MessageType<?> inputType() { return declaration.inputType(); }
    public Class<?> outputType() { return declaration.outputType(); }
    public HandlerMetadata metadata() { return declaration.metadata(); }
    public String name() { return declaration.name(); }

    /**
     * Runs the handler. The message must be an instance of this binding's input type.
     */
    public Object invoke(Connection connection, Message message) throws Exception {
        if (!inputType().messageClass().isInstance(message)) {
            throw new IllegalArgumentException("Handler " + name() + " expects "
                    + inputType().messageClass().getSimpleName() + " but got " + message.getClass().getSimpleName());
        }
        return call(declaration, connection, message);
    }

    private static <I extends Message, O> Object call(HandlerDeclaration<I, O> declaration,
                                                      Connection connection, Message message) throws Exception {
        return declaration.handler().handle(connection, declaration.inputType().messageClass().cast(message));
    }

    @Override
    public String toString() {
        return "HandlerBinding{" + direction + ":" + discriminator() + " -> " + name() + "}";
    }
}
