/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.connection;

import com.courier.common.config.DispatchConfig;
import com.courier.common.exception.ConstructionException;
import com.courier.common.util.Names;
import com.courier.server.auth.Authenticator;
import com.courier.server.auth.Authenticators;
import com.courier.server.registry.SchemaRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Everything shared by the connections of one endpoint: registry, dispatch settings,
 * authentication gate, initial groups and lifecycle hooks. Immutable; one instance per
 * endpoint, built at startup.
 */
public final class ConnectionType {

    private final String name;
    private final String description;
    private final List<String> tags;
    private final DispatchConfig config;
    private final SchemaRegistry registry;
    private final Authenticator authenticator;
    private final List<String> groups;
    private final GroupResolver groupResolver;
    private final ConnectionHook postAuthentication;

    private ConnectionType(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.tags = List.copyOf(b.tags);
        this.config = b.config;
        this.registry = b.registry;
        this.authenticator = b.authenticator;
        this.groups = List.copyOf(b.groups);
        this.groupResolver = b.groupResolver;
        this.postAuthentication = b.postAuthentication;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Derives the name from a consumer class, e.g. {@code ChatConsumer} becomes {@code chat}. */
    public static Builder builder(Class<?> consumerClass) {
        return new Builder(Names.connectionTypeName(consumerClass.getSimpleName()));
    }

    public String name() { return name; }
    public String description() { return description; }
    public List<String> tags() { return tags; }
    public DispatchConfig config() { return config; }
    public SchemaRegistry registry() { return registry; }
    public Authenticator authenticator() { return authenticator; }
    /** Static groups every authenticated connection joins. */
    public List<String> groups() { return groups; }
    public GroupResolver groupResolver() { return groupResolver; }
    public ConnectionHook postAuthentication() { return postAuthentication; }

    @Override
    public String toString() {
        return "ConnectionType{" + name + "}";
    }

    public static final class Builder {
        private final String name;
        private String description;
        private final List<String> tags = new ArrayList<>();
        private DispatchConfig config = DispatchConfig.defaults();
        private SchemaRegistry registry;
        private Authenticator authenticator = Authenticators.allowAll();
        private final List<String> groups = new ArrayList<>();
        private GroupResolver groupResolver = connection -> List.of();
        private ConnectionHook postAuthentication = connection -> { };

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder description(String description) { this.description = description; return this; }
        public Builder tags(String... tags) { this.tags.addAll(Arrays.asList(tags)); return this; }
        public Builder config(DispatchConfig config) { this.config = Objects.requireNonNull(config, "config"); return this; }
        public Builder registry(SchemaRegistry registry) { this.registry = registry; return this; }
        public Builder authenticator(Authenticator authenticator) { this.authenticator = Objects.requireNonNull(authenticator, "authenticator"); return this; }
        public Builder groups(String... groups) { this.groups.addAll(Arrays.asList(groups)); return this; }
        public Builder groupResolver(GroupResolver resolver) { this.groupResolver = Objects.requireNonNull(resolver, "resolver"); return this; }
        public Builder postAuthentication(ConnectionHook hook) { this.postAuthentication = Objects.requireNonNull(hook, "hook"); return this; }

        public ConnectionType build() {
            if (registry == null) {
                throw new ConstructionException("Connection type '" + name + "' has no schema registry");
            }
            if (!registry.discriminatorField().equals(config.discriminatorField())) {
                throw new ConstructionException("Connection type '" + name + "' uses discriminator '"
                        + config.discriminatorField() + "' but its registry was built for '"
                        + registry.discriminatorField() + "'");
            }
            return new ConnectionType(this);
        }
    }
}
