package fr.lapetina.orchestrator.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents one language-model provider reachable through the gateway.
 * Immutable; built once from static configuration.
 */
public final class Provider {
    private final String id;
    private final String name;
    private final String routingPath;
    private final int priority;
    private final boolean enabled;
    private final Map<ModelTier, String> models;

    private Provider(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.name = builder.name != null ? builder.name : capitalize(builder.id);
        this.routingPath = builder.routingPath != null ? builder.routingPath : builder.id;
        this.priority = builder.priority;
        this.enabled = builder.enabled;
        this.models = Collections.unmodifiableMap(new EnumMap<>(builder.models));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Path segment used by the gateway to route to this provider,
     * e.g. {@code anthropic} in {@code anthropic/claude-3-5-sonnet}.
     */
    public String getRoutingPath() {
        return routingPath;
    }

    /**
     * Lower value means tried earlier.
     */
    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Model configured for the given tier. A tier without its own model uses
     * the standard one; empty when the provider configures neither.
     */
    public Optional<String> modelFor(ModelTier tier) {
        String model = models.get(tier);
        if (model == null) {
            model = models.get(ModelTier.STANDARD);
        }
        return Optional.ofNullable(model);
    }

    /**
     * Fully qualified model name as understood by the gateway.
     */
    public String qualifiedModel(String model) {
        return routingPath + "/" + model;
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Provider that = (Provider) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Provider{" +
                "id='" + id + '\'' +
                ", routingPath='" + routingPath + '\'' +
                ", priority=" + priority +
                ", enabled=" + enabled +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String routingPath;
        private int priority = 100;
        private boolean enabled = true;
        private final Map<ModelTier, String> models = new EnumMap<>(ModelTier.class);

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder routingPath(String routingPath) {
            this.routingPath = routingPath;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * Sets the model of a tier; a null or blank name clears it.
         */
        public Builder model(ModelTier tier, String model) {
            if (model == null || model.isBlank()) {
                this.models.remove(tier);
            } else {
                this.models.put(tier, model);
            }
            return this;
        }

        public Provider build() {
            return new Provider(this);
        }
    }
}
