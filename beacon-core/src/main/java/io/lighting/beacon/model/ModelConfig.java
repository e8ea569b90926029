package io.lighting.beacon.model;

import io.lighting.beacon.id.IdGeneratorProvider;
import io.lighting.beacon.id.IdGenerators;
import io.lighting.beacon.meta.ModelMetaRegistry;
import io.lighting.beacon.meta.ReflectionModelMetaRegistry;
import io.lighting.beacon.naming.Inflector;
import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators shared by every {@link Model} created with it.
 */
public final class ModelConfig {
    private final ModelMetaRegistry metaRegistry;
    private final Inflector inflector;
    private final Clock clock;
    private final IdGeneratorProvider idGeneratorProvider;
    private final TableNameResolver tableNameResolver;

    private ModelConfig(Builder builder) {
        this.inflector = Objects.requireNonNull(builder.inflector, "inflector");
        this.metaRegistry = builder.metaRegistry != null
            ? builder.metaRegistry
            : new ReflectionModelMetaRegistry(inflector);
        this.clock = builder.clock;
        this.idGeneratorProvider = Objects.requireNonNull(builder.idGeneratorProvider, "idGeneratorProvider");
        this.tableNameResolver = new TableNameResolver(metaRegistry, inflector);
    }

    /**
     * Shared configuration: reflection metadata, bundled inflection rules and {@link ModelClock}.
     */
    public static ModelConfig defaults() {
        return Defaults.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ModelMetaRegistry metaRegistry() {
        return metaRegistry;
    }

    public Inflector inflector() {
        return inflector;
    }

    /**
     * The configured clock, or the current {@link ModelClock} when none was configured.
     */
    public Clock clock() {
        return clock != null ? clock : ModelClock.current();
    }

    public IdGeneratorProvider idGeneratorProvider() {
        return idGeneratorProvider;
    }

    public TableNameResolver tableNameResolver() {
        return tableNameResolver;
    }

    private static final class Defaults {
        private static final ModelConfig INSTANCE = builder().build();
    }

    public static final class Builder {
        private ModelMetaRegistry metaRegistry;
        private Inflector inflector = Inflector.defaults();
        private Clock clock;
        private IdGeneratorProvider idGeneratorProvider = IdGenerators::forKind;

        public Builder metaRegistry(ModelMetaRegistry metaRegistry) {
            this.metaRegistry = metaRegistry;
            return this;
        }

        public Builder inflector(Inflector inflector) {
            this.inflector = Objects.requireNonNull(inflector, "inflector");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder idGeneratorProvider(IdGeneratorProvider provider) {
            this.idGeneratorProvider = Objects.requireNonNull(provider, "provider");
            return this;
        }

        public ModelConfig build() {
            return new ModelConfig(this);
        }
    }
}
