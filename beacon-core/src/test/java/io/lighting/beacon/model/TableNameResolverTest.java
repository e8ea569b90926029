package io.lighting.beacon.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.beacon.ModelException;
import io.lighting.beacon.meta.Column;
import io.lighting.beacon.meta.ModelMeta;
import io.lighting.beacon.meta.ReflectionModelMetaRegistry;
import io.lighting.beacon.meta.Table;
import io.lighting.beacon.naming.Inflector;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TableNameResolverTest {
    private ReflectionModelMetaRegistry registry;
    private TableNameResolver resolver;

    @BeforeEach
    void setUp() {
        registry = new ReflectionModelMetaRegistry();
        resolver = new TableNameResolver(registry, Inflector.defaults());
        CountingStatic.CALLS.set(0);
        CountingContextual.CALLS.set(0);
    }

    @Test
    void staticNamesAreComputedOnce() {
        CountingStatic model = new CountingStatic();

        resolver.resolve(CountingStatic.class, model, ModelContext.background());
        ResolvedTableName resolved = resolver.resolve(CountingStatic.class, model, ModelContext.background());

        assertEquals("counted", resolved.name());
        assertEquals(TableNameSource.STATIC, resolved.source());
        assertEquals(1, CountingStatic.CALLS.get());
    }

    @Test
    void contextualNamesAreNeverCached() {
        CountingContextual model = new CountingContextual();

        assertEquals("a_rows", resolver.resolve(CountingContextual.class, model, ModelContext.of("tenant", "a")).name());
        assertEquals("b_rows", resolver.resolve(CountingContextual.class, model, ModelContext.of("tenant", "b")).name());
        assertEquals(2, CountingContextual.CALLS.get());
    }

    @Test
    void capabilityInstanceIsCreatedWhenMissing() {
        assertEquals("counted", resolver.resolve(CountingStatic.class, null, ModelContext.background()).name());
        assertEquals(
            "default_rows",
            resolver.resolve(CountingContextual.class, null, ModelContext.background()).name()
        );
    }

    @Test
    void capabilityWithoutNoArgConstructorFails() {
        assertThrows(
            ModelException.class,
            () -> resolver.resolve(NoDefaultConstructor.class, null, ModelContext.background())
        );
    }

    @Test
    void registeredTableIsUsed() {
        registry.register(ModelMeta.builder(Plain.class).table("plain_records").build());

        ResolvedTableName resolved = resolver.resolve(Plain.class, null, ModelContext.background());

        assertEquals("plain_records", resolved.name());
        assertEquals(TableNameSource.ANNOTATION, resolved.source());
    }

    @Test
    void tableAnnotationResolvesDespiteInvalidColumns() {
        ResolvedTableName resolved = resolver.resolve(ClashingColumns.class, null, ModelContext.background());

        assertEquals("clashing_rows", resolved.name());
        assertEquals(TableNameSource.ANNOTATION, resolved.source());
    }

    @Test
    void conventionNames() {
        ResolvedTableName resolved = resolver.resolve(Plain.class, null, ModelContext.background());

        assertEquals("plains", resolved.name());
        assertEquals(TableNameSource.CONVENTION, resolved.source());
    }

    @Test
    void cacheability() {
        assertFalse(TableNameSource.LITERAL.cacheable());
        assertTrue(TableNameSource.STATIC.cacheable());
        assertFalse(TableNameSource.CONTEXTUAL.cacheable());
        assertTrue(TableNameSource.ANNOTATION.cacheable());
        assertTrue(TableNameSource.CONVENTION.cacheable());
    }

    private static final class CountingStatic implements HasTableName {
        private static final AtomicInteger CALLS = new AtomicInteger();

        @Override
        public String tableName() {
            CALLS.incrementAndGet();
            return "counted";
        }
    }

    private static final class CountingContextual implements HasContextualTableName {
        private static final AtomicInteger CALLS = new AtomicInteger();

        @Override
        public String tableName(ModelContext context) {
            CALLS.incrementAndGet();
            return context.get("tenant", String.class).orElse("default") + "_rows";
        }
    }

    private static final class NoDefaultConstructor implements HasTableName {
        private final String name;

        private NoDefaultConstructor(String name) {
            this.name = name;
        }

        @Override
        public String tableName() {
            return name;
        }
    }

    @Table(name = "clashing_rows")
    private static final class ClashingColumns {
        @Column(name = "value")
        private long first;

        @Column(name = "value")
        private long second;
    }

    private static final class Plain {
        private long id;
    }
}
