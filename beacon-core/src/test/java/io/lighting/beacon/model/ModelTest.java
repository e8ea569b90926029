package io.lighting.beacon.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.beacon.MissingFieldException;
import io.lighting.beacon.ModelException;
import io.lighting.beacon.NotARecordException;
import io.lighting.beacon.columns.ColumnSet;
import io.lighting.beacon.meta.Column;
import io.lighting.beacon.meta.Id;
import io.lighting.beacon.meta.PrimaryKeyKind;
import io.lighting.beacon.meta.Table;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ModelTest {

    @Test
    void stringValueIsTheTableName() {
        Model model = Model.of("custom_table");

        assertEquals("custom_table", model.tableName());
        assertEquals(TableNameSource.LITERAL, model.resolveTableName().source());
        assertEquals("id", model.idField());
        assertTrue(model.usingAutoIncrement());
        assertTrue(model.columns().isEmpty());
        assertThrows(NotARecordException.class, model::id);
        assertThrows(NotARecordException.class, model::primaryKeyType);
    }

    @Test
    void conventionTableizesSimpleName() {
        assertEquals("users", Model.of(new User()).tableName());
        assertEquals("people", Model.of(new Person()).tableName());
        assertEquals("order_items", Model.of(new OrderItem()).tableName());
    }

    @Test
    void staticCapabilityWinsOverAnnotationAndConvention() {
        ResolvedTableName resolved = Model.of(new LegacyPerson()).resolveTableName();

        assertEquals("legacy_people", resolved.name());
        assertEquals(TableNameSource.STATIC, resolved.source());
    }

    @Test
    void staticCapabilityWinsOverContextualCapability() {
        assertEquals("both_static", Model.of(new BothCapabilities(), ModelContext.of("tenant", "acme")).tableName());
    }

    @Test
    void contextualCapabilityReceivesTheContext() {
        Widget widget = new Widget();

        assertEquals("acme_widgets", Model.of(widget, ModelContext.of("tenant", "acme")).tableName());
        assertEquals("globex_widgets", Model.of(widget, ModelContext.of("tenant", "globex")).tableName());
        assertEquals("widgets", Model.of(widget).tableName());
        assertEquals(TableNameSource.CONTEXTUAL, Model.of(widget).resolveTableName().source());
    }

    @Test
    void tableAnnotationWinsOverConvention() {
        ResolvedTableName resolved = Model.of(new Invoice()).resolveTableName();

        assertEquals("billing.invoices", resolved.name());
        assertEquals(TableNameSource.ANNOTATION, resolved.source());
    }

    @Test
    void collectionsUseTheElementType() {
        assertEquals("users", Model.of(List.of(new User(), new User())).tableName());
        assertEquals("users", Model.of(new User[] {new User()}).tableName());
        assertEquals("users", Model.of(new User[0]).tableName());
        assertEquals("users", Model.ofCollection(User.class, List.of()).tableName());
        assertEquals("legacy_people", Model.ofCollection(LegacyPerson.class, List.of()).tableName());
    }

    @Test
    void collectionOfContextualElementsThreadsEachContext() {
        List<Widget> widgets = List.of(new Widget());

        assertEquals("acme_widgets", Model.of(widgets, ModelContext.of("tenant", "acme")).tableName());
        assertEquals("globex_widgets", Model.of(widgets, ModelContext.of("tenant", "globex")).tableName());
    }

    @Test
    void emptyUntypedCollectionCannotResolveTable() {
        Model model = Model.of(List.of());

        assertThrows(ModelException.class, model::tableName);
        assertEquals("id", model.idField());
        assertTrue(model.usingAutoIncrement());
    }

    @Test
    void aliasDefaultsToTableName() {
        assertEquals("users", Model.of(new User()).alias());
        assertEquals("u", Model.of(new User()).as("u").alias());
        assertEquals("billing_invoices", Model.of(new Invoice()).alias());
        assertEquals("public_accounts", Model.of("public.accounts").alias());
    }

    @Test
    void whereIdFragments() {
        assertEquals("users.id = ?", Model.of(new User()).whereId());
        assertEquals("users.id = :id", Model.of(new User()).whereNamedId());
        assertEquals("t.uid = :uid", Model.of(new Token()).as("t").whereNamedId());
    }

    @Test
    void associationNameSingularizesTable() {
        assertEquals("user_id", Model.of(new User()).associationName());
        assertEquals("person_id", Model.of(new Person()).associationName());
        assertEquals("order_item_id", Model.of(new OrderItem()).associationName());
        assertEquals("base_id", Model.of(new Base()).associationName());
        assertEquals("bias_id", Model.of(new Bias()).associationName());
    }

    @Test
    void hiddenSuperclassKeyDoesNotBreakModelOperations() {
        DerivedRecord record = new DerivedRecord();
        Model model = Model.of(record);

        assertEquals("derived_records", model.tableName());
        assertEquals("id", model.idField());
        assertTrue(model.usingAutoIncrement());
        model.touchCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), ((BaseRecord) record).createdAt);

        model.assignId(5L);
        assertEquals(5L, record.id);
        assertEquals(5L, model.id());
    }

    @Test
    void idReturnsCurrentKey() {
        User user = new User();
        user.id = 42;

        assertEquals(42L, Model.of(user).id());
        assertEquals("long", Model.of(user).primaryKeyType());
        assertEquals(PrimaryKeyKind.LONG, Model.of(user).primaryKeyKind());
    }

    @Test
    void uuidKeysAreReturnedAsCanonicalStrings() {
        Token token = new Token();
        token.uid = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

        Model model = Model.of(token);

        assertEquals("6ba7b810-9dad-11d1-80b4-00c04fd430c8", model.id());
        assertEquals("UUID", model.primaryKeyType());
        assertEquals(PrimaryKeyKind.UUID, model.primaryKeyKind());
        assertEquals("uid", model.idField());
        assertFalse(model.usingAutoIncrement());
    }

    @Test
    void missingKeyField() {
        Model model = Model.of(new Keyless());

        assertThrows(MissingFieldException.class, model::id);
        MissingFieldException ex = assertThrows(MissingFieldException.class, model::primaryKeyType);
        assertEquals("id", ex.fieldName());
        assertEquals(Keyless.class, ex.modelType());
        assertEquals("id", model.idField());
        assertTrue(model.usingAutoIncrement());
    }

    @Test
    void idOnCollectionIsRejected() {
        assertThrows(ModelException.class, () -> Model.of(List.of(new User())).id());
    }

    @Test
    void autoIncrementOptOutRequiresExactTrue() {
        assertFalse(Model.of(new Token()).usingAutoIncrement());
        assertTrue(Model.of(new LooseToken()).usingAutoIncrement());
        assertTrue(Model.of(new User()).usingAutoIncrement());
    }

    @Test
    void columnsOfRecordWithRenamedField() {
        ColumnSet columns = Model.of(new User()).columns();

        assertEquals("users", columns.tableName());
        assertEquals(List.of("id", "full_name", "created_at"), columns.names());
        assertEquals(List.of("full_name", "created_at"), columns.writeable().names());
        assertEquals("id", columns.idField().name());
        assertFalse(columns.idField().writeable());
        assertEquals("users.full_name", columns.get("full_name").orElseThrow().qualifiedName());
    }

    @Test
    void columnsUseAlias() {
        ColumnSet columns = Model.of(new User()).as("u").columns();

        assertEquals("u.id, u.full_name, u.created_at", columns.selectString());
    }

    @Test
    void columnsIncludeCallerAssignedKeyInWrites() {
        ColumnSet columns = Model.of(new Token()).columns();

        assertEquals(List.of("uid", "label"), columns.writeable().names());
        assertTrue(columns.idField().writeable());
    }

    @Test
    void valuesFollowColumnOrder() {
        User user = new User();
        user.id = 3;
        user.name = "Ada";

        assertEquals(List.of("id", "full_name", "created_at"), List.copyOf(Model.of(user).values().keySet()));
        assertEquals("Ada", Model.of(user).valueOf("full_name"));
        assertEquals(3L, Model.of(user).valueOf(Model.of(user).columns().get("id").orElseThrow()));
        assertThrows(MissingFieldException.class, () -> Model.of(user).valueOf("nickname"));
    }

    private static final class User {
        private long id;

        @Column(name = "full_name")
        private String name;

        private Instant createdAt;
    }

    private static final class Person {
        private long id;
    }

    private static final class OrderItem {
        private long id;
    }

    private static final class Base {
        private long id;
    }

    private static final class Bias {
        private long id;
    }

    private static class BaseRecord {
        private long id;

        private Instant createdAt;
    }

    private static final class DerivedRecord extends BaseRecord {
        private long id;
    }

    @Table(name = "people_archive")
    private static final class LegacyPerson implements HasTableName {
        private long id;

        @Override
        public String tableName() {
            return "legacy_people";
        }
    }

    private static final class BothCapabilities implements HasTableName, HasContextualTableName {
        @Override
        public String tableName() {
            return "both_static";
        }

        @Override
        public String tableName(ModelContext context) {
            return "both_contextual";
        }
    }

    private static final class Widget implements HasContextualTableName {
        private long id;

        @Override
        public String tableName(ModelContext context) {
            return context.get("tenant", String.class).map(tenant -> tenant + "_widgets").orElse("widgets");
        }
    }

    @Table(name = "billing.invoices")
    private static final class Invoice {
        private long id;
    }

    private static final class Token {
        @Id(noAutoIncrement = "true")
        private UUID uid;

        private String label;
    }

    private static final class LooseToken {
        @Id(noAutoIncrement = "TRUE")
        private UUID uid;
    }

    private static final class Keyless {
        private String name;
    }
}
