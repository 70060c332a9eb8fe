package org.carball.dbml.model.schema;

import org.carball.dbml.validation.ValidationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.params.provider.Arguments.arguments;

public class RequiredFieldValidationTest {

    private static Table orders(Column column) {
        return new Table("orders").addColumn(column);
    }

    private static Column userRef(String schema, String table) {
        return new Column("user_id", "bigint").withRef(RelationshipType.MANY_TO_ONE, schema, table, "id");
    }

    static Stream<Arguments> graphsMissingARequiredField() {
        return Stream.of(
                arguments("Project.Name",
                        new Project(""),
                        "Project.Name: name is required"),
                arguments("table public.: Table.Name",
                        new Project("shop").addTable(new Table("").addColumn(new Column("id", "int"))),
                        "table public.: Table.Name: name is required"),
                arguments("table .users: Table.Schema",
                        new Project("shop").addTable(new Table("users").withSchema("")
                                .addColumn(new Column("id", "int"))),
                        "table .users: Table.Schema: schema is required"),
                arguments("table public.orders: column 0: Column.Name",
                        new Project("shop").addTable(orders(new Column("", "int"))),
                        "table public.orders: column 0: Column.Name: name is required"),
                arguments("table public.orders: column 0: inline_ref: InlineRef.Schema",
                        new Project("shop").addTable(orders(userRef("", "users"))),
                        "table public.orders: column 0: inline_ref: InlineRef.Schema: schema is required"),
                arguments("table public.orders: column 0: inline_ref: InlineRef.Table",
                        new Project("shop").addTable(orders(userRef("public", ""))),
                        "table public.orders: column 0: inline_ref: InlineRef.Table: table is required"),
                arguments("enum public.: Enum.Name",
                        new Project("shop").addEnum(new SchemaEnum("", "active")),
                        "enum public.: Enum.Name: name is required"),
                arguments("enum .status: Enum.Schema",
                        new Project("shop").addEnum(new SchemaEnum("status", "active").withSchema("")),
                        "enum .status: Enum.Schema: schema is required"),
                arguments("ref 0: left: RefEndpoint.Schema",
                        new Project("shop").addRef(new Ref(RelationshipType.MANY_TO_ONE)
                                .from("", "posts", "user_id")
                                .to("public", "users", "id")),
                        "ref 0: left: RefEndpoint.Schema: schema is required"),
                arguments("ref 0: left: RefEndpoint.Columns",
                        new Project("shop").addRef(new Ref(RelationshipType.MANY_TO_ONE)
                                .from("public", "posts")
                                .to("public", "users", "id")),
                        "ref 0: left: RefEndpoint.Columns: at least one column is required"),
                arguments("ref 0: right: RefEndpoint.Columns",
                        new Project("shop").addRef(new Ref(RelationshipType.MANY_TO_ONE)
                                .from("public", "posts", "user_id")
                                .to("public", "users")),
                        "ref 0: right: RefEndpoint.Columns: at least one column is required"),
                arguments("table_group 0: TableGroup.Name",
                        new Project("shop").addTableGroup(new TableGroup("").addTable("public", "users")),
                        "table_group 0: TableGroup.Name: name is required"),
                arguments("table_group 0: TableGroup.Tables[0].Schema",
                        new Project("shop").addTableGroup(new TableGroup("core").addTable("", "users")),
                        "table_group 0: TableGroup.Tables[0].Schema: schema is required")
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("graphsMissingARequiredField")
    void shouldNameMissingFieldPath(String expectedPath, Project project, String expectedMessage) {
        assertThatThrownBy(project::validate)
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getPath()).isEqualTo(expectedPath);
                    assertThat(e.getMessage()).isEqualTo(expectedMessage);
                });
    }
}
