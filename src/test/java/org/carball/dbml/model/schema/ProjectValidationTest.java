package org.carball.dbml.model.schema;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.dbml.validation.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ProjectValidationTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(Project.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setAdditive(true);
    }

    private static Project validProject() {
        return new Project("shop")
                .addTable(new Table("users")
                        .addColumn(new Column("id", "bigint").withPrimaryKey())
                        .addColumn(new Column("email", "varchar(255)").withUnique()))
                .addTable(new Table("orders")
                        .addColumn(new Column("id", "bigint").withPrimaryKey())
                        .addColumn(new Column("user_id", "bigint")
                                .withRef(RelationshipType.MANY_TO_ONE, "public", "users", "id")))
                .addEnum(new SchemaEnum("order_status", "pending", "shipped"))
                .addRef(new Ref(RelationshipType.MANY_TO_ONE)
                        .from("public", "orders", "user_id")
                        .to("public", "users", "id"))
                .addTableGroup(new TableGroup("core")
                        .addTable("public", "users")
                        .addTable("public", "orders"));
    }

    @Test
    void shouldAcceptCompleteProject() {
        assertThatCode(() -> validProject().validate()).doesNotThrowAnyException();
    }

    @Test
    void shouldLogSummaryWhenValid() throws ValidationException {
        // When
        validProject().validate();

        // Then
        List<ILoggingEvent> logs = logAppender.list;
        assertThat(logs).anyMatch(event -> event.getLevel() == Level.DEBUG &&
                event.getFormattedMessage().contains("Project 'shop' is valid: 2 tables, 1 enums, 1 refs, 1 table groups"));
    }

    @Test
    void shouldRequireProjectName() {
        Project project = validProject();
        project.setName("");

        assertThatThrownBy(project::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessage("Project.Name: name is required");
    }

    @Test
    void shouldReportProjectNameBeforeTableErrors() {
        Project project = new Project(null).addTable(new Table("broken"));

        assertThatThrownBy(project::validate)
                .hasMessage("Project.Name: name is required");
    }

    @Test
    void shouldRequireAtLeastOneColumn() {
        Project project = new Project("shop").addTable(new Table("users"));

        assertThatThrownBy(project::validate)
                .isInstanceOf(ValidationException.class)
                .hasMessage("table public.users: Table.Columns: at least one column is required");
    }

    @Test
    void shouldLocateColumnErrorByIndex() {
        // Given
        Project project = new Project("shop")
                .addTable(new Table("users")
                        .addColumn(new Column("id", "bigint").withPrimaryKey())
                        .addColumn(new Column("email", "")));

        // When/Then
        assertThatThrownBy(project::validate)
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("table public.users: column 1: Column.Type: type is required");
                    assertThat(e.getField()).isEqualTo("Column.Type");
                    assertThat(e.getReason()).isEqualTo("type is required");
                    assertThat(e.getLocation()).containsExactly("table public.users", "column 1");
                    assertThat(e.getPath()).isEqualTo("table public.users: column 1: Column.Type");
                });
    }

    @Test
    void shouldLogFailurePath() {
        Project project = new Project("shop")
                .addTable(new Table("users").addColumn(new Column(null, "int")));

        assertThatThrownBy(project::validate).isInstanceOf(ValidationException.class);

        assertThat(logAppender.list).anyMatch(event ->
                event.getFormattedMessage().contains("failed validation at table public.users: column 0: Column.Name"));
    }

    @Test
    void shouldReportFirstFailingTableInInsertionOrder() {
        Project project = new Project("shop")
                .addTable(new Table("zebra"))
                .addTable(new Table("alpha"));

        assertThatThrownBy(project::validate)
                .hasMessageStartingWith("table public.zebra: ");
    }

    @Test
    void shouldReportMissingTableDefinition() {
        Project project = new Project("shop");
        project.getTables().put("public.ghost", null);

        assertThatThrownBy(project::validate)
                .hasMessage("table public.ghost: Table: table definition is missing");
    }

    @Test
    void shouldRequireTableSchema() {
        Project project = new Project("shop")
                .addTable(new Table("users").withSchema("")
                        .addColumn(new Column("id", "int")));

        assertThatThrownBy(project::validate)
                .hasMessage("table .users: Table.Schema: schema is required");
    }

    @Test
    void shouldValidateInlineRef() {
        Project project = new Project("shop")
                .addTable(new Table("orders")
                        .addColumn(new Column("user_id", "bigint")
                                .withRef(RelationshipType.MANY_TO_ONE, "public", "users", "")));

        assertThatThrownBy(project::validate)
                .hasMessage("table public.orders: column 0: inline_ref: InlineRef.Column: column is required");
    }

    @Test
    void shouldRequireInlineRefType() {
        Project project = new Project("shop")
                .addTable(new Table("orders")
                        .addColumn(new Column("user_id", "bigint")
                                .withRef(null, "public", "users", "id")));

        assertThatThrownBy(project::validate)
                .hasMessageEndingWith("inline_ref: InlineRef.Type: relationship type is required");
    }

    @Test
    void shouldRejectIndexWithoutColumns() {
        Project project = new Project("shop")
                .addTable(new Table("users")
                        .addColumn(new Column("id", "int"))
                        .addIndex(new Index()));

        assertThatThrownBy(project::validate)
                .hasMessage("table public.users: index 0: Index.Columns: at least one column is required");
    }

    @Test
    void shouldRejectIndexColumnWithNameAndExpression() {
        Index index = new Index();
        index.getColumns().add(new IndexColumn("created_at", "date(created_at)"));
        Project project = new Project("shop")
                .addTable(new Table("users")
                        .addColumn(new Column("id", "int"))
                        .addIndex(index));

        assertThatThrownBy(project::validate)
                .hasMessage("table public.users: index 0: Index.Columns[0]: cannot have both name and expression");
    }

    @Test
    void shouldRejectEmptyIndexColumn() {
        Index index = Index.on("id");
        index.getColumns().add(new IndexColumn());
        Project project = new Project("shop")
                .addTable(new Table("users")
                        .addColumn(new Column("id", "int"))
                        .addIndex(index));

        assertThatThrownBy(project::validate)
                .hasMessage("table public.users: index 0: Index.Columns[1]: either name or expression is required");
    }

    @Test
    void shouldAcceptExpressionIndex() {
        Project project = new Project("shop")
                .addTable(new Table("events")
                        .addColumn(new Column("created_at", "timestamp"))
                        .addIndex(Index.onExpressions("date(created_at)")));

        assertThatCode(project::validate).doesNotThrowAnyException();
    }

    @Test
    void shouldRequireEnumValues() {
        Project project = new Project("shop").addEnum(new SchemaEnum("status").withSchema("billing"));

        assertThatThrownBy(project::validate)
                .hasMessage("enum billing.status: Enum.Values: at least one value is required");
    }

    @Test
    void shouldValidateTablesBeforeEnums() {
        Project project = new Project("shop")
                .addEnum(new SchemaEnum("status"))
                .addTable(new Table("users"));

        assertThatThrownBy(project::validate)
                .hasMessageStartingWith("table public.users: ");
    }

    @Test
    void shouldRequireRefEndpoints() {
        Project project = new Project("shop")
                .addRef(new Ref(RelationshipType.ONE_TO_MANY).from("public", "users", "id"));

        assertThatThrownBy(project::validate)
                .hasMessage("ref 0: Ref.Right: right endpoint is required");
    }

    @Test
    void shouldCheckEndpointsBeforeType() {
        Project project = new Project("shop").addRef(new Ref(null));

        assertThatThrownBy(project::validate)
                .hasMessage("ref 0: Ref.Left: left endpoint is required");
    }

    @Test
    void shouldRequireRefType() {
        Project project = new Project("shop")
                .addRef(new Ref(null)
                        .from("public", "posts", "user_id")
                        .to("public", "users", "id"));

        assertThatThrownBy(project::validate)
                .hasMessage("ref 0: Ref.Type: relationship type is required");
    }

    @Test
    void shouldLocateEndpointErrors() {
        Project project = new Project("shop")
                .addRef(new Ref(RelationshipType.MANY_TO_ONE)
                        .from("public", "posts", "user_id")
                        .to("public", "", "id"));

        assertThatThrownBy(project::validate)
                .hasMessage("ref 0: right: RefEndpoint.Table: table is required");
    }

    @Test
    void shouldRejectCompositeKeyWithMismatchedColumnCounts() {
        // Given
        Project project = new Project("shop")
                .addRef(new Ref(RelationshipType.MANY_TO_ONE)
                        .from("public", "posts", "tenant_id", "user_id")
                        .to("public", "users", "id"));

        // When/Then
        assertThatThrownBy(project::validate)
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getField()).isEqualTo("Ref.Columns");
                    assertThat(e.getMessage()).isEqualTo(
                            "ref 0: Ref.Columns: left and right column counts must match (2 != 1)");
                });
    }

    @Test
    void shouldAcceptCompositeKeyWithMatchingColumnCounts() {
        Project project = new Project("shop")
                .addRef(new Ref(RelationshipType.MANY_TO_ONE)
                        .from("public", "posts", "tenant_id", "user_id")
                        .to("public", "users", "tenant_id", "user_id"));

        assertThatCode(project::validate).doesNotThrowAnyException();
    }

    @Test
    void shouldLocateTableGroupMemberErrors() {
        Project project = new Project("shop")
                .addTableGroup(new TableGroup("core")
                        .addTable("public", "users")
                        .addTable("public", null));

        assertThatThrownBy(project::validate)
                .hasMessage("table_group 0: TableGroup.Tables[1].Name: name is required");
    }

    @Test
    void shouldRequireTableGroupMembers() {
        TableGroup group = new TableGroup("core");
        group.setTables(new ArrayList<>());
        Project project = new Project("shop").addTableGroup(group);

        assertThatThrownBy(project::validate)
                .hasMessage("table_group 0: TableGroup.Tables: at least one table is required");
    }

    @Test
    void shouldReportMissingRefDefinition() {
        Project project = new Project("shop");
        project.getRefs().add(null);

        assertThatThrownBy(project::validate)
                .hasMessage("ref 0: Ref: ref definition is missing");
    }
}
