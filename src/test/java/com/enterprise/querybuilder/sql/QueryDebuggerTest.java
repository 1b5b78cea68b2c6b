package com.enterprise.querybuilder.sql;

import com.enterprise.querybuilder.sql.builder.QueryBuilder;
import com.enterprise.querybuilder.sql.core.DatabaseType;
import com.enterprise.querybuilder.sql.debug.QueryDebugger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static com.enterprise.querybuilder.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.*;

@ExtendWith(OutputCaptureExtension.class)
class QueryDebuggerTest {

    @Test
    void formatShowsTemplateBuiltAndPlaceholders() {
        QueryBuilder builder = QueryBuilder.forDialect(DatabaseType.ORACLE)
                .from("users")
                .whereWithPlaceholder(eq("id", ":id"))
                .setValue(":id", 42)
                .setValue(":name", "'bob'");

        String out = QueryDebugger.format(builder);

        assertThat(out).startsWith("=== SQL Query Debug ===");
        assertThat(out).contains("Dialect: ORACLE");
        assertThat(out).contains("SQL (template):\n  SELECT * FROM users WHERE id = :id");
        assertThat(out).contains("SQL (built):\n  SELECT * FROM users WHERE id = 42");
        assertThat(out).contains("Placeholders (2):");
        assertThat(out).contains("  :id = 42\n");
        assertThat(out).contains("  :name = 'bob' (unused)");
    }

    @Test
    void formatDoesNotChangeBuilder() {
        QueryBuilder builder = QueryBuilder.forDialect(DatabaseType.MARIADB).select("id").from("t").limit(2);
        String before = builder.build();
        QueryDebugger.format(builder);
        assertThat(builder.build()).isEqualTo(before);
    }

    @Test
    void missingTableWarnedOncePerFormat(CapturedOutput output) {
        QueryBuilder builder = QueryBuilder.forDialect(DatabaseType.MARIADB).select("id");

        builder.buildTemplate();
        assertThat(output.getAll()).doesNotContain("without a table name");

        QueryDebugger.format(builder);
        assertThat(output.getAll()).containsOnlyOnce("Rendering MARIADB query without a table name");
    }
}
