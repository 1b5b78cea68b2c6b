package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.sql.core.DatabaseType;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.*;

public class QueryBuilderFactoryTests {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(QueryBuilderConfig.class);

    // ==================== Dialect names ====================

    @Test
    void testForDialectNameIgnoresCase() {
        assertThat(QueryBuilderFactory.forDialectName("oracle").defaultDialect()).isEqualTo(DatabaseType.ORACLE);
        assertThat(QueryBuilderFactory.forDialectName("MariaDB").defaultDialect()).isEqualTo(DatabaseType.MARIADB);
    }

    @Test
    void testUnknownDialectNameThrows() {
        assertThatThrownBy(() -> QueryBuilderFactory.forDialectName("postgres"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown dialect: postgres")
                .hasMessageContaining("MARIADB");
    }

    @Test
    void testNullDefaultDialectThrows() {
        assertThatThrownBy(() -> new QueryBuilderFactory(null)).isInstanceOf(NullPointerException.class);
    }

    // ==================== Configuration ====================

    @Test
    void testDefaultsToMariaDbWithSampleRunner() {
        contextRunner.run(ctx -> {
            assertThat(ctx.getBean(QueryBuilderFactory.class).defaultDialect()).isEqualTo(DatabaseType.MARIADB);
            assertThat(ctx).hasSingleBean(SampleQueryRunner.class);
        });
    }

    @Test
    void testDialectPropertyIsCaseInsensitive() {
        contextRunner.withPropertyValues("querybuilder.dialect=oracle", "querybuilder.sample.enabled=false")
                .run(ctx -> {
                    assertThat(ctx.getBean(QueryBuilderFactory.class).defaultDialect()).isEqualTo(DatabaseType.ORACLE);
                    assertThat(ctx).doesNotHaveBean(SampleQueryRunner.class);
                });
    }

    @Test
    void testUnknownDialectPropertyFailsStartup() {
        contextRunner.withPropertyValues("querybuilder.dialect=postgres")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    // ==================== Sample query ====================

    @Test
    void testSampleQueryMariaDb() {
        String sql = SampleQueryRunner.sampleQuery(new QueryBuilderFactory(DatabaseType.MARIADB)).build();
        assertThat(sql).isEqualTo("SELECT  DISTINCT  id, name, `DATE` FROM users FORCE INDEX(idx_users_name) "
                + " INNER JOIN orders ON users.id = orders.user_id WHERE join_date = SYSDATE"
                + " ORDER BY name ASC LIMIT 10 OFFSET 5");
    }

    @Test
    void testSampleRunnerAcceptsDialectArgument() {
        SampleQueryRunner runner = new SampleQueryRunner(new QueryBuilderFactory(DatabaseType.MARIADB));
        assertThatCode(() -> runner.run(new DefaultApplicationArguments("oracle"))).doesNotThrowAnyException();
        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments("db2")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testSampleRunnerIgnoresOptionArguments() {
        SampleQueryRunner runner = new SampleQueryRunner(new QueryBuilderFactory(DatabaseType.MARIADB));
        assertThatCode(() -> runner.run(new DefaultApplicationArguments(
                "--querybuilder.sample.enabled=true", "--querybuilder.dialect=ORACLE")))
                .doesNotThrowAnyException();
    }

    @Test
    void testDialectOptionOnStartup() {
        contextRunner.withPropertyValues("querybuilder.dialect=ORACLE")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    assertThat(ctx.getBean(QueryBuilderFactory.class).defaultDialect()).isEqualTo(DatabaseType.ORACLE);
                });
    }
}
