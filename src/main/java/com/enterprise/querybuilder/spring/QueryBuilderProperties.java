package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.sql.core.DatabaseType;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from {@code querybuilder.*}:
 * <pre>
 * querybuilder.dialect=ORACLE
 * querybuilder.sample.enabled=false
 * </pre>
 */
@ConfigurationProperties(prefix = "querybuilder")
public class QueryBuilderProperties {

    /** Dialect used by {@link QueryBuilderFactory#create()}. */
    private DatabaseType dialect = DatabaseType.MARIADB;

    private final Sample sample = new Sample();

    public DatabaseType getDialect() { return dialect; }
    public void setDialect(DatabaseType dialect) { this.dialect = dialect; }

    public Sample getSample() { return sample; }

    public static class Sample {

        /** Render and log the sample query on startup. */
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
