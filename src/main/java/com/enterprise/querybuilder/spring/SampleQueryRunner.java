package com.enterprise.querybuilder.spring;

import com.enterprise.querybuilder.sql.builder.QueryBuilder;
import com.enterprise.querybuilder.sql.debug.QueryDebugger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.List;

import static com.enterprise.querybuilder.sql.condition.Conditions.eq;

/**
 * Renders a sample query on startup. The first non-option command-line argument,
 * when present, overrides the configured dialect (e.g. {@code oracle}). Option
 * arguments such as {@code --querybuilder.dialect=ORACLE} are left to Spring.
 */
public class SampleQueryRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SampleQueryRunner.class);

    private final QueryBuilderFactory factory;

    public SampleQueryRunner(QueryBuilderFactory factory) {
        this.factory = factory;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> dialectArgs = args.getNonOptionArgs();
        QueryBuilderFactory effective = dialectArgs.isEmpty()
                ? factory
                : QueryBuilderFactory.forDialectName(dialectArgs.get(0));
        QueryBuilder builder = sampleQuery(effective);
        log.info("Generated Query: {}", builder.build());
        if (log.isDebugEnabled()) {
            log.debug("\n{}", QueryDebugger.format(builder));
        }
    }

    static QueryBuilder sampleQuery(QueryBuilderFactory factory) {
        return factory.create()
                .select("id", "name", "DATE")
                .distinct()
                .from("users")
                .useIndex("idx_users_name")
                .whereWithPlaceholder(eq("join_date", "?joindate"))
                .setValue("?joindate", "SYSDATE")
                .innerJoin("orders", "users.id = orders.user_id")
                .orderBy("name")
                .limit(10)
                .offset(5);
    }
}
