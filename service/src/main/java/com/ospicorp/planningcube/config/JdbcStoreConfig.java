package com.ospicorp.planningcube.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * The DataSource is only configured when the JDBC repositories are selected; the in-memory
 * store runs without any database on the classpath being reachable.
 */
@Configuration
@ConditionalOnProperty(name = "planning.cube.store", havingValue = "jdbc")
@Import(DataSourceAutoConfiguration.class)
public class JdbcStoreConfig {
}
