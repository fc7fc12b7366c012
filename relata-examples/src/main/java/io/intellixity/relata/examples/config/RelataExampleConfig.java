package io.intellixity.relata.examples.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.relata.persistence.exec.DefaultRelationEngine;
import io.intellixity.relata.persistence.exec.RelationEngine;
import io.intellixity.relata.persistence.exec.TransactionExecutor;
import io.intellixity.relata.persistence.jdbc.JdbcHandle;
import io.intellixity.relata.persistence.jdbc.JdbcTransactionExecutor;
import io.intellixity.relata.persistence.jdbc.postgres.PostgresDialect;
import io.intellixity.relata.persistence.memory.InMemoryTransactionExecutor;
import io.intellixity.relata.persistence.read.ReadSpecJsonParser;
import io.intellixity.relata.persistence.schema.SchemaRegistry;
import io.intellixity.relata.persistence.schema.yaml.YamlSchemaLoader;
import io.intellixity.relata.persistence.write.WriteDataJsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RelataProperties.class)
public class RelataExampleConfig {
  private static final Logger log = LoggerFactory.getLogger(RelataExampleConfig.class);

  @Bean
  public SchemaRegistry schemaRegistry(RelataProperties props) {
    SchemaRegistry schema = new YamlSchemaLoader().registryFromResource(props.getSchemaLocation());
    log.info("relata.schema loaded location={} engine={}", props.getSchemaLocation(), props.getEngine());
    return schema;
  }

  @Bean
  @ConditionalOnProperty(prefix = "relata", name = "engine", havingValue = "memory", matchIfMissing = true)
  public TransactionExecutor memoryExecutor(SchemaRegistry schema) {
    return new InMemoryTransactionExecutor(schema);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "relata", name = "engine", havingValue = "postgres")
  public HikariDataSource relataDataSource(RelataProperties props) {
    RelataProperties.Datasource db = props.getDatasource();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("relata.datasource.jdbc-url is required for engine=postgres");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setPoolName("relata");
    return new HikariDataSource(hc);
  }

  @Bean
  @ConditionalOnProperty(prefix = "relata", name = "engine", havingValue = "postgres")
  public TransactionExecutor postgresExecutor(HikariDataSource ds,
                                              RelataProperties props,
                                              SchemaRegistry schema,
                                              ObjectMapper mapper) {
    JdbcHandle handle = new JdbcHandle("postgres", ds, props.getDatasource().getSchema());
    return new JdbcTransactionExecutor(handle, schema, new PostgresDialect(mapper));
  }

  @Bean
  public RelationEngine relationEngine(SchemaRegistry schema, TransactionExecutor executor) {
    return new DefaultRelationEngine(schema, executor);
  }

  @Bean
  public WriteDataJsonParser writeDataJsonParser(SchemaRegistry schema, ObjectMapper mapper) {
    return new WriteDataJsonParser(schema, mapper);
  }

  @Bean
  public ReadSpecJsonParser readSpecJsonParser(ObjectMapper mapper) {
    return new ReadSpecJsonParser(mapper);
  }
}
