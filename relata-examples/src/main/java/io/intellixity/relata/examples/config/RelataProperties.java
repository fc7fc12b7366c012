package io.intellixity.relata.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relata")
public class RelataProperties {
  /** "memory" or "postgres". */
  private String engine = "memory";
  /** Classpath resource holding the YAML schema. */
  private String schemaLocation = "schema/blog.yml";
  private final Datasource datasource = new Datasource();

  public String getEngine() { return engine; }
  public void setEngine(String engine) { this.engine = engine; }
  public String getSchemaLocation() { return schemaLocation; }
  public void setSchemaLocation(String schemaLocation) { this.schemaLocation = schemaLocation; }
  public Datasource getDatasource() { return datasource; }

  public static class Datasource {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }
}
