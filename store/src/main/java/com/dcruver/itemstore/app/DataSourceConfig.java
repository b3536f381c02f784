package com.dcruver.itemstore.app;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration for the SQLite data source and its transaction manager.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(@Value("${itemstore.db-path}") String dbPath) throws IOException {
        Path path = Paths.get(dbPath.replace("${user.home}", System.getProperty("user.home")));
        return sqliteDataSource(path);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    /**
     * Build a data source for the given database file, creating parent directories.
     * Foreign keys are switched on for every connection so cascades are enforced.
     */
    public static DataSource sqliteDataSource(Path dbPath) throws IOException {
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        Properties connectionProperties = new Properties();
        connectionProperties.setProperty("foreign_keys", "true");
        connectionProperties.setProperty("busy_timeout", "5000");

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        dataSource.setConnectionProperties(connectionProperties);

        return dataSource;
    }
}
