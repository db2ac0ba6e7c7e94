package com.dcruver.anchorwatch.app;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * SQLite data source shared by the stores, with the transaction template batches commit through.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(@Value("${anchorwatch.database-path}") String databasePath) throws IOException {
        Path dbPath = resolveDatabasePath(databasePath, System.getProperty("user.home"));
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }

        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());

        return dataSource;
    }

    /**
     * Expands a leading {@code ~} or a {@code ${user.home}} token. A tilde anywhere else is part of the file name.
     */
    static Path resolveDatabasePath(String databasePath, String home) {
        String expanded = databasePath.replace("${user.home}", home);
        if (expanded.equals("~")) {
            expanded = home;
        } else if (expanded.startsWith("~/")) {
            expanded = home + expanded.substring(1);
        }
        return Paths.get(expanded);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
