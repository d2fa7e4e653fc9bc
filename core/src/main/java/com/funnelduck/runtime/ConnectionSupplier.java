package com.funnelduck.runtime;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * Source of JDBC connections. Every call returns a connection the caller
 * closes.
 */
@FunctionalInterface
public interface ConnectionSupplier {

    Connection getConnection() throws SQLException;

    static ConnectionSupplier of(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        return dataSource::getConnection;
    }
}
