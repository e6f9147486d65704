package robotrader.core.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies pooled connections to the JDBC repositories.
 * Connections are not auto-commit; the caller commits and closes.
 */
@FunctionalInterface
public interface ConnectionSource {

    Connection getConnection() throws SQLException;
}
