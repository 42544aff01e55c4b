package io.healing.jdbc.store;

import io.healing.jdbc.H2Databases;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcJobStoresTest {

    @Test
    void allReturnsBuiltInJobStores() {
        List<AbstractJdbcJobStore> stores = JdbcJobStores.all();

        assertTrue(stores.size() >= 3);
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("mysql")));
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("postgresql")));
        assertTrue(stores.stream().anyMatch(s -> s.name().equals("h2")));
    }

    @Test
    void getByNameIsCaseInsensitive() {
        assertEquals("postgresql", JdbcJobStores.get("PostgreSQL").name());
        assertInstanceOf(MySqlJobStore.class, JdbcJobStores.get("mysql"));
    }

    @Test
    void getUnknownNameThrows() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> JdbcJobStores.get("oracle"));
        assertTrue(e.getMessage().contains("Unknown job store: oracle"));
    }

    @Test
    void detectFromUrl() {
        assertInstanceOf(MySqlJobStore.class, JdbcJobStores.detect("jdbc:mysql://localhost:3306/ci"));
        assertInstanceOf(MySqlJobStore.class, JdbcJobStores.detect("jdbc:tidb://localhost:4000/ci"));
        assertInstanceOf(PostgresJobStore.class, JdbcJobStores.detect("jdbc:postgresql://localhost/ci"));
        assertInstanceOf(H2JobStore.class, JdbcJobStores.detect("JDBC:H2:mem:ci"));
    }

    @Test
    void detectRejectsUnknownOrEmptyUrl() {
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect("jdbc:sqlserver://x"));
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect(""));
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect((String) null));
    }

    @Test
    void detectFromDataSource() {
        assertInstanceOf(H2JobStore.class, JdbcJobStores.detect(H2Databases.withSchema()));
    }

    @Test
    void detectWithTableNameReturnsNewInstance() {
        AbstractJdbcJobStore shared = JdbcJobStores.detect("jdbc:h2:mem:ci");
        AbstractJdbcJobStore custom = JdbcJobStores.detect("jdbc:h2:mem:ci", "ci_healing_job");

        assertNotSame(shared, custom);
        assertEquals("ci_healing_job", custom.tableName());
        assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect("jdbc:h2:mem:ci", "bad name"));
    }
}
