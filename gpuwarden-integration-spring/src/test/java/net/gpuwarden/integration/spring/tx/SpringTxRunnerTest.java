package net.gpuwarden.integration.spring.tx;

import net.gpuwarden.adapter.jdbc.TxContext;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.io.IOException;
import java.sql.Connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SpringTxRunnerTest {

    private DriverManagerDataSource ds;
    private JdbcTemplate jdbc;
    private SpringTxRunner tx;

    @BeforeAll
    void setup() {
        ds = new DriverManagerDataSource("jdbc:h2:mem:spring-tx;DB_CLOSE_DELAY=-1", "sa", "");
        jdbc = new JdbcTemplate(ds);
        jdbc.execute("CREATE TABLE T_NOTE (ID INT PRIMARY KEY, BODY VARCHAR(50))");
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
    }

    @BeforeEach
    void clean() {
        jdbc.update("DELETE FROM T_NOTE");
    }

    @Test
    void commits_andBindsTheConnection() throws Exception {
        tx.required(() -> insert(1, "a"));

        assertThat(count()).isEqualTo(1);
        assertThat(TxContext.get()).isNull();
    }

    @Test
    void checkedException_rollsBack_andIsRethrownAsIs() {
        assertThatThrownBy(() -> tx.required(() -> {
            insert(1, "a");
            throw new IOException("remote down");
        })).isInstanceOf(IOException.class).hasMessage("remote down");

        assertThat(count()).isZero();
    }

    @Test
    void nestedRequired_joinsTheOuterTransaction() throws Exception {
        tx.required(() -> {
            Connection outer = TxContext.get();
            tx.required(() -> assertThat(TxContext.get()).isSameAs(outer));
        });
    }

    @Test
    void requiresNew_commitsIndependently_andRestoresTheOuterConnection() {
        assertThatThrownBy(() -> tx.required(() -> {
            Connection outer = TxContext.get();
            insert(1, "outer");
            tx.requiresNew(() -> {
                assertThat(TxContext.get()).isNotSameAs(outer);
                insert(2, "inner");
            });
            assertThat(TxContext.get()).isSameAs(outer);
            throw new IllegalStateException("outer fails");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(jdbc.queryForList("SELECT ID FROM T_NOTE", Integer.class)).containsExactly(2);
    }

    private void insert(int id, String body) throws Exception {
        try (var ps = TxContext.require().prepareStatement("INSERT INTO T_NOTE (ID, BODY) VALUES (?, ?)")) {
            ps.setInt(1, id);
            ps.setString(2, body);
            ps.executeUpdate();
        }
    }

    private int count() {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM T_NOTE", Integer.class);
        return n == null ? 0 : n;
    }
}
