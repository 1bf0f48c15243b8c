package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * FTS5 index over filename/title/collection for each asset table.
 * Triggers keep it in step with the base row inside the writing transaction.
 */
public final class V2__search_index extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        for (String table : V1__catalog_schema.ASSET_TABLES) {
            if (!tableExists(conn, table)) {
                throw new IllegalStateException("Missing asset table: " + table);
            }
            createIndex(conn, table);
            createTriggers(conn, table);
            rebuild(conn, table);
        }
    }

    private void createIndex(Connection conn, String table) throws SQLException {
        String fts = V1__catalog_schema.q(table + "_fts");
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE VIRTUAL TABLE IF NOT EXISTS " + fts
                    + " USING fts5(filename, title, collection, content='" + table + "', content_rowid='id')");
        }
    }

    private void createTriggers(Connection conn, String table) throws SQLException {
        String t = V1__catalog_schema.q(table);
        String fts = table + "_fts";
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TRIGGER IF NOT EXISTS %2$s_ai AFTER INSERT ON %1$s BEGIN
                    INSERT INTO %2$s(rowid, filename, title, collection)
                    VALUES (new.id, new.filename, new.title, new.collection);
                END
                """.formatted(t, fts));
            st.execute("""
                CREATE TRIGGER IF NOT EXISTS %2$s_ad AFTER DELETE ON %1$s BEGIN
                    INSERT INTO %2$s(%2$s, rowid, filename, title, collection)
                    VALUES ('delete', old.id, old.filename, old.title, old.collection);
                END
                """.formatted(t, fts));
            // Only the indexed columns; touching last_seen_at must not churn the index.
            st.execute("""
                CREATE TRIGGER IF NOT EXISTS %2$s_au AFTER UPDATE OF filename, title, collection ON %1$s BEGIN
                    INSERT INTO %2$s(%2$s, rowid, filename, title, collection)
                    VALUES ('delete', old.id, old.filename, old.title, old.collection);
                    INSERT INTO %2$s(rowid, filename, title, collection)
                    VALUES (new.id, new.filename, new.title, new.collection);
                END
                """.formatted(t, fts));
        }
    }

    private void rebuild(Connection conn, String table) throws SQLException {
        String fts = table + "_fts";
        try (Statement st = conn.createStatement()) {
            st.execute("INSERT INTO " + fts + "(" + fts + ") VALUES ('rebuild')");
        }
    }

    private static boolean tableExists(Connection conn, String table) throws SQLException {
        try (var ps = conn.prepareStatement("SELECT 1 FROM sqlite_master WHERE type='table' AND name=?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
