package db.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Embedded document metadata (author, page count, producer) and the model creator, with author
 * and creator added to the search index.
 */
public final class V3__asset_metadata extends BaseJavaMigration {

    private static final List<String> COLUMNS = List.of(
            "author TEXT",
            "creator TEXT",
            "page_count INTEGER",
            "producer TEXT");

    private static final String INDEXED = "filename, title, collection, author, creator";

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        for (String table : V1__catalog_schema.ASSET_TABLES) {
            for (String column : COLUMNS) {
                String name = column.substring(0, column.indexOf(' '));
                if (!columnExists(conn, table, name)) {
                    try (Statement st = conn.createStatement()) {
                        st.execute("ALTER TABLE " + V1__catalog_schema.q(table) + " ADD COLUMN " + column);
                    }
                }
            }
            recreateIndex(conn, table);
        }
    }

    private void recreateIndex(Connection conn, String table) throws SQLException {
        String t = V1__catalog_schema.q(table);
        String fts = table + "_fts";
        try (Statement st = conn.createStatement()) {
            st.execute("DROP TRIGGER IF EXISTS " + fts + "_ai");
            st.execute("DROP TRIGGER IF EXISTS " + fts + "_ad");
            st.execute("DROP TRIGGER IF EXISTS " + fts + "_au");
            st.execute("DROP TABLE IF EXISTS " + V1__catalog_schema.q(fts));

            st.execute("CREATE VIRTUAL TABLE " + V1__catalog_schema.q(fts)
                    + " USING fts5(" + INDEXED + ", content='" + table + "', content_rowid='id')");
            st.execute("""
                CREATE TRIGGER %2$s_ai AFTER INSERT ON %1$s BEGIN
                    INSERT INTO %2$s(rowid, %3$s)
                    VALUES (new.id, new.filename, new.title, new.collection, new.author, new.creator);
                END
                """.formatted(t, fts, INDEXED));
            st.execute("""
                CREATE TRIGGER %2$s_ad AFTER DELETE ON %1$s BEGIN
                    INSERT INTO %2$s(%2$s, rowid, %3$s)
                    VALUES ('delete', old.id, old.filename, old.title, old.collection, old.author, old.creator);
                END
                """.formatted(t, fts, INDEXED));
            st.execute("""
                CREATE TRIGGER %2$s_au AFTER UPDATE OF %3$s ON %1$s BEGIN
                    INSERT INTO %2$s(%2$s, rowid, %3$s)
                    VALUES ('delete', old.id, old.filename, old.title, old.collection, old.author, old.creator);
                    INSERT INTO %2$s(rowid, %3$s)
                    VALUES (new.id, new.filename, new.title, new.collection, new.author, new.creator);
                END
                """.formatted(t, fts, INDEXED));
            st.execute("INSERT INTO " + fts + "(" + fts + ") VALUES ('rebuild')");
        }
    }

    private static boolean columnExists(Connection conn, String table, String column) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + V1__catalog_schema.q(table) + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) {
                    return true;
                }
            }
            return false;
        }
    }
}
