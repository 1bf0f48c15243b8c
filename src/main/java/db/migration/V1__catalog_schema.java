package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Volumes, the two asset catalogs (documents, models) and scan job bookkeeping.
 * Timestamps are epoch milliseconds.
 */
public final class V1__catalog_schema extends BaseJavaMigration {

    static final List<String> ASSET_TABLES = List.of("documents", "models");

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();

        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON");
        }

        createVolumes(conn);
        for (String table : ASSET_TABLES) {
            createAssetTable(conn, table);
            createAssetIndexes(conn, table);
        }
        createScanJobs(conn);
    }

    private void createVolumes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS volumes (
                    id              TEXT PRIMARY KEY,
                    label           TEXT NOT NULL,
                    mount_path      TEXT NOT NULL,
                    is_readonly     INTEGER NOT NULL DEFAULT 0,
                    enabled         INTEGER NOT NULL DEFAULT 1,
                    status          TEXT NOT NULL DEFAULT 'online',   -- online | offline | error
                    status_reason   TEXT,
                    last_checked_at INTEGER,
                    last_indexed_at INTEGER,
                    created_at      INTEGER NOT NULL
                )
                """);
            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS ux_volumes_mount ON volumes(mount_path)");
        }
    }

    private void createAssetTable(Connection conn, String table) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS %1$s (
                    id                 INTEGER PRIMARY KEY AUTOINCREMENT,
                    volume_id          TEXT NOT NULL REFERENCES volumes(id),
                    relative_path      TEXT NOT NULL,
                    filename           TEXT NOT NULL,
                    format             TEXT NOT NULL,
                    title              TEXT,
                    collection         TEXT,
                    file_size          INTEGER NOT NULL,
                    file_mtime         INTEGER NOT NULL,
                    partial_hash       TEXT,
                    full_hash          TEXT,
                    archive_path       TEXT,
                    archive_member     TEXT,
                    folder_path        TEXT NOT NULL DEFAULT '',
                    index_status       TEXT NOT NULL DEFAULT 'indexed',  -- indexed | missing | error
                    last_seen_at       INTEGER,
                    last_seen_job_id   INTEGER,
                    last_indexed_at    INTEGER,
                    missing_since      INTEGER,
                    thumb_storage      TEXT,
                    thumb_path         TEXT,
                    thumb_rendered_at  INTEGER,
                    thumb_source_mtime INTEGER,
                    force_rerender     INTEGER NOT NULL DEFAULT 0,
                    is_duplicate       INTEGER NOT NULL DEFAULT 0,
                    duplicate_of_id    INTEGER REFERENCES %1$s(id),
                    created_at         INTEGER NOT NULL
                )
                """.formatted(table));
        }
    }

    private void createAssetIndexes(Connection conn, String table) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + q("ux_" + table + "_path") + " ON " + q(table)
                    + "(volume_id, relative_path) WHERE is_duplicate = 0 AND archive_member IS NULL");
            st.execute("CREATE INDEX IF NOT EXISTS " + q("idx_" + table + "_lookup") + " ON " + q(table)
                    + "(volume_id, relative_path)");
            st.execute("CREATE INDEX IF NOT EXISTS " + q("idx_" + table + "_partial") + " ON " + q(table)
                    + "(partial_hash)");
            st.execute("CREATE INDEX IF NOT EXISTS " + q("idx_" + table + "_folder") + " ON " + q(table)
                    + "(volume_id, folder_path)");
            st.execute("CREATE INDEX IF NOT EXISTS " + q("idx_" + table + "_status") + " ON " + q(table)
                    + "(index_status)");
            st.execute("CREATE INDEX IF NOT EXISTS " + q("idx_" + table + "_thumb") + " ON " + q(table)
                    + "(thumb_rendered_at, force_rerender)");
        }
    }

    private void createScanJobs(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS scan_jobs (
                    id               INTEGER PRIMARY KEY AUTOINCREMENT,
                    job_type         TEXT NOT NULL,                    -- scan | dedupe | verify
                    volume_id        TEXT REFERENCES volumes(id),
                    target_path      TEXT,
                    recursive        INTEGER NOT NULL DEFAULT 1,
                    force_mode       INTEGER NOT NULL DEFAULT 0,
                    duplicate_policy TEXT,
                    status           TEXT NOT NULL DEFAULT 'running',  -- running | completed | cancelled | failed
                    phase            TEXT,                             -- walking | reconciling | done
                    progress_current INTEGER NOT NULL DEFAULT 0,
                    progress_total   INTEGER,
                    current_item     TEXT,
                    items_processed  INTEGER NOT NULL DEFAULT 0,
                    items_skipped    INTEGER NOT NULL DEFAULT 0,
                    items_failed     INTEGER NOT NULL DEFAULT 0,
                    items_missing    INTEGER NOT NULL DEFAULT 0,
                    error_message    TEXT,
                    started_at       INTEGER NOT NULL,
                    completed_at     INTEGER
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS job_errors (
                    id            INTEGER PRIMARY KEY AUTOINCREMENT,
                    job_id        INTEGER NOT NULL REFERENCES scan_jobs(id),
                    file_path     TEXT NOT NULL,
                    error_type    TEXT NOT NULL,
                    error_message TEXT,
                    created_at    INTEGER NOT NULL
                )
                """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_job_errors_job ON job_errors(job_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_scan_jobs_status ON scan_jobs(status, started_at)");
        }
    }

    static String q(String ident) {
        return "\"" + ident.replace("\"", "\"\"") + "\"";
    }
}
