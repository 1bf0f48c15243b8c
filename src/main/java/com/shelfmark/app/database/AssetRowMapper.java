package com.shelfmark.app.database;

import java.sql.ResultSet;
import java.sql.SQLException;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

public final class AssetRowMapper implements RowMapper<AssetRow> {

    @Override
    public AssetRow map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new AssetRow(
                rs.getLong("id"),
                rs.getString("volume_id"),
                rs.getString("relative_path"),
                rs.getString("filename"),
                rs.getString("format"),
                rs.getString("title"),
                rs.getString("collection"),
                rs.getLong("file_size"),
                rs.getLong("file_mtime"),
                rs.getString("partial_hash"),
                rs.getString("full_hash"),
                rs.getString("archive_path"),
                rs.getString("archive_member"),
                rs.getString("folder_path"),
                rs.getString("author"),
                rs.getString("creator"),
                nullableInt(rs, "page_count"),
                rs.getString("producer"),
                IndexStatus.fromDb(rs.getString("index_status")),
                nullableLong(rs, "last_seen_at"),
                nullableLong(rs, "last_seen_job_id"),
                nullableLong(rs, "last_indexed_at"),
                nullableLong(rs, "missing_since"),
                rs.getString("thumb_storage"),
                rs.getString("thumb_path"),
                nullableLong(rs, "thumb_rendered_at"),
                nullableLong(rs, "thumb_source_mtime"),
                rs.getInt("force_rerender") != 0,
                rs.getInt("is_duplicate") != 0,
                nullableLong(rs, "duplicate_of_id"),
                rs.getLong("created_at")
        );
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }
}
