package com.shelfmark.app.database;

import java.sql.ResultSet;
import java.sql.SQLException;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

public final class VolumeRowMapper implements RowMapper<VolumeRow> {

    @Override
    public VolumeRow map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new VolumeRow(
                rs.getString("id"),
                rs.getString("label"),
                rs.getString("mount_path"),
                rs.getInt("is_readonly") != 0,
                rs.getInt("enabled") != 0,
                VolumeStatus.fromDb(rs.getString("status")),
                rs.getString("status_reason"),
                AssetRowMapper.nullableLong(rs, "last_checked_at"),
                AssetRowMapper.nullableLong(rs, "last_indexed_at"),
                rs.getLong("created_at")
        );
    }
}
