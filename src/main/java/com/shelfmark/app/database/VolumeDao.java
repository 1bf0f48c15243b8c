package com.shelfmark.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

@RegisterRowMapper(VolumeRowMapper.class)
public interface VolumeDao {

    @SqlUpdate("""
        INSERT INTO volumes(id, label, mount_path, is_readonly, enabled, status, created_at)
        VALUES (:id, :label, :mountPath, :readonly, 1, 'online', :now)
        """)
    void insert(@Bind("id") String id,
                @Bind("label") String label,
                @Bind("mountPath") String mountPath,
                @Bind("readonly") boolean readonly,
                @Bind("now") long now);

    @SqlQuery("SELECT * FROM volumes WHERE id = :id")
    Optional<VolumeRow> findById(@Bind("id") String id);

    @SqlQuery("SELECT * FROM volumes ORDER BY id")
    List<VolumeRow> findAll();

    @SqlUpdate("""
        UPDATE volumes
           SET status = :status,
               status_reason = :reason,
               last_checked_at = :now
         WHERE id = :id
        """)
    int updateStatus(@Bind("id") String id,
                     @Bind("status") String status,
                     @Bind("reason") String reason,
                     @Bind("now") long now);

    @SqlUpdate("UPDATE volumes SET enabled = :enabled WHERE id = :id")
    int setEnabled(@Bind("id") String id, @Bind("enabled") boolean enabled);

    @SqlUpdate("UPDATE volumes SET last_indexed_at = :now WHERE id = :id")
    int markIndexed(@Bind("id") String id, @Bind("now") long now);

    /** Job history outlives the volume it ran against. */
    @SqlUpdate("UPDATE scan_jobs SET volume_id = NULL WHERE volume_id = :id")
    int detachJobs(@Bind("id") String id);

    @SqlUpdate("DELETE FROM volumes WHERE id = :id")
    int delete(@Bind("id") String id);

    @SqlQuery("""
        SELECT (SELECT COUNT(*) FROM documents WHERE volume_id = :id)
             + (SELECT COUNT(*) FROM models WHERE volume_id = :id)
        """)
    long countReferencingAssets(@Bind("id") String id);
}
