package com.shelfmark.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

public interface ScanJobDao {

    @SqlUpdate("""
        INSERT INTO scan_jobs(job_type, volume_id, target_path, recursive, force_mode, duplicate_policy,
                              status, phase, started_at)
        VALUES (:jobType, :volumeId, :targetPath, :recursive, :force, :policy, 'running', 'walking', :now)
        """)
    void insert(@Bind("jobType") String jobType,
                @Bind("volumeId") String volumeId,
                @Bind("targetPath") String targetPath,
                @Bind("recursive") boolean recursive,
                @Bind("force") boolean force,
                @Bind("policy") String policy,
                @Bind("now") long now);

    @SqlQuery("SELECT last_insert_rowid()")
    long lastInsertId();

    @SqlUpdate("""
        UPDATE scan_jobs
           SET phase = :phase,
               progress_current = :current,
               current_item = :item,
               items_processed = :processed,
               items_skipped = :skipped,
               items_failed = :failed
         WHERE id = :id
        """)
    int updateProgress(@Bind("id") long id,
                       @Bind("phase") String phase,
                       @Bind("current") long current,
                       @Bind("item") String item,
                       @Bind("processed") long processed,
                       @Bind("skipped") long skipped,
                       @Bind("failed") long failed);

    @SqlUpdate("""
        UPDATE scan_jobs
           SET status = :status,
               phase = 'done',
               progress_current = :total,
               progress_total = :total,
               current_item = NULL,
               items_processed = :processed,
               items_skipped = :skipped,
               items_failed = :failed,
               items_missing = :missing,
               error_message = :error,
               completed_at = :now
         WHERE id = :id
           AND status = 'running'
        """)
    int finish(@Bind("id") long id,
               @Bind("status") String status,
               @Bind("total") long total,
               @Bind("processed") long processed,
               @Bind("skipped") long skipped,
               @Bind("failed") long failed,
               @Bind("missing") long missing,
               @Bind("error") String error,
               @Bind("now") long now);

    @SqlUpdate("""
        INSERT INTO job_errors(job_id, file_path, error_type, error_message, created_at)
        VALUES (:jobId, :filePath, :errorType, :message, :now)
        """)
    void insertError(@Bind("jobId") long jobId,
                     @Bind("filePath") String filePath,
                     @Bind("errorType") String errorType,
                     @Bind("message") String message,
                     @Bind("now") long now);

    @SqlQuery("SELECT * FROM scan_jobs WHERE id = :id")
    @RegisterConstructorMapper(ScanJobRow.class)
    Optional<ScanJobRow> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM scan_jobs ORDER BY id DESC LIMIT :limit")
    @RegisterConstructorMapper(ScanJobRow.class)
    List<ScanJobRow> recent(@Bind("limit") int limit);

    @SqlQuery("SELECT * FROM job_errors WHERE job_id = :jobId ORDER BY id")
    @RegisterConstructorMapper(JobErrorRow.class)
    List<JobErrorRow> errorsFor(@Bind("jobId") long jobId);
}
