package com.shelfmark.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.customizer.Define;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Statements shared by the documents and models catalogs; {@code <table>} selects the catalog.
 * Comparisons are written with {@code >} only so that {@code <} stays reserved for defines.
 */
@RegisterRowMapper(AssetRowMapper.class)
public interface AssetDao {

    // --- Lookups -------------------------------------------------------------

    @SqlQuery("SELECT * FROM <table> WHERE id = :id")
    Optional<AssetRow> findById(@Define("table") String table, @Bind("id") long id);

    @SqlQuery("""
        SELECT * FROM <table>
         WHERE volume_id = :volumeId
           AND relative_path = :relativePath
         ORDER BY is_duplicate ASC, id ASC
         LIMIT 1
        """)
    Optional<AssetRow> findByPath(@Define("table") String table,
                                  @Bind("volumeId") String volumeId,
                                  @Bind("relativePath") String relativePath);

    /**
     * Non-duplicate rows with the same partial hash at any other location, most recently confirmed first.
     */
    @SqlQuery("""
        SELECT * FROM <table>
         WHERE partial_hash = :partialHash
           AND is_duplicate = 0
           AND NOT (volume_id = :volumeId AND relative_path = :relativePath)
         ORDER BY COALESCE(last_seen_at, 0) DESC, id ASC
        """)
    List<AssetRow> findPartialMatches(@Define("table") String table,
                                      @Bind("partialHash") String partialHash,
                                      @Bind("volumeId") String volumeId,
                                      @Bind("relativePath") String relativePath);

    @SqlQuery("SELECT COUNT(*) FROM <table>")
    long countAll(@Define("table") String table);

    @SqlQuery("SELECT COUNT(*) FROM <table> WHERE volume_id = :volumeId")
    long countByVolume(@Define("table") String table, @Bind("volumeId") String volumeId);

    @SqlQuery("""
        SELECT * FROM <table>
         WHERE volume_id = :volumeId
           AND folder_path = :folderPath
         ORDER BY filename, id
        """)
    List<AssetRow> listFolder(@Define("table") String table,
                              @Bind("volumeId") String volumeId,
                              @Bind("folderPath") String folderPath);

    @SqlQuery("""
        SELECT a.* FROM <table>_fts
          JOIN <table> a ON a.id = <table>_fts.rowid
         WHERE <table>_fts MATCH :query
         ORDER BY rank
         LIMIT :limit
        """)
    List<AssetRow> search(@Define("table") String table, @Bind("query") String query, @Bind("limit") int limit);

    // --- Scanner writes --------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO <table>(volume_id, relative_path, filename, format, title, collection,
                            file_size, file_mtime, partial_hash, full_hash, archive_path, archive_member,
                            folder_path, index_status, last_seen_at, last_seen_job_id, last_indexed_at,
                            is_duplicate, duplicate_of_id, author, creator, page_count, producer, created_at)
        VALUES (:volumeId, :relativePath, :filename, :format, :title, :collection,
                :fileSize, :fileMtime, :partialHash, :fullHash, :archivePath, :archiveMember,
                :folderPath, 'indexed', :now, :jobId, :now,
                :duplicate, :duplicateOfId, :author, :creator, :pageCount, :producer, :now)
        """)
    void insert(@Define("table") String table,
                @BindMethods AssetWrite asset,
                @Bind("jobId") Long jobId,
                @Bind("now") long now);

    @SqlQuery("SELECT last_insert_rowid()")
    long lastInsertId();

    /**
     * Rewrites every content and location column of a row; used by UPDATE.
     */
    @SqlUpdate("""
        UPDATE <table>
           SET volume_id = :volumeId,
               relative_path = :relativePath,
               filename = :filename,
               format = :format,
               title = :title,
               collection = :collection,
               file_size = :fileSize,
               file_mtime = :fileMtime,
               partial_hash = :partialHash,
               full_hash = :fullHash,
               archive_path = :archivePath,
               archive_member = :archiveMember,
               folder_path = :folderPath,
               author = :author,
               creator = :creator,
               page_count = :pageCount,
               producer = :producer,
               index_status = 'indexed',
               missing_since = NULL,
               last_seen_at = :now,
               last_seen_job_id = :jobId,
               last_indexed_at = :now,
               is_duplicate = :duplicate,
               duplicate_of_id = :duplicateOfId
         WHERE id = :id
        """)
    int rewrite(@Define("table") String table,
                @Bind("id") long id,
                @BindMethods AssetWrite asset,
                @Bind("jobId") Long jobId,
                @Bind("now") long now);

    /**
     * Same as {@link #rewrite} but only while the row still sits where the caller last saw it; used by MOVED.
     */
    @SqlUpdate("""
        UPDATE <table>
           SET volume_id = :volumeId,
               relative_path = :relativePath,
               filename = :filename,
               format = :format,
               title = :title,
               collection = :collection,
               file_size = :fileSize,
               file_mtime = :fileMtime,
               partial_hash = :partialHash,
               full_hash = :fullHash,
               archive_path = :archivePath,
               archive_member = :archiveMember,
               folder_path = :folderPath,
               author = :author,
               creator = :creator,
               page_count = :pageCount,
               producer = :producer,
               index_status = 'indexed',
               missing_since = NULL,
               last_seen_at = :now,
               last_seen_job_id = :jobId,
               last_indexed_at = :now,
               is_duplicate = 0,
               duplicate_of_id = NULL
         WHERE id = :id
           AND volume_id = :expectedVolumeId
           AND relative_path = :expectedPath
           AND is_duplicate = 0
        """)
    int relocate(@Define("table") String table,
                 @Bind("id") long id,
                 @Bind("expectedVolumeId") String expectedVolumeId,
                 @Bind("expectedPath") String expectedPath,
                 @BindMethods AssetWrite asset,
                 @Bind("jobId") Long jobId,
                 @Bind("now") long now);

    @SqlUpdate("""
        UPDATE <table>
           SET last_seen_at = :now,
               last_seen_job_id = :jobId,
               index_status = 'indexed',
               missing_since = NULL
         WHERE id = :id
        """)
    int touch(@Define("table") String table, @Bind("id") long id, @Bind("jobId") Long jobId, @Bind("now") long now);

    @SqlUpdate("""
        UPDATE <table>
           SET index_status = 'error',
               last_seen_at = :now,
               last_seen_job_id = :jobId
         WHERE id = :id
        """)
    int markError(@Define("table") String table, @Bind("id") long id, @Bind("jobId") Long jobId, @Bind("now") long now);

    @SqlUpdate("UPDATE <table> SET full_hash = :fullHash WHERE id = :id")
    int setFullHash(@Define("table") String table, @Bind("id") long id, @Bind("fullHash") String fullHash);

    @SqlUpdate("""
        UPDATE <table>
           SET is_duplicate = 0,
               duplicate_of_id = NULL
         WHERE duplicate_of_id = :id
        """)
    int releaseDuplicatesOf(@Define("table") String table, @Bind("id") long id);

    // --- Missing detection -----------------------------------------------------

    @SqlQuery("""
        SELECT * FROM <table>
         WHERE volume_id = :volumeId
           AND index_status != 'missing'
           AND (last_seen_job_id IS NULL OR last_seen_job_id != :jobId)
           AND relative_path LIKE :pattern ESCAPE '!'
         ORDER BY id
        """)
    List<AssetRow> findUnseenUnder(@Define("table") String table,
                                   @Bind("volumeId") String volumeId,
                                   @Bind("jobId") long jobId,
                                   @Bind("pattern") String pattern);

    @SqlQuery("""
        SELECT * FROM <table>
         WHERE volume_id = :volumeId
           AND index_status != 'missing'
           AND (last_seen_job_id IS NULL OR last_seen_job_id != :jobId)
           AND folder_path = :folderPath
         ORDER BY id
        """)
    List<AssetRow> findUnseenInFolder(@Define("table") String table,
                                      @Bind("volumeId") String volumeId,
                                      @Bind("jobId") long jobId,
                                      @Bind("folderPath") String folderPath);

    @SqlUpdate("""
        UPDATE <table>
           SET index_status = 'missing',
               missing_since = COALESCE(missing_since, :now)
         WHERE id IN (<ids>)
        """)
    int markMissing(@Define("table") String table, @BindList("ids") List<Long> ids, @Bind("now") long now);

    @SqlQuery("""
        SELECT * FROM <table>
         WHERE volume_id = :volumeId
           AND index_status = 'missing'
         ORDER BY id
        """)
    List<AssetRow> findMissing(@Define("table") String table, @Bind("volumeId") String volumeId);

    @SqlUpdate("""
        UPDATE <table>
           SET index_status = 'indexed',
               missing_since = NULL,
               last_seen_at = :now
         WHERE id = :id
           AND index_status = 'missing'
        """)
    int restore(@Define("table") String table, @Bind("id") long id, @Bind("now") long now);

    // --- Thumbnails ------------------------------------------------------------

    /**
     * Indexed rows on online, enabled volumes whose preview is absent or stale, within {@code [minSize, maxSize)}.
     */
    @SqlQuery("""
        SELECT * FROM <table>
         WHERE index_status = 'indexed'
           AND format IN (<formats>)
           AND file_size >= :minSize
           AND :maxSize > file_size
           AND (thumb_rendered_at IS NULL
                OR thumb_source_mtime IS NULL
                OR thumb_source_mtime != file_mtime
                OR thumb_source_mtime > thumb_rendered_at
                OR force_rerender = 1)
           AND volume_id IN (SELECT id FROM volumes WHERE status = 'online' AND enabled = 1)
         ORDER BY force_rerender DESC, file_size ASC, id ASC
         LIMIT :limit
        """)
    List<AssetRow> findNeedingThumbnail(@Define("table") String table,
                                        @BindList(value = "formats", onEmpty = BindList.EmptyHandling.NULL_STRING)
                                        List<String> formats,
                                        @Bind("minSize") long minSize,
                                        @Bind("maxSize") long maxSize,
                                        @Bind("limit") int limit);

    /**
     * Every preview column in one statement; also clears a pending forced re-render.
     */
    @SqlUpdate("""
        UPDATE <table>
           SET thumb_storage = :storage,
               thumb_path = :path,
               thumb_rendered_at = :renderedAt,
               thumb_source_mtime = :sourceMtime,
               force_rerender = 0
         WHERE id = :id
        """)
    int applyThumbnail(@Define("table") String table,
                       @Bind("id") long id,
                       @Bind("storage") String storage,
                       @Bind("path") String path,
                       @Bind("renderedAt") long renderedAt,
                       @Bind("sourceMtime") long sourceMtime);

    @SqlUpdate("UPDATE <table> SET force_rerender = 1 WHERE id = :id")
    int flagRerender(@Define("table") String table, @Bind("id") long id);

    // --- Duplicate sweep ---------------------------------------------------------

    @SqlQuery("""
        SELECT partial_hash FROM <table>
         WHERE is_duplicate = 0
           AND index_status = 'indexed'
           AND partial_hash IS NOT NULL
         GROUP BY partial_hash
        HAVING COUNT(*) > 1
         ORDER BY partial_hash
        """)
    List<String> findCollidingPartialHashes(@Define("table") String table);

    @SqlQuery("""
        SELECT * FROM <table>
         WHERE partial_hash = :partialHash
           AND is_duplicate = 0
           AND index_status = 'indexed'
         ORDER BY id
        """)
    List<AssetRow> findPrimariesByPartialHash(@Define("table") String table, @Bind("partialHash") String partialHash);

    @SqlUpdate("""
        UPDATE <table>
           SET is_duplicate = 1,
               duplicate_of_id = :targetId
         WHERE id = :id
           AND is_duplicate = 0
        """)
    int linkDuplicate(@Define("table") String table, @Bind("id") long id, @Bind("targetId") long targetId);
}
