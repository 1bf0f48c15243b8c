package com.shelfmark.app.inventory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.archive.ArchiveEntry;
import com.shelfmark.app.archive.ArchiveReader;
import com.shelfmark.app.archive.ArchiveWalker;
import com.shelfmark.app.config.ScannerSettings;
import com.shelfmark.app.database.AssetRow;
import com.shelfmark.app.database.AssetWrite;
import com.shelfmark.app.database.Catalog;
import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.database.IndexStatus;
import com.shelfmark.app.database.VolumeRow;
import com.shelfmark.app.database.VolumeStatus;
import com.shelfmark.app.format.EmbeddedMetadata;
import com.shelfmark.app.format.FormatCapability;
import com.shelfmark.app.format.FormatRegistry;
import com.shelfmark.app.format.ValidationException;
import com.shelfmark.app.format.ValidationResult;
import com.shelfmark.app.format.ValidationSource;
import com.shelfmark.app.hash.ContentHasher;
import com.shelfmark.app.volume.PathTraversalException;
import com.shelfmark.app.volume.VolumeDisabledException;
import com.shelfmark.app.volume.VolumeMonitor;
import com.shelfmark.app.volume.VolumeOfflineException;
import com.shelfmark.app.volume.VolumeResolver;

/**
 * Brings the catalog in line with a directory tree.
 * <p>
 * Every visited file is classified as NEW, UNCHANGED, UPDATE, MOVED, DUPLICATE, SKIP or ERROR
 * and written in traversal order, one transaction per item. Zip and rar archives are opened and
 * their members cataloged like files. After a complete walk, rows in the scanned scope that
 * were not seen become {@code missing}.
 * <p>
 * A scan runs on the calling thread. Scans of different volumes may run concurrently; a second
 * scan of a volume that is being scanned is refused.
 */
public final class Scanner {

    private static final Logger logger = LoggerFactory.getLogger(Scanner.class);

    public static final String JOB_TYPE = "scan";

    static final String PHASE_WALKING = "walking";
    static final String PHASE_RECONCILING = "reconciling";

    private final Catalog catalog;
    private final FormatRegistry registry;
    private final ScannerSettings settings;
    private final VolumeMonitor monitor;
    private final List<PathMatcher> excludes;
    private final FullHashLookup fullHashes;

    private final Set<String> activeVolumes = ConcurrentHashMap.newKeySet();
    private final Map<Long, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    public Scanner(Catalog catalog, FormatRegistry registry, ScannerSettings settings) {
        this.catalog = catalog;
        this.registry = registry;
        this.settings = settings;
        this.monitor = new VolumeMonitor(catalog);
        this.fullHashes = new FullHashLookup(catalog);
        this.excludes = settings.excludeGlobs().stream()
                .map(g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                .toList();
    }

    /**
     * @throws IllegalArgumentException if no registered volume contains the path
     * @throws VolumeDisabledException  if the owning volume is disabled
     * @throws VolumeOfflineException   if the owning volume's mount is unreachable
     * @throws ScanInProgressException  if the owning volume is already being scanned
     * @throws PathTraversalException   if the path resolves outside its volume
     */
    public ScanResult scan(ScanRequest request) throws IOException {
        Path target = request.path().toAbsolutePath().normalize();
        VolumeRow volume = VolumeResolver.owning(catalog.listVolumes(), target)
                .orElseThrow(() -> new IllegalArgumentException("No registered volume contains " + target));
        if (!volume.enabled()) {
            throw new VolumeDisabledException(volume.id());
        }
        DuplicatePolicy policy = request.policy() != null
                ? request.policy()
                : DuplicatePolicy.parse(settings.defaultPolicy());

        if (!activeVolumes.add(volume.id())) {
            throw new ScanInProgressException(volume.id());
        }
        try {
            String scope = VolumeResolver.resolve(volume, target);
            long jobId = catalog.startJob(JOB_TYPE, volume.id(), target.toString(),
                    request.recursive(), request.force(), policy.dbValue());

            VolumeRow current = monitor.refresh(volume);
            if (!current.isOnline()) {
                catalog.finishJob(jobId, "failed", 0, 0, 0, 0, 0, "volume offline: " + current.statusReason());
                throw new VolumeOfflineException(volume.id(), current.statusReason());
            }

            AtomicBoolean cancel = new AtomicBoolean(false);
            cancelFlags.put(jobId, cancel);
            ScanContext ctx = new ScanContext(jobId, current, policy, request.force(), cancel);
            logger.info("Scan #{} started: volume={} path={} recursive={} force={} policy={}",
                    jobId, volume.id(), scope.isEmpty() ? "/" : scope, request.recursive(), request.force(),
                    policy.dbValue());
            try {
                boolean singleFile = Files.isRegularFile(target);
                walk(ctx, target, request.recursive());

                boolean cancelled = cancel.get();
                if (!cancelled && !singleFile) {
                    reconcile(ctx, scope, request.recursive());
                }
                if (!cancelled) {
                    catalog.markVolumeIndexed(volume.id());
                }
                ScanMetrics m = ctx.metrics;
                catalog.finishJob(jobId, cancelled ? "cancelled" : "completed", m.visited(), m.processed(),
                        m.get(ScanAction.SKIP), m.get(ScanAction.ERROR), m.missing.sum(), null);
                ScanResult result = m.toResult(jobId, cancelled);
                logger.info("Scan #{} {} in {} ms: {}", jobId, cancelled ? "cancelled" : "finished",
                        m.elapsedMillis(), result);
                return result;
            } catch (IOException | RuntimeException e) {
                ScanMetrics m = ctx.metrics;
                catalog.finishJob(jobId, "failed", m.visited(), m.processed(),
                        m.get(ScanAction.SKIP), m.get(ScanAction.ERROR), m.missing.sum(), e.toString());
                throw e;
            } finally {
                cancelFlags.remove(jobId);
            }
        } finally {
            activeVolumes.remove(volume.id());
        }
    }

    /**
     * Asks a running scan to stop after the current item. A cancelled scan does not mark anything missing.
     *
     * @return false if no such scan is running
     */
    public boolean cancel(long jobId) {
        AtomicBoolean flag = cancelFlags.get(jobId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        logger.info("Scan #{} cancellation requested", jobId);
        return true;
    }

    public Set<Long> activeJobs() {
        return Set.copyOf(cancelFlags.keySet());
    }

    // --- walk ------------------------------------------------------------------------

    private void walk(ScanContext ctx, Path target, boolean recursive) throws IOException {
        int depth = recursive ? Integer.MAX_VALUE : 1;
        Files.walkFileTree(target, EnumSet.noneOf(FileVisitOption.class), depth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (ctx.cancelled()) return FileVisitResult.TERMINATE;
                if (!dir.equals(target) && (isHidden(dir) || isExcluded(ctx, dir))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (ctx.cancelled()) return FileVisitResult.TERMINATE;
                if (isHidden(file) || isExcluded(ctx, file)) return FileVisitResult.CONTINUE;
                visit(ctx, file, attrs);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                if (file.equals(target) && exc instanceof NoSuchFileException) {
                    logger.warn("Scan #{}: {} does not exist", ctx.jobId, target);
                    return FileVisitResult.CONTINUE;
                }
                unreadable(ctx, file, exc);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (exc != null) {
                    unreadable(ctx, dir, exc);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static boolean isHidden(Path p) {
        Path name = p.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    private boolean isExcluded(ScanContext ctx, Path p) {
        if (excludes.isEmpty()) {
            return false;
        }
        Path rel = ctx.volumeRoot.relativize(p.toAbsolutePath().normalize());
        for (PathMatcher m : excludes) {
            if (m.matches(rel)) {
                return true;
            }
        }
        return false;
    }

    private void unreadable(ScanContext ctx, Path path, IOException exc) {
        String rel = ctx.volumeRoot.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
        ctx.unreadable.add(rel);
        error(ctx, rel, "IO", exc.toString());
    }

    private void visit(ScanContext ctx, Path file, BasicFileAttributes attrs) {
        BasicFileAttributes a = attrs;
        try {
            if (a.isSymbolicLink()) {
                if (!Files.isRegularFile(file)) {
                    return;
                }
                a = Files.readAttributes(file, BasicFileAttributes.class);
            }
            if (!a.isRegularFile()) {
                return;
            }
            String rel = VolumeResolver.resolve(ctx.volume, file);
            if (ArchiveWalker.isArchive(file)) {
                scanArchive(ctx, file, rel, a.lastModifiedTime().toMillis());
                return;
            }
            Optional<FormatCapability> format = registry.forFile(file);
            if (format.isEmpty()) {
                ctx.record(ScanAction.SKIP, rel);
                return;
            }
            handle(ctx, new FileItem(file, ctx.volumeRoot, rel, format.get(), a.size(),
                    a.lastModifiedTime().toMillis()));
        } catch (PathTraversalException e) {
            error(ctx, file.toString(), "PATH_TRAVERSAL", e.getMessage());
        } catch (IOException e) {
            error(ctx, file.toString(), "IO", e.toString());
        } catch (RuntimeException e) {
            logger.error("Scan #{}: unexpected failure on {}", ctx.jobId, file, e);
            error(ctx, file.toString(), "INTERNAL", e.toString());
        }
    }

    private void scanArchive(ScanContext ctx, Path archive, String archivePath, long archiveMtime) {
        try (ArchiveReader reader = ArchiveWalker.open(archive)) {
            for (ArchiveEntry entry : reader.entries()) {
                if (ctx.cancelled()) {
                    return;
                }
                String rel = VolumeResolver.memberPath(archivePath, entry.member());
                Optional<FormatCapability> format = registry.forName(entry.member());
                if (format.isEmpty()) {
                    ctx.record(ScanAction.SKIP, rel);
                    continue;
                }
                handle(ctx, new MemberItem(reader, entry, rel, archivePath, format.get(), archiveMtime));
            }
        } catch (IOException e) {
            // member rows of an unreadable archive are neither confirmed nor reported missing
            ctx.unreadable.add(archivePath);
            error(ctx, archivePath, "ARCHIVE", e.getMessage());
        } catch (RuntimeException e) {
            ctx.unreadable.add(archivePath);
            logger.error("Scan #{}: archive reader failed on {}", ctx.jobId, archivePath, e);
            error(ctx, archivePath, "ARCHIVE", e.toString());
        }
    }

    // --- per-item decision -----------------------------------------------------------

    private void handle(ScanContext ctx, Item item) {
        CatalogKind kind = item.format().kind();
        AssetRow existing = null;
        try {
            existing = catalog.findByPath(kind, ctx.volume.id(), item.relativePath()).orElse(null);
            ScanAction action = existing != null
                    ? reindex(ctx, kind, item, existing)
                    : admit(ctx, kind, item);
            ctx.record(action, item.relativePath());
        } catch (ValidationException e) {
            fail(ctx, kind, existing, item.relativePath(), "VALIDATION", e.getMessage());
        } catch (IOException e) {
            fail(ctx, kind, existing, item.relativePath(), "IO", e.toString());
        } catch (JdbiException e) {
            fail(ctx, kind, existing, item.relativePath(), "CATALOG", e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Scan #{}: unexpected failure on {}", ctx.jobId, item.relativePath(), e);
            fail(ctx, kind, existing, item.relativePath(), "INTERNAL", e.toString());
        }
    }

    /** A row already sits at this path. */
    private ScanAction reindex(ScanContext ctx, CatalogKind kind, Item item, AssetRow row)
            throws IOException, ValidationException {
        boolean sameStat = row.fileSize() == item.size() && row.fileMtime() == item.mtime();
        if (sameStat && !ctx.force && row.indexStatus() != IndexStatus.ERROR) {
            catalog.touchAsset(kind, row.id(), ctx.jobId);
            return ScanAction.UNCHANGED;
        }

        validate(item);
        String partial = item.partialHash();
        boolean contentChanged = !partial.equals(row.partialHash());
        String full = null;
        if (!contentChanged && row.fullHash() != null) {
            full = ctx.force ? item.fullHash() : row.fullHash();
            contentChanged = !full.equals(row.fullHash());
        }
        boolean keepDuplicate = !contentChanged && row.duplicate();
        AssetWrite write = describe(ctx, item, partial, contentChanged ? null : full,
                keepDuplicate, keepDuplicate ? row.duplicateOfId() : null);
        catalog.updateAsset(kind, row.id(), write, ctx.jobId, contentChanged);
        return ScanAction.UPDATE;
    }

    /** No row at this path: new file, moved file or copy. */
    private ScanAction admit(ScanContext ctx, CatalogKind kind, Item item) throws IOException, ValidationException {
        validate(item);
        String partial = item.partialHash();
        AssetWrite write = describe(ctx, item, partial, null, false, null);

        List<AssetRow> matches = catalog.findPartialMatches(kind, partial, ctx.volume.id(), item.relativePath());
        String candidateFull = null;
        for (AssetRow match : DuplicateResolver.rankTargets(matches)) {
            if (settings.verifyFullHash()) {
                if (candidateFull == null) {
                    candidateFull = item.fullHash();
                }
                String matchFull = knownFullHash(ctx, kind, match);
                if (matchFull != null && !matchFull.equals(candidateFull)) {
                    logger.debug("Partial hash collision between {} and #{} ({})",
                            item.relativePath(), match.id(), match.relativePath());
                    continue;
                }
                write = write.withFullHash(candidateFull);
            }

            DuplicateResolver.Resolution r = DuplicateResolver.resolve(match, ctx.policy);
            if (r.action() == ScanAction.DUPLICATE) {
                logger.debug("{} duplicates #{} ({})", item.relativePath(), match.id(), match.relativePath());
                return ScanAction.DUPLICATE;
            }
            if (r.action() == ScanAction.MOVED) {
                AssetWrite moved = write.fullHash() != null ? write : write.withFullHash(match.fullHash());
                if (catalog.relocateAsset(kind, match.id(), match.volumeId(), match.relativePath(), moved, ctx.jobId)) {
                    logger.debug("#{} moved {} -> {}", match.id(), match.relativePath(), item.relativePath());
                    return ScanAction.MOVED;
                }
                logger.debug("#{} changed before it could be repointed; cataloging {} as new",
                        match.id(), item.relativePath());
                catalog.insertAsset(kind, write, ctx.jobId);
                return ScanAction.NEW;
            }
            catalog.insertAsset(kind, write.asDuplicateOf(match.id()), ctx.jobId);
            ctx.metrics.flagged.increment();
            logger.debug("{} cataloged as duplicate of #{}", item.relativePath(), match.id());
            return ScanAction.NEW;
        }

        catalog.insertAsset(kind, write, ctx.jobId);
        return ScanAction.NEW;
    }

    private static void validate(Item item) throws IOException, ValidationException {
        ValidationResult result = item.format().validator().validate(item.validationSource());
        if (!result.ok()) {
            throw new ValidationException(item.relativePath(), result);
        }
    }

    private static AssetWrite describe(ScanContext ctx, Item item, String partialHash, String fullHash,
                                       boolean duplicate, Long duplicateOfId) {
        String rel = item.relativePath();
        boolean model = item.format().kind() == CatalogKind.MODEL;
        EmbeddedMetadata meta = item.format().metadata().read(item.validationSource());
        String title = meta.title() != null
                ? meta.title()
                : model ? AssetNaming.modelTitle(item.filename()) : AssetNaming.title(item.filename());
        return new AssetWrite(
                ctx.volume.id(),
                rel,
                item.filename(),
                item.format().id(),
                title,
                AssetNaming.collection(rel, item.archivePath()),
                item.size(),
                item.mtime(),
                partialHash,
                fullHash,
                item.archivePath(),
                item.archiveMember(),
                VolumeResolver.folderOf(rel),
                duplicate,
                duplicateOfId,
                meta.author(),
                model ? AssetNaming.creator(rel, item.archivePath()) : null,
                meta.pageCount(),
                meta.producer());
    }

    private String knownFullHash(ScanContext ctx, CatalogKind kind, AssetRow match) {
        if (match.fullHash() != null) {
            return match.fullHash();
        }
        VolumeRow volume = ctx.volumeFor(match.volumeId());
        if (volume == null || !ctx.isOnline(volume)) {
            return null;
        }
        return fullHashes.of(kind, match, volume);
    }

    private void fail(ScanContext ctx, CatalogKind kind, AssetRow existing, String rel, String type, String message) {
        error(ctx, rel, type, message);
        if (existing != null) {
            try {
                catalog.markAssetError(kind, existing.id(), ctx.jobId);
            } catch (JdbiException e) {
                logger.warn("Scan #{}: could not flag #{} as failed: {}", ctx.jobId, existing.id(), e.getMessage());
            }
        }
    }

    private void error(ScanContext ctx, String rel, String type, String message) {
        logger.warn("Scan #{} {} {}: {}", ctx.jobId, type, rel, message);
        catalog.recordJobError(ctx.jobId, rel, type, message);
        ctx.record(ScanAction.ERROR, rel);
    }

    // --- missing detection -----------------------------------------------------------

    private void reconcile(ScanContext ctx, String scope, boolean recursive) {
        ScanMetrics m = ctx.metrics;
        catalog.updateJobProgress(ctx.jobId, PHASE_RECONCILING, m.visited(), null,
                m.processed(), m.get(ScanAction.SKIP), m.get(ScanAction.ERROR));
        for (CatalogKind kind : CatalogKind.values()) {
            List<Long> ids = new ArrayList<>();
            for (AssetRow row : catalog.findUnseen(kind, ctx.volume.id(), ctx.jobId, scope, recursive)) {
                if (!ctx.underUnreadable(row.relativePath())) {
                    ids.add(row.id());
                }
            }
            int marked = catalog.markMissing(kind, ids);
            if (marked > 0) {
                logger.info("Scan #{}: {} {} no longer found", ctx.jobId, marked, kind.table());
            }
            m.missing.add(marked);
        }
    }

    // --- per-scan state --------------------------------------------------------------

    private final class ScanContext {
        final long jobId;
        final VolumeRow volume;
        final Path volumeRoot;
        final DuplicatePolicy policy;
        final boolean force;
        final AtomicBoolean cancel;
        final ScanMetrics metrics = new ScanMetrics();
        final List<String> unreadable = new ArrayList<>();
        private final Map<String, VolumeRow> volumes = new HashMap<>();
        private final Map<String, Boolean> online = new HashMap<>();

        ScanContext(long jobId, VolumeRow volume, DuplicatePolicy policy, boolean force, AtomicBoolean cancel) {
            this.jobId = jobId;
            this.volume = volume;
            this.volumeRoot = volume.mountRoot().toAbsolutePath().normalize();
            this.policy = policy;
            this.force = force;
            this.cancel = cancel;
            volumes.put(volume.id(), volume);
            online.put(volume.id(), true);
        }

        boolean cancelled() {
            return cancel.get();
        }

        void record(ScanAction action, String rel) {
            metrics.count(action);
            long visited = metrics.visited();
            if (visited % settings.progressEvery() == 0) {
                catalog.updateJobProgress(jobId, PHASE_WALKING, visited, rel,
                        metrics.processed(), metrics.get(ScanAction.SKIP), metrics.get(ScanAction.ERROR));
            }
        }

        VolumeRow volumeFor(String id) {
            return volumes.computeIfAbsent(id, k -> catalog.findVolume(k).orElse(null));
        }

        boolean isOnline(VolumeRow v) {
            return online.computeIfAbsent(v.id(), k -> v.enabled()
                    && v.status() != VolumeStatus.ERROR
                    && VolumeMonitor.check(v.mountRoot()).online());
        }

        boolean underUnreadable(String relativePath) {
            String onDisk = VolumeResolver.containerPath(relativePath);
            for (String u : unreadable) {
                if (u.isEmpty() || onDisk.equals(u) || onDisk.startsWith(u + "/")) {
                    return true;
                }
            }
            return false;
        }
    }

    // --- scanned items ---------------------------------------------------------------

    /** A plain file or an archive member, as far as cataloging is concerned. */
    private interface Item {
        String relativePath();

        String filename();

        FormatCapability format();

        long size();

        long mtime();

        String archivePath();

        String archiveMember();

        ValidationSource validationSource();

        String partialHash() throws IOException;

        String fullHash() throws IOException;
    }

    private record FileItem(Path file, Path volumeRoot, String relativePath, FormatCapability format, long size,
                            long mtime) implements Item {

        @Override
        public String filename() {
            return file.getFileName().toString();
        }

        @Override
        public String archivePath() {
            return null;
        }

        @Override
        public String archiveMember() {
            return null;
        }

        @Override
        public ValidationSource validationSource() {
            return ValidationSource.of(file, volumeRoot);
        }

        @Override
        public String partialHash() throws IOException {
            return ContentHasher.partialHash(file);
        }

        @Override
        public String fullHash() throws IOException {
            return ContentHasher.fullHash(file);
        }
    }

    private record MemberItem(ArchiveReader reader, ArchiveEntry entry, String relativePath, String archivePath,
                              FormatCapability format, long mtime) implements Item {

        @Override
        public String filename() {
            return entry.filename();
        }

        @Override
        public long size() {
            return entry.size();
        }

        @Override
        public String archiveMember() {
            return entry.member();
        }

        @Override
        public ValidationSource validationSource() {
            return ValidationSource.of(reader, entry);
        }

        @Override
        public String partialHash() throws IOException {
            try (InputStream in = reader.open(entry)) {
                return ContentHasher.partialHash(in, entry.size());
            }
        }

        @Override
        public String fullHash() throws IOException {
            try (InputStream in = reader.open(entry)) {
                return ContentHasher.fullHash(in);
            }
        }
    }
}
