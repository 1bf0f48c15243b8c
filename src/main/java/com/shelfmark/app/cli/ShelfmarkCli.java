package com.shelfmark.app.cli;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shelfmark.app.config.DaemonSettings;
import com.shelfmark.app.config.ScannerSettings;
import com.shelfmark.app.database.AssetRow;
import com.shelfmark.app.database.Catalog;
import com.shelfmark.app.database.CatalogKind;
import com.shelfmark.app.database.Database;
import com.shelfmark.app.database.JobErrorRow;
import com.shelfmark.app.database.SchemaSelfTest;
import com.shelfmark.app.database.VolumeRow;
import com.shelfmark.app.format.FormatRegistry;
import com.shelfmark.app.inventory.DuplicatePolicy;
import com.shelfmark.app.inventory.DuplicateSweeper;
import com.shelfmark.app.inventory.ScanRequest;
import com.shelfmark.app.inventory.ScanResult;
import com.shelfmark.app.inventory.Scanner;
import com.shelfmark.app.thumbnail.DaemonProgress;
import com.shelfmark.app.thumbnail.ThumbnailDaemon;
import com.shelfmark.app.volume.VolumeService;
import com.shelfmark.app.volume.VolumeUnavailableException;

/**
 * Command-line front end. Every command opens the configured catalog, runs and returns an exit code:
 * 0 success, 1 failure, 2 usage error.
 */
public final class ShelfmarkCli {

    private static final Logger logger = LoggerFactory.getLogger(ShelfmarkCli.class);

    private static final int SEARCH_LIMIT = 50;

    private ShelfmarkCli() {}

    public static int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 0;
        }

        String cmd = args[0].toLowerCase(Locale.ROOT);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        if (cmd.equals("help") || cmd.equals("-h") || cmd.equals("--help")) {
            printUsage();
            return 0;
        }
        if (cmd.equals("selftest")) {
            return runSelfTest();
        }

        requireSelfTest();
        try (Database db = Database.openDefault()) {
            Catalog catalog = new Catalog(db);
            return switch (cmd) {
                case "volume" -> runVolume(catalog, rest);
                case "scan" -> runScan(catalog, rest);
                case "dedupe" -> runDedupe(catalog, rest);
                case "search" -> runSearch(catalog, rest);
                case "daemon" -> runDaemon(catalog);
                default -> {
                    System.err.println("Unknown command: " + args[0]);
                    printUsage();
                    yield 2;
                }
            };
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            printUsage();
            return 2;
        } catch (VolumeUnavailableException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (Exception e) {
            logger.error("Command {} failed", cmd, e);
            System.err.println("Failed: " + safeMsg(e));
            return 1;
        }
    }

    // ----------------- selftest -----------------

    private static int runSelfTest() {
        SchemaSelfTest.SelfTestResult result = SchemaSelfTest.run();
        System.out.print(result.report());
        return result.ok() ? 0 : 1;
    }

    private static void requireSelfTest() {
        SchemaSelfTest.SelfTestResult result = SchemaSelfTest.run();
        if (!result.ok()) {
            throw new IllegalStateException("Catalog self-test failed:\n" + result.report());
        }
    }

    // ----------------- volume -----------------

    private static int runVolume(Catalog catalog, String[] args) {
        if (args.length == 0) {
            throw new UsageException("volume: missing sub-command");
        }
        VolumeService volumes = new VolumeService(catalog);
        String sub = args[0].toLowerCase(Locale.ROOT);
        switch (sub) {
            case "add" -> {
                String label = null;
                boolean readonly = false;
                String id = null;
                String mount = null;
                ArgCursor c = new ArgCursor(Arrays.copyOfRange(args, 1, args.length));
                while (c.hasNext()) {
                    String t = c.next();
                    if (t.equals("--readonly")) readonly = true;
                    else if (t.equals("--label")) label = c.requireNext("--label");
                    else if (id == null) id = t;
                    else if (mount == null) mount = t;
                    else throw new UsageException("volume add: unexpected argument " + t);
                }
                if (id == null || mount == null) {
                    throw new UsageException("volume add: <id> and <mount-path> are required");
                }
                VolumeRow v = volumes.register(id, label, Path.of(mount), readonly);
                printVolume(v);
            }
            case "list" -> {
                List<VolumeRow> all = volumes.list();
                if (all.isEmpty()) {
                    System.out.println("No volumes registered.");
                }
                all.forEach(ShelfmarkCli::printVolume);
            }
            case "disable" -> volumes.disable(requireArg(args, 1, "volume disable <id>"));
            case "enable" -> volumes.enable(requireArg(args, 1, "volume enable <id>"));
            case "delete" -> volumes.delete(requireArg(args, 1, "volume delete <id>"));
            case "check" -> {
                if (args.length > 1) {
                    printVolume(volumes.monitor().refresh(volumes.require(args[1])));
                } else {
                    volumes.monitor().refreshAll().forEach(ShelfmarkCli::printVolume);
                }
            }
            case "verify" -> {
                VolumeService.VerifyResult r = volumes.verifyAssets(requireArg(args, 1, "volume verify <id>"));
                System.out.printf("verify #%d: %d missing checked, %d restored%n", r.jobId(), r.checked(), r.restored());
            }
            default -> throw new UsageException("Unknown volume sub-command: " + args[0]);
        }
        return 0;
    }

    private static void printVolume(VolumeRow v) {
        System.out.printf("%s | %s | %s | %s%s%s%s%n",
                v.id(),
                v.label(),
                v.mountPath(),
                v.status().dbValue(),
                v.enabled() ? "" : " (disabled)",
                v.readonly() ? " (read-only)" : "",
                StringUtils.isBlank(v.statusReason()) ? "" : " - " + v.statusReason());
    }

    // ----------------- scan -----------------

    private static int runScan(Catalog catalog, String[] args) throws Exception {
        String path = null;
        boolean recursive = true;
        boolean force = false;
        DuplicatePolicy policy = null;
        for (String t : args) {
            if (t.equals("--no-recursive")) recursive = false;
            else if (t.equals("--force")) force = true;
            else if (t.startsWith("--policy=")) policy = DuplicatePolicy.parse(t.substring("--policy=".length()));
            else if (t.startsWith("--")) throw new UsageException("scan: unknown option " + t);
            else if (path == null) path = t;
            else throw new UsageException("scan: only one path is accepted");
        }
        if (path == null) {
            throw new UsageException("scan: <path> is required");
        }

        Scanner scanner = new Scanner(catalog, FormatRegistry.standard(DaemonSettings.load().render()),
                ScannerSettings.load());

        // Ctrl+C stops after the current item
        Thread cancelHook = new Thread(() -> scanner.activeJobs().forEach(scanner::cancel), "shelfmark-cli-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);
        try {
            ScanResult result = scanner.scan(new ScanRequest(Path.of(path), recursive, force, policy));
            System.out.println("scan #" + result.jobId() + ": " + result);
            for (JobErrorRow e : catalog.jobErrors(result.jobId())) {
                System.out.printf("  %s %s: %s%n", e.errorType(), e.filePath(), e.errorMessage());
            }
            return result.errors() > 0 ? 1 : 0;
        } finally {
            removeHook(cancelHook);
        }
    }

    // ----------------- dedupe -----------------

    private static int runDedupe(Catalog catalog, String[] args) {
        List<CatalogKind> kinds = args.length == 0
                ? List.of(CatalogKind.values())
                : List.of(parseKind(args[0]));
        DuplicateSweeper sweeper = new DuplicateSweeper(catalog);
        for (CatalogKind kind : kinds) {
            System.out.printf("%s: %d duplicates linked%n", kind.table(), sweeper.sweep(kind));
        }
        return 0;
    }

    // ----------------- search -----------------

    private static int runSearch(Catalog catalog, String[] args) {
        if (args.length < 2) {
            throw new UsageException("search <documents|models> <query>");
        }
        CatalogKind kind = parseKind(args[0]);
        String query = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
        List<AssetRow> hits = catalog.search(kind, query, SEARCH_LIMIT);
        if (hits.isEmpty()) {
            System.out.println("No matches.");
        }
        for (AssetRow r : hits) {
            String by = r.author() != null ? r.author() : r.creator();
            System.out.printf("%d | %s%s | %s:%s | %s%s%n",
                    r.id(),
                    r.title(),
                    by != null ? " (" + by + ")" : "",
                    r.volumeId(),
                    r.relativePath(),
                    FileUtils.byteCountToDisplaySize(r.fileSize()),
                    r.duplicate() ? " | duplicate of " + r.duplicateOfId() : "");
        }
        return 0;
    }

    // ----------------- daemon -----------------

    private static int runDaemon(Catalog catalog) throws Exception {
        DaemonSettings settings = DaemonSettings.load();
        FormatRegistry registry = FormatRegistry.standard(settings.render());
        new VolumeService(catalog).monitor().refreshAll();

        try (ThumbnailDaemon daemon = new ThumbnailDaemon(catalog, registry, settings)) {
            Thread main = Thread.currentThread();
            Thread stopHook = new Thread(() -> {
                main.interrupt();
                try {
                    // let the daemon close before the JVM halts
                    main.join(TimeUnit.SECONDS.toMillis(30));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shelfmark-daemon-stop");
            Runtime.getRuntime().addShutdownHook(stopHook);
            daemon.start();
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    TimeUnit.MINUTES.sleep(1);
                    DaemonProgress p = daemon.progress();
                    logger.info("Previews: {} rendered, {} fast pending, {} slow pending ({})",
                            p.renderedTotal(), p.pendingFast(), p.pendingSlow(), daemon.state());
                }
            } catch (InterruptedException e) {
                logger.info("Stopping thumbnail daemon");
            } finally {
                removeHook(stopHook);
            }
        }
        return 0;
    }

    // ----------------- helpers -----------------

    private static CatalogKind parseKind(String value) {
        try {
            return CatalogKind.parse(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static String requireArg(String[] args, int index, String usage) {
        if (args.length <= index) {
            throw new UsageException("Usage: " + usage);
        }
        return args[index];
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // already shutting down
            logger.debug("Shutdown in progress, hook stays registered");
        }
    }

    private static String safeMsg(Throwable t) {
        return (t.getMessage() == null || t.getMessage().isBlank())
                ? t.getClass().getSimpleName()
                : t.getMessage();
    }

    private static void printUsage() {
        System.out.println("""
                Shelfmark
                Commands:
                  volume add <id> <mount-path> [--label <label>] [--readonly]
                  volume list
                  volume disable|enable|delete|verify <id>
                  volume check [<id>]
                  scan <path> [--no-recursive] [--force] [--policy=merge|warn|reject]
                  dedupe [documents|models]
                  search <documents|models> <query>
                  daemon
                  selftest
                  help
                """);
    }

    private static final class UsageException extends IllegalArgumentException {
        UsageException(String message) {
            super(message);
        }
    }

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new UsageException("Missing value for " + opt);
            return next();
        }
    }
}
