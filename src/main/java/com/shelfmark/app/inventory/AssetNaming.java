package com.shelfmark.app.inventory;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import com.shelfmark.app.volume.VolumeResolver;

/**
 * Search fields derived from a catalog path.
 */
final class AssetNaming {

    // Folder names that say how files are stored rather than who made them.
    private static final Set<String> GENERIC_FOLDERS =
            Set.of("3d", "stl", "obj", "models", "files", "supported", "unsupported", "presupported");

    private static final Pattern LEADING_NUMBERS = Pattern.compile("^[\\d_\\-\\s]+");

    private AssetNaming() {}

    /** "dragon_bust-v2.stl" becomes "dragon bust v2". */
    static String title(String filename) {
        String stem = FilenameUtils.getBaseName(filename);
        String spaced = stem.replace('_', ' ').replace('-', ' ').replace('.', ' ');
        String title = StringUtils.normalizeSpace(spaced);
        return title.isEmpty() ? filename : title;
    }

    /** Like {@link #title}, without the sequence number kits put in front ("03_tower.stl" is "tower"). */
    static String modelTitle(String filename) {
        String title = title(filename);
        String stripped = LEADING_NUMBERS.matcher(title).replaceFirst("");
        return stripped.isEmpty() ? title : stripped;
    }

    /**
     * Archive stem for members, otherwise the name of the containing folder ("" at the volume root).
     */
    static String collection(String relativePath, String archivePath) {
        if (archivePath != null) {
            return FilenameUtils.getBaseName(archivePath);
        }
        return lastSegment(VolumeResolver.folderOf(relativePath));
    }

    /**
     * The folder above the collection: "Artisan/castle_set/tower.stl" and
     * "Artisan/castle_set.zip::tower.stl" both belong to "Artisan". Null when there is no such
     * folder or it only names a file type.
     */
    static String creator(String relativePath, String archivePath) {
        String collectionFolder = archivePath != null
                ? VolumeResolver.folderOf(archivePath)
                : parentOf(VolumeResolver.folderOf(relativePath));
        String name = lastSegment(collectionFolder);
        if (name.isEmpty() || GENERIC_FOLDERS.contains(name.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return name;
    }

    private static String parentOf(String folder) {
        int slash = folder.lastIndexOf('/');
        return slash < 0 ? "" : folder.substring(0, slash);
    }

    private static String lastSegment(String folder) {
        int slash = folder.lastIndexOf('/');
        return slash < 0 ? folder : folder.substring(slash + 1);
    }
}
