package com.questrail.cot.prefs;

import com.questrail.cot.tls.CryptoSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * PreferencePackageImporter
 * =============================================================================
 * Unpacks a preference package (a zip of connection settings and certificates)
 * and turns it into client configuration.
 *
 * <h2>Settings document</h2>
 * The first match, searching the whole archive in path order, of:
 * <ol>
 *   <li>{@code settings.ini}</li>
 *   <li>any other {@code *.ini}</li>
 *   <li>any {@code *.pref} (TAK preference XML)</li>
 * </ol>
 *
 * <h2>Certificate references</h2>
 * {@code TLS_CLIENT_CERT}, {@code TLS_CLIENT_KEY} and {@code TLS_CLIENT_CAFILE}
 * are rewritten to absolute paths of the extracted files. A reference is looked up
 * relative to the archive root first, then by file name anywhere in the archive.
 * A reference that matches nothing fails the import.
 *
 * <p>After a successful import the extraction directory is left in place; callers
 * that need cleanup own it through {@link ImportedPreferences#workingDirectory()}.
 * A failed import removes it.</p>
 */
public final class PreferencePackageImporter
{
    private static final Logger log = LoggerFactory.getLogger(PreferencePackageImporter.class);

    private final Path workRoot;

    /** Extracts into fresh directories under the system temporary directory. */
    public PreferencePackageImporter() {
        this(null);
    }

    /**
     * @param workRoot parent of the extraction directories; {@code null} for the
     *                 system temporary directory
     */
    public PreferencePackageImporter(Path workRoot) {
        this.workRoot = workRoot;
    }

    /**
     * @throws PreferencePackageException if the archive cannot be read or extracted,
     *                                    holds no settings document, or references a
     *                                    certificate it does not contain
     * @throws com.questrail.cot.tls.DependencyMissingException if the package carries
     *         certificates and the crypto toolkit is unavailable
     */
    public ImportedPreferences importPackage(Path archive) {
        if (!Files.isRegularFile(archive)) {
            throw new PreferencePackageException("Preference package not found: " + archive);
        }
        Path dir = createWorkDirectory();
        try {
            extract(archive, dir);

            Path document = findSettingsDocument(dir)
                    .orElseThrow(() -> new PreferencePackageException(
                            "No settings document (settings.ini, *.ini or *.pref) in " + archive));
            log.debug("Reading settings from {}", dir.relativize(document));

            Map<String, String> settings = new LinkedHashMap<>(SettingsDocuments.parse(document));
            boolean hasCertificates = false;
            for (String key : SettingsDocuments.PATH_KEYS) {
                String value = settings.get(key);
                if (value != null) {
                    settings.put(key, locate(dir, value, archive).toString());
                    hasCertificates = true;
                }
            }
            if (hasCertificates) {
                CryptoSupport.requireBouncyCastle();
            }

            log.info("Imported preference package {} ({} settings) into {}", archive.getFileName(), settings.size(), dir);
            return new ImportedPreferences(settings, dir);
        } catch (RuntimeException e) {
            deleteRecursively(dir);
            throw e;
        }
    }

    private Path createWorkDirectory() {
        try {
            if (workRoot != null) {
                Files.createDirectories(workRoot);
                return Files.createTempDirectory(workRoot, "cot-pref-");
            }
            return Files.createTempDirectory("cot-pref-");
        } catch (IOException e) {
            throw new PreferencePackageException("Cannot create extraction directory", e);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Could not remove extraction directory {}: {}", dir, e.toString());
        }
    }

    private static void extract(Path archive, Path dir) {
        int entries = 0;
        try (InputStream in = Files.newInputStream(archive);
             ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path target = dir.resolve(entry.getName()).normalize();
                if (!target.startsWith(dir)) {
                    throw new PreferencePackageException("Archive entry escapes the extraction directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                }
                entries++;
            }
        } catch (NoSuchFileException e) {
            throw new PreferencePackageException("Preference package not found: " + archive, e);
        } catch (ZipException e) {
            throw new PreferencePackageException("Not a valid zip archive: " + archive, e);
        } catch (IOException e) {
            throw new PreferencePackageException("Cannot extract " + archive, e);
        }
        if (entries == 0) {
            throw new PreferencePackageException("Not a zip archive, or empty: " + archive);
        }
    }

    static Optional<Path> findSettingsDocument(Path dir) {
        List<Path> files = listFiles(dir);
        return firstMatch(files, p -> p.getFileName().toString().equalsIgnoreCase("settings.ini"))
                .or(() -> firstMatch(files, SettingsDocuments::isIni))
                .or(() -> firstMatch(files, SettingsDocuments::isPref));
    }

    static Path locate(Path dir, String reference, Path archive) {
        Path direct = dir.resolve(reference).normalize();
        if (direct.startsWith(dir) && Files.isRegularFile(direct)) {
            return direct.toAbsolutePath();
        }
        Path name = Path.of(reference.replace('\\', '/')).getFileName();
        if (name != null) {
            Optional<Path> byName = firstMatch(listFiles(dir), p -> p.getFileName().equals(name));
            if (byName.isPresent()) {
                return byName.get().toAbsolutePath();
            }
        }
        throw new PreferencePackageException("Certificate " + reference + " is referenced but not contained in " + archive);
    }

    private static Optional<Path> firstMatch(List<Path> files, Predicate<Path> filter) {
        return files.stream().filter(filter).findFirst();
    }

    private static List<Path> listFiles(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .sorted(Comparator.comparingInt(Path::getNameCount).thenComparing(Comparator.naturalOrder()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PreferencePackageException("Cannot list " + dir, e);
        }
    }
}
