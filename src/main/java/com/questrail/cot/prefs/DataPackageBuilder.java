package com.questrail.cot.prefs;

import com.questrail.cot.model.CotXml;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes TAK data packages: a zip holding the given files plus a
 * {@code MANIFEST/manifest.xml} ({@code MissionPackageManifest} version 2).
 *
 * <pre>{@code
 * new DataPackageBuilder("Client config")
 *         .addFile(Path.of("settings.ini"))
 *         .addFile(Path.of("client.p12"))
 *         .writeTo(Path.of("client-config.zip"));
 * }</pre>
 */
public final class DataPackageBuilder
{
    static final String MANIFEST_ENTRY = "MANIFEST/manifest.xml";

    private final String name;
    private String uid = UUID.randomUUID().toString();
    private boolean onReceiveDelete;
    private final List<Content> contents = new ArrayList<>();

    private record Content(Path file, String zipEntry, boolean ignore) {}

    public DataPackageBuilder(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public DataPackageBuilder uid(String uid) {
        this.uid = Objects.requireNonNull(uid, "uid");
        return this;
    }

    public DataPackageBuilder onReceiveDelete(boolean onReceiveDelete) {
        this.onReceiveDelete = onReceiveDelete;
        return this;
    }

    public DataPackageBuilder addFile(Path file) {
        return addFile(file, file.getFileName().toString(), false);
    }

    /**
     * @param zipEntry name inside the archive
     * @param ignore   marks the entry as not to be imported by the receiver
     * @throws PreferencePackageException if {@code file} does not exist
     */
    public DataPackageBuilder addFile(Path file, String zipEntry, boolean ignore) {
        if (!Files.isRegularFile(file)) {
            throw new PreferencePackageException("File not found: " + file);
        }
        contents.add(new Content(file, zipEntry.replace('\\', '/'), ignore));
        return this;
    }

    /**
     * Adds every file under {@code dir}, named by its path relative to {@code dir}.
     *
     * @param ignoreSubstring files whose name contains this are skipped; may be null
     */
    public DataPackageBuilder addDirectory(Path dir, boolean recursive, String ignoreSubstring) {
        if (!Files.isDirectory(dir)) {
            throw new PreferencePackageException("Directory not found: " + dir);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(dir, recursive ? Integer.MAX_VALUE : 1)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new PreferencePackageException("Cannot list " + dir, e);
        }
        for (Path f : files) {
            if (ignoreSubstring != null && f.getFileName().toString().contains(ignoreSubstring)) {
                continue;
            }
            addFile(f, dir.relativize(f).toString(), false);
        }
        return this;
    }

    String manifestXml() {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version='1.0' encoding='UTF-8'?>\n");
        sb.append("<MissionPackageManifest version=\"2\">\n");
        sb.append("  <Configuration>\n");
        parameter(sb, "uid", uid);
        parameter(sb, "name", name);
        parameter(sb, "onReceiveDelete", Boolean.toString(onReceiveDelete));
        sb.append("  </Configuration>\n");
        sb.append("  <Contents>\n");
        for (Content c : contents) {
            sb.append("    <Content ignore=\"").append(c.ignore())
              .append("\" zipEntry=\"").append(CotXml.escape(c.zipEntry())).append("\" />\n");
        }
        sb.append("  </Contents>\n");
        sb.append("</MissionPackageManifest>\n");
        return sb.toString();
    }

    /**
     * @return {@code zipFile}
     * @throws PreferencePackageException if the archive cannot be written
     */
    public Path writeTo(Path zipFile) {
        try {
            Path parent = zipFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(zipFile);
                 ZipOutputStream zip = new ZipOutputStream(out)) {
                for (Content c : contents) {
                    zip.putNextEntry(new ZipEntry(c.zipEntry()));
                    Files.copy(c.file(), zip);
                    zip.closeEntry();
                }
                zip.putNextEntry(new ZipEntry(MANIFEST_ENTRY));
                zip.write(manifestXml().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new PreferencePackageException("Cannot write data package " + zipFile, e);
        }
        return zipFile;
    }

    private static void parameter(StringBuilder sb, String name, String value) {
        sb.append("    <Parameter name=\"").append(name)
          .append("\" value=\"").append(CotXml.escape(value)).append("\" />\n");
    }
}
