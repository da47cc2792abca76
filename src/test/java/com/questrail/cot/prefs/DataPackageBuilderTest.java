package com.questrail.cot.prefs;

import com.questrail.cot.config.ConfigKeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.junit.jupiter.api.Assertions.*;

class DataPackageBuilderTest
{
    @TempDir
    Path dir;

    @Test
    void manifestListsEveryEntry() throws Exception {
        Path ini = Files.writeString(dir.resolve("settings.ini"), "COT_URL=tcp://tak.example:8087\n");
        Path cert = Files.writeString(dir.resolve("client.p12"), "bundle");

        String manifest = new DataPackageBuilder("Ops & Intel")
                .uid("pkg-1")
                .addFile(ini)
                .addFile(cert, "certs/client.p12", true)
                .manifestXml();

        assertTrue(manifest.contains("<MissionPackageManifest version=\"2\">"));
        assertTrue(manifest.contains("<Parameter name=\"uid\" value=\"pkg-1\" />"));
        assertTrue(manifest.contains("<Parameter name=\"name\" value=\"Ops &amp; Intel\" />"));
        assertTrue(manifest.contains("<Parameter name=\"onReceiveDelete\" value=\"false\" />"));
        assertTrue(manifest.contains("<Content ignore=\"false\" zipEntry=\"settings.ini\" />"));
        assertTrue(manifest.contains("<Content ignore=\"true\" zipEntry=\"certs/client.p12\" />"));
    }

    @Test
    void writtenPackageIsImportable() throws Exception {
        Path source = Files.createDirectories(dir.resolve("src"));
        Files.writeString(source.resolve("settings.ini"),
                "COT_URL=tls://tak.example:8089\nTLS_CLIENT_CERT=client.p12\n");
        Files.writeString(source.resolve("client.p12"), "bundle");
        Files.writeString(source.resolve("notes.bak"), "skip me");

        Path zip = new DataPackageBuilder("client")
                .addDirectory(source, false, ".bak")
                .writeTo(dir.resolve("out/client.zip"));

        try (ZipFile file = new ZipFile(zip.toFile())) {
            List<String> names = new ArrayList<>();
            for (ZipEntry e : Collections.list(file.entries())) {
                names.add(e.getName());
            }
            assertEquals(List.of("client.p12", "settings.ini", DataPackageBuilder.MANIFEST_ENTRY), names);
            String manifest = new String(file.getInputStream(file.getEntry(DataPackageBuilder.MANIFEST_ENTRY)).readAllBytes(),
                    StandardCharsets.UTF_8);
            assertFalse(manifest.contains("notes.bak"));
        }

        ImportedPreferences prefs = new PreferencePackageImporter(dir.resolve("work")).importPackage(zip);
        assertEquals("tls://tak.example:8089", prefs.settings().get(ConfigKeys.COT_URL));
        assertTrue(Files.isRegularFile(Path.of(prefs.settings().get(ConfigKeys.TLS_CLIENT_CERT))));
    }

    @Test
    void missingFileIsRejected() {
        DataPackageBuilder builder = new DataPackageBuilder("client");
        assertThrows(PreferencePackageException.class, () -> builder.addFile(dir.resolve("absent.ini")));
    }
}
