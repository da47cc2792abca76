package com.questrail.cot.prefs;

import com.questrail.cot.config.ConfigKeys;
import com.questrail.cot.transport.Destination;
import com.questrail.cot.transport.TransportException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsers for the two settings document formats found in preference packages.
 *
 * <ul>
 *   <li>INI: {@code KEY=value} lines. Section headers, blank lines and
 *       {@code #}/{@code ;} comments are skipped. A {@code PYTAK_} key prefix is
 *       dropped.</li>
 *   <li>TAK {@code .pref} XML: {@code <entry key="...">value</entry>} elements, of
 *       which the connection and certificate entries are mapped onto client keys.</li>
 * </ul>
 */
final class SettingsDocuments
{
    private static final String LEGACY_PREFIX = "PYTAK_";

    /** {@code .pref} entry key to client key; {@code connectString0} is handled separately. */
    private static final Map<String, String> PREF_KEYS = Map.of(
            "certificateLocation", ConfigKeys.TLS_CLIENT_CERT,
            "clientPassword", ConfigKeys.TLS_CLIENT_PASSWORD,
            "caLocation", ConfigKeys.TLS_CLIENT_CAFILE,
            "caPassword", ConfigKeys.TLS_CA_PASSWORD);

    /** Keys whose values name files inside the package. */
    static final List<String> PATH_KEYS = List.of(
            ConfigKeys.TLS_CLIENT_CERT, ConfigKeys.TLS_CLIENT_KEY, ConfigKeys.TLS_CLIENT_CAFILE);

    private SettingsDocuments() {}

    static boolean isIni(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".ini");
    }

    static boolean isPref(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pref");
    }

    static Map<String, String> parse(Path file) {
        return isPref(file) ? parsePref(file) : parseIni(file);
    }

    static Map<String, String> parseIni(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PreferencePackageException("Cannot read settings document " + file, e);
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";") || line.startsWith("[")) {
                continue;
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = line.substring(0, eq).strip().toUpperCase(Locale.ROOT);
            String value = line.substring(eq + 1).strip();
            if (key.startsWith(LEGACY_PREFIX)) {
                key = key.substring(LEGACY_PREFIX.length());
            }
            if (!value.isEmpty()) {
                out.put(key, value);
            }
        }
        return out;
    }

    static Map<String, String> parsePref(Path file) {
        Map<String, String> out = new LinkedHashMap<>();
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);

        try (InputStream in = Files.newInputStream(file)) {
            XMLStreamReader reader = factory.createXMLStreamReader(in);
            try {
                while (reader.hasNext()) {
                    if (reader.next() == XMLStreamConstants.START_ELEMENT && "entry".equals(reader.getLocalName())) {
                        String key = reader.getAttributeValue(null, "key");
                        String value = reader.getElementText().strip();
                        if (key != null && !value.isEmpty()) {
                            mapPrefEntry(key, value, out);
                        }
                    }
                }
            } finally {
                reader.close();
            }
        } catch (IOException | XMLStreamException e) {
            throw new PreferencePackageException("Cannot parse preference document " + file, e);
        }
        return out;
    }

    private static void mapPrefEntry(String key, String value, Map<String, String> out) {
        if ("connectString0".equals(key)) {
            try {
                out.put(ConfigKeys.COT_URL, Destination.connectStringToUrl(value));
            } catch (TransportException e) {
                throw new PreferencePackageException("Invalid connectString0: " + value, e);
            }
            return;
        }
        String mapped = PREF_KEYS.get(key);
        if (mapped != null) {
            out.put(mapped, value);
        }
    }
}
