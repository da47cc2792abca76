package com.questrail.cot.codec.impl;

import com.questrail.cot.model.CotEvent;
import com.questrail.cot.model.CotPoint;
import com.questrail.cot.model.CotTime;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Parses one XML {@code <event>} document back into a {@link CotEvent}.
 *
 * <p>Attributes are read with StAX, which also checks the document is well-formed.
 * The inner markup of {@code <detail>} is kept as raw text so unknown extensions
 * pass through untouched. DTDs and external entities are disabled.</p>
 */
final class XmlEventParser
{
    private static final XMLInputFactory FACTORY = newFactory();

    private XmlEventParser() {}

    /**
     * @throws IllegalArgumentException if the bytes are not a well-formed event
     */
    static CotEvent parse(byte[] frame) {
        String xml = new String(frame, StandardCharsets.UTF_8);
        XMLStreamReader reader = null;
        try {
            reader = FACTORY.createXMLStreamReader(new StringReader(xml));
            reader.nextTag();
            if (!"event".equals(reader.getLocalName())) {
                throw new IllegalArgumentException("Root element is <" + reader.getLocalName() + ">, expected <event>");
            }
            String type = required(reader, "type");
            String uid = required(reader, "uid");
            String how = optional(reader, "how", "");
            Instant time = CotTime.parse(required(reader, "time"));
            Instant start = CotTime.parse(optional(reader, "start", reader.getAttributeValue(null, "time")));
            Instant stale = CotTime.parse(required(reader, "stale"));

            CotPoint point = null;
            boolean hasDetail = false;
            int depth = 1;
            while (depth > 0) {
                int next = reader.next();
                if (next == XMLStreamConstants.START_ELEMENT) {
                    depth++;
                    if (depth == 2 && "point".equals(reader.getLocalName())) {
                        point = point(reader);
                    } else if (depth == 2 && "detail".equals(reader.getLocalName())) {
                        hasDetail = true;
                    }
                } else if (next == XMLStreamConstants.END_ELEMENT) {
                    depth--;
                }
            }

            String detail = hasDetail ? rawDetail(xml) : null;
            return new CotEvent(type, uid, how, time, start, stale, point, detail);
        } catch (XMLStreamException e) {
            throw new IllegalArgumentException("Malformed event XML: " + e.getMessage(), e);
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    throw new IllegalStateException("Failed to close XML reader", e);
                }
            }
        }
    }

    private static CotPoint point(XMLStreamReader reader) {
        return new CotPoint(
                number(reader, "lat", 0.0),
                number(reader, "lon", 0.0),
                number(reader, "hae", CotPoint.UNKNOWN),
                number(reader, "ce", CotPoint.UNKNOWN),
                number(reader, "le", CotPoint.UNKNOWN));
    }

    /**
     * Text between the {@code <detail>} start tag and the last {@code </detail>}.
     */
    static String rawDetail(String xml) {
        int open = indexOfStartTag(xml, "detail");
        if (open < 0) {
            return null;
        }
        int tagEnd = xml.indexOf('>', open);
        if (tagEnd < 0) {
            return null;
        }
        if (xml.charAt(tagEnd - 1) == '/') {
            return "";
        }
        int close = xml.lastIndexOf("</detail");
        if (close < tagEnd) {
            return "";
        }
        return xml.substring(tagEnd + 1, close);
    }

    private static int indexOfStartTag(String xml, String name) {
        String needle = "<" + name;
        int from = 0;
        while (true) {
            int idx = xml.indexOf(needle, from);
            if (idx < 0) {
                return -1;
            }
            int after = idx + needle.length();
            if (after < xml.length()) {
                char c = xml.charAt(after);
                if (c == '>' || c == '/' || Character.isWhitespace(c)) {
                    return idx;
                }
            }
            from = after;
        }
    }

    private static String required(XMLStreamReader reader, String name) {
        String value = reader.getAttributeValue(null, name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("<event> is missing attribute '" + name + "'");
        }
        return value;
    }

    private static String optional(XMLStreamReader reader, String name, String defaultValue) {
        String value = reader.getAttributeValue(null, name);
        return value == null ? defaultValue : value;
    }

    private static double number(XMLStreamReader reader, String name, double defaultValue) {
        String value = reader.getAttributeValue(null, name);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("<point> attribute '" + name + "' is not a number: " + value, e);
        }
    }

    private static XMLInputFactory newFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        return factory;
    }
}
