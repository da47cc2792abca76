package com.questrail.cot.codec.impl;

import com.questrail.cot.model.CotEvent;
import com.questrail.cot.model.CotPoint;
import com.questrail.cot.model.CotTime;
import com.questrail.cot.model.CotXml;

import java.nio.charset.StandardCharsets;

/**
 * Renders a {@link CotEvent} as a standalone XML document.
 *
 * <p>The {@code detail} string is emitted verbatim; it is the producer's job to
 * make it well-formed.</p>
 */
final class XmlEventWriter
{
    static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\" ?>";

    private XmlEventWriter() {}

    static byte[] toBytes(CotEvent event) {
        return toXml(event).getBytes(StandardCharsets.UTF_8);
    }

    static String toXml(CotEvent event) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(DECLARATION).append('\n');
        sb.append("<event version=\"2.0\"");
        attribute(sb, "type", event.type());
        attribute(sb, "uid", event.uid());
        attribute(sb, "how", event.how());
        attribute(sb, "time", CotTime.format(event.time()));
        attribute(sb, "start", CotTime.format(event.start()));
        attribute(sb, "stale", CotTime.format(event.stale()));
        sb.append('>');

        CotPoint p = event.point();
        if (p != null) {
            sb.append("<point");
            attribute(sb, "lat", Double.toString(p.lat()));
            attribute(sb, "lon", Double.toString(p.lon()));
            attribute(sb, "hae", Double.toString(p.hae()));
            attribute(sb, "ce", Double.toString(p.ce()));
            attribute(sb, "le", Double.toString(p.le()));
            sb.append("/>");
        }

        String detail = event.detail();
        if (detail != null) {
            if (detail.isEmpty()) {
                sb.append("<detail/>");
            } else {
                sb.append("<detail>").append(detail).append("</detail>");
            }
        }
        return sb.append("</event>").toString();
    }

    private static void attribute(StringBuilder sb, String name, String value) {
        sb.append(' ').append(name).append("=\"").append(CotXml.escape(value)).append('"');
    }
}
