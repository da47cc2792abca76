package com.questrail.cot.model;

import com.questrail.cot.time.SystemWallClock;
import com.questrail.cot.time.WallClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * CotEvent
 * =============================================================================
 * Semantic form of a Cursor-on-Target {@code <event>}.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code type}: CoT type hierarchy string (e.g. {@code a-f-G-U-C})</li>
 *   <li>{@code uid}: globally unique id of the thing being reported</li>
 *   <li>{@code how}: how the position was produced (e.g. {@code m-g})</li>
 *   <li>{@code time}, {@code start}, {@code stale}: creation time, validity start
 *       and staleness deadline</li>
 *   <li>{@code point}: position; {@code null} when the event carries none</li>
 *   <li>{@code detail}: raw inner XML of {@code <detail>}; {@code null} when the
 *       event has no detail element, empty when the element is empty</li>
 * </ul>
 *
 * <p>Instances are immutable. Use {@link #builder()} to construct events with the
 * standard timestamp triad.</p>
 */
public record CotEvent(
        String type,
        String uid,
        String how,
        Instant time,
        Instant start,
        Instant stale,
        CotPoint point,
        String detail
) implements CotPayload {

    public static final String DEFAULT_TYPE = "a-u-G";
    public static final String DEFAULT_HOW = "m-g";
    public static final Duration DEFAULT_STALE = Duration.ofSeconds(120);

    public CotEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(uid, "uid");
        Objects.requireNonNull(how, "how");
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(stale, "stale");
        if (uid.isBlank()) {
            throw new IllegalArgumentException("uid must not be blank");
        }
    }

    public Optional<CotPoint> pointIfPresent() {
        return Optional.ofNullable(point);
    }

    public Optional<String> detailIfPresent() {
        return Optional.ofNullable(detail);
    }

    /**
     * Returns {@code true} once {@code now} has reached the staleness deadline.
     */
    public boolean isStale(Instant now) {
        return !now.isBefore(stale);
    }

    public static Builder builder() {
        return new Builder(SystemWallClock.INSTANCE);
    }

    public static Builder builder(WallClock clock) {
        return new Builder(clock);
    }

    /**
     * Builds events whose {@code time} and {@code start} are "now" and whose
     * {@code stale} is "now + staleAfter", all truncated to microseconds.
     */
    public static final class Builder {
        private final WallClock clock;
        private String type = DEFAULT_TYPE;
        private String uid;
        private String how = DEFAULT_HOW;
        private Duration staleAfter = DEFAULT_STALE;
        private CotPoint point = CotPoint.origin();
        private String callsign;
        private String flowTag;
        private String detail;

        private Builder(WallClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder uid(String uid) {
            this.uid = uid;
            return this;
        }

        public Builder how(String how) {
            this.how = how;
            return this;
        }

        public Builder staleAfter(Duration staleAfter) {
            if (staleAfter.isNegative()) {
                throw new IllegalArgumentException("staleAfter must be non-negative");
            }
            this.staleAfter = staleAfter;
            return this;
        }

        public Builder point(CotPoint point) {
            this.point = point;
            return this;
        }

        public Builder noPoint() {
            this.point = null;
            return this;
        }

        /** Adds a {@code <contact callsign="..."/>} element to the detail. */
        public Builder callsign(String callsign) {
            this.callsign = callsign;
            return this;
        }

        /** Adds a {@code <_flow-tags_>} entry naming the originating host. */
        public Builder flowTag(String hostId) {
            this.flowTag = hostId;
            return this;
        }

        /** Raw inner XML of {@code <detail>}; appended after generated elements. */
        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public CotEvent build() {
            Instant now = CotTime.truncate(clock.now());
            return new CotEvent(
                    type,
                    uid,
                    how,
                    now,
                    now,
                    now.plus(staleAfter),
                    point,
                    composeDetail(now));
        }

        private String composeDetail(Instant now) {
            if (flowTag == null && callsign == null && detail == null) {
                return null;
            }
            StringBuilder sb = new StringBuilder();
            if (flowTag != null) {
                String attribute = (flowTag + "-cot").replace('@', '-');
                sb.append("<_flow-tags_ ").append(CotXml.escape(attribute))
                  .append("=\"").append(CotTime.format(now)).append("\"/>");
            }
            if (callsign != null) {
                sb.append("<contact callsign=\"").append(CotXml.escape(callsign)).append("\"/>");
            }
            if (detail != null) {
                sb.append(detail);
            }
            return sb.toString();
        }
    }
}
