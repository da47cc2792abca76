package com.questrail.cot.model;

import com.questrail.cot.time.SystemWallClock;
import com.questrail.cot.time.WallClock;

import java.time.Duration;

/**
 * Factories for the well-known control events.
 */
public final class CotEvents
{
    /** Type used by ping, pong and deletion events. */
    public static final String TASKING_TYPE = "t-x-d-d";

    static final String DELETE_HOW = "h-g-i-g-o";

    private CotEvents() {}

    /**
     * Position report with the default type and how.
     *
     * @param callsign optional {@code <contact>} callsign; omitted when null
     */
    public static CotEvent event(String uid, CotPoint point, Duration staleAfter, String callsign) {
        return event(uid, point, staleAfter, callsign, SystemWallClock.INSTANCE);
    }

    public static CotEvent event(String uid, CotPoint point, Duration staleAfter, String callsign, WallClock clock) {
        return CotEvent.builder(clock)
                .uid(uid)
                .point(point == null ? CotPoint.origin() : point)
                .staleAfter(staleAfter == null ? CotEvent.DEFAULT_STALE : staleAfter)
                .callsign(callsign)
                .build();
    }

    /**
     * Greeting emitted once when a pipeline starts.
     *
     * @param hostId identity of this client; {@code takPing} when null or blank
     */
    public static CotEvent hello(String hostId) {
        return hello(hostId, SystemWallClock.INSTANCE);
    }

    public static CotEvent hello(String hostId, WallClock clock) {
        return hello(hostId, CotEvent.DEFAULT_STALE, clock);
    }

    public static CotEvent hello(String hostId, Duration staleAfter, WallClock clock) {
        String uid = hostId == null || hostId.isBlank() ? "takPing" : hostId;
        return CotEvent.builder(clock)
                .uid(uid)
                .type(TASKING_TYPE)
                .staleAfter(staleAfter)
                .build();
    }

    public static CotEvent takPong() {
        return takPong(SystemWallClock.INSTANCE);
    }

    public static CotEvent takPong(WallClock clock) {
        return CotEvent.builder(clock)
                .uid("takPong")
                .type(TASKING_TYPE)
                .staleAfter(Duration.ofHours(1))
                .noPoint()
                .build();
    }

    /**
     * Event instructing receivers to retract a previously sent event by uid, without
     * waiting for it to go stale.
     */
    public static CotEvent deletion(String targetUid) {
        return deletion(targetUid, SystemWallClock.INSTANCE);
    }

    public static CotEvent deletion(String targetUid, WallClock clock) {
        if (targetUid == null || targetUid.isBlank()) {
            throw new IllegalArgumentException("targetUid must not be blank");
        }
        String escaped = CotXml.escape(targetUid);
        return CotEvent.builder(clock)
                .uid(targetUid + "-delete")
                .type(TASKING_TYPE)
                .how(DELETE_HOW)
                .staleAfter(Duration.ofSeconds(20))
                .detail("<link uid=\"" + escaped + "\" relation=\"none\" type=\"none\"/><__forcedelete/>")
                .build();
    }
}
