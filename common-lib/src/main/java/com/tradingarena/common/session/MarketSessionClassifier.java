package com.tradingarena.common.session;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Maps an {@link Instant} to a US equity {@link MarketSession}.
 *
 * <h3>Session boundaries (America/New_York)</h3>
 * <pre>
 *   PRE_MARKET   04:00 – 09:30
 *   REGULAR      09:30 – 16:00
 *   AFTER_HOURS  16:00 – 20:00
 *   CLOSED       20:00 – 04:00, weekends
 * </pre>
 *
 * Exchange holidays are not modelled; a holiday is classified like any other weekday.
 */
public final class MarketSessionClassifier {

    public static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static final LocalTime PRE_OPEN     = LocalTime.of(4, 0);
    private static final LocalTime REGULAR_OPEN = LocalTime.of(9, 30);
    private static final LocalTime CLOSE        = LocalTime.of(16, 0);
    private static final LocalTime AFTER_CLOSE  = LocalTime.of(20, 0);

    private MarketSessionClassifier() {}

    public static MarketSession classify(Instant now) {
        ZonedDateTime ny = now.atZone(NEW_YORK);
        DayOfWeek dow = ny.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) return MarketSession.CLOSED;

        LocalTime time = ny.toLocalTime();
        if (time.isBefore(PRE_OPEN))     return MarketSession.CLOSED;
        if (time.isBefore(REGULAR_OPEN)) return MarketSession.PRE_MARKET;
        if (time.isBefore(CLOSE))        return MarketSession.REGULAR;
        if (time.isBefore(AFTER_CLOSE))  return MarketSession.AFTER_HOURS;
        return MarketSession.CLOSED;
    }

    public static boolean isMarketOpen(Instant now) {
        return classify(now).isOpen();
    }
}
