package com.questrail.ical.model;

import com.questrail.ical.api.InvalidValueException;
import com.questrail.ical.api.Parameters;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 3.3.9 Period of Time: a start paired with either an explicit end or a
 * duration.
 *
 * <p>Start and end are both {@link DateTimeValue}s or both
 * {@link DateValue}s. A date period may only be shifted by whole days.</p>
 *
 * <p>Both forms are normalized on construction so that {@link #start()},
 * {@link #end()} and {@link #duration()} are always available;
 * {@link #byDuration()} remembers which form was supplied so it can be
 * written back the same way.</p>
 *
 * <p>Invariant: {@code start <= end}.</p>
 */
public final class PeriodValue implements PropertyValue
{
    private static final Duration DAY = Duration.ofDays(1);

    private final TemporalValue start;
    private final TemporalValue end;
    private final Duration duration;
    private final boolean byDuration;

    private PeriodValue(TemporalValue start, TemporalValue end, Duration duration, boolean byDuration) {
        if (compare(start, end) > 0) {
            throw new InvalidValueException(start + " / " + end, "PERIOD", "start is after end");
        }
        this.start = start;
        this.end = end;
        this.duration = duration;
        this.byDuration = byDuration;
    }

    /**
     * Explicit form: {@code start/end}.
     *
     * @throws InvalidValueException if start is after end, the operands are
     *         not both dates or both date-times, or only one side is zoned
     */
    public static PeriodValue between(TemporalValue start, TemporalValue end) {
        requireAnchor(start, "start");
        requireAnchor(end, "end");
        return new PeriodValue(start, end, until(start, end), false);
    }

    /**
     * Duration form: {@code start/duration}.
     *
     * @throws InvalidValueException if the duration is negative, is not whole
     *         days for a date start, or moves the end out of range
     */
    public static PeriodValue of(TemporalValue start, Duration duration) {
        requireAnchor(start, "start");
        Objects.requireNonNull(duration, "duration");
        Duration exact = new DurationValue(duration).duration();
        return new PeriodValue(start, shift(start, exact), exact, true);
    }

    /**
     * Builds a period from a start and a second operand that is either a
     * date, a date-time or a {@link DurationValue}.
     *
     * @throws InvalidValueException for any other operand variant
     */
    public static PeriodValue of(TemporalValue start, TemporalValue endOrDuration) {
        Objects.requireNonNull(endOrDuration, "endOrDuration");
        if (endOrDuration instanceof DurationValue d) {
            return of(start, d.duration());
        }
        return between(start, endOrDuration);
    }

    public TemporalValue start() {
        return start;
    }

    public TemporalValue end() {
        return end;
    }

    public Duration duration() {
        return duration;
    }

    public boolean byDuration() {
        return byDuration;
    }

    /**
     * Two periods overlap iff the later-starting one starts within
     * {@code [earlier.start, earlier.end)}. The relation is symmetric.
     *
     * @throws InvalidValueException if one period is date based and the other
     *         date-time based
     */
    public boolean overlaps(PeriodValue other) {
        Objects.requireNonNull(other, "other");
        if (compare(start, other.start) > 0) {
            return other.overlaps(this);
        }
        return compare(other.start, end) < 0;
    }

    @Override
    public String typeName() {
        return "PERIOD";
    }

    @Override
    public Parameters parameters() {
        Parameters p = new Parameters();
        if (start instanceof DateTimeValue moment) {
            Timezones.tzidOf(moment.zone()).ifPresent(tzid -> p.put(Parameters.TZID, tzid));
        }
        return p;
    }

    // ------------------------------------------------------------------------
    // Operand arithmetic
    // ------------------------------------------------------------------------

    private static void requireAnchor(TemporalValue v, String role) {
        Objects.requireNonNull(v, role);
        if (!(v instanceof DateValue) && !(v instanceof DateTimeValue)) {
            throw new InvalidValueException(v.toString(), "PERIOD",
                    "period " + role + " must be a DATE or a DATE-TIME, got " + v.typeName());
        }
    }

    private static int compare(TemporalValue a, TemporalValue b) {
        if (a instanceof DateValue da && b instanceof DateValue db) {
            return da.date().compareTo(db.date());
        }
        if (a instanceof DateTimeValue ma && b instanceof DateTimeValue mb) {
            return ma.compareMoment(mb);
        }
        throw mixed(a, b);
    }

    private static Duration until(TemporalValue start, TemporalValue end) {
        if (start instanceof DateValue ds && end instanceof DateValue de) {
            return Duration.ofDays(ChronoUnit.DAYS.between(ds.date(), de.date()));
        }
        if (start instanceof DateTimeValue ms && end instanceof DateTimeValue me) {
            return ms.until(me);
        }
        throw mixed(start, end);
    }

    private static InvalidValueException mixed(TemporalValue a, TemporalValue b) {
        return new InvalidValueException(a + " / " + b, "PERIOD",
                "cannot mix " + a.typeName() + " and " + b.typeName());
    }

    private static TemporalValue shift(TemporalValue start, Duration duration) {
        try {
            if (start instanceof DateValue date) {
                if (duration.toSeconds() % DAY.toSeconds() != 0) {
                    throw new InvalidValueException(start + " + " + duration, "PERIOD",
                            "a DATE period needs a whole number of days");
                }
                LocalDate shifted = date.date().plusDays(duration.toDays());
                return new DateValue(shifted);
            }
            return ((DateTimeValue) start).plus(duration);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidValueException(start + " + " + duration, "PERIOD", "end is out of range", e);
        } catch (InvalidValueException e) {
            if ("PERIOD".equals(e.typeName())) {
                throw e;
            }
            throw new InvalidValueException(start + " + " + duration, "PERIOD", "end is out of range", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeriodValue that)) return false;
        return byDuration == that.byDuration
                && start.equals(that.start)
                && end.equals(that.end)
                && duration.equals(that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, duration, byDuration);
    }

    @Override
    public String toString() {
        return "PeriodValue[start=" + start + ", " + (byDuration ? "duration=" + duration : "end=" + end) + "]";
    }
}
