package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.triggerware.api.PolledQueryException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * CalendarSchedule
 * -----------------------------------------------------------------------------
 * A cron-like recurring schedule. Each field is {@code *} or a list of values
 * and ranges such as {@code 1,15} or {@code 9-17}.
 *
 * <p>Ranges: day 1-31, hour 0-23, minute 0-59, month 1-12, weekday 0-6
 * (Sunday is 0). The time zone is an IANA-style name such as
 * {@code America/New_York}.</p>
 */
public record CalendarSchedule(
        String days,
        String hours,
        String minutes,
        String months,
        String timezone,
        String weekdays
) implements PolledQuerySchedule {

    private static final Pattern TIMEZONE =
            Pattern.compile("^[A-Za-z]+(?:_[A-Za-z]+)*(?:/[A-Za-z]+(?:_[A-Za-z]+)*)*$");

    public static final String ANY = "*";

    public CalendarSchedule {
        Objects.requireNonNull(days, "days");
        Objects.requireNonNull(hours, "hours");
        Objects.requireNonNull(minutes, "minutes");
        Objects.requireNonNull(months, "months");
        Objects.requireNonNull(timezone, "timezone");
        Objects.requireNonNull(weekdays, "weekdays");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void validate() {
        validateField("day", days, 1, 31);
        validateField("hour", hours, 0, 23);
        validateField("minute", minutes, 0, 59);
        validateField("month", months, 1, 12);
        validateField("weekday", weekdays, 0, 6);
        if (!TIMEZONE.matcher(timezone).matches()) {
            throw new PolledQueryException("Invalid timezone format");
        }
    }

    @Override
    public JsonNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("days", days);
        node.put("hours", hours);
        node.put("minutes", minutes);
        node.put("months", months);
        node.put("timezone", timezone);
        node.put("weekdays", weekdays);
        return node;
    }

    private static void validateField(String unit, String value, int min, int max) {
        if (ANY.equals(value)) {
            return;
        }
        for (String item : value.split(",", -1)) {
            for (String part : item.split("-", -1)) {
                int parsed;
                try {
                    parsed = Integer.parseInt(part.trim());
                } catch (NumberFormatException e) {
                    throw new PolledQueryException("Invalid " + unit + " value: " + part, e);
                }
                if (parsed < min || parsed > max) {
                    throw new PolledQueryException(unit + " value out of range: " + part);
                }
            }
        }
    }

    public static final class Builder {
        private String days = ANY;
        private String hours = ANY;
        private String minutes = ANY;
        private String months = ANY;
        private String timezone = "UTC";
        private String weekdays = ANY;

        public Builder withDays(String days) {
            this.days = days;
            return this;
        }

        public Builder withHours(String hours) {
            this.hours = hours;
            return this;
        }

        public Builder withMinutes(String minutes) {
            this.minutes = minutes;
            return this;
        }

        public Builder withMonths(String months) {
            this.months = months;
            return this;
        }

        public Builder withTimezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder withWeekdays(String weekdays) {
            this.weekdays = weekdays;
            return this;
        }

        public CalendarSchedule build() {
            return new CalendarSchedule(days, hours, minutes, months, timezone, weekdays);
        }
    }
}
