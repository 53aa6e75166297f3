package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.triggerware.api.PolledQueryException;

import java.util.List;

/**
 * When the server evaluates a polled query: at a single instant, on a
 * recurring {@link CalendarSchedule}, or on any combination of those.
 */
public sealed interface PolledQuerySchedule permits CalendarSchedule, PolledQuerySchedule.At, PolledQuerySchedule.Composite
{
    /**
     * @throws PolledQueryException if any part of the schedule is malformed
     */
    void validate();

    JsonNode toJson();

    static PolledQuerySchedule at(long time) {
        return new At(time);
    }

    static PolledQuerySchedule of(List<PolledQuerySchedule> schedules) {
        return new Composite(schedules);
    }

    /**
     * A single trigger time, in the server's integer time encoding.
     */
    record At(long time) implements PolledQuerySchedule {
        @Override
        public void validate() {
            // any instant is accepted; the server rejects ones in the past
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(time);
        }
    }

    record Composite(List<PolledQuerySchedule> schedules) implements PolledQuerySchedule {
        public Composite {
            schedules = List.copyOf(schedules);
        }

        @Override
        public void validate() {
            schedules.forEach(PolledQuerySchedule::validate);
        }

        @Override
        public JsonNode toJson() {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            schedules.forEach(s -> array.add(s.toJson()));
            return array;
        }
    }
}
