package org.netpreserve.mapcrawl.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Reads durations written as {@code 30s}, {@code 24h}, {@code 2d}, {@code 50ms} or ISO-8601 ({@code PT30S}).
 * A bare number is taken in the unit of the subclass: {@link Seconds} or {@link Hours}.
 */
public abstract class DurationDeserializer extends JsonDeserializer<Duration> {
    private final ChronoUnit numericUnit;

    protected DurationDeserializer(ChronoUnit numericUnit) {
        this.numericUnit = numericUnit;
    }

    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext ctx) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return ofUnits(jsonParser.getDoubleValue(), numericUnit);
        String text = jsonParser.getText().strip().toUpperCase(Locale.ROOT);
        try {
            return parse(text);
        } catch (DateTimeParseException | NumberFormatException e) {
            return (Duration) ctx.handleWeirdStringValue(Duration.class, jsonParser.getText(),
                    "expected a duration like 30s, 24h or 2d");
        }
    }

    public static Duration ofUnits(double amount, ChronoUnit unit) {
        return Duration.ofNanos(Math.round(amount * unit.getDuration().toNanos()));
    }

    static Duration parse(String text) {
        if (text.startsWith("P")) return Duration.parse(text);
        if (text.endsWith("D")) return Duration.ofDays(Long.parseLong(text.substring(0, text.length() - 1)));
        if (text.endsWith("MS")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2)));
        return Duration.parse("PT" + text);
    }

    public static class Seconds extends DurationDeserializer {
        public Seconds() {
            super(ChronoUnit.SECONDS);
        }
    }

    public static class Hours extends DurationDeserializer {
        public Hours() {
            super(ChronoUnit.HOURS);
        }
    }
}
