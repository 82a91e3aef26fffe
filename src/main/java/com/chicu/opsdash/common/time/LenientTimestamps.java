package com.chicu.opsdash.common.time;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Мягкий разбор временных меток из внешних источников.
 *
 * Понимает:
 *  - ISO-8601 instant / offset / zoned ("2024-01-01T00:00Z", "...+03:00")
 *  - локальные дату-время и дату (трактуются как UTC)
 *  - epoch millis / epoch seconds числом или строкой
 *
 * Нераспознанное значение → clock.instant() (parse) или пусто (tryParse).
 */
public class LenientTimestamps {

    /** Всё, что больше, считаем миллисекундами, иначе секундами */
    private static final long EPOCH_MILLIS_FLOOR = 100_000_000_000L;

    /** Числа меньше - не метка времени (индексы, часы и т.п.) */
    private static final double EPOCH_MIN = 1e9;

    /** Порядок важен: от строгого к самому мягкому */
    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> ZonedDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private final Clock clock;

    public LenientTimestamps(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /** Никогда не падает: мусор → текущее время */
    public Instant parse(String raw) {
        return tryParse(raw).orElseGet(clock::instant);
    }

    public Instant parse(Number epoch) {
        if (epoch == null) return clock.instant();
        return fromEpoch(epoch.doubleValue()).orElseGet(clock::instant);
    }

    public static Optional<Instant> tryParse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        if (s.isEmpty()) return Optional.empty();

        if (looksNumeric(s)) {
            try {
                return fromEpoch(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        for (Function<String, Instant> parser : PARSERS) {
            try {
                return Optional.of(parser.apply(s));
            } catch (DateTimeParseException e) {
                // следующий формат
                continue;
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> fromEpoch(double v) {
        if (!Double.isFinite(v) || v < EPOCH_MIN) {
            return Optional.empty();
        }
        long n = (long) v;
        return Optional.of(n >= EPOCH_MILLIS_FLOOR ? Instant.ofEpochMilli(n) : Instant.ofEpochSecond(n));
    }

    private static boolean looksNumeric(String s) {
        int start = (s.charAt(0) == '-' || s.charAt(0) == '+') ? 1 : 0;
        if (start >= s.length()) return false;
        boolean dot = false;
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '.' && !dot) {
                dot = true;
            } else if (!Character.isDigit(c)) {
                return false;
            }
        }
        return true;
    }
}
