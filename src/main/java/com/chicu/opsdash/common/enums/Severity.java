package com.chicu.opsdash.common.enums;

import java.util.Locale;
import java.util.Map;

/** Уровень важности события в ленте дашборда */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    SUCCESS;

    private static final Map<String, Severity> ALIASES = Map.of(
            "info", INFO,
            "warning", WARNING,
            "warn", WARNING,
            "error", ERROR,
            "critical", ERROR,
            "fatal", ERROR,
            "success", SUCCESS,
            "ok", SUCCESS
    );

    /**
     * Разбор уровня из произвольной строки источника.
     * Неизвестное или пустое значение → INFO.
     */
    public static Severity from(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        Severity s = ALIASES.get(raw.trim().toLowerCase(Locale.ROOT));
        return s != null ? s : INFO;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
