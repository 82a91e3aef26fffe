package com.chicu.opsdash.fusion;

import com.chicu.opsdash.common.time.TimeRange;
import com.chicu.opsdash.common.time.TimeWindow;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Параметры одного прогона heatmap.
 * Явный range важнее именованного окна.
 */
@Value
@Builder(toBuilder = true)
public class FusionQuery {

    public static final String CUSTOM_WINDOW = "custom";

    /** null/пусто = все площадки */
    String venue;

    /** null/пусто = все символы */
    String symbol;

    @Builder.Default
    TimeWindow window = TimeWindow.H1;

    TimeRange range;

    public boolean hasRange() {
        return range != null;
    }

    public String windowCode() {
        return hasRange() ? CUSTOM_WINDOW : window.getCode();
    }

    public boolean hasVenue() {
        return venue != null && !venue.isBlank();
    }

    public boolean hasSymbol() {
        return symbol != null && !symbol.isBlank();
    }

    /** venue, symbol и window=<code> либо from/to в epoch ms + window=custom */
    public Map<String, String> toUpstreamQuery() {
        Map<String, String> q = new LinkedHashMap<>();
        if (hasVenue()) q.put("venue", venue.trim());
        if (hasSymbol()) q.put("symbol", symbol.trim());
        if (hasRange()) {
            q.put("from", String.valueOf(range.from().toEpochMilli()));
            q.put("to", String.valueOf(range.to().toEpochMilli()));
        }
        q.put("window", windowCode());
        return q;
    }
}
