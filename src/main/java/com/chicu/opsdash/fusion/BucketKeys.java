package com.chicu.opsdash.fusion;

import com.chicu.opsdash.common.time.LenientTimestamps;

import java.time.Instant;
import java.util.Optional;

/** Ключ бакета как момент времени: ISO-8601 или epoch millis числом */
final class BucketKeys {

    /** меньшие числа - номера бакетов, не время */
    private static final double EPOCH_MILLIS_MIN = 1e9;

    private BucketKeys() {
    }

    /**
     * @return пусто для ключей, которые не похожи на время ("0", "h1", "morning")
     */
    static Optional<Instant> toInstant(String bucketKey) {
        if (bucketKey == null || bucketKey.isBlank()) {
            return Optional.empty();
        }
        String s = bucketKey.trim();
        try {
            double v = Double.parseDouble(s);
            if (!Double.isFinite(v) || v <= EPOCH_MILLIS_MIN) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochMilli((long) v));
        } catch (NumberFormatException e) {
            return LenientTimestamps.tryParse(s);
        }
    }
}
