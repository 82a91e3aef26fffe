package com.chicu.opsdash.source;

import java.util.List;

/**
 * Таблица приоритетов имён полей.
 *
 * Апстрим несколько раз менял нейминг, поэтому каждое поле - упорядоченный
 * список ключей-кандидатов. Порядок = приоритет.
 */
public final class FieldAliases {

    private FieldAliases() {
    }

    // ---------- общие ----------
    public static final List<String> ID = List.of("id", "_id", "uuid");
    public static final List<String> TIMESTAMP = List.of("timestamp", "ts", "time", "created_at", "createdAt");
    public static final List<String> SEVERITY = List.of("severity", "level");
    public static final List<String> READ = List.of("read", "is_read");
    public static final List<String> EVENT = List.of("event", "event_type", "eventType");
    public static final List<String> DETAILS = List.of("details", "meta", "metadata");

    // ---------- alerts ----------
    public static final List<String> ALERT_TITLE = List.of("title", "type", "event");
    public static final List<String> ALERT_MESSAGE = List.of("message", "detail", "description");

    // ---------- notifications ----------
    public static final List<String> NOTIFICATION_TITLE = List.of("title", "subject");
    public static final List<String> NOTIFICATION_MESSAGE = List.of("message", "body", "text");

    // ---------- compliance ----------
    public static final List<String> COMPLIANCE_STATUS = List.of("status", "severity", "result");
    public static final List<String> COMPLIANCE_RULE = List.of("rule", "rule_type", "ruleType");
    public static final List<String> COMPLIANCE_TRADE = List.of("tradeId", "trade_id");
    public static final List<String> COMPLIANCE_USER = List.of("user", "actor", "user_id");

    // ---------- audit ----------
    public static final List<String> AUDIT_ACTION = List.of("action", "operation");
    public static final List<String> AUDIT_DETAILS = List.of("details", "detail", "message");
    public static final List<String> AUDIT_ACTOR = List.of("actor", "user");
    public static final List<String> AUDIT_SUCCESS = List.of("success", "ok");

    // ---------- anomalies ----------
    public static final List<String> ANOMALY_TYPE = List.of("type", "anomaly_type", "anomalyType");
    public static final List<String> ANOMALY_SYMBOL = List.of("symbol", "asset");
    public static final List<String> ANOMALY_CRITICAL = List.of("critical", "is_critical");
    public static final List<String> ANOMALY_ACK = List.of("acknowledged", "ack");

    // ---------- execution: общий ключ ----------
    public static final List<String> VENUE = List.of("venue", "exchange", "name");
    public static final List<String> BUCKET = List.of("bucket", "timeBucket", "t", "ts", "hour");
    public static final List<String> SYMBOL = List.of("symbol", "pair");

    // ---------- execution: latency ----------
    public static final List<String> P50_LATENCY = List.of("p50_latency_ms", "p50", "lat_p50", "p50_latency", "latencyMs", "latency");
    public static final List<String> P95_LATENCY = List.of("p95_latency_ms", "p95", "lat_p95", "p95_latency");
    public static final List<String> P50_SLIPPAGE = List.of("p50_slippage_bps", "slip_p50", "p50_slip");
    public static final List<String> P95_SLIPPAGE = List.of("p95_slippage_bps", "slip_p95", "p95_slip");
    public static final List<String> FILL_RATE = List.of("fill_rate", "fill", "fills", "fill_ratio");
    public static final List<String> DEPTH_USD = List.of("depth_usd", "depthUsd", "market_depth", "depth");

    // ---------- execution: impact ----------
    public static final List<String> PREDICTED_COST = List.of("predicted_cost", "pred_cost", "model_cost", "predictedCost");
    public static final List<String> REALIZED_COST = List.of("realized_cost", "realized", "impact", "slippage", "realizedCost");

    // ---------- venue health ----------
    public static final List<String> VENUE_LATENCY = List.of("latencyMs", "latency", "latency_ms");
    public static final List<String> VENUE_SPREAD = List.of("spread_bps", "spreadBps", "spread");

    // ---------- regime ----------
    public static final List<String> REGIME_LABEL = List.of("label", "regime", "name");
    public static final List<String> REGIME_START = List.of("start", "since", "from");
    public static final List<String> REGIME_CONFIDENCE = List.of("confidence", "conf");
    public static final List<String> MARKER_TS = List.of("ts", "time", "t");
    public static final List<String> MARKER_LABEL = List.of("label", "name");
}
