package com.chicu.opsdash.web.controller.api;

import com.chicu.opsdash.aggregate.AlertFeedSnapshot;
import com.chicu.opsdash.aggregate.CrossSourceAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ops/alerts")
public class AlertFeedApiController {

    private final CrossSourceAggregator aggregator;

    @GetMapping
    public AlertFeedSnapshot feed() {
        return aggregator.snapshot();
    }

    /** Внеочередной цикл сверки */
    @PostMapping("/refresh")
    public AlertFeedSnapshot refresh() {
        log.info("🌐 [API] alerts refresh");
        aggregator.refresh();
        return aggregator.snapshot();
    }

    /** key - поле key события в ленте, вида notifications:42 */
    @PostMapping("/{key}/read")
    public AlertFeedSnapshot markRead(@PathVariable String key) {
        aggregator.markRead(key);
        return aggregator.snapshot();
    }

    @PostMapping("/read-all")
    public AlertFeedSnapshot markAllRead() {
        aggregator.markAllRead();
        return aggregator.snapshot();
    }

    @PostMapping("/{key}/ack")
    public AlertFeedSnapshot acknowledge(@PathVariable String key) {
        aggregator.acknowledge(key);
        return aggregator.snapshot();
    }

    @DeleteMapping("/{key}")
    public AlertFeedSnapshot dismiss(@PathVariable String key) {
        aggregator.dismiss(key);
        return aggregator.snapshot();
    }
}
