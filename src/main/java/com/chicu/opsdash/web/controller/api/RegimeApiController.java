package com.chicu.opsdash.web.controller.api;

import com.chicu.opsdash.regime.RegimeTimeline;
import com.chicu.opsdash.regime.RegimeTimelineService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ops/regimes")
public class RegimeApiController {

    private final RegimeTimelineService regimeService;

    @GetMapping
    public RegimeTimeline timeline() {
        return regimeService.timeline();
    }

    @PostMapping("/refresh")
    public RegimeTimeline refresh() {
        return regimeService.refresh();
    }
}
