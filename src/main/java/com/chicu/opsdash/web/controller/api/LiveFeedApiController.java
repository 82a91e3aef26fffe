package com.chicu.opsdash.web.controller.api;

import com.chicu.opsdash.live.LiveChannelManager;
import com.chicu.opsdash.live.LiveChannelRegistry;
import com.chicu.opsdash.live.LiveChannelState;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ops/live")
public class LiveFeedApiController {

    private final LiveChannelRegistry registry;

    @GetMapping
    public List<LiveChannelState> all() {
        return registry.all().stream().map(LiveChannelManager::snapshot).toList();
    }

    @GetMapping("/{feed}")
    public LiveChannelState feed(@PathVariable String feed) {
        return registry.get(feed).snapshot();
    }
}
