package com.chicu.opsdash.web.controller.api;

import com.chicu.opsdash.snapshot.Snapshot;
import com.chicu.opsdash.snapshot.SnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ops/snapshots")
public class SnapshotApiController {

    private final SnapshotService snapshotService;

    @GetMapping
    public List<Snapshot> all() {
        return snapshotService.all();
    }

    @GetMapping("/{name}")
    public Snapshot one(@PathVariable String name) {
        return snapshotService.get(name);
    }
}
