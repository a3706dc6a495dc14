package com.gnovoa.matchsim.api;

import com.gnovoa.matchsim.api.dto.RoundRequest;
import com.gnovoa.matchsim.api.dto.RoundResponse;
import com.gnovoa.matchsim.core.FixtureRuntime;
import com.gnovoa.matchsim.runner.MatchFacade;
import com.gnovoa.matchsim.runner.MatchRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/rounds")
public class RoundController {

    private final MatchFacade facade;
    private final MatchRegistry registry;

    public RoundController(MatchFacade facade, MatchRegistry registry) {
        this.facade = facade;
        this.registry = registry;
    }

    @PostMapping
    public ResponseEntity<RoundResponse> start(@RequestBody RoundRequest request) {
        RoundResponse response = facade.startRound(request);
        HttpStatus status = response.fixtureId() == null ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/{fixtureId}")
    public ResponseEntity<List<FixtureRuntime.RunningMatch>> matches(@PathVariable String fixtureId) {
        return registry.fixture(fixtureId)
                .map(f -> ResponseEntity.ok(f.matches()))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{fixtureId}/stop")
    public ResponseEntity<Void> stop(@PathVariable String fixtureId) {
        return registry.fixture(fixtureId)
                .map(f -> {
                    f.stop(); // immediate
                    return ResponseEntity.accepted().<Void>build();
                })
                .orElse(ResponseEntity.notFound().build());
    }
}
