package com.gnovoa.matchsim.api;

import com.gnovoa.matchsim.api.dto.CreateMatchRequest;
import com.gnovoa.matchsim.api.dto.MatchCreatedResponse;
import com.gnovoa.matchsim.api.dto.SubstitutionRequest;
import com.gnovoa.matchsim.api.dto.TracesResponse;
import com.gnovoa.matchsim.core.MatchSnapshot;
import com.gnovoa.matchsim.events.MatchEvent;
import com.gnovoa.matchsim.model.TeamSide;
import com.gnovoa.matchsim.runner.MatchFacade;
import com.gnovoa.matchsim.sim.HalfTimeAdvisor;
import com.gnovoa.matchsim.stats.MatchStats;
import com.gnovoa.matchsim.stats.Scoreboard;
import com.gnovoa.matchsim.trace.AiTraceType;
import com.gnovoa.matchsim.trace.TraceQuery;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/matches")
public class MatchController {

    private final MatchFacade facade;

    public MatchController(MatchFacade facade) {
        this.facade = facade;
    }

    @PostMapping
    public ResponseEntity<MatchCreatedResponse> create(@RequestBody CreateMatchRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(facade.create(request));
    }

    @GetMapping("/{matchId}")
    public MatchSnapshot snapshot(@PathVariable String matchId) {
        return facade.snapshot(matchId);
    }

    @PostMapping("/{matchId}/advance")
    public MatchSnapshot advance(@PathVariable String matchId,
                                 @RequestParam(defaultValue = "1") int minutes) {
        if (minutes < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "minutes must be at least 1, got " + minutes);
        }
        return facade.advance(matchId, minutes);
    }

    @PostMapping("/{matchId}/finish")
    public MatchSnapshot finish(@PathVariable String matchId) {
        return facade.finish(matchId);
    }

    @DeleteMapping("/{matchId}")
    public ResponseEntity<Void> discard(@PathVariable String matchId) {
        facade.discard(matchId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{matchId}/substitutions")
    public MatchEvent substitute(@PathVariable String matchId, @RequestBody SubstitutionRequest request) {
        return facade.substitute(matchId, request);
    }

    @GetMapping("/{matchId}/events")
    public List<MatchEvent> events(@PathVariable String matchId) {
        return facade.events(matchId);
    }

    @GetMapping("/{matchId}/traces")
    public TracesResponse traces(@PathVariable String matchId,
                                 @RequestParam(required = false) Integer minute,
                                 @RequestParam(required = false) TeamSide team,
                                 @RequestParam(required = false) AiTraceType type) {
        return facade.traces(matchId, new TraceQuery(minute, team, type));
    }

    @GetMapping("/{matchId}/stats")
    public MatchStats stats(@PathVariable String matchId) {
        return facade.stats(matchId);
    }

    @GetMapping("/{matchId}/timeline")
    public Scoreboard timeline(@PathVariable String matchId,
                               @RequestParam(required = false) Integer upToMinute) {
        return facade.timeline(matchId, upToMinute);
    }

    @GetMapping("/{matchId}/half-time-hints")
    public HalfTimeAdvisor.HalfTimeHints halfTimeHints(@PathVariable String matchId,
                                                       @RequestParam(defaultValue = "HOME") TeamSide side) {
        return facade.halfTimeHints(matchId, side);
    }
}
