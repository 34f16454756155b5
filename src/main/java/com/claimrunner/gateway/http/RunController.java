package com.claimrunner.gateway.http;

import com.claimrunner.worker.RunTrigger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

@RestController
public class RunController {

    private final RunTrigger trigger;
    private final Clock clock;

    public RunController(RunTrigger trigger, Clock clock) {
        this.trigger = trigger;
        this.clock = clock;
    }

    @RequestMapping(path = "/run", method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.HEAD})
    public ResponseEntity<Map<String, String>> run(
            @RequestParam(name = "token", required = false) String token,
            @RequestHeader(name = "X-Run-Secret", required = false) String headerSecret) {
        var presented = token != null && !token.isEmpty() ? token : headerSecret;
        return switch (trigger.requestRun(presented)) {
            case UNAUTHORIZED -> ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "Unauthorized"));
            case ALREADY_RUNNING -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Run already in progress"));
            case STARTED -> ResponseEntity.ok(Map.of("status", "started", "ts", clock.instant().toString()));
        };
    }
}
