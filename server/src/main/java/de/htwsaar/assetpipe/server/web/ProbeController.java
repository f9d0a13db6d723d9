package de.htwsaar.assetpipe.server.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health- und Readiness-Probes.
 */
@RestController
public class ProbeController {

    /** @return HTTP 200 "ok" */
    @GetMapping("/healthz")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }

    /** @return HTTP 200 "ready" */
    @GetMapping("/readyz")
    public ResponseEntity<String> ready() {
        return ResponseEntity.ok("ready");
    }
}
