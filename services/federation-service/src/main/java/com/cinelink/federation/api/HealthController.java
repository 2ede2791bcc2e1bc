package com.cinelink.federation.api;

import com.cinelink.federation.api.dto.HealthResponse;
import com.cinelink.federation.service.FederationGateway;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final FederationGateway gateway;

    public HealthController(FederationGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        HealthResponse response = gateway.health();
        HttpStatus status = response.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/")
    public Map<String, Object> index() {
        return gateway.index();
    }
}
