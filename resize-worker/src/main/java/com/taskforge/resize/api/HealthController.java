package com.taskforge.resize.api;

import com.taskforge.resize.infrastructure.health.HealthAggregator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "Worker Health")
public class HealthController {
  private final HealthAggregator health;

  public HealthController(HealthAggregator health) { this.health = health; }

  @GetMapping("/live")
  @Operation(summary = "Liveness of the worker process")
  public Map<String, String> live() {
    return Map.of("status", "Alive");
  }

  @GetMapping("/health")
  @Operation(summary = "Reachability of the broker and the cache store",
      responses = {
          @ApiResponse(responseCode = "200", description = "All dependencies UP"),
          @ApiResponse(responseCode = "500", description = "At least one dependency DOWN")
      })
  public ResponseEntity<HealthAggregator.Report> health() {
    HealthAggregator.Report report = health.check();
    HttpStatus status = report.healthy() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
    return ResponseEntity.status(status).body(report);
  }
}
