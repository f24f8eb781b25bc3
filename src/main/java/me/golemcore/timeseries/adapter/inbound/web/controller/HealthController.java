package me.golemcore.timeseries.adapter.inbound.web.controller;

import me.golemcore.timeseries.adapter.inbound.web.dto.HealthCheckResponse;
import me.golemcore.timeseries.domain.service.HealthStatusRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Health checking protocol over HTTP. {@code Watch} is not offered.
 */
@RestController
@RequestMapping("/grpc.health.v1.Health")
@RequiredArgsConstructor
public class HealthController {

    private final HealthStatusRegistry registry;

    @GetMapping("/Check")
    public Mono<HealthCheckResponse> check(@RequestParam(value = "service", defaultValue = "") String service) {
        return Mono.fromCallable(() -> new HealthCheckResponse(registry.check(service)));
    }

    @GetMapping("/Watch")
    public Mono<HealthCheckResponse> watch(@RequestParam(value = "service", defaultValue = "") String service) {
        return Mono.fromCallable(() -> new HealthCheckResponse(registry.watch(service)));
    }
}
