package me.golemcore.timeseries.adapter.inbound.web.dto;

import me.golemcore.timeseries.domain.model.ServingStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthCheckResponse {
    private ServingStatus status;
}
