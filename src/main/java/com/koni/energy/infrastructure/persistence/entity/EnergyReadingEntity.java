package com.koni.energy.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the reading store table. Read-only for the alerting service.
 */
@Entity
@Table(
    name = "energy_readings",
    indexes = {
        @Index(
            name = "idx_energy_readings_device_ts",
            columnList = "user_id, device_id, ts DESC"
        )
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EnergyReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID ownerId;

    @Column(name = "device_id", nullable = false)
    private UUID deviceId;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Column(name = "power_w")
    private Double powerW;

    @Column(name = "voltage_v")
    private Double voltageV;

    @Column(name = "current_a")
    private Double currentA;

    @Column(name = "energy_wh")
    private Double energyWh;

    @Column(name = "source", nullable = false, length = 32)
    private String source;

    /**
     * Constructor for a reading with power only, as most devices report.
     */
    public EnergyReadingEntity(UUID ownerId, UUID deviceId, Instant timestamp, Double powerW) {
        this.ownerId = ownerId;
        this.deviceId = deviceId;
        this.timestamp = timestamp;
        this.powerW = powerW;
        this.source = "device";
    }
}
