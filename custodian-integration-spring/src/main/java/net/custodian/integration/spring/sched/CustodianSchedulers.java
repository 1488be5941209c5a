package net.custodian.integration.spring.sched;

import net.custodian.core.maintenance.MaintenanceService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class CustodianSchedulers {
    private final MaintenanceService maintenance;

    private Duration staleAfter = Duration.ofDays(1);

    public CustodianSchedulers(MaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${custodian.scheduler.maintenance-delay-ms:3600000}",
               initialDelayString = "${custodian.scheduler.maintenance-initial-delay-ms:60000}")
    public void maintenance() {
        maintenance.runOnce(staleAfter);
    }

    public void setStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
    }
}
