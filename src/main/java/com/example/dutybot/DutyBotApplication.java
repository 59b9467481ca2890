package com.example.dutybot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * dutyscdp-bot - on-call aggregation and change notification service.
 *
 * Architecture:
 * - Config Loader → config.toml ([loop] mandatory, [oncall] optional, [[sinks]], [notification])
 * - Provider Clients → Loop duty group, Grafana OnCall schedule
 * - Schedule Reconciler → per-provider polling, atomic snapshot, transition detection
 * - Notification Dispatcher → coalescing, retries with backoff, webhook and Loop sinks
 * - Duty Reminder → daily Loop mention until the person answers @take
 * - Webhook Server → /healthz, /ready, /duty, /events/{provider}
 *
 * Arguments: --config=path, --webhook-host=host, --webhook-port=port; any other
 * --key=value argument is passed to the Spring environment.
 */
@SpringBootApplication
@EnableScheduling
public class DutyBotApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔══════════════════════════════════════════════════╗
            ║         dutyscdp-bot v0.1.0                      ║
            ║         Loop / Grafana OnCall duty aggregator    ║
            ╚══════════════════════════════════════════════════╝
            """);
        SpringApplication.run(DutyBotApplication.class, args);
    }
}
