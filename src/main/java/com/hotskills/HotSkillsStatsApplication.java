package com.hotskills;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * HotSkills statistics backend.
 *
 * Serves vacancy counts, salary ranges and hot skills per programming
 * language to the web front end.
 *
 * Architecture:
 * - REST API over a read-through aggregate resolver
 * - PostgreSQL snapshot tables, appended to by the collectors (read-only here)
 * - Redis cache with per-aggregate TTL
 * - Small connection pool (4) sized for a low-memory host
 */
@SpringBootApplication
public class HotSkillsStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(HotSkillsStatsApplication.class, args);
    }
}
