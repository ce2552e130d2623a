package com.pageanalytics;

import com.pageanalytics.command.PrecalculateStatsCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

/**
 * Page View Analytics Service
 * 
 * Answers grouped, top-N and time-series questions about blog views from
 * pre-calculated daily summaries instead of scanning raw events per request.
 * 
 * Architecture:
 * - Page views appended to an event table
 * - Daily summaries per (day, country) and (day, author), built by the precalc command or nightly schedule
 * - Range queries union per-day distinct blog sets for exact distinct counts
 * - Optional HyperLogLog sketches in Redis for approximate distinct counts
 * - Recompute lock (Redis / PostgreSQL advisory) so only one run per scope writes
 * - Redis cache for query results
 * 
 * Run with --precalc to build summaries and exit (see PrecalculateStatsCommand).
 */
@SpringBootApplication
@EnableScheduling
public class PageAnalyticsApplication {

    public static void main(String[] args) {
        boolean precalc = Arrays.stream(args).anyMatch(arg -> arg.equals("--" + PrecalculateStatsCommand.OPTION));
        
        if (!precalc) {
            SpringApplication.run(PageAnalyticsApplication.class, args);
            return;
        }
        
        SpringApplication application = new SpringApplication(PageAnalyticsApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext context = application.run(args);
        System.exit(SpringApplication.exit(context));
    }
}
