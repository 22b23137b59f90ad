package com.wayfarer.dispatch.cli;

import com.wayfarer.core.engine.RunResult;
import com.wayfarer.core.events.WayfarerEvent;
import com.wayfarer.core.model.*;
import com.wayfarer.core.state.PlanningState;
import picocli.CommandLine;

import java.math.BigDecimal;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Wayfarer CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WAYFARER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WAYFARER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void section(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
    }

    /**
     * Prints the plan, alerts and outcome of a run.
     */
    public static void runResult(RunResult result) {
        PlanningState state = result.state();
        System.out.println();
        System.out.println("RUN " + result.runId());
        System.out.println("Request: " + state.query().requestText());
        System.out.println("Destination: " + (state.destination() != null ? state.destination() : "-"));
        plan(state.plan());

        if (!state.plan().alerts().isEmpty()) {
            section("Alerts (" + state.plan().alerts().size() + ")");
            state.plan().alerts().forEach(a -> warn(a));
        }

        System.out.println();
        switch (result.status()) {
            case COMPLETED -> success("Plan complete.");
            case AWAITING_INPUT -> {
                Interruption interruption = state.interruption();
                info("Awaiting input: " + (interruption != null ? interruption.reason() : "-"));
                info("Continue with: wayfarer resume " + result.runId() + " \"<answer>\"");
            }
            case FAILED -> error("Planning failed.");
        }
    }

    public static void plan(TravelPlan plan) {
        DestinationResearch research = plan.destination();
        if (research != null && research.resolved()) {
            section("Destination");
            System.out.println("  " + research.destination() + (research.summary() != null ? ": " + research.summary() : ""));
            research.highlights().forEach(h -> System.out.println("    - " + h));
        }
        if (plan.flights() != null && !plan.flights().options().isEmpty()) {
            section("Flights");
            for (FlightOption f : plan.flights().options()) {
                System.out.printf("  %-12s %-8s %s -> %s  %s%n", f.airline(), f.flightNumber(),
                        f.origin(), f.destination(), f.price());
            }
        }
        if (plan.accommodation() != null && !plan.accommodation().options().isEmpty()) {
            section("Accommodation");
            for (AccommodationOption a : plan.accommodation().options()) {
                System.out.printf("  %-30s %-10s %s/night  %.1f%n", truncate(a.name(), 30), a.type(),
                        a.nightlyRate(), a.rating());
            }
        }
        if (plan.transportation() != null && !plan.transportation().options().isEmpty()) {
            section("Getting around");
            for (TransportOption t : plan.transportation().options()) {
                System.out.printf("  %-12s %s (%s)%n", t.mode(), truncate(t.description(), 50), t.estimatedCost());
            }
        }
        if (plan.activities() != null && !plan.activities().itineraries().isEmpty()) {
            section("Itinerary");
            for (DailyItinerary day : plan.activities().itineraries()) {
                System.out.println("  Day " + day.day() + ": " + day.theme());
                day.activities().forEach(a -> System.out.println("    - " + a));
            }
        }
        if (plan.budget() != null) {
            BudgetReport b = plan.budget();
            section("Budget");
            for (Map.Entry<String, BigDecimal> e : b.breakdown().entrySet()) {
                System.out.printf("  %-16s %s%n", e.getKey(), e.getValue());
            }
            String total = "Total: " + b.estimatedTotal() + " " + b.currency();
            if (b.withinBudget()) {
                success(total);
            } else {
                error(total + " (over budget)");
            }
        }
    }

    public static void watchEvent(WayfarerEvent event) {
        String prefix = switch (event.type()) {
            case RUN_CREATED -> "@|fg(cyan) [RUN]|@";
            case TASK_STARTED, TASK_COMPLETED -> "@|fg(blue) [TASK]|@";
            case TASK_FAILED -> "@|fg(red) [TASK]|@";
            case STAGE_RETRYING -> "@|fg(yellow) [RETRY]|@";
            case RUN_INTERRUPTED, RUN_RESUMED -> "@|fg(magenta) [INPUT]|@";
            case RUN_FAILED -> "@|fg(red),bold [FAILED]|@";
            case RUN_HALTED -> "@|fg(green),bold [HALTED]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.type().label())
                + " " + event.describe());
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
