package com.wayfarer.core.capability;

import com.wayfarer.core.llm.LlmService;
import com.wayfarer.core.model.AccommodationResults;
import com.wayfarer.core.model.ActivityResults;
import com.wayfarer.core.model.BudgetReport;
import com.wayfarer.core.model.DestinationResearch;
import com.wayfarer.core.model.FlightResults;
import com.wayfarer.core.model.QueryAnalysis;
import com.wayfarer.core.model.TaskKind;
import com.wayfarer.core.model.TransportationResults;
import com.wayfarer.core.state.PlanningState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Wires the LLM-backed capabilities and their prompts.
 */
@Configuration
public class CapabilityConfig {

    private static final Logger log = LoggerFactory.getLogger(CapabilityConfig.class);

    static final String QUERY_ANALYSIS_PROMPT = """
            You are the intake agent of a travel planner. Read the traveller's request and extract:
            - query: origin, destination (blank when the traveller has not chosen one),
              departureDate and returnDate (ISO dates, null when unknown), travelers (default 1),
              budget (total, null when unknown) and currency (default "USD").
              Copy the request verbatim into requestText.
            - preferences: interests (list) and values (free-form keys such as "lodging", "pace").
            - confidence: 0.0 to 1.0, how sure you are that you understood the request.
            - researchNeeded: true when the destination is missing or vague.

            Respond with valid JSON matching the schema provided.
            """;

    static final String DESTINATION_RESEARCH_PROMPT = """
            You are a destination research agent. Recommend one destination that fits the
            traveller's request and preferences, with a short summary and highlights.
            If the request allows several equally good places, leave destination blank and
            list them in alternatives.

            Respond with valid JSON matching the schema provided.
            """;

    static final String FLIGHT_PROMPT = """
            You are a flight search agent. Propose up to five realistic flight options for the
            trip below, cheapest first. Prices are per traveller in the trip currency.

            Respond with valid JSON matching the schema provided.
            """;

    static final String ACCOMMODATION_PROMPT = """
            You are an accommodation search agent. Propose up to five places to stay at the
            destination that match the traveller's preferences, with nightly rates and ratings (0-5).

            Respond with valid JSON matching the schema provided.
            """;

    static final String TRANSPORTATION_PROMPT = """
            You are a local transportation agent. Propose ways to get around the destination
            (transit passes, car rental, transfers) with estimated costs for the whole stay.

            Respond with valid JSON matching the schema provided.
            """;

    static final String ACTIVITIES_PROMPT = """
            You are an itinerary planner. Build a day-by-day itinerary for the trip below, one
            theme and a few activities per day, matched to the traveller's interests.

            Respond with valid JSON matching the schema provided.
            """;

    static final String BUDGET_PROMPT = """
            You are a budget manager. Estimate the total trip cost from the options below, broken
            down by category (flights, accommodation, transportation, activities), and say whether
            it fits the traveller's budget. With no budget given, withinBudget is true.

            Respond with valid JSON matching the schema provided.
            """;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService llmExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "llm-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Capability<QueryAnalysis> queryAnalysisCapability(LlmService llmService, ExecutorService llmExecutor) {
        return new LlmCapability<>("query-analysis", llmService, QUERY_ANALYSIS_PROMPT,
                (parameters, snapshot) -> "Travel request: " + snapshot.query().requestText(),
                QueryAnalysis.class, llmExecutor);
    }

    @Bean
    public Capability<DestinationResearch> destinationResearchCapability(LlmService llmService,
                                                                         ExecutorService llmExecutor) {
        return new LlmCapability<>("destination-research", llmService, DESTINATION_RESEARCH_PROMPT,
                CapabilityConfig::describeTrip, DestinationResearch.class, llmExecutor);
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(LlmService llmService, ExecutorService llmExecutor) {
        var registry = new CapabilityRegistry()
                .register(TaskKind.FLIGHT_SEARCH, new LlmCapability<>("flight-search", llmService,
                        FLIGHT_PROMPT, CapabilityConfig::describeTrip, FlightResults.class, llmExecutor))
                .register(TaskKind.ACCOMMODATION, new LlmCapability<>("accommodation-search", llmService,
                        ACCOMMODATION_PROMPT, CapabilityConfig::describeTrip, AccommodationResults.class, llmExecutor))
                .register(TaskKind.TRANSPORTATION, new LlmCapability<>("transportation-search", llmService,
                        TRANSPORTATION_PROMPT, CapabilityConfig::describeTrip, TransportationResults.class, llmExecutor))
                .register(TaskKind.ACTIVITIES, new LlmCapability<>("activity-planning", llmService,
                        ACTIVITIES_PROMPT, CapabilityConfig::describeTrip, ActivityResults.class, llmExecutor))
                .register(TaskKind.BUDGET, new LlmCapability<>("budget-management", llmService,
                        BUDGET_PROMPT, CapabilityConfig::describeTrip, BudgetReport.class, llmExecutor));
        log.info("Registered LLM capabilities for all task kinds");
        return registry;
    }

    /**
     * Renders task parameters as one {@code key: value} line each, in key order.
     */
    static String describeTrip(Map<String, String> parameters, PlanningState snapshot) {
        String trip = parameters.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
        return "Original request: " + snapshot.query().requestText() + "\n\n" + trip;
    }
}
