package com.uctp.optimizer.advisory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.uctp.optimizer.config.AdvisoryProperties;
import com.uctp.optimizer.engine.operator.Heuristic;
import com.uctp.optimizer.engine.operator.HeuristicDistribution;
import com.uctp.optimizer.model.ConstraintWeights;
import com.uctp.optimizer.model.FeedbackSample;
import com.uctp.optimizer.model.RankedSubstitute;
import com.uctp.optimizer.strategy.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Advisor backed by the Gemini {@code generateContent} REST endpoint. Every
 * prompt asks for a JSON answer; overloaded responses are retried with a
 * doubling delay.
 */
public class GeminiAdvisoryService implements AdvisoryService {
    private static final Logger logger = LoggerFactory.getLogger(GeminiAdvisoryService.class);

    private final RestClient restClient;
    private final AdvisoryProperties properties;
    private final ObjectMapper objectMapper;

    public GeminiAdvisoryService(RestClient.Builder restClientBuilder, AdvisoryProperties properties,
                                 ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.baseUrl(properties.getBaseUrl()).build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Phase> proposePhaseStrategy(ProblemSummary summary) {
        String prompt = "You are an expert in hyper-heuristics for university timetabling.\n"
                + "Design a multi-phase strategy for a genetic algorithm. The total number of generations "
                + "should be around " + summary.getGenerationBudget() + ".\n\n"
                + "Problem details:\n"
                + "- Batches to schedule: " + summary.getBatchCount() + "\n"
                + "- Total classes to place: " + summary.getSessionCount() + "\n"
                + "- Available faculty: " + summary.getFacultyCount() + "\n"
                + "- Available rooms: " + summary.getRoomCount() + "\n"
                + "- Pinned constraints: " + summary.getPinnedAssignmentCount() + "\n\n"
                + "Available low-level heuristics are: SWAP_MUTATE, MOVE_MUTATE, SIMULATED_ANNEALING, "
                + "DAY_WISE_CROSSOVER.\n"
                + "Design a strategy with 2-4 phases. Each phase has 'generations' and 'heuristics', an object "
                + "mapping every heuristic name to its selection probability (summing to 1.0).\n"
                + "Early phases should explore (crossover, move), later phases should refine (swap, annealing).\n"
                + "Respond with a JSON array of phase objects.";

        JsonNode answer = generate(prompt);
        if (!answer.isArray() || answer.isEmpty()) {
            throw new AdvisoryException("Expected a non-empty JSON array of phases, got " + answer);
        }
        List<Phase> phases = new ArrayList<>();
        for (JsonNode node : answer) {
            phases.add(toPhase(node, phases.size() + 1));
        }
        logger.info("Advisor proposed {} phases", phases.size());
        return phases;
    }

    @Override
    public Optional<InterventionSuggestion> proposeIntervention(String bestTimetableSummary) {
        String prompt = "You are an expert scheduler helping a stuck genetic algorithm.\n"
                + "The fitness of a university timetable has stagnated and needs a creative, non-obvious swap "
                + "of two classes to escape the local optimum.\n\n"
                + "Class assignments of the current best timetable:\n"
                + bestTimetableSummary + "\n\n"
                + "Identify two classes to swap. Respond with a JSON object with the keys "
                + "\"classId1\" and \"classId2\".";

        JsonNode answer = generate(prompt);
        String first = answer.path("classId1").asText(null);
        String second = answer.path("classId2").asText(null);
        if (first == null || second == null) {
            logger.warn("Advisor intervention answer is missing class ids: {}", answer);
            return Optional.empty();
        }
        return Optional.of(new InterventionSuggestion(first, second));
    }

    @Override
    public ConstraintWeights tuneWeights(ConstraintWeights current, List<FeedbackSample> feedback) {
        String feedbackLines = feedback.stream()
                .map(sample -> "- Faculty " + sample.getFacultyId() + " gave a rating of " + sample.getRating()
                        + "/5. Comment: " + (sample.getComment() == null ? "N/A" : sample.getComment()))
                .collect(Collectors.joining("\n"));
        String prompt = "You are a university administrator tuning a timetable scheduling algorithm.\n"
                + "Higher weights mean a higher penalty.\n\n"
                + "Current weights:\n"
                + "- Student gap weight: " + current.getStudentGap() + "\n"
                + "- Faculty gap weight: " + current.getFacultyGap() + "\n"
                + "- Faculty workload variance weight: " + current.getFacultyWorkloadStdDev() + "\n"
                + "- Faculty preference violation weight: " + current.getFacultyPreference() + "\n\n"
                + "Recent faculty feedback:\n" + feedbackLines + "\n\n"
                + "Suggest subtly adjusted weights. Respond with a JSON object with the keys "
                + "\"studentGapWeight\", \"facultyGapWeight\", \"facultyWorkloadDistributionWeight\" and "
                + "\"facultyPreferenceWeight\".";

        JsonNode answer = generate(prompt);
        ConstraintWeights tuned = current.toBuilder()
                .studentGap(answer.path("studentGapWeight").asDouble(current.getStudentGap()))
                .facultyGap(answer.path("facultyGapWeight").asDouble(current.getFacultyGap()))
                .facultyWorkloadStdDev(answer.path("facultyWorkloadDistributionWeight")
                        .asDouble(current.getFacultyWorkloadStdDev()))
                .facultyPreference(answer.path("facultyPreferenceWeight").asDouble(current.getFacultyPreference()))
                .build();
        if (!tuned.isValid()) {
            throw new AdvisoryException("Advisor proposed invalid weights " + tuned);
        }
        logger.info("Advisor tuned weights to {}", tuned);
        return tuned;
    }

    @Override
    public List<SubstituteRanking> rankSubstitutes(String sessionDescription, List<RankedSubstitute> candidates) {
        ArrayNode candidateData = objectMapper.createArrayNode();
        for (RankedSubstitute candidate : candidates) {
            candidateData.addObject()
                    .put("id", candidate.getFaculty().getId())
                    .put("name", candidate.getFaculty().getName())
                    .put("workload", candidate.getWorkload())
                    .put("compactness", candidate.getScheduleGaps())
                    .put("canTeachOriginal", candidate.isCanTeachOriginal())
                    .put("isAllocatedToBatch", candidate.isAllocatedToBatch());
        }
        String prompt = "You are an expert university administrator finding the best substitute teacher.\n"
                + "A substitute is needed for " + sessionDescription + ".\n\n"
                + "Available candidates and their metrics:\n"
                + candidateData.toPrettyString() + "\n\n"
                + "Rank the candidates by these priorities:\n"
                + "1. High: can they teach the original subject (canTeachOriginal)?\n"
                + "2. High: are they already allocated to this batch (isAllocatedToBatch)?\n"
                + "3. Medium: a lower current workload is better.\n"
                + "4. Low: a lower compactness value keeps their day compact.\n"
                + "Respond with a JSON array of objects with the keys \"id\", \"score\" (integer 0-100) "
                + "and \"reasons\" (short positive strings).";

        JsonNode answer = generate(prompt);
        if (!answer.isArray()) {
            throw new AdvisoryException("Expected a JSON array of ranked substitutes, got " + answer);
        }
        List<SubstituteRanking> rankings = new ArrayList<>();
        for (JsonNode node : answer) {
            String id = node.path("id").asText(null);
            if (id == null) {
                continue;
            }
            List<String> reasons = new ArrayList<>();
            node.path("reasons").forEach(reason -> reasons.add(reason.asText()));
            rankings.add(new SubstituteRanking(id, node.path("score").asInt(0), reasons));
        }
        logger.info("Advisor ranked {} of {} substitutes", rankings.size(), candidates.size());
        return rankings;
    }

    private Phase toPhase(JsonNode node, int position) {
        int generations = node.path("generations").asInt(0);
        JsonNode heuristics = node.path("heuristics");
        if (generations <= 0 || !heuristics.isObject()) {
            throw new AdvisoryException("Malformed phase " + node);
        }
        Map<Heuristic, Double> weights = new EnumMap<>(Heuristic.class);
        heuristics.fields().forEachRemaining(entry -> {
            Heuristic heuristic = Heuristic.fromName(entry.getKey())
                    .orElseThrow(() -> new AdvisoryException("Unknown heuristic " + entry.getKey()));
            weights.put(heuristic, entry.getValue().asDouble());
        });
        try {
            return new Phase("advised-" + position, generations, HeuristicDistribution.of(weights));
        } catch (IllegalArgumentException e) {
            throw new AdvisoryException("Phase " + position + " has an unusable heuristic mix", e);
        }
    }

    /** Sends one prompt and parses the JSON text of the first candidate. */
    JsonNode generate(String prompt) {
        String text = callWithRetry(requestBody(prompt));
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new AdvisoryException("Advisor answer is not valid JSON", e);
        }
    }

    private String callWithRetry(ObjectNode body) {
        long delayMillis = properties.getRetryDelay().toMillis();
        int retriesLeft = properties.getRetries();
        while (true) {
            try {
                JsonNode response = restClient.post()
                        .uri("/models/{model}:generateContent", properties.getModel())
                        .header("x-goog-api-key", properties.getApiKey())
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(body)
                        .retrieve()
                        .body(JsonNode.class);
                return extractText(response);
            } catch (RestClientException e) {
                if (retriesLeft <= 0 || !isOverloaded(e)) {
                    throw new AdvisoryException("Gemini call failed: " + e.getMessage(), e);
                }
                logger.warn("Gemini overloaded, retrying in {} ms ({} retries left)", delayMillis, retriesLeft);
                sleep(delayMillis);
                retriesLeft--;
                delayMillis *= 2;
            }
        }
    }

    private ObjectNode requestBody(String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode contents = body.putArray("contents");
        contents.addObject().putArray("parts").addObject().put("text", prompt);
        body.putObject("generationConfig").put("responseMimeType", "application/json");
        return body;
    }

    private static String extractText(JsonNode response) {
        if (response == null) {
            throw new AdvisoryException("Gemini returned an empty response");
        }
        JsonNode text = response.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual()) {
            throw new AdvisoryException("Gemini response has no text part");
        }
        return text.asText();
    }

    private static boolean isOverloaded(RestClientException e) {
        if (e instanceof HttpServerErrorException
                && ((HttpServerErrorException) e).getStatusCode().value() == HttpStatus.SERVICE_UNAVAILABLE.value()) {
            return true;
        }
        return e.getMessage() != null && e.getMessage().toLowerCase().contains("overloaded");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdvisoryException("Interrupted while backing off", e);
        }
    }
}
