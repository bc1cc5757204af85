package dev.jobmatcher;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.api.MatchRequest;
import dev.jobmatcher.api.MatchResponse;
import dev.jobmatcher.service.MatchingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a match request file, runs the matching engine and writes the response.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MatchRunner {

    private static final String SEPARATOR = "========================================";

    private final MatchingService matchingService;
    private final ObjectMapper objectMapper;

    @Value("${matcher.request-file:}")
    private String requestFile;

    @Value("${matcher.response-file:}")
    private String responseFile;

    /**
     * Executes one matching run.
     *
     * @return Number of matches returned
     */
    public int execute() {
        if (requestFile == null || requestFile.isBlank()) {
            log.warn("No request file configured (matcher.request-file) - nothing to match");
            return 0;
        }

        log.info(SEPARATOR);
        log.info("Job Matcher Starting");
        log.info(SEPARATOR);

        MatchRequest request = readRequest(Path.of(requestFile));
        MatchResponse response = matchingService.match(request).block();
        int count = response != null ? response.matchesFound() : 0;

        writeResponse(response);

        log.info(SEPARATOR);
        log.info("Job Matcher Completed Successfully");
        log.info("Matches found: {}", count);
        log.info(SEPARATOR);

        return count;
    }

    private MatchRequest readRequest(Path path) {
        try {
            log.info("Reading match request from {}", path.toAbsolutePath());
            return objectMapper.readValue(path.toFile(), MatchRequest.class);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read match request from " + path, e);
        }
    }

    private void writeResponse(MatchResponse response) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
            if (responseFile == null || responseFile.isBlank()) {
                System.out.println(json);
            } else {
                Files.writeString(Path.of(responseFile), json);
                log.info("Match response written to {}", responseFile);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not write match response", e);
        }
    }
}
