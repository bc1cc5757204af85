package dev.jobmatcher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobMatcherApplication implements CommandLineRunner {

    private final MatchRunner matchRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(JobMatcherApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            matchRunner.execute();
            log.info("Job Matcher exiting...");
            exitManager.exit(ExitManager.SUCCESS);
        } catch (Exception e) {
            log.error("Job Matcher failed: {}", e.getMessage(), e);
            exitManager.exit(ExitManager.FAILURE);
        }
    }
}
