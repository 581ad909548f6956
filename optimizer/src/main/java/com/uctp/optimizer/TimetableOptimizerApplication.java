package com.uctp.optimizer;

import com.uctp.optimizer.demo.DemoProblems;
import com.uctp.optimizer.model.Candidate;
import com.uctp.optimizer.model.DiagnosticIssue;
import com.uctp.optimizer.model.OptimizationRequest;
import com.uctp.optimizer.service.OptimizationOrchestrator;
import com.uctp.optimizer.service.PreflightDiagnosticsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.List;

@SpringBootApplication
public class TimetableOptimizerApplication {
    private static final Logger logger = LoggerFactory.getLogger(TimetableOptimizerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TimetableOptimizerApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(name = "timetable.demo.enabled", havingValue = "true")
    public CommandLineRunner demoRun(PreflightDiagnosticsService diagnostics, OptimizationOrchestrator orchestrator) {
        return args -> {
            OptimizationRequest request = DemoProblems.smallDepartment();
            for (DiagnosticIssue issue : diagnostics.diagnose(request)) {
                logger.warn("[{}] {}: {}", issue.getSeverity(), issue.getTitle(), issue.getDescription());
            }
            List<Candidate> candidates = orchestrator.optimize(request);
            for (int i = 0; i < candidates.size(); i++) {
                logger.info("Candidate {}: {}", i + 1, candidates.get(i).getMetrics());
            }
        };
    }
}
