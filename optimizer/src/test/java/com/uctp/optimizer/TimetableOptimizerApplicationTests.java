package com.uctp.optimizer;

import com.uctp.optimizer.advisory.AdvisoryService;
import com.uctp.optimizer.advisory.GuardedAdvisoryService;
import com.uctp.optimizer.demo.DemoProblems;
import com.uctp.optimizer.model.Candidate;
import com.uctp.optimizer.service.OptimizationOrchestrator;
import com.uctp.optimizer.service.PreflightDiagnosticsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "timetable.optimizer.seed=7",
        "timetable.optimizer.population-size=8",
        "timetable.optimizer.generation-budget=6"
})
class TimetableOptimizerApplicationTests {
    @Autowired
    private OptimizationOrchestrator orchestrator;

    @Autowired
    private PreflightDiagnosticsService diagnostics;

    @Autowired
    private AdvisoryService advisoryService;

    @Test
    void contextLoads() {
        assertThat(advisoryService).isInstanceOf(GuardedAdvisoryService.class);
    }

    @Test
    void optimizesTheDemoDepartment() {
        assertThat(diagnostics.diagnose(DemoProblems.smallDepartment())).isNotNull();

        List<Candidate> candidates = orchestrator.optimize(DemoProblems.smallDepartment());

        assertThat(candidates).isNotEmpty().hasSizeLessThanOrEqualTo(3);
    }
}
