package tech.noetzold.devpulse_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.devpulse_api.model.DefectAssessment;
import tech.noetzold.devpulse_api.model.DefectReport;
import tech.noetzold.devpulse_api.model.PrioritizedDefectList;
import tech.noetzold.devpulse_api.service.DefectTriageService;

import java.util.List;

@RestController
@RequestMapping("/triage")
@Tag(name = "Triage")
public class TriageController {

    private final DefectTriageService triageService;

    public TriageController(DefectTriageService triageService) {
        this.triageService = triageService;
    }

    @PostMapping("/assess")
    public DefectAssessment assess(@RequestBody DefectReport defect) {
        requireBody(defect);
        return triageService.assess(defect);
    }

    @PostMapping("/prioritize")
    public PrioritizedDefectList prioritize(@RequestBody List<DefectReport> defects) {
        defects.forEach(TriageController::requireBody);
        return triageService.prioritize(defects);
    }

    private static void requireBody(DefectReport defect) {
        if (defect == null) {
            throw new IllegalArgumentException("defect body is required");
        }
    }
}
