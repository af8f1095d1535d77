package com.taxengine.api;

import com.taxengine.projection.AdminSummary;
import com.taxengine.projection.AdminSummaryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
public class SummaryController {

    private final AdminSummaryService summaryService;

    public SummaryController(AdminSummaryService summaryService) {
        this.summaryService = summaryService;
    }

    @GetMapping("/summary")
    public AdminSummary summary() {
        return summaryService.summarize();
    }
}
