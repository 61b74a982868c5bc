package com.fleetledger.controller;

import com.fleetledger.dto.ApprovalResultDto;
import com.fleetledger.service.WeeklyLogApprovalService;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/admin/weekly-logs")
@PreAuthorize("hasRole('ADMIN')")
public class AdminWeeklyLogController {

    private final WeeklyLogApprovalService approvalService;

    public AdminWeeklyLogController(WeeklyLogApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @PostMapping("/{weekId}/drivers/{driverId}/approve")
    public ApprovalResultDto approve(@PathVariable("weekId") String weekId,
                                     @PathVariable("driverId") String driverId) {
        return approvalService.approve(weekId, driverId);
    }
}
