package org.example.restaurantfieldservice.controller;

import lombok.RequiredArgsConstructor;
import org.example.restaurantfieldservice.dto.OverviewStatsDTO;
import org.example.restaurantfieldservice.dto.TechnicianDashboardDTO;
import org.example.restaurantfieldservice.service.DashboardService;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardService dashboardService;

    @GetMapping("/technician")
    public ResponseEntity<TechnicianDashboardDTO> getTechnicianDashboard(SessionContext session) {
        return ResponseEntity.ok(dashboardService.getTechnicianDashboard(session));
    }

    @GetMapping("/overview")
    public ResponseEntity<OverviewStatsDTO> getOverview(SessionContext session) {
        return ResponseEntity.ok(dashboardService.getOverview(session));
    }
}
