package com.cred.freestyle.jewelryauction.api.controller;

import com.cred.freestyle.jewelryauction.api.dto.EnrollmentResponse;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import com.cred.freestyle.jewelryauction.service.EnrollmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Enrollment review and self-service. Enrolling itself lives under the session resource.
 *
 * @author Jewelry Auction Team
 */
@RestController
@RequestMapping("/api/v1/enrollments")
@PreAuthorize("isAuthenticated()")
public class EnrollmentController {

    private final EnrollmentService enrollmentService;

    public EnrollmentController(EnrollmentService enrollmentService) {
        this.enrollmentService = enrollmentService;
    }

    @GetMapping("/mine")
    public ResponseEntity<List<EnrollmentResponse>> mine() {
        return ResponseEntity.ok(enrollmentService.mine(SecurityUtils.currentActor()).stream()
                .map(EnrollmentResponse::fromEntity)
                .collect(Collectors.toList()));
    }

    @PostMapping("/{enrollmentId}/approve")
    public ResponseEntity<EnrollmentResponse> approve(@PathVariable String enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.fromEntity(
                enrollmentService.approve(enrollmentId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{enrollmentId}/reject")
    public ResponseEntity<EnrollmentResponse> reject(@PathVariable String enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.fromEntity(
                enrollmentService.reject(enrollmentId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{enrollmentId}/cancel")
    public ResponseEntity<EnrollmentResponse> cancel(@PathVariable String enrollmentId) {
        return ResponseEntity.ok(EnrollmentResponse.fromEntity(
                enrollmentService.cancel(enrollmentId, SecurityUtils.currentActor())));
    }
}
