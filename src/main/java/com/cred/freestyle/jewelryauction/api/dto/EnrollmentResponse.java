package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.Enrollment;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class EnrollmentResponse {

    private String enrollmentId;
    private String userId;
    private String sessionId;
    private String status;
    private String reviewedBy;
    private Instant reviewedAt;
    private Instant createdAt;

    public static EnrollmentResponse fromEntity(Enrollment enrollment) {
        EnrollmentResponse response = new EnrollmentResponse();
        response.setEnrollmentId(enrollment.getEnrollmentId());
        response.setUserId(enrollment.getUserId());
        response.setSessionId(enrollment.getSessionId());
        response.setStatus(enrollment.getStatus().name());
        response.setReviewedBy(enrollment.getReviewedBy());
        response.setReviewedAt(enrollment.getReviewedAt());
        response.setCreatedAt(enrollment.getCreatedAt());
        return response;
    }
}
