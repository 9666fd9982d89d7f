package com.cred.freestyle.jewelryauction.api.dto;

import com.cred.freestyle.jewelryauction.domain.model.SellRequest;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for sell requests, with every stage timestamp.
 *
 * @author Jewelry Auction Team
 */
@Data
@NoArgsConstructor
public class SellRequestResponse {

    private String sellRequestId;
    private String sellerId;
    private String jewelryItemId;
    private String status;
    private String sellerNotes;
    private String staffNotes;
    private String managerNotes;
    private String rejectionReason;
    private String rejectedBy;
    private Instant submittedAt;
    private Instant preliminaryAppraisedAt;
    private Instant receivedAt;
    private Instant appraisedAt;
    private Instant approvedAt;
    private Instant acceptedAt;
    private Instant assignedAt;
    private Instant rejectedAt;

    public static SellRequestResponse fromEntity(SellRequest request) {
        SellRequestResponse response = new SellRequestResponse();
        response.setSellRequestId(request.getSellRequestId());
        response.setSellerId(request.getSellerId());
        response.setJewelryItemId(request.getJewelryItemId());
        response.setStatus(request.getStatus().name());
        response.setSellerNotes(request.getSellerNotes());
        response.setStaffNotes(request.getStaffNotes());
        response.setManagerNotes(request.getManagerNotes());
        response.setRejectionReason(request.getRejectionReason());
        response.setRejectedBy(request.getRejectedBy());
        response.setSubmittedAt(request.getSubmittedAt());
        response.setPreliminaryAppraisedAt(request.getPreliminaryAppraisedAt());
        response.setReceivedAt(request.getReceivedAt());
        response.setAppraisedAt(request.getAppraisedAt());
        response.setApprovedAt(request.getApprovedAt());
        response.setAcceptedAt(request.getAcceptedAt());
        response.setAssignedAt(request.getAssignedAt());
        response.setRejectedAt(request.getRejectedAt());
        return response;
    }
}
