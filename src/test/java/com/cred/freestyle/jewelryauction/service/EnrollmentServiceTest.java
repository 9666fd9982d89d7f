package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.AuctionSession;
import com.cred.freestyle.jewelryauction.domain.model.AuctionSession.SessionStatus;
import com.cred.freestyle.jewelryauction.domain.model.Enrollment;
import com.cred.freestyle.jewelryauction.domain.model.Enrollment.EnrollmentStatus;
import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.exception.AuctionNotOpenException;
import com.cred.freestyle.jewelryauction.exception.AuthorizationException;
import com.cred.freestyle.jewelryauction.exception.ConcurrencyException;
import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import com.cred.freestyle.jewelryauction.repository.AuctionSessionRepository;
import com.cred.freestyle.jewelryauction.repository.EnrollmentRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnrollmentService Unit Tests")
class EnrollmentServiceTest {

    @Mock
    private EnrollmentRepository enrollmentRepository;

    @Mock
    private AuctionSessionRepository sessionRepository;

    @InjectMocks
    private EnrollmentService enrollmentService;

    private AuctionSession session;

    @BeforeEach
    void setUp() {
        session = TestDataBuilder.session(SessionStatus.SCHEDULED);
    }

    private Enrollment pending() {
        return Enrollment.builder()
                .enrollmentId("enr-1")
                .userId(TestDataBuilder.BIDDER_ID)
                .sessionId(session.getSessionId())
                .status(EnrollmentStatus.PENDING)
                .build();
    }

    // ========================================
    // enroll() Tests
    // ========================================

    @Test
    @DisplayName("enroll - New enrollment starts PENDING")
    void enroll_Success() {
        // Given
        when(sessionRepository.findById(session.getSessionId())).thenReturn(Optional.of(session));
        when(enrollmentRepository.findByUserIdAndSessionId(TestDataBuilder.BIDDER_ID, session.getSessionId()))
                .thenReturn(Optional.empty());
        when(enrollmentRepository.saveAndFlush(any(Enrollment.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Enrollment result = enrollmentService.enroll(session.getSessionId(), TestDataBuilder.bidder());

        // Then
        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.PENDING);
        assertThat(result.getUserId()).isEqualTo(TestDataBuilder.BIDDER_ID);
    }

    @Test
    @DisplayName("enroll - Second request returns the existing enrollment")
    void enroll_Existing() {
        Enrollment existing = pending();
        existing.approve(TestDataBuilder.STAFF_ID);
        when(sessionRepository.findById(session.getSessionId())).thenReturn(Optional.of(session));
        when(enrollmentRepository.findByUserIdAndSessionId(TestDataBuilder.BIDDER_ID, session.getSessionId()))
                .thenReturn(Optional.of(existing));

        Enrollment result = enrollmentService.enroll(session.getSessionId(), TestDataBuilder.bidder());

        assertThat(result).isSameAs(existing);
        verify(enrollmentRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("enroll - Closed session does not take enrollments")
    void enroll_SessionClosed() {
        AuctionSession closed = TestDataBuilder.session(SessionStatus.CLOSED);
        when(sessionRepository.findById(closed.getSessionId())).thenReturn(Optional.of(closed));
        when(enrollmentRepository.findByUserIdAndSessionId(TestDataBuilder.BIDDER_ID, closed.getSessionId()))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> enrollmentService.enroll(closed.getSessionId(), TestDataBuilder.bidder()))
                .isInstanceOf(AuctionNotOpenException.class);
    }

    @Test
    @DisplayName("enroll - Concurrent duplicate surfaces as ConcurrencyException")
    void enroll_ConcurrentDuplicate() {
        when(sessionRepository.findById(session.getSessionId())).thenReturn(Optional.of(session));
        when(enrollmentRepository.findByUserIdAndSessionId(TestDataBuilder.BIDDER_ID, session.getSessionId()))
                .thenReturn(Optional.empty());
        when(enrollmentRepository.saveAndFlush(any(Enrollment.class)))
                .thenThrow(new DataIntegrityViolationException("uk_enrollment_user_session"));

        assertThatThrownBy(() -> enrollmentService.enroll(session.getSessionId(), TestDataBuilder.bidder()))
                .isInstanceOf(ConcurrencyException.class);
    }

    @Test
    @DisplayName("enroll - Guests cannot enroll")
    void enroll_Guest() {
        assertThatThrownBy(() -> enrollmentService.enroll(session.getSessionId(),
                AuthenticatedUser.of("g-1", Role.GUEST)))
                .isInstanceOf(AuthorizationException.class);
        verifyNoInteractions(sessionRepository);
    }

    // ========================================
    // Review Tests
    // ========================================

    @Test
    @DisplayName("approve - Staff approval records the reviewer")
    void approve_Success() {
        when(enrollmentRepository.findById("enr-1")).thenReturn(Optional.of(pending()));
        when(enrollmentRepository.save(any(Enrollment.class))).thenAnswer(inv -> inv.getArgument(0));

        Enrollment result = enrollmentService.approve("enr-1", TestDataBuilder.staff());

        assertThat(result.isApproved()).isTrue();
        assertThat(result.getReviewedBy()).isEqualTo(TestDataBuilder.STAFF_ID);
        assertThat(result.getReviewedAt()).isNotNull();
    }

    @Test
    @DisplayName("approve - Members cannot approve")
    void approve_MemberDenied() {
        assertThatThrownBy(() -> enrollmentService.approve("enr-1", TestDataBuilder.bidder()))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("reject - Already reviewed enrollment cannot be rejected")
    void reject_AlreadyApproved() {
        Enrollment approved = pending();
        approved.approve(TestDataBuilder.STAFF_ID);
        when(enrollmentRepository.findById("enr-1")).thenReturn(Optional.of(approved));

        assertThatThrownBy(() -> enrollmentService.reject("enr-1", TestDataBuilder.manager()))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("cancel - Only the enrolled user may cancel")
    void cancel_NotOwner() {
        when(enrollmentRepository.findById("enr-1")).thenReturn(Optional.of(pending()));

        assertThatThrownBy(() -> enrollmentService.cancel("enr-1",
                TestDataBuilder.member(TestDataBuilder.OTHER_BIDDER_ID)))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("cancel - Owner cancels an approved enrollment")
    void cancel_Success() {
        Enrollment approved = pending();
        approved.approve(TestDataBuilder.STAFF_ID);
        when(enrollmentRepository.findById("enr-1")).thenReturn(Optional.of(approved));
        when(enrollmentRepository.save(any(Enrollment.class))).thenAnswer(inv -> inv.getArgument(0));

        Enrollment result = enrollmentService.cancel("enr-1", TestDataBuilder.bidder());

        assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.CANCELED);
    }
}
