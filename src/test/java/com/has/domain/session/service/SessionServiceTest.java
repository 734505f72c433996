package com.has.domain.session.service;

import com.has.domain.availability.service.AvailabilityService;
import com.has.domain.catalog.entity.CameroonProvince;
import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.catalog.entity.ServiceListing;
import com.has.domain.catalog.service.ServiceCatalogService;
import com.has.domain.pricing.dto.PricingResult;
import com.has.domain.pricing.service.SessionPricingService;
import com.has.domain.session.config.SessionProperties;
import com.has.domain.session.dto.RatingSummary;
import com.has.domain.session.dto.ReviewRequest;
import com.has.domain.session.dto.SessionCreateRequest;
import com.has.domain.session.dto.StatusAggregate;
import com.has.domain.session.dto.SessionUpdateRequest;
import com.has.domain.session.entity.PaymentStatus;
import com.has.domain.session.entity.Session;
import com.has.domain.session.entity.SessionStatus;
import com.has.domain.session.event.SessionCompletedEvent;
import com.has.domain.session.event.SessionEventProducer;
import com.has.domain.session.repository.SessionQueryRepository;
import com.has.domain.session.repository.SessionRepository;
import com.has.domain.user.entity.ProviderProfile;
import com.has.domain.user.entity.UserRole;
import com.has.domain.user.service.ProviderDirectoryService;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SessionServiceTest {

    private static final Long SESSION_ID = 1L;
    private static final Long SEEKER_ID = 100L;
    private static final Long PROVIDER_ID = 200L;
    private static final Long ADMIN_ID = 900L;
    private static final LocalDate DATE = LocalDate.of(2024, 1, 1);

    @Mock
    private SessionRepository sessionRepository;
    @Mock
    private SessionQueryRepository sessionQueryRepository;
    @Mock
    private SessionConflictService sessionConflictService;
    @Mock
    private ScheduleLockService scheduleLockService;
    @Mock
    private SessionEventProducer sessionEventProducer;
    @Mock
    private SessionPricingService sessionPricingService;
    @Mock
    private AvailabilityService availabilityService;
    @Mock
    private ServiceCatalogService serviceCatalogService;
    @Mock
    private ProviderDirectoryService providerDirectoryService;
    @Spy
    private SessionProperties sessionProperties = new SessionProperties();

    @InjectMocks
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        // 락은 바로 작업을 실행
        lenient().when(scheduleLockService.withScheduleLock(any(), any(), any())).thenAnswer(invocation -> {
            Supplier<Mono<Object>> action = invocation.getArgument(2);
            return action.get();
        });
        lenient().when(sessionRepository.save(any(Session.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(sessionRepository.updateStatusIfCurrent(anyLong(), anyString(), anyString(), any()))
                .thenReturn(Mono.just(1));
        lenient().when(sessionEventProducer.sendSessionCompletedEvent(any())).thenReturn(Mono.empty());
    }

    private static Session session(SessionStatus status) {
        return Session.builder()
                .id(SESSION_ID)
                .seekerId(SEEKER_ID)
                .providerId(PROVIDER_ID)
                .serviceId(3L)
                .category("CLEANING")
                .sessionDate(DATE)
                .startTime("10:00")
                .endTime("14:00")
                .duration(4.0)
                .basePrice(3000)
                .overtimePrice(0)
                .totalAmount(3000)
                .currency("FCFA")
                .status(status.name())
                .paymentStatus(PaymentStatus.PENDING.name())
                .build();
    }

    private static Session awaitingAssignment() {
        Session session = session(SessionStatus.PENDING_ASSIGNMENT);
        session.setProviderId(null);
        session.setServiceLocation("CENTRE");
        return session;
    }

    private void givenSession(Session session) {
        when(sessionRepository.findById(SESSION_ID)).thenReturn(Mono.just(session));
    }

    private static PricingResult pricing5h30() {
        return PricingResult.builder()
                .basePrice(3000).overtimePrice(1125).totalPrice(4125)
                .baseDuration(4).overtimeHours(1.5)
                .build();
    }

    private static ServiceListing activeService() {
        return ServiceListing.builder()
                .id(3L).providerId(PROVIDER_ID).title("Home cleaning").category("CLEANING")
                .status("ACTIVE").isAvailable(true)
                .build();
    }

    private static SessionCreateRequest createRequest(double duration) {
        SessionCreateRequest request = new SessionCreateRequest();
        request.setServiceId(3L);
        request.setSessionDate(DATE);
        request.setStartTime("10:00");
        request.setDuration(duration);
        return request;
    }

    private static void assertErrorCode(Throwable e, ErrorCode expected) {
        assertInstanceOf(BusinessException.class, e);
        assertEquals(expected, ((BusinessException) e).getErrorCode());
    }

    // ============ 생성 ============

    @Test
    void createSession_AdminAssignmentPolicy_CreatesPendingAssignment() {
        // Arrange
        when(serviceCatalogService.findServiceOrThrow(3L)).thenReturn(Mono.just(activeService()));
        when(sessionPricingService.calculateSessionPrice(ServiceCategory.CLEANING, 5.5)).thenReturn(Mono.just(pricing5h30()));
        when(availabilityService.isAvailable(PROVIDER_ID, DATE, "10:00", "15:30")).thenReturn(Mono.just(true));
        when(sessionConflictService.checkSessionConflict(PROVIDER_ID, DATE, "10:00", "15:30", null))
                .thenReturn(Mono.just(false));

        // Act & Assert
        StepVerifier.create(sessionService.createSession(SEEKER_ID, createRequest(5.5)))
                .assertNext(saved -> {
                    assertEquals(SessionStatus.PENDING_ASSIGNMENT.name(), saved.getStatus());
                    assertNull(saved.getProviderId());
                    assertEquals("15:30", saved.getEndTime());
                    assertEquals(3000, saved.getBasePrice());
                    assertEquals(1125, saved.getOvertimePrice());
                    assertEquals(4125, saved.getTotalAmount());
                    assertEquals("FCFA", saved.getCurrency());
                    assertEquals(PaymentStatus.PENDING.name(), saved.getPaymentStatus());
                })
                .verifyComplete();
    }

    @Test
    void createSession_DirectBooking_CreatesPendingWithProvider() {
        sessionProperties.setRequireAdminAssignment(false);
        when(serviceCatalogService.findServiceOrThrow(3L)).thenReturn(Mono.just(activeService()));
        when(sessionPricingService.calculateSessionPrice(ServiceCategory.CLEANING, 5.5)).thenReturn(Mono.just(pricing5h30()));
        when(availabilityService.isAvailable(PROVIDER_ID, DATE, "10:00", "15:30")).thenReturn(Mono.just(true));
        when(sessionConflictService.checkSessionConflict(PROVIDER_ID, DATE, "10:00", "15:30", null))
                .thenReturn(Mono.just(false));

        StepVerifier.create(sessionService.createSession(SEEKER_ID, createRequest(5.5)))
                .assertNext(saved -> {
                    assertEquals(SessionStatus.PENDING.name(), saved.getStatus());
                    assertEquals(PROVIDER_ID, saved.getProviderId());
                })
                .verifyComplete();
    }

    @Test
    void createSession_ProviderUnavailable_ThrowsAndDoesNotSave() {
        when(serviceCatalogService.findServiceOrThrow(3L)).thenReturn(Mono.just(activeService()));
        when(sessionPricingService.calculateSessionPrice(ServiceCategory.CLEANING, 5.5)).thenReturn(Mono.just(pricing5h30()));
        when(availabilityService.isAvailable(PROVIDER_ID, DATE, "10:00", "15:30")).thenReturn(Mono.just(false));

        StepVerifier.create(sessionService.createSession(SEEKER_ID, createRequest(5.5)))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.PROVIDER_UNAVAILABLE))
                .verify();

        verify(sessionConflictService, never()).checkSessionConflict(any(), any(), any(), any(), any());
        verify(sessionRepository, never()).save(any(Session.class));
    }

    @Test
    void createSession_Conflict_ThrowsScheduleConflict() {
        when(serviceCatalogService.findServiceOrThrow(3L)).thenReturn(Mono.just(activeService()));
        when(sessionPricingService.calculateSessionPrice(ServiceCategory.CLEANING, 5.5)).thenReturn(Mono.just(pricing5h30()));
        when(availabilityService.isAvailable(PROVIDER_ID, DATE, "10:00", "15:30")).thenReturn(Mono.just(true));
        when(sessionConflictService.checkSessionConflict(PROVIDER_ID, DATE, "10:00", "15:30", null))
                .thenReturn(Mono.just(true));

        StepVerifier.create(sessionService.createSession(SEEKER_ID, createRequest(5.5)))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.SCHEDULE_CONFLICT))
                .verify();

        verify(sessionRepository, never()).save(any(Session.class));
    }

    @Test
    void createSession_DurationOutOfRange_ThrowsInvalidDuration() {
        StepVerifier.create(sessionService.createSession(SEEKER_ID, createRequest(12.5)))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_DURATION))
                .verify();

        verify(serviceCatalogService, never()).findServiceOrThrow(any());
    }

    @Test
    void createSession_InactiveService_ThrowsServiceUnavailable() {
        ServiceListing inactive = activeService();
        inactive.setStatus("SUSPENDED");
        when(serviceCatalogService.findServiceOrThrow(3L)).thenReturn(Mono.just(inactive));

        StepVerifier.create(sessionService.createSession(SEEKER_ID, createRequest(4)))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.SERVICE_UNAVAILABLE))
                .verify();
    }

    // ============ 배정 ============

    @Test
    void assignProvider_AutoConfirm_ConfirmsSession() {
        Session pending = awaitingAssignment();
        givenSession(pending);
        when(providerDirectoryService.validateAssignable(PROVIDER_ID, ServiceCategory.CLEANING, CameroonProvince.CENTRE))
                .thenReturn(Mono.just(ProviderProfile.builder().userId(PROVIDER_ID).build()));
        when(availabilityService.isAvailable(PROVIDER_ID, DATE, "10:00", "14:00")).thenReturn(Mono.just(true));
        when(sessionConflictService.checkSessionConflict(PROVIDER_ID, DATE, "10:00", "14:00", SESSION_ID))
                .thenReturn(Mono.just(false));

        StepVerifier.create(sessionService.assignProvider(SESSION_ID, PROVIDER_ID, ADMIN_ID, "closest provider"))
                .assertNext(saved -> {
                    assertEquals(SessionStatus.CONFIRMED.name(), saved.getStatus());
                    assertEquals(PROVIDER_ID, saved.getProviderId());
                    assertEquals(ADMIN_ID, saved.getAssignedBy());
                    assertNotNull(saved.getAssignedAt());
                    assertEquals("closest provider", saved.getAssignmentNotes());
                })
                .verifyComplete();

        verify(sessionRepository).updateStatusIfCurrent(eq(SESSION_ID), eq("PENDING_ASSIGNMENT"), eq("CONFIRMED"), any());
    }

    @Test
    void assignProvider_WithoutAutoConfirm_LeavesAssigned() {
        sessionProperties.setAutoConfirmOnAssignment(false);
        givenSession(awaitingAssignment());
        when(providerDirectoryService.validateAssignable(PROVIDER_ID, ServiceCategory.CLEANING, CameroonProvince.CENTRE))
                .thenReturn(Mono.just(ProviderProfile.builder().userId(PROVIDER_ID).build()));
        when(availabilityService.isAvailable(PROVIDER_ID, DATE, "10:00", "14:00")).thenReturn(Mono.just(true));
        when(sessionConflictService.checkSessionConflict(PROVIDER_ID, DATE, "10:00", "14:00", SESSION_ID))
                .thenReturn(Mono.just(false));

        StepVerifier.create(sessionService.assignProvider(SESSION_ID, PROVIDER_ID, ADMIN_ID, null))
                .assertNext(saved -> assertEquals(SessionStatus.ASSIGNED.name(), saved.getStatus()))
                .verifyComplete();
    }

    @Test
    void assignProvider_ProviderBusy_LeavesSessionUntouched() {
        Session pending = awaitingAssignment();
        givenSession(pending);
        when(providerDirectoryService.validateAssignable(PROVIDER_ID, ServiceCategory.CLEANING, CameroonProvince.CENTRE))
                .thenReturn(Mono.just(ProviderProfile.builder().userId(PROVIDER_ID).build()));
        when(availabilityService.isAvailable(PROVIDER_ID, DATE, "10:00", "14:00")).thenReturn(Mono.just(true));
        when(sessionConflictService.checkSessionConflict(PROVIDER_ID, DATE, "10:00", "14:00", SESSION_ID))
                .thenReturn(Mono.just(true));

        StepVerifier.create(sessionService.assignProvider(SESSION_ID, PROVIDER_ID, ADMIN_ID, null))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.SCHEDULE_CONFLICT))
                .verify();

        assertNull(pending.getProviderId());
        assertEquals(SessionStatus.PENDING_ASSIGNMENT.name(), pending.getStatus());
    }

    @Test
    void assignProvider_AfterRejection_ThrowsNotPendingAssignment() {
        Session pending = awaitingAssignment();
        givenSession(pending);

        StepVerifier.create(sessionService.rejectServiceRequest(SESSION_ID, "no provider in area", null, ADMIN_ID))
                .assertNext(saved -> assertEquals(SessionStatus.REJECTED.name(), saved.getStatus()))
                .verifyComplete();

        StepVerifier.create(sessionService.assignProvider(SESSION_ID, PROVIDER_ID, ADMIN_ID, null))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.SESSION_NOT_PENDING_ASSIGNMENT))
                .verify();

        verify(providerDirectoryService, never()).validateAssignable(any(), any(), any());
    }

    // ============ 제공자 확인 / 거절 ============

    @Test
    void confirmSession_OtherProvider_ThrowsForbidden() {
        givenSession(session(SessionStatus.ASSIGNED));

        StepVerifier.create(sessionService.confirmSession(SESSION_ID, 777L, UserRole.PROVIDER))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.FORBIDDEN))
                .verify();
    }

    @Test
    void confirmSession_AssignedProvider_Confirms() {
        givenSession(session(SessionStatus.ASSIGNED));

        StepVerifier.create(sessionService.confirmSession(SESSION_ID, PROVIDER_ID, UserRole.PROVIDER))
                .assertNext(saved -> assertEquals(SessionStatus.CONFIRMED.name(), saved.getStatus()))
                .verifyComplete();
    }

    @Test
    void rejectAssignment_ReturnToPool_ClearsProvider() {
        sessionProperties.setReturnToPoolOnProviderRejection(true);
        givenSession(session(SessionStatus.ASSIGNED));

        StepVerifier.create(sessionService.rejectAssignment(SESSION_ID, PROVIDER_ID, UserRole.PROVIDER, "busy"))
                .assertNext(saved -> {
                    assertEquals(SessionStatus.PENDING_ASSIGNMENT.name(), saved.getStatus());
                    assertNull(saved.getProviderId());
                    assertEquals("busy", saved.getRejectionReason());
                })
                .verifyComplete();
    }

    @Test
    void rejectAssignment_DefaultPolicy_Rejects() {
        givenSession(session(SessionStatus.ASSIGNED));

        StepVerifier.create(sessionService.rejectAssignment(SESSION_ID, PROVIDER_ID, UserRole.PROVIDER, "busy"))
                .assertNext(saved -> assertEquals(SessionStatus.REJECTED.name(), saved.getStatus()))
                .verifyComplete();
    }

    // ============ 취소 ============

    @Test
    void cancelSession_Completed_ThrowsSessionCompleted() {
        givenSession(session(SessionStatus.COMPLETED));

        StepVerifier.create(sessionService.cancelSession(SESSION_ID, SEEKER_ID, "changed my mind"))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.SESSION_COMPLETED))
                .verify();
    }

    @Test
    void cancelSession_NonParticipant_ThrowsForbidden() {
        givenSession(session(SessionStatus.CONFIRMED));

        StepVerifier.create(sessionService.cancelSession(SESSION_ID, 555L, null))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.FORBIDDEN))
                .verify();
    }

    @Test
    void cancelSession_Paid_MarksRefunded() {
        Session paid = session(SessionStatus.CONFIRMED);
        paid.setPaymentStatus(PaymentStatus.PAID.name());
        givenSession(paid);

        StepVerifier.create(sessionService.cancelSession(SESSION_ID, SEEKER_ID, "travelling"))
                .assertNext(saved -> {
                    assertEquals(SessionStatus.CANCELLED.name(), saved.getStatus());
                    assertEquals(PaymentStatus.REFUNDED.name(), saved.getPaymentStatus());
                    assertEquals("travelling", saved.getCancellationReason());
                })
                .verifyComplete();
    }

    @Test
    void cancelSession_InProgress_ThrowsInvalidTransition() {
        givenSession(session(SessionStatus.IN_PROGRESS));

        StepVerifier.create(sessionService.cancelSession(SESSION_ID, PROVIDER_ID, null))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_STATUS_TRANSITION))
                .verify();
    }

    // ============ 수정 / 완료 ============

    @Test
    void updateSession_Completion_PublishesEventOnce() {
        Session inProgress = session(SessionStatus.IN_PROGRESS);
        givenSession(inProgress);
        SessionUpdateRequest complete = new SessionUpdateRequest();
        complete.setStatus(SessionStatus.COMPLETED);

        StepVerifier.create(sessionService.updateSession(SESSION_ID, complete, ADMIN_ID, UserRole.ADMIN))
                .assertNext(saved -> assertEquals(SessionStatus.COMPLETED.name(), saved.getStatus()))
                .verifyComplete();
        // 같은 요청 재전송: 상태가 이미 COMPLETED이므로 이벤트 없음
        StepVerifier.create(sessionService.updateSession(SESSION_ID, complete, ADMIN_ID, UserRole.ADMIN))
                .assertNext(saved -> assertEquals(SessionStatus.COMPLETED.name(), saved.getStatus()))
                .verifyComplete();

        ArgumentCaptor<SessionCompletedEvent> captor = ArgumentCaptor.forClass(SessionCompletedEvent.class);
        verify(sessionEventProducer, times(1)).sendSessionCompletedEvent(captor.capture());
        assertEquals(SESSION_ID, captor.getValue().getSessionId());
        assertEquals(PROVIDER_ID, captor.getValue().getProviderId());
        assertEquals(3000, captor.getValue().getAmount());
    }

    @Test
    void completeSession_AlreadyCompleted_NoEvent() {
        givenSession(session(SessionStatus.COMPLETED));

        StepVerifier.create(sessionService.completeSession(SESSION_ID))
                .assertNext(saved -> assertEquals(SessionStatus.COMPLETED.name(), saved.getStatus()))
                .verifyComplete();

        verify(sessionEventProducer, never()).sendSessionCompletedEvent(any());
        verify(sessionRepository, never()).updateStatusIfCurrent(any(), any(), any(), any());
    }

    @Test
    void completeSession_RefundedPayment_SkipsSettlementEvent() {
        Session refunded = session(SessionStatus.IN_PROGRESS);
        refunded.setPaymentStatus(PaymentStatus.REFUNDED.name());
        givenSession(refunded);

        StepVerifier.create(sessionService.completeSession(SESSION_ID))
                .assertNext(saved -> assertEquals(SessionStatus.COMPLETED.name(), saved.getStatus()))
                .verifyComplete();

        verify(sessionEventProducer, never()).sendSessionCompletedEvent(any());
    }

    @Test
    void completeSession_ConcurrentStatusChange_Fails() {
        givenSession(session(SessionStatus.IN_PROGRESS));
        when(sessionRepository.updateStatusIfCurrent(anyLong(), anyString(), anyString(), any()))
                .thenReturn(Mono.just(0));

        StepVerifier.create(sessionService.completeSession(SESSION_ID))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_STATUS_TRANSITION))
                .verify();

        verify(sessionEventProducer, never()).sendSessionCompletedEvent(any());
    }

    @Test
    void updateSession_TerminalStatus_ThrowsInvalidTransition() {
        givenSession(session(SessionStatus.CANCELLED));
        SessionUpdateRequest request = new SessionUpdateRequest();
        request.setStatus(SessionStatus.CONFIRMED);

        StepVerifier.create(sessionService.updateSession(SESSION_ID, request, SEEKER_ID, UserRole.SEEKER))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_STATUS_TRANSITION))
                .verify();
    }

    @Test
    void updateSession_PaidOnCancelledSession_ThrowsPaymentNotAllowed() {
        givenSession(session(SessionStatus.CANCELLED));
        SessionUpdateRequest request = new SessionUpdateRequest();
        request.setPaymentStatus(PaymentStatus.PAID);

        StepVerifier.create(sessionService.updateSession(SESSION_ID, request, ADMIN_ID, UserRole.ADMIN))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.PAYMENT_NOT_ALLOWED))
                .verify();
    }

    @Test
    void updateSession_RescheduleInProgress_ThrowsRescheduleNotAllowed() {
        givenSession(session(SessionStatus.IN_PROGRESS));
        SessionUpdateRequest request = new SessionUpdateRequest();
        request.setStartTime("11:00");

        StepVerifier.create(sessionService.updateSession(SESSION_ID, request, SEEKER_ID, UserRole.SEEKER))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.RESCHEDULE_NOT_ALLOWED))
                .verify();
    }

    @Test
    void updateSession_Reschedule_ExcludesSelfAndReprices() {
        givenSession(session(SessionStatus.CONFIRMED));
        when(sessionPricingService.calculateSessionPrice(ServiceCategory.CLEANING, 5.5)).thenReturn(Mono.just(pricing5h30()));
        when(availabilityService.isAvailable(PROVIDER_ID, DATE, "10:00", "15:30")).thenReturn(Mono.just(true));
        when(sessionConflictService.checkSessionConflict(PROVIDER_ID, DATE, "10:00", "15:30", SESSION_ID))
                .thenReturn(Mono.just(false));
        SessionUpdateRequest request = new SessionUpdateRequest();
        request.setDuration(5.5);

        StepVerifier.create(sessionService.updateSession(SESSION_ID, request, SEEKER_ID, UserRole.SEEKER))
                .assertNext(saved -> {
                    assertEquals(SessionStatus.CONFIRMED.name(), saved.getStatus());
                    assertEquals("15:30", saved.getEndTime());
                    assertEquals(5.5, saved.getDuration());
                    assertEquals(4125, saved.getTotalAmount());
                })
                .verifyComplete();

        verify(sessionRepository, never()).updateStatusIfCurrent(any(), any(), any(), any());
    }

    @Test
    void updateSession_NonParticipant_ThrowsForbidden() {
        givenSession(session(SessionStatus.CONFIRMED));

        StepVerifier.create(sessionService.updateSession(SESSION_ID, new SessionUpdateRequest(), 555L, UserRole.SEEKER))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.FORBIDDEN))
                .verify();
    }

    @Test
    void updateSession_SeekerConfirmsUnassignedRequest_ThrowsInvalidTransition() {
        givenSession(awaitingAssignment());
        SessionUpdateRequest request = new SessionUpdateRequest();
        request.setStatus(SessionStatus.CONFIRMED);

        StepVerifier.create(sessionService.updateSession(SESSION_ID, request, SEEKER_ID, UserRole.SEEKER))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_STATUS_TRANSITION))
                .verify();

        verify(sessionRepository, never()).updateStatusIfCurrent(any(), any(), any(), any());
        verify(sessionEventProducer, never()).sendSessionCompletedEvent(any());
    }

    @Test
    void updateSession_SeekerConfirmsPendingBooking_ThrowsInvalidTransition() {
        givenSession(session(SessionStatus.PENDING));
        SessionUpdateRequest request = new SessionUpdateRequest();
        request.setStatus(SessionStatus.CONFIRMED);

        StepVerifier.create(sessionService.updateSession(SESSION_ID, request, SEEKER_ID, UserRole.SEEKER))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_STATUS_TRANSITION))
                .verify();
    }

    @Test
    void updateSession_ProviderlessSessionToInProgress_ThrowsProviderNotAssigned() {
        Session orphan = session(SessionStatus.CONFIRMED);
        orphan.setProviderId(null);
        givenSession(orphan);
        SessionUpdateRequest request = new SessionUpdateRequest();
        request.setStatus(SessionStatus.IN_PROGRESS);

        StepVerifier.create(sessionService.updateSession(SESSION_ID, request, SEEKER_ID, UserRole.SEEKER))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.PROVIDER_NOT_ASSIGNED))
                .verify();

        verify(sessionRepository, never()).updateStatusIfCurrent(any(), any(), any(), any());
    }

    @Test
    void completeSession_WithoutProvider_ThrowsProviderNotAssignedAndPublishesNothing() {
        Session orphan = session(SessionStatus.IN_PROGRESS);
        orphan.setProviderId(null);
        givenSession(orphan);

        StepVerifier.create(sessionService.completeSession(SESSION_ID))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.PROVIDER_NOT_ASSIGNED))
                .verify();

        verify(sessionEventProducer, never()).sendSessionCompletedEvent(any());
    }

    @Test
    void updateSession_SeekerCancelsUnassignedRequest_Cancels() {
        givenSession(awaitingAssignment());
        SessionUpdateRequest request = new SessionUpdateRequest();
        request.setStatus(SessionStatus.CANCELLED);

        StepVerifier.create(sessionService.updateSession(SESSION_ID, request, SEEKER_ID, UserRole.SEEKER))
                .assertNext(saved -> {
                    assertEquals(SessionStatus.CANCELLED.name(), saved.getStatus());
                    assertNull(saved.getProviderId());
                })
                .verifyComplete();
    }

    @Test
    void cancelSession_AlreadyCancelled_ThrowsInvalidTransitionAndKeepsReason() {
        Session cancelled = session(SessionStatus.CANCELLED);
        cancelled.setCancellationReason("original reason");
        givenSession(cancelled);

        StepVerifier.create(sessionService.cancelSession(SESSION_ID, SEEKER_ID, "second try"))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_STATUS_TRANSITION))
                .verify();

        assertEquals("original reason", cancelled.getCancellationReason());
        verify(sessionRepository, never()).save(any(Session.class));
    }

    @Test
    void cancelSession_Rejected_ThrowsInvalidTransition() {
        givenSession(session(SessionStatus.REJECTED));

        StepVerifier.create(sessionService.cancelSession(SESSION_ID, SEEKER_ID, null))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_STATUS_TRANSITION))
                .verify();
    }

    // ============ 리뷰 ============

    @Test
    void addReview_InvalidRating_ThrowsInvalidRating() {
        ReviewRequest request = new ReviewRequest();
        request.setRating(6);

        StepVerifier.create(sessionService.addReview(SESSION_ID, SEEKER_ID, request))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.INVALID_RATING))
                .verify();

        verify(sessionRepository, never()).findById(anyLong());
    }

    @Test
    void addReview_NotCompleted_ThrowsReviewNotAllowed() {
        givenSession(session(SessionStatus.CONFIRMED));
        ReviewRequest request = new ReviewRequest();
        request.setRating(5);

        StepVerifier.create(sessionService.addReview(SESSION_ID, SEEKER_ID, request))
                .expectErrorSatisfies(e -> assertErrorCode(e, ErrorCode.REVIEW_NOT_ALLOWED))
                .verify();
    }

    @Test
    void addReview_BySeeker_RefreshesProviderRating() {
        givenSession(session(SessionStatus.COMPLETED));
        when(sessionQueryRepository.ratingSummaryByProvider(PROVIDER_ID))
                .thenReturn(Mono.just(RatingSummary.builder().averageRating(4.5).totalReviews(2).build()));
        when(providerDirectoryService.updateRating(PROVIDER_ID, 4.5, 2L)).thenReturn(Mono.empty());
        ReviewRequest request = new ReviewRequest();
        request.setRating(5);
        request.setReview("Very thorough");

        StepVerifier.create(sessionService.addReview(SESSION_ID, SEEKER_ID, request))
                .assertNext(saved -> {
                    assertEquals(5, saved.getSeekerRating());
                    assertEquals("Very thorough", saved.getSeekerReview());
                    assertNull(saved.getProviderRating());
                })
                .verifyComplete();

        verify(providerDirectoryService).updateRating(PROVIDER_ID, 4.5, 2L);
    }

    @Test
    void addReview_ByProvider_DoesNotTouchProviderRating() {
        givenSession(session(SessionStatus.COMPLETED));
        ReviewRequest request = new ReviewRequest();
        request.setRating(4);

        StepVerifier.create(sessionService.addReview(SESSION_ID, PROVIDER_ID, request))
                .assertNext(saved -> assertEquals(4, saved.getProviderRating()))
                .verifyComplete();

        verify(providerDirectoryService, never()).updateRating(anyLong(), anyDouble(), anyLong());
    }

    @Test
    void findByProvider_BuildsPaginationAndStatusSummary() {
        when(sessionRepository.findByProviderIdOrderBySessionDateDesc(eq(PROVIDER_ID), any()))
                .thenReturn(Flux.just(session(SessionStatus.COMPLETED), session(SessionStatus.CONFIRMED)));
        when(sessionRepository.countByProviderId(PROVIDER_ID)).thenReturn(Mono.just(12L));
        when(sessionQueryRepository.aggregateByProvider(PROVIDER_ID)).thenReturn(Flux.just(
                StatusAggregate.builder().status("COMPLETED").count(10).totalAmount(30000).build(),
                StatusAggregate.builder().status("CONFIRMED").count(2).totalAmount(6000).build()));

        StepVerifier.create(sessionService.findByProvider(PROVIDER_ID, null, 2, 5))
                .assertNext(res -> {
                    assertEquals(2, res.getSessions().size());
                    assertEquals(2, res.getPagination().getPage());
                    assertEquals(12L, res.getPagination().getTotal());
                    assertEquals(3, res.getPagination().getTotalPages());
                    assertEquals(12L, res.getSummary().getTotalSessions());
                    assertEquals(10L, res.getSummary().getStatusCounts().get("COMPLETED"));
                    assertEquals(0L, res.getSummary().getStatusCounts().get("CANCELLED"));
                    assertEquals(30000L, res.getSummary().getTotalEarnings());
                })
                .verifyComplete();
    }

    @Test
    void findBySeeker_WithStatusFilter_OmitsEarnings() {
        when(sessionRepository.findBySeekerIdAndStatusOrderByCreatedAtDesc(eq(SEEKER_ID), eq("PENDING_ASSIGNMENT"), any()))
                .thenReturn(Flux.just(awaitingAssignment()));
        when(sessionRepository.countBySeekerIdAndStatus(SEEKER_ID, "PENDING_ASSIGNMENT")).thenReturn(Mono.just(1L));
        when(sessionQueryRepository.aggregateBySeeker(SEEKER_ID)).thenReturn(Flux.empty());

        StepVerifier.create(sessionService.findBySeeker(SEEKER_ID, SessionStatus.PENDING_ASSIGNMENT, 1, 10))
                .assertNext(res -> {
                    assertEquals(1, res.getSessions().size());
                    assertEquals(1, res.getPagination().getTotalPages());
                    assertNull(res.getSummary().getTotalEarnings());
                })
                .verifyComplete();
    }
}
