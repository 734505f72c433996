package com.has.domain.session.service;

import com.has.domain.catalog.entity.CameroonProvince;
import com.has.domain.catalog.entity.ServiceCategory;
import com.has.domain.catalog.entity.ServiceListing;
import com.has.domain.catalog.service.ServiceCatalogService;
import com.has.domain.pricing.dto.PricingResult;
import com.has.domain.pricing.service.SessionPricingService;
import com.has.domain.session.dto.ServiceRequestCreateRequest;
import com.has.domain.session.entity.Session;
import com.has.domain.session.repository.SessionRepository;
import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ServiceRequestServiceTest {

    @Mock
    private SessionRepository sessionRepository;

    @Mock
    private ServiceCatalogService serviceCatalogService;

    @Mock
    private SessionPricingService sessionPricingService;

    @InjectMocks
    private ServiceRequestService serviceRequestService;

    @Test
    void createServiceRequest_CreatesUnassignedSessionWithEstimate() {
        // Arrange
        ServiceListing generic = ServiceListing.builder()
                .id(50L).title("PLUMBING service").category("PLUMBING").status("ACTIVE").isAvailable(true)
                .build();
        when(serviceCatalogService.findOrCreateGenericService(ServiceCategory.PLUMBING, "Leaking sink"))
                .thenReturn(Mono.just(generic));
        when(sessionPricingService.calculateSessionPrice(ServiceCategory.PLUMBING, 2.0))
                .thenReturn(Mono.just(PricingResult.builder()
                        .basePrice(3000).overtimePrice(0).totalPrice(3000).baseDuration(4).overtimeHours(0)
                        .build()));
        when(sessionRepository.save(any(Session.class))).thenAnswer(invocation -> {
            Session session = invocation.getArgument(0);
            session.setId(77L);
            return Mono.just(session);
        });

        ServiceRequestCreateRequest request = new ServiceRequestCreateRequest();
        request.setCategory(ServiceCategory.PLUMBING);
        request.setServiceDate(LocalDate.of(2024, 1, 2));
        request.setStartTime("23:00");
        request.setDuration(2.0);
        request.setProvince(CameroonProvince.LITTORAL);
        request.setServiceAddress("Rue 1.234, Douala");
        request.setDescription("Leaking sink");

        // Act & Assert
        StepVerifier.create(serviceRequestService.createServiceRequest(10L, request))
                .assertNext(response -> {
                    assertEquals(77L, response.getRequestId());
                    assertEquals("PENDING_ASSIGNMENT", response.getStatus());
                    assertEquals(3000, response.getEstimatedCost());
                    assertNull(response.getProviderId());
                    // 자정을 넘기는 종료 시각
                    assertEquals("01:00", response.getEndTime());
                })
                .verifyComplete();

        ArgumentCaptor<Session> captor = ArgumentCaptor.forClass(Session.class);
        verify(sessionRepository).save(captor.capture());
        assertEquals("LITTORAL", captor.getValue().getServiceLocation());
        assertEquals(50L, captor.getValue().getServiceId());
    }

    @Test
    void getServiceRequestStatus_OtherSeeker_ThrowsForbidden() {
        Session session = Session.builder().id(77L).seekerId(10L).status("PENDING_ASSIGNMENT").build();
        when(sessionRepository.findById(77L)).thenReturn(Mono.just(session));

        StepVerifier.create(serviceRequestService.getServiceRequestStatus(77L, 11L))
                .expectErrorSatisfies(e -> assertEquals(ErrorCode.FORBIDDEN, ((BusinessException) e).getErrorCode()))
                .verify();
    }

    @Test
    void getServiceRequestStatus_Missing_ThrowsNotFound() {
        when(sessionRepository.findById(78L)).thenReturn(Mono.empty());

        StepVerifier.create(serviceRequestService.getServiceRequestStatus(78L, 10L))
                .expectErrorSatisfies(e -> assertEquals(ErrorCode.SESSION_NOT_FOUND,
                        ((BusinessException) e).getErrorCode()))
                .verify();
    }
}
