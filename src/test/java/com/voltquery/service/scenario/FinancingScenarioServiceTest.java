package com.voltquery.service.scenario;

import com.voltquery.client.GeocodingClient;
import com.voltquery.client.ReoptClient;
import com.voltquery.client.ReoptJobRequest;
import com.voltquery.client.UrdbClient;
import com.voltquery.config.VoltQueryProperties;
import com.voltquery.exception.InvalidQuestionException;
import com.voltquery.exception.TransientApiException;
import com.voltquery.model.DetectedLocation;
import com.voltquery.model.FinancingComparison;
import com.voltquery.model.OptimizationOutcome;
import com.voltquery.model.dto.FinancingRequest;
import com.voltquery.service.location.LocationExtractor;
import com.voltquery.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FinancingScenarioServiceTest {

    private static final DetectedLocation DENVER = DetectedLocation.builder()
            .zipCode("80202")
            .locationType(DetectedLocation.LocationType.ZIP_CODE)
            .latitude(39.75)
            .longitude(-104.99)
            .build();

    private ReoptClient reoptClient;
    private UrdbClient urdbClient;
    private GeocodingClient geocodingClient;
    private MutableClock clock;
    private FinancingScenarioService service;

    @BeforeEach
    void setUp() {
        reoptClient = mock(ReoptClient.class);
        urdbClient = mock(UrdbClient.class);
        geocodingClient = mock(GeocodingClient.class);
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));

        when(urdbClient.tariffLabel(anyDouble(), anyDouble(), anyString()))
                .thenReturn(Mono.just("5cd3f9fe5457a3f1d4b2a9e0"));
        when(geocodingClient.resolve(any())).thenReturn(Mono.just(DENVER));

        service = new FinancingScenarioService(new ScenarioBranchExecutor(), reoptClient, urdbClient,
                geocodingClient, new LocationExtractor(), new VoltQueryProperties(), clock);
    }

    private static OptimizationOutcome outcome(String runUuid, double npv, double itc) {
        return OptimizationOutcome.builder()
                .runUuid(runUuid)
                .npv(npv)
                .pvKw(7.2)
                .recommendedSizeKw(7.2)
                .federalItcFraction(itc)
                .analysisYears(25)
                .build();
    }

    private void stubReopt(Mono<OptimizationOutcome> purchase, Mono<OptimizationOutcome> lease) {
        when(reoptClient.optimize(any())).thenAnswer(invocation -> {
            ReoptJobRequest job = invocation.getArgument(0);
            return job.isThirdPartyOwnership() ? lease : purchase;
        });
    }

    @Test
    void testResidentialComparesPurchaseAndLease() {
        stubReopt(Mono.just(outcome("p-1", 8_000.0, 0.0)), Mono.just(outcome("l-1", 11_500.0, 0.30)));

        StepVerifier.create(service.compare(DENVER, "residential", false))
                .assertNext(comparison -> {
                    assertEquals("residential", comparison.getScenarioType());
                    assertEquals(List.of(FinancingComparison.PURCHASE, FinancingComparison.LEASE),
                            comparison.getReport().getResults().stream().map(ScenarioResult::getName).toList());
                    assertEquals(3_500.0, comparison.getNpvDifference(), 1e-9);
                    assertEquals("5cd3f9fe5457a3f1d4b2a9e0", comparison.getUrdbLabel());
                    assertNull(comparison.getPolicyNotice());
                })
                .verifyComplete();

        ArgumentCaptor<ReoptJobRequest> jobs = ArgumentCaptor.forClass(ReoptJobRequest.class);
        verify(reoptClient, times(2)).optimize(jobs.capture());
        ReoptJobRequest purchase = jobs.getAllValues().stream().filter(job -> !job.isThirdPartyOwnership())
                .findFirst().orElseThrow();
        ReoptJobRequest lease = jobs.getAllValues().stream().filter(ReoptJobRequest::isThirdPartyOwnership)
                .findFirst().orElseThrow();
        assertEquals(0.0, purchase.getFederalItcFraction());
        assertEquals(0.30, lease.getFederalItcFraction());
        assertEquals("5cd3f9fe5457a3f1d4b2a9e0", lease.getUrdbLabel());
        assertEquals(39.75, lease.getLatitude());
        assertEquals(25, lease.getAnalysisYears());
        assertEquals(25, purchase.getAnalysisYears());
    }

    @Test
    void testBranchParamsCarryItcAndAnalysisYears() {
        VoltQueryProperties properties = new VoltQueryProperties();
        properties.getFinancing().setAnalysisYears(20);
        service = new FinancingScenarioService(new ScenarioBranchExecutor(), reoptClient, urdbClient,
                geocodingClient, new LocationExtractor(), properties, clock);
        stubReopt(Mono.just(outcome("p-1", 8_000.0, 0.0)), Mono.just(outcome("l-1", 11_500.0, 0.30)));

        StepVerifier.create(service.compare(DENVER, "residential", false))
                .assertNext(comparison -> {
                    ScenarioResult<OptimizationOutcome> purchase =
                            comparison.getReport().find(FinancingComparison.PURCHASE).orElseThrow();
                    ScenarioResult<OptimizationOutcome> lease =
                            comparison.getReport().find(FinancingComparison.LEASE).orElseThrow();
                    assertEquals(0.0, purchase.getParams().get(FinancingScenarioService.ITC_PARAM));
                    assertEquals(20, purchase.getParams().get(FinancingScenarioService.ANALYSIS_YEARS_PARAM));
                    assertEquals(0.30, lease.getParams().get(FinancingScenarioService.ITC_PARAM));
                    assertEquals(20, lease.getParams().get(FinancingScenarioService.ANALYSIS_YEARS_PARAM));
                })
                .verifyComplete();

        ArgumentCaptor<ReoptJobRequest> jobs = ArgumentCaptor.forClass(ReoptJobRequest.class);
        verify(reoptClient, times(2)).optimize(jobs.capture());
        assertTrue(jobs.getAllValues().stream().allMatch(job -> job.getAnalysisYears() == 20));
    }

    @Test
    void testFailedLeaseStillReturnsPurchase() {
        stubReopt(Mono.just(outcome("p-1", 8_000.0, 0.0)),
                Mono.error(new TransientApiException("REopt returned HTTP 503")));

        StepVerifier.create(service.compare(DENVER, "residential", false))
                .assertNext(comparison -> {
                    ScenarioBranchReport<OptimizationOutcome> report = comparison.getReport();
                    assertEquals(8_000.0, report.outcome(FinancingComparison.PURCHASE).orElseThrow().getNpv());
                    assertFalse(report.find(FinancingComparison.LEASE).orElseThrow().isSuccess());
                    assertNull(comparison.getNpvDifference());
                    assertFalse(report.isAllFailed());
                })
                .verifyComplete();
    }

    @Test
    void testLeaseOnlyRunsSingleBranch() {
        stubReopt(Mono.just(outcome("p-1", 1.0, 0.0)), Mono.just(outcome("l-1", 11_500.0, 0.30)));

        StepVerifier.create(service.compare(DENVER, "residential", true))
                .assertNext(comparison -> {
                    assertEquals(1, comparison.getReport().getResults().size());
                    assertTrue(comparison.getReport().outcome(FinancingComparison.LEASE).isPresent());
                    assertNull(comparison.getNpvDifference());
                })
                .verifyComplete();
        verify(reoptClient, times(1)).optimize(any());
    }

    @Test
    void testCommercialShowsPolicyNoticeBeforeSafeHarbor() {
        stubReopt(Mono.just(outcome("c-1", 250_000.0, 0.30)), Mono.empty());

        StepVerifier.create(service.compare(DENVER, "Commercial", false))
                .assertNext(comparison -> {
                    assertEquals("commercial", comparison.getScenarioType());
                    assertTrue(comparison.getReport().outcome(FinancingComparison.COMMERCIAL).isPresent());
                    assertEquals("NOTE: You must commence construction by July 4, 2026, to lock in this 30% credit.",
                            comparison.getPolicyNotice());
                })
                .verifyComplete();
        verify(urdbClient).tariffLabel(anyDouble(), anyDouble(), eq("commercial"));
        verify(reoptClient).optimize(argThat(job -> job.getFederalItcFraction() == 0.30
                && !job.isThirdPartyOwnership()
                && job.getPropertyType().equals("commercial")));
    }

    @Test
    void testNoPolicyNoticeFromSafeHarborDate() {
        stubReopt(Mono.just(outcome("c-1", 250_000.0, 0.30)), Mono.empty());
        clock.set(Instant.parse("2026-07-04T00:00:00Z"));

        StepVerifier.create(service.compare(DENVER, "industrial", false))
                .assertNext(comparison -> assertNull(comparison.getPolicyNotice()))
                .verifyComplete();
    }

    @Test
    void testUnsupportedPropertyTypeIsRejected() {
        StepVerifier.create(service.compare(DENVER, "agricultural", false))
                .expectError(InvalidQuestionException.class)
                .verify();
        verifyNoInteractions(reoptClient, urdbClient);
    }

    @Test
    void testMissingTariffFailsComparison() {
        when(urdbClient.tariffLabel(anyDouble(), anyDouble(), anyString()))
                .thenReturn(Mono.error(new TransientApiException("No tariff found")));

        StepVerifier.create(service.compare(DENVER, "residential", false))
                .expectError(TransientApiException.class)
                .verify();
        verify(reoptClient, never()).optimize(any());
    }

    @Test
    void testRequestResolvesLocationText() {
        stubReopt(Mono.just(outcome("p-1", 8_000.0, 0.0)), Mono.just(outcome("l-1", 9_000.0, 0.30)));

        FinancingRequest request = FinancingRequest.builder().location("80202").build();

        StepVerifier.create(service.compare(request))
                .assertNext(comparison -> {
                    assertEquals("80202", comparison.getLocation());
                    assertEquals(1_000.0, comparison.getNpvDifference(), 1e-9);
                })
                .verifyComplete();
        verify(geocodingClient).resolve(argThat(location -> "80202".equals(location.getZipCode())));
    }

    @Test
    void testFreeTextLocationIsGeocoded() {
        stubReopt(Mono.just(outcome("p-1", 8_000.0, 0.0)), Mono.just(outcome("l-1", 9_000.0, 0.30)));
        when(geocodingClient.geocodeText("Boulder")).thenReturn(Mono.just(new double[]{40.01, -105.27}));

        StepVerifier.create(service.compare(FinancingRequest.builder().location("Boulder").build()))
                .assertNext(comparison -> {
                    assertEquals("Boulder", comparison.getLocation());
                    assertEquals(40.01, comparison.getLatitude());
                })
                .verifyComplete();
    }

    @Test
    void testBlankLocationIsRejected() {
        StepVerifier.create(service.compare(FinancingRequest.builder().location("  ").build()))
                .expectError(InvalidQuestionException.class)
                .verify();
    }
}
