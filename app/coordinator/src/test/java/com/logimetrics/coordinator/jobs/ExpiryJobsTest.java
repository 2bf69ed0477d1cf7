package com.logimetrics.coordinator.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.MoreExecutors;
import com.logimetrics.coordinator.config.SchedulerProperties;
import com.logimetrics.coordinator.dashboard.DashboardAlertRaised;
import com.logimetrics.coordinator.dashboard.VehicleStatusChanged;
import com.logimetrics.coordinator.domain.AuditTrail;
import com.logimetrics.coordinator.domain.DocumentRepository;
import com.logimetrics.coordinator.domain.Driver;
import com.logimetrics.coordinator.domain.DriverRepository;
import com.logimetrics.coordinator.domain.Vehicle;
import com.logimetrics.coordinator.domain.VehicleDocument;
import com.logimetrics.coordinator.domain.VehicleRepository;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.NotificationPriority;
import com.logimetrics.coordinator.notification.NotificationPublisher;
import com.logimetrics.coordinator.notification.NotificationType;
import com.logimetrics.coordinator.notification.Recipient;
import com.logimetrics.coordinator.notification.RecipientDirectory;
import com.logimetrics.coordinator.tenant.IterationOptions;
import com.logimetrics.coordinator.tenant.IterationResult;
import com.logimetrics.coordinator.tenant.Tenant;
import com.logimetrics.coordinator.tenant.TenantIterator;
import com.logimetrics.coordinator.tenant.TenantRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

class ExpiryJobsTest {

  // 12:00 in Asia/Kolkata
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-10-18T06:30:00Z"), ZoneOffset.UTC);
  private static final LocalDate TODAY = LocalDate.of(2026, 10, 18);
  private static final Tenant TENANT = new Tenant(UUID.randomUUID(), "acme", "active");
  private static final Recipient ADMIN =
      new Recipient(
          UUID.randomUUID(), TENANT.id(), "Asha", "asha@acme.test", null, "admin");

  private final TenantRepository tenantRepository = mock(TenantRepository.class);
  private final VehicleRepository vehicleRepository = mock(VehicleRepository.class);
  private final DriverRepository driverRepository = mock(DriverRepository.class);
  private final DocumentRepository documentRepository = mock(DocumentRepository.class);
  private final RecipientDirectory recipientDirectory = mock(RecipientDirectory.class);
  private final NotificationPublisher publisher = mock(NotificationPublisher.class);
  private final ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
  private final AuditTrail auditTrail = mock(AuditTrail.class);
  private ExpiryJobs jobs;

  @BeforeEach
  void setUp() {
    when(tenantRepository.findActive()).thenReturn(List.of(TENANT));
    when(recipientDirectory.findByCompanyAndRoles(TENANT.id(), ExpiryJobs.FLEET_ROLES))
        .thenReturn(List.of(ADMIN));
    final TenantIterator iterator =
        new TenantIterator(tenantRepository, MoreExecutors.newDirectExecutorService(), CLOCK);
    jobs =
        new ExpiryJobs(
            iterator,
            IterationOptions.defaults(),
            vehicleRepository,
            driverRepository,
            documentRepository,
            recipientDirectory,
            publisher,
            events,
            auditTrail,
            new SchedulerProperties(true, "Asia/Kolkata", null, null, 0, 0, null),
            CLOCK);
  }

  @Test
  void expiredLicenseDeactivatesDriverAndNotifiesDriverAndAdmins() {
    final UUID driverUser = UUID.randomUUID();
    final Driver driver =
        new Driver(
            UUID.randomUUID(),
            TENANT.id(),
            driverUser,
            "Ravi Kumar",
            "KA01-2020-001",
            TODAY.minusDays(1),
            "active");
    when(driverRepository.findLicensesExpiringBy(TENANT.id(), TODAY.plusDays(30)))
        .thenReturn(List.of(driver));
    when(driverRepository.deactivate(driver.id(), Instant.now(CLOCK))).thenReturn(1);

    final IterationResult result = jobs.checkLicenseExpiry(CancellationToken.create());

    assertThat(result.allSucceeded()).isTrue();
    verify(driverRepository).deactivate(driver.id(), Instant.now(CLOCK));
    final ArgumentCaptor<Notification> sent = ArgumentCaptor.forClass(Notification.class);
    verify(publisher, times(2)).publish(sent.capture());
    final Notification toDriver = sent.getAllValues().get(0);
    assertThat(toDriver.recipientId()).isEqualTo(driverUser);
    assertThat(toDriver.type()).isEqualTo(NotificationType.LICENSE_EXPIRY);
    assertThat(toDriver.priority()).isEqualTo(NotificationPriority.URGENT);
    assertThat(toDriver.title()).isEqualTo("License Expired");
    assertThat(toDriver.channels())
        .containsExactlyInAnyOrder(
            NotificationChannel.IN_APP, NotificationChannel.EMAIL, NotificationChannel.SMS);
    assertThat(toDriver.data()).containsEntry("alertLevel", "expired");
    final Notification toAdmin = sent.getAllValues().get(1);
    assertThat(toAdmin.recipientId()).isEqualTo(ADMIN.id());
    assertThat(toAdmin.priority()).isEqualTo(NotificationPriority.URGENT);
    assertThat(toAdmin.message()).startsWith("Ravi Kumar: ");
    verify(auditTrail)
        .record(eq("driver.deactivated"), eq("driver"), eq(driver.id()), eq(TENANT.id()), anyMap());
    final ArgumentCaptor<DashboardAlertRaised> alert =
        ArgumentCaptor.forClass(DashboardAlertRaised.class);
    verify(events).publishEvent(alert.capture());
    assertThat(alert.getValue().severity()).isEqualTo("critical");
  }

  @Test
  void licenseInWarningWindowOnlyNotifiesInApp() {
    final Driver driver =
        new Driver(
            UUID.randomUUID(),
            TENANT.id(),
            UUID.randomUUID(),
            null,
            "KA01-2020-002",
            TODAY.plusDays(10),
            "active");
    when(driverRepository.findLicensesExpiringBy(TENANT.id(), TODAY.plusDays(30)))
        .thenReturn(List.of(driver));

    jobs.checkLicenseExpiry(CancellationToken.create());

    verify(driverRepository, never()).deactivate(any(), any());
    final ArgumentCaptor<Notification> sent = ArgumentCaptor.forClass(Notification.class);
    verify(publisher, times(2)).publish(sent.capture());
    assertThat(sent.getAllValues())
        .allSatisfy(
            n -> {
              assertThat(n.channels()).containsExactly(NotificationChannel.IN_APP);
              assertThat(n.priority()).isEqualTo(NotificationPriority.HIGH);
            });
    assertThat(sent.getAllValues().get(1).message())
        .isEqualTo("Driver KA01-2020-002: Driving license KA01-2020-002 expires in 10 days.");
  }

  @Test
  void overdueMaintenanceIsUrgentAndKeepsVehicleInService() {
    final Vehicle vehicle =
        new Vehicle(
            UUID.randomUUID(), TENANT.id(), "KA05MX1234", "Tata", "Ace", "active", TODAY);
    when(vehicleRepository.findServiceDueBy(TENANT.id(), TODAY.plusDays(30)))
        .thenReturn(List.of(vehicle));

    jobs.checkVehicleMaintenance(CancellationToken.create());

    final ArgumentCaptor<Notification> sent = ArgumentCaptor.forClass(Notification.class);
    verify(publisher).publish(sent.capture());
    assertThat(sent.getValue().title()).isEqualTo("Vehicle Maintenance Urgent");
    assertThat(sent.getValue().message())
        .isEqualTo("Vehicle KA05MX1234 (Tata Ace) is overdue for maintenance!");
    assertThat(sent.getValue().channels())
        .containsExactlyInAnyOrder(NotificationChannel.IN_APP, NotificationChannel.EMAIL);
    verify(vehicleRepository, never()).changeStatus(any(), any(), any());
  }

  @Test
  void expiredMandatoryDocumentTakesVehicleOffTheRoad() {
    final VehicleDocument document =
        new VehicleDocument(
            UUID.randomUUID(),
            TENANT.id(),
            UUID.randomUUID(),
            "KA05MX1234",
            "insurance",
            true,
            TODAY.minusDays(2));
    when(documentRepository.findVehicleDocumentsExpiringBy(TENANT.id(), TODAY.plusDays(30)))
        .thenReturn(List.of(document));
    when(vehicleRepository.changeStatus(
            document.vehicleId(), VehicleRepository.STATUS_INACTIVE, Instant.now(CLOCK)))
        .thenReturn(Optional.of("active"));

    jobs.checkDocumentExpiry(CancellationToken.create());

    verify(documentRepository).markExpired(document.id(), Instant.now(CLOCK));
    verify(events)
        .publishEvent(
            new VehicleStatusChanged(
                TENANT.id(), document.vehicleId(), "active", "inactive", "insurance_expired"));
    verify(auditTrail)
        .record(
            eq("vehicle.deactivated"),
            eq("vehicle"),
            eq(document.vehicleId()),
            eq(TENANT.id()),
            anyMap());
  }

  @Test
  void documentInNoticeWindowIsAnnouncedAsWarning() {
    final VehicleDocument document =
        new VehicleDocument(
            UUID.randomUUID(),
            TENANT.id(),
            UUID.randomUUID(),
            "KA05MX1234",
            "permit",
            false,
            TODAY.plusDays(25));
    when(documentRepository.findVehicleDocumentsExpiringBy(TENANT.id(), TODAY.plusDays(30)))
        .thenReturn(List.of(document));

    jobs.checkDocumentExpiry(CancellationToken.create());

    final ArgumentCaptor<Notification> sent = ArgumentCaptor.forClass(Notification.class);
    verify(publisher).publish(sent.capture());
    assertThat(sent.getValue().data()).containsEntry("alertLevel", "warning");
    assertThat(sent.getValue().message())
        .isEqualTo("PERMIT for vehicle KA05MX1234 expires in 25 days.");
    assertThat(sent.getValue().priority()).isEqualTo(NotificationPriority.HIGH);
    verify(documentRepository, never()).markExpired(any(), any());
  }

  @Test
  void expiryLevelsFollowDayThresholds() {
    assertThat(ExpiryLevel.of(0)).isEqualTo(ExpiryLevel.EXPIRED);
    assertThat(ExpiryLevel.of(7)).isEqualTo(ExpiryLevel.URGENT);
    assertThat(ExpiryLevel.of(8)).isEqualTo(ExpiryLevel.WARNING);
    assertThat(ExpiryLevel.of(15)).isEqualTo(ExpiryLevel.WARNING);
    assertThat(ExpiryLevel.of(16)).isEqualTo(ExpiryLevel.NOTICE);
    assertThat(ExpiryJobs.severityOf(ExpiryLevel.URGENT)).isEqualTo("high");
  }
}
