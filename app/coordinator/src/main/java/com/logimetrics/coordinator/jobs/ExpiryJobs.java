/*
 * Where: Periodic jobs
 * What: Vehicle service, driver license and vehicle document expiry checks
 * Why: Expired papers take drivers and vehicles off the road; people must hear about it first
 */
package com.logimetrics.coordinator.jobs;

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
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Repositories and publishers are shared Spring-managed components")
public class ExpiryJobs {

  static final List<String> FLEET_ROLES =
      List.of(RecipientDirectory.ROLE_ADMIN, RecipientDirectory.ROLE_FLEET_MANAGER);

  private static final Logger logger = LoggerFactory.getLogger(ExpiryJobs.class);

  private final TenantIterator tenantIterator;
  private final IterationOptions iterationOptions;
  private final VehicleRepository vehicleRepository;
  private final DriverRepository driverRepository;
  private final DocumentRepository documentRepository;
  private final RecipientDirectory recipientDirectory;
  private final NotificationPublisher publisher;
  private final ApplicationEventPublisher events;
  private final AuditTrail auditTrail;
  private final ZoneId zone;
  private final Clock clock;

  public ExpiryJobs(
      TenantIterator tenantIterator,
      IterationOptions iterationOptions,
      VehicleRepository vehicleRepository,
      DriverRepository driverRepository,
      DocumentRepository documentRepository,
      RecipientDirectory recipientDirectory,
      NotificationPublisher publisher,
      ApplicationEventPublisher events,
      AuditTrail auditTrail,
      SchedulerProperties schedulerProperties,
      Clock clock) {
    this.tenantIterator = tenantIterator;
    this.iterationOptions = iterationOptions;
    this.vehicleRepository = vehicleRepository;
    this.driverRepository = driverRepository;
    this.documentRepository = documentRepository;
    this.recipientDirectory = recipientDirectory;
    this.publisher = publisher;
    this.events = events;
    this.auditTrail = auditTrail;
    this.zone = schedulerProperties.zoneId();
    this.clock = clock;
  }

  public IterationResult checkVehicleMaintenance(CancellationToken token) {
    final LocalDate today = today();
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> {
          final List<Vehicle> due =
              vehicleRepository.findServiceDueBy(
                  tenant.id(), today.plusDays(ExpiryLevel.NOTICE_DAYS));
          if (due.isEmpty()) {
            return;
          }
          final List<Recipient> managers = fleetManagers(tenant);
          for (Vehicle vehicle : due) {
            tenantToken.throwIfCancelled();
            notifyServiceDue(tenant, vehicle, today, managers);
          }
          logger.info("maintenance alerts sent tenantId={} vehicles={}", tenant.id(), due.size());
        },
        iterationOptions,
        token);
  }

  private void notifyServiceDue(
      Tenant tenant, Vehicle vehicle, LocalDate today, List<Recipient> managers) {
    final long days = ChronoUnit.DAYS.between(today, vehicle.nextServiceDate());
    // overdue service counts as urgent; vehicles stay in service
    final ExpiryLevel level = days <= 0 ? ExpiryLevel.URGENT : ExpiryLevel.of(days);
    final String message =
        days <= 0
            ? "Vehicle " + vehicle.label() + " is overdue for maintenance!"
            : "Vehicle " + vehicle.label() + " is due for maintenance in " + days + " days.";
    final Set<NotificationChannel> channels =
        level == ExpiryLevel.URGENT
            ? EnumSet.of(NotificationChannel.IN_APP, NotificationChannel.EMAIL)
            : EnumSet.of(NotificationChannel.IN_APP);
    for (Recipient manager : managers) {
      publisher.publish(
          Notification.builder(manager.id(), NotificationType.VEHICLE_MAINTENANCE)
              .companyId(tenant.id())
              .title("Vehicle Maintenance " + capitalize(level.value()))
              .message(message)
              .data("vehicleId", vehicle.id().toString())
              .data("nextServiceDate", vehicle.nextServiceDate().toString())
              .data("daysUntil", days)
              .data("alertLevel", level.value())
              .channels(channels)
              .priority(priorityOf(level))
              .build(clock));
    }
    raiseAlert(
        tenant,
        level,
        "Vehicle maintenance " + level.value(),
        message,
        Map.of("vehicleId", vehicle.id().toString(), "daysUntil", days));
  }

  public IterationResult checkLicenseExpiry(CancellationToken token) {
    final LocalDate today = today();
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> {
          final List<Driver> expiring =
              driverRepository.findLicensesExpiringBy(
                  tenant.id(), today.plusDays(ExpiryLevel.NOTICE_DAYS));
          if (expiring.isEmpty()) {
            return;
          }
          final List<Recipient> managers = fleetManagers(tenant);
          for (Driver driver : expiring) {
            tenantToken.throwIfCancelled();
            handleLicense(tenant, driver, today, managers);
          }
          logger.info(
              "license expiry alerts sent tenantId={} drivers={}", tenant.id(), expiring.size());
        },
        iterationOptions,
        token);
  }

  private void handleLicense(
      Tenant tenant, Driver driver, LocalDate today, List<Recipient> managers) {
    final long days = ChronoUnit.DAYS.between(today, driver.licenseExpiry());
    final ExpiryLevel level = ExpiryLevel.of(days);
    final String message =
        level == ExpiryLevel.EXPIRED
            ? "Driving license " + driver.licenseNumber() + " has expired."
            : "Driving license "
                + driver.licenseNumber()
                + " expires in "
                + days
                + " days.";
    final NotificationPriority priority = priorityOf(level);
    if (driver.userId() != null) {
      final Set<NotificationChannel> channels =
          level.escalates()
              ? EnumSet.of(
                  NotificationChannel.IN_APP, NotificationChannel.EMAIL, NotificationChannel.SMS)
              : EnumSet.of(NotificationChannel.IN_APP);
      publisher.publish(
          licenseNotice(tenant, driver, driver.userId(), level, days, message)
              .channels(channels)
              .priority(priority)
              .build(clock));
    }
    final String managerMessage = driver.displayName() + ": " + message;
    for (Recipient manager : managers) {
      publisher.publish(
          licenseNotice(tenant, driver, manager.id(), level, days, managerMessage)
              .channels(NotificationChannel.IN_APP)
              .priority(priority)
              .build(clock));
    }
    if (level == ExpiryLevel.EXPIRED) {
      deactivate(tenant, driver);
    }
    raiseAlert(
        tenant,
        level,
        "License " + level.value(),
        managerMessage,
        Map.of("driverId", driver.id().toString(), "daysUntil", days));
  }

  private Notification.Builder licenseNotice(
      Tenant tenant,
      Driver driver,
      UUID recipientId,
      ExpiryLevel level,
      long days,
      String message) {
    return Notification.builder(recipientId, NotificationType.LICENSE_EXPIRY)
        .companyId(tenant.id())
        .title(level == ExpiryLevel.EXPIRED ? "License Expired" : "License Expiring Soon")
        .message(message)
        .data("driverId", driver.id().toString())
        .data("licenseExpiry", driver.licenseExpiry().toString())
        .data("daysUntil", days)
        .data("alertLevel", level.value());
  }

  private void deactivate(Tenant tenant, Driver driver) {
    final Instant now = Instant.now(clock);
    if (driverRepository.deactivate(driver.id(), now) == 0) {
      return;
    }
    logger.warn(
        "driver deactivated for expired license tenantId={} driverId={} expiry={}",
        tenant.id(),
        driver.id(),
        driver.licenseExpiry());
    auditTrail.record(
        "driver.deactivated",
        "driver",
        driver.id(),
        tenant.id(),
        Map.of(
            "reason", "license_expired",
            "licenseExpiry", driver.licenseExpiry().toString(),
            "previousStatus", String.valueOf(driver.status())));
  }

  public IterationResult checkDocumentExpiry(CancellationToken token) {
    final LocalDate today = today();
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> {
          final List<VehicleDocument> documents =
              documentRepository.findVehicleDocumentsExpiringBy(
                  tenant.id(), today.plusDays(ExpiryLevel.NOTICE_DAYS));
          if (documents.isEmpty()) {
            return;
          }
          final List<Recipient> managers = fleetManagers(tenant);
          for (VehicleDocument document : documents) {
            tenantToken.throwIfCancelled();
            handleDocument(tenant, document, today, managers);
          }
          logger.info(
              "document expiry alerts sent tenantId={} documents={}",
              tenant.id(),
              documents.size());
        },
        iterationOptions,
        token);
  }

  private void handleDocument(
      Tenant tenant, VehicleDocument document, LocalDate today, List<Recipient> managers) {
    final long days = ChronoUnit.DAYS.between(today, document.expiryDate());
    final ExpiryLevel level = ExpiryLevel.of(days);
    final String type = document.documentType().toUpperCase(Locale.ROOT);
    final String message =
        level == ExpiryLevel.EXPIRED
            ? type + " for vehicle " + document.registrationNumber() + " has expired."
            : type
                + " for vehicle "
                + document.registrationNumber()
                + " expires in "
                + days
                + " days.";
    // documents inside the notice window but beyond warning go out at warning level
    final ExpiryLevel announced = level == ExpiryLevel.NOTICE ? ExpiryLevel.WARNING : level;
    final Set<NotificationChannel> channels =
        level == ExpiryLevel.EXPIRED
            ? EnumSet.of(NotificationChannel.IN_APP, NotificationChannel.EMAIL)
            : EnumSet.of(NotificationChannel.IN_APP);
    for (Recipient manager : managers) {
      publisher.publish(
          Notification.builder(manager.id(), NotificationType.DOCUMENT_EXPIRY)
              .companyId(tenant.id())
              .title(level == ExpiryLevel.EXPIRED ? "Document Expired" : "Document Expiring Soon")
              .message(message)
              .data("documentId", document.id().toString())
              .data("vehicleId", document.vehicleId().toString())
              .data("documentType", document.documentType())
              .data("daysUntil", days)
              .data("alertLevel", announced.value())
              .channels(channels)
              .priority(priorityOf(announced))
              .build(clock));
    }
    if (level == ExpiryLevel.EXPIRED) {
      expire(tenant, document);
    }
    raiseAlert(
        tenant,
        announced,
        "Document " + announced.value(),
        message,
        Map.of(
            "documentId", document.id().toString(),
            "vehicleId", document.vehicleId().toString(),
            "daysUntil", days));
  }

  private void expire(Tenant tenant, VehicleDocument document) {
    final Instant now = Instant.now(clock);
    documentRepository.markExpired(document.id(), now);
    if (!document.mandatory()) {
      return;
    }
    final Optional<String> previous =
        vehicleRepository.changeStatus(
            document.vehicleId(), VehicleRepository.STATUS_INACTIVE, now);
    if (previous.isEmpty()) {
      return;
    }
    logger.warn(
        "vehicle deactivated for expired document tenantId={} vehicleId={} documentType={}",
        tenant.id(),
        document.vehicleId(),
        document.documentType());
    events.publishEvent(
        new VehicleStatusChanged(
            tenant.id(),
            document.vehicleId(),
            previous.get(),
            VehicleRepository.STATUS_INACTIVE,
            document.documentType() + "_expired"));
    auditTrail.record(
        "vehicle.deactivated",
        "vehicle",
        document.vehicleId(),
        tenant.id(),
        Map.of("reason", document.documentType() + "_expired", "documentId", document.id()));
  }

  private void raiseAlert(
      Tenant tenant, ExpiryLevel level, String title, String message, Map<String, Object> data) {
    if (level == ExpiryLevel.NOTICE) {
      return;
    }
    final Map<String, Object> alertData = new LinkedHashMap<>(data);
    alertData.put("alertLevel", level.value());
    events.publishEvent(
        new DashboardAlertRaised(tenant.id(), severityOf(level), title, message, alertData));
  }

  private List<Recipient> fleetManagers(Tenant tenant) {
    return recipientDirectory.findByCompanyAndRoles(tenant.id(), FLEET_ROLES);
  }

  private LocalDate today() {
    return LocalDate.now(clock.withZone(zone));
  }

  static NotificationPriority priorityOf(ExpiryLevel level) {
    return switch (level) {
      case EXPIRED, URGENT -> NotificationPriority.URGENT;
      case WARNING -> NotificationPriority.HIGH;
      case NOTICE -> NotificationPriority.NORMAL;
    };
  }

  static String severityOf(ExpiryLevel level) {
    return switch (level) {
      case EXPIRED -> "critical";
      case URGENT -> "high";
      case WARNING -> "medium";
      case NOTICE -> "low";
    };
  }

  private static String capitalize(String value) {
    return Character.toUpperCase(value.charAt(0)) + value.substring(1);
  }
}
