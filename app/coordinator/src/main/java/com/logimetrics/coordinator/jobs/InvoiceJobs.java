/*
 * Where: Periodic jobs
 * What: Recurring invoice generation, payment reminders and the overdue flip
 * Why: Billing state advances by calendar day in the platform timezone, not per request
 */
package com.logimetrics.coordinator.jobs;

import com.logimetrics.coordinator.config.SchedulerProperties;
import com.logimetrics.coordinator.domain.Invoice;
import com.logimetrics.coordinator.domain.InvoiceRepository;
import com.logimetrics.coordinator.domain.RecurringFrequency;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.NotificationPriority;
import com.logimetrics.coordinator.notification.NotificationPublisher;
import com.logimetrics.coordinator.notification.NotificationType;
import com.logimetrics.coordinator.notification.Recipient;
import com.logimetrics.coordinator.notification.RecipientDirectory;
import com.logimetrics.coordinator.tenant.BatchPager;
import com.logimetrics.coordinator.tenant.IterationOptions;
import com.logimetrics.coordinator.tenant.IterationResult;
import com.logimetrics.coordinator.tenant.Tenant;
import com.logimetrics.coordinator.tenant.TenantIterator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class InvoiceJobs {

  static final Duration REMINDER_INTERVAL = Duration.ofDays(3);
  static final long DEFAULT_PAYMENT_TERM_DAYS = 30;
  static final List<String> OVERDUE_RECIPIENT_ROLES =
      List.of(RecipientDirectory.ROLE_ADMIN, RecipientDirectory.ROLE_FINANCE);

  private static final Logger logger = LoggerFactory.getLogger(InvoiceJobs.class);

  private final TenantIterator tenantIterator;
  private final IterationOptions iterationOptions;
  private final InvoiceRepository invoiceRepository;
  private final RecipientDirectory recipientDirectory;
  private final NotificationPublisher publisher;
  private final TransactionTemplate transactionTemplate;
  private final ZoneId zone;
  private final Clock clock;

  public InvoiceJobs(
      TenantIterator tenantIterator,
      IterationOptions iterationOptions,
      InvoiceRepository invoiceRepository,
      RecipientDirectory recipientDirectory,
      NotificationPublisher publisher,
      TransactionTemplate transactionTemplate,
      SchedulerProperties schedulerProperties,
      Clock clock) {
    this.tenantIterator = tenantIterator;
    this.iterationOptions = iterationOptions;
    this.invoiceRepository = invoiceRepository;
    this.recipientDirectory = recipientDirectory;
    this.publisher = publisher;
    this.transactionTemplate = transactionTemplate;
    this.zone = schedulerProperties.zoneId();
    this.clock = clock;
  }

  public IterationResult processRecurringInvoices(CancellationToken token) {
    final LocalDate today = LocalDate.now(clock.withZone(zone));
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> {
          final long processed =
              BatchPager.forEachPage(
                  iterationOptions.batchSize(),
                  (UUID afterId, int limit) ->
                      invoiceRepository.findRecurringDue(tenant.id(), today, afterId, limit),
                  Invoice::id,
                  page -> page.forEach(template -> generateFrom(template, today)),
                  tenantToken);
          logger.info("recurring invoices processed tenantId={} count={}", tenant.id(), processed);
        },
        iterationOptions,
        token);
  }

  private void generateFrom(Invoice template, LocalDate today) {
    final Instant now = Instant.now(clock);
    final String invoiceNumber =
        template.invoiceNumber() + "-" + today.format(DateTimeFormatter.BASIC_ISO_DATE);
    final LocalDate dueDate = today.plusDays(paymentTermDays(template));
    final LocalDate nextDate =
        RecurringFrequency.fromValue(template.recurringFrequency()).advance(today);
    final UUID created;
    try {
      created =
          transactionTemplate.execute(
              status -> {
                final UUID id =
                    invoiceRepository.insertRecurringCopy(
                        template, invoiceNumber, today, dueDate, now);
                invoiceRepository.updateNextRecurringDate(template.id(), nextDate, now);
                return id;
              });
    } catch (DataAccessException ex) {
      logger.warn("recurring invoice not generated templateId={}", template.id(), ex);
      return;
    }
    logger.info(
        "recurring invoice generated templateId={} invoiceId={} number={} nextDate={}",
        template.id(),
        created,
        invoiceNumber,
        nextDate);
    if (template.customerId() == null) {
      return;
    }
    publisher.publish(
        Notification.builder(template.customerId(), NotificationType.INVOICE_GENERATED)
            .companyId(template.companyId())
            .title("New Invoice " + invoiceNumber)
            .message(
                "Your recurring invoice "
                    + invoiceNumber
                    + " for "
                    + template.currency()
                    + " "
                    + template.totalAmount()
                    + " is ready.")
            .data("invoiceId", created == null ? null : created.toString())
            .channels(NotificationChannel.IN_APP, NotificationChannel.EMAIL)
            .build(clock));
  }

  static long paymentTermDays(Invoice template) {
    if (template.issueDate() == null || template.dueDate() == null) {
      return DEFAULT_PAYMENT_TERM_DAYS;
    }
    final long days = ChronoUnit.DAYS.between(template.issueDate(), template.dueDate());
    return days > 0 ? days : DEFAULT_PAYMENT_TERM_DAYS;
  }

  public IterationResult sendPaymentReminders(CancellationToken token) {
    final Instant remindedBefore = Instant.now(clock).minus(REMINDER_INTERVAL);
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> {
          final long reminded =
              BatchPager.forEachPage(
                  iterationOptions.batchSize(),
                  (UUID afterId, int limit) ->
                      invoiceRepository.findReminderCandidates(
                          tenant.id(), remindedBefore, afterId, limit),
                  Invoice::id,
                  page -> page.forEach(this::remind),
                  tenantToken);
          logger.info("payment reminders processed tenantId={} count={}", tenant.id(), reminded);
        },
        iterationOptions,
        token);
  }

  private void remind(Invoice invoice) {
    publisher.publish(
        Notification.builder(invoice.customerId(), NotificationType.PAYMENT_REMINDER)
            .companyId(invoice.companyId())
            .title("Payment Reminder")
            .message(
                "Invoice "
                    + invoice.invoiceNumber()
                    + " is overdue. Amount: "
                    + invoice.currency()
                    + " "
                    + invoice.totalAmount())
            .data("invoiceId", invoice.id().toString())
            .channels(NotificationChannel.IN_APP, NotificationChannel.EMAIL)
            .priority(NotificationPriority.HIGH)
            .build(clock));
    invoiceRepository.markReminderSent(invoice.id(), Instant.now(clock));
  }

  public IterationResult updateOverdueStatus(CancellationToken token) {
    final LocalDate today = LocalDate.now(clock.withZone(zone));
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> flagOverdue(tenant, today, tenantToken), iterationOptions, token);
  }

  private void flagOverdue(Tenant tenant, LocalDate today, CancellationToken token) {
    final List<Invoice> flipped =
        invoiceRepository.markOverdue(tenant.id(), today, clock.instant());
    logger.info("invoices marked overdue tenantId={} count={}", tenant.id(), flipped.size());
    if (flipped.isEmpty()) {
      return;
    }
    final List<Recipient> recipients =
        recipientDirectory.findByCompanyAndRoles(tenant.id(), OVERDUE_RECIPIENT_ROLES);
    for (Invoice invoice : flipped) {
      token.throwIfCancelled();
      for (Recipient recipient : recipients) {
        publisher.publish(
            Notification.builder(recipient.id(), NotificationType.INVOICE_OVERDUE)
                .companyId(tenant.id())
                .title("Invoice Overdue")
                .message("Invoice " + invoice.invoiceNumber() + " is now overdue")
                .data("invoiceId", invoice.id().toString())
                .channels(NotificationChannel.IN_APP)
                .build(clock));
      }
    }
  }
}
