package com.serge.community.service;

import com.serge.community.config.AsyncConfig;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Sends the confirmation mail after the registration has committed, off the request thread.
 * Delivery is best effort: a failure is logged and the account stays pending.
 */
@Component
@RequiredArgsConstructor
public class ConfirmationMailer {
    private static final Logger log = LoggerFactory.getLogger(ConfirmationMailer.class);
    static final String SUBJECT = "Confirm your registration";

    private final EmailService emailService;

    // public address of the site; never taken from the request
    @Value("${APP_BASE_URL:http://localhost:8080}")
    private String baseUrl;

    @Async(AsyncConfig.MAIL_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRegistered(AccountRegisteredEvent event) {
        String link = baseUrl + "/api/auth/confirm/" + event.confirmationCode();
        try {
            emailService.send(event.email(), SUBJECT,
                    "<p>Hello " + event.username() + ",</p>" +
                            "<p>Thanks for joining. Please confirm your email address:</p>" +
                            "<p><a href=\"" + link + "\">Confirm registration</a></p>" +
                            "<p>If you did not register, ignore this message.</p>");
            log.info("registration.mail.sent accountId={}", event.accountId());
        } catch (MailDispatchException e) {
            log.error("registration.mail.failed accountId={} email={}", event.accountId(), event.email(), e);
        }
    }
}
