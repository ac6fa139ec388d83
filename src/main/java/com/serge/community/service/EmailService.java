package com.serge.community.service;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;

@Service
@RequiredArgsConstructor
public class EmailService {
    private static final Logger log = LoggerFactory.getLogger(EmailService.class);
    private final JavaMailSender mailSender;

    @Value("${MAIL_FROM:postmaster@dev-community.local}")
    private String from;

    @Value("${MAIL_FROM_NAME:Dev Community}")
    private String fromName;

    /**
     * Sends an HTML message synchronously.
     *
     * @throws MailDispatchException when the message cannot be built or the SMTP hand-off fails
     */
    public void send(String to, String subject, String html) {
        log.debug("email.send to={} subject={}", to, subject);
        try {
            MimeMessage msg = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(msg, false, StandardCharsets.UTF_8.name());
            helper.setFrom(from, fromName);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(html, true);
            mailSender.send(msg);
            log.info("email.send.success to={} subject={}", to, subject);
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            log.error("email.send.failed to={} subject={} error={}", to, subject, e.toString());
            throw new MailDispatchException("Failed to send email to " + to, e);
        }
    }
}
