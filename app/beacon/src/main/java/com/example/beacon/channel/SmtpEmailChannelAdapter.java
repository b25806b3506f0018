/*
 * どこで: Beacon チャネル層
 * 何を: JavaMailSender で EMAIL チャネルを送信する
 * なぜ: SMTP の失敗を宛先起因 (恒久) と経路起因 (一時) に分けて返すため
 */
package com.example.beacon.channel;

import com.example.beacon.config.BeaconMessageProperties;
import com.example.beacon.model.Channel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.mail.SendFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

public class SmtpEmailChannelAdapter implements ChannelAdapter {

  private static final Logger logger = LoggerFactory.getLogger(SmtpEmailChannelAdapter.class);

  private final JavaMailSender mailSender;
  private final ContactValidator contactValidator;
  private final BeaconMessageProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JavaMailSender は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public SmtpEmailChannelAdapter(
      JavaMailSender mailSender,
      ContactValidator contactValidator,
      BeaconMessageProperties properties) {
    this.mailSender = mailSender;
    this.contactValidator = contactValidator;
    this.properties = properties;
  }

  @Override
  public Channel channel() {
    return Channel.EMAIL;
  }

  @Override
  public SendResult send(String destination, AlertMessage message) {
    if (contactValidator.normalizeEmail(destination).isEmpty()) {
      return SendResult.permanentError("invalid email address");
    }
    final SimpleMailMessage mail = new SimpleMailMessage();
    mail.setFrom(properties.emailFrom());
    mail.setTo(destination);
    mail.setSubject(message.subject());
    mail.setText(message.body());
    try {
      mailSender.send(mail);
      return SendResult.ok();
    } catch (MailParseException | MailPreparationException ex) {
      logger.warn("email rejected before send reason={}", ex.getMessage());
      return SendResult.permanentError("email could not be prepared: " + ex.getMessage());
    } catch (MailSendException ex) {
      if (isRecipientRejected(ex)) {
        logger.warn("email recipient rejected reason={}", ex.getMessage());
        return SendResult.permanentError("recipient rejected: " + ex.getMessage());
      }
      logger.warn("email send failed reason={}", ex.getMessage());
      return SendResult.transientError("smtp send failed: " + ex.getMessage());
    } catch (MailException ex) {
      logger.warn("email send failed reason={}", ex.getMessage());
      return SendResult.transientError("smtp failure: " + ex.getMessage());
    }
  }

  private boolean isRecipientRejected(MailSendException ex) {
    for (Exception failure : ex.getFailedMessages().values()) {
      Throwable current = failure;
      while (current != null) {
        if (current instanceof SendFailedException sendFailed
            && sendFailed.getInvalidAddresses() != null
            && sendFailed.getInvalidAddresses().length > 0) {
          return true;
        }
        current = current.getCause();
      }
    }
    return false;
  }
}
