package io.pulse4j.internal.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.pulse4j.QueueJobHandler;
import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobType;
import io.pulse4j.exception.QueueJobException;
import io.pulse4j.spi.EmailSender;
import io.pulse4j.spi.EmailSender.EmailMessage;
import io.pulse4j.spi.EmailSender.EmailResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Sends one email through {@link EmailSender}. A rejected send fails the attempt.
 */
public class EmailJobHandler implements QueueJobHandler<EmailJobHandler.EmailPayload> {
    private static final Logger log = LoggerFactory.getLogger(EmailJobHandler.class);

    private final EmailSender sender;

    public EmailJobHandler(EmailSender sender) {
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
    }

    @Override
    public QueueJobType type() {
        return QueueJobType.EMAIL;
    }

    @Override
    public Class<EmailPayload> payloadClass() {
        return EmailPayload.class;
    }

    @Override
    public void execute(QueueJob job, EmailPayload payload) {
        if (payload == null || payload.recipient() == null || payload.recipient().isBlank()) {
            throw QueueJobException.permanent("email job " + job.id() + " has no recipient", null);
        }

        EmailResult result = sender.send(new EmailMessage(
                payload.userId(),
                payload.recipient(),
                payload.subject(),
                payload.content(),
                payload.htmlContent()
        ));

        if (result == null || !result.success()) {
            String reason = (result == null || result.error() == null) ? "Email send failed" : result.error();
            throw new QueueJobException(reason);
        }
        log.debug("pulse email sent id={} campaignId={} messageId={}", job.id(), payload.campaignId(), result.messageId());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EmailPayload(
            String userId,
            String recipient,
            String subject,
            String content,
            String htmlContent,
            String campaignId
    ) {
    }
}
