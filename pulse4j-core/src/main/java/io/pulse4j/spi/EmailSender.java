package io.pulse4j.spi;

/**
 * Transport used by the {@code email} queue job.
 */
public interface EmailSender {

    EmailResult send(EmailMessage message);

    record EmailMessage(String userId, String to, String subject, String text, String html) {
    }

    record EmailResult(boolean success, String messageId, String error) {

        public static EmailResult sent(String messageId) {
            return new EmailResult(true, messageId, null);
        }

        public static EmailResult rejected(String error) {
            return new EmailResult(false, null, error);
        }
    }
}
