package io.pulse4j.spi;

import java.util.List;
import java.util.Optional;

/**
 * Lookup used by the {@code campaign} queue job to fan out one email per recipient.
 */
public interface CampaignSource {

    Optional<Campaign> findCampaign(String campaignId, String userId);

    record Campaign(String id, String subject, String content, String htmlContent, List<String> recipients) {

        public Campaign {
            recipients = (recipients == null) ? List.of() : List.copyOf(recipients);
        }
    }
}
