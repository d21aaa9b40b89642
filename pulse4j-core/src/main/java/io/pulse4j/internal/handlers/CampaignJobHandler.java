package io.pulse4j.internal.handlers;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.pulse4j.QueueJobHandler;
import io.pulse4j.core.NewQueueJob;
import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobType;
import io.pulse4j.exception.QueueJobException;
import io.pulse4j.spi.CampaignSource;
import io.pulse4j.spi.CampaignSource.Campaign;
import io.pulse4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fans a campaign out into one {@code email} job per recipient, inheriting the campaign job's priority.
 *
 * <p>Each email inherits the campaign job's priority and attempt budget.
 *
 * <p>A retry after a partial fan-out enqueues the remaining recipients again; email jobs are
 * expected to be idempotent downstream.
 */
public class CampaignJobHandler implements QueueJobHandler<CampaignJobHandler.CampaignPayload> {
    private static final Logger log = LoggerFactory.getLogger(CampaignJobHandler.class);

    private final CampaignSource campaigns;
    private final JobStore store;

    public CampaignJobHandler(CampaignSource campaigns, JobStore store) {
        this.campaigns = Objects.requireNonNull(campaigns, "campaigns must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    @Override
    public QueueJobType type() {
        return QueueJobType.CAMPAIGN;
    }

    @Override
    public Class<CampaignPayload> payloadClass() {
        return CampaignPayload.class;
    }

    @Override
    public void execute(QueueJob job, CampaignPayload payload) {
        if (payload == null || payload.campaignId() == null) {
            throw QueueJobException.permanent("campaign job " + job.id() + " has no campaignId", null);
        }

        Campaign campaign = campaigns.findCampaign(payload.campaignId(), payload.userId())
                .orElseThrow(() -> new QueueJobException("Campaign not found: " + payload.campaignId()));

        int enqueued = 0;
        for (String recipient : campaign.recipients()) {
            store.createQueueJob(NewQueueJob.builder(QueueJobType.EMAIL)
                    .put("userId", payload.userId())
                    .put("campaignId", campaign.id())
                    .put("recipient", recipient)
                    .put("subject", campaign.subject())
                    .put("content", campaign.content())
                    .put("htmlContent", campaign.htmlContent())
                    .priority(job.priority())
                    .maxAttempts(job.maxAttempts())
                    .build());
            enqueued++;
        }
        log.info("pulse campaign fanned out id={} campaignId={} emails={}", job.id(), campaign.id(), enqueued);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CampaignPayload(String campaignId, String userId) {
    }
}
