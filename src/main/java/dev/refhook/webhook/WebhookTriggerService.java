package dev.refhook.webhook;

import dev.refhook.domain.entity.Principal;
import dev.refhook.domain.entity.PullReq;
import dev.refhook.domain.entity.Repository;
import dev.refhook.domain.enums.WebhookTrigger;
import dev.refhook.domain.event.Event;
import dev.refhook.domain.event.pullreq.BranchUpdatedPayload;
import dev.refhook.domain.event.pullreq.ClosedPayload;
import dev.refhook.domain.event.pullreq.CreatedPayload;
import dev.refhook.domain.event.pullreq.MergedPayload;
import dev.refhook.domain.event.pullreq.ReopenedPayload;
import dev.refhook.exception.DiscardEventException;
import dev.refhook.webhook.payload.BaseSegment;
import dev.refhook.webhook.payload.CommitInfo;
import dev.refhook.webhook.payload.PrincipalInfo;
import dev.refhook.webhook.payload.PullReqBranchUpdatedPayload;
import dev.refhook.webhook.payload.PullReqClosedPayload;
import dev.refhook.webhook.payload.PullReqCreatedPayload;
import dev.refhook.webhook.payload.PullReqInfo;
import dev.refhook.webhook.payload.PullReqMergedPayload;
import dev.refhook.webhook.payload.PullReqReopenedPayload;
import dev.refhook.webhook.payload.PullReqSegment;
import dev.refhook.webhook.payload.ReferenceDetailsSegment;
import dev.refhook.webhook.payload.ReferenceInfo;
import dev.refhook.webhook.payload.ReferenceSegment;
import dev.refhook.webhook.payload.ReferenceUpdateSegment;
import dev.refhook.webhook.payload.RepositoryInfo;
import dev.refhook.webhook.payload.TargetReferenceSegment;
import org.springframework.stereotype.Service;

/**
 * Pull-request event handlers, one per lifecycle kind.
 *
 * <p>Each handler picks the trigger and the SHA to resolve, and passes the orchestrator
 * a builder that resolves the commit in the <em>source</em> repository and assembles
 * the payload. Webhooks fire for the target repository.
 *
 * <p>Holds no state beyond its collaborators, so handlers for events of the same pull
 * request may run concurrently and in any order.
 */
@Service
public class WebhookTriggerService {

    private final PullReqTriggerOrchestrator orchestrator;
    private final CommitInfoFetcher commitInfoFetcher;
    private final UrlProvider urlProvider;

    public WebhookTriggerService(PullReqTriggerOrchestrator orchestrator,
                                 CommitInfoFetcher commitInfoFetcher,
                                 UrlProvider urlProvider) {
        this.orchestrator = orchestrator;
        this.commitInfoFetcher = commitInfoFetcher;
        this.urlProvider = urlProvider;
    }

    public void handlePullReqCreated(Event<CreatedPayload> event) {
        CreatedPayload payload = event.payload();
        WebhookTrigger trigger = WebhookTrigger.PULLREQ_CREATED;
        orchestrator.trigger(trigger, event.id(), payload.principalId(), payload.pullReqId(),
                (principal, pr, targetRepo, sourceRepo) -> {
                    Segments s = segments(trigger, principal, pr, targetRepo, sourceRepo, payload.sourceSha());
                    return new PullReqCreatedPayload(s.base(), s.pullReq(), s.targetRef(), s.ref(), s.details());
                });
    }

    public void handlePullReqReopened(Event<ReopenedPayload> event) {
        ReopenedPayload payload = event.payload();
        WebhookTrigger trigger = WebhookTrigger.PULLREQ_REOPENED;
        orchestrator.trigger(trigger, event.id(), payload.principalId(), payload.pullReqId(),
                (principal, pr, targetRepo, sourceRepo) -> {
                    Segments s = segments(trigger, principal, pr, targetRepo, sourceRepo, payload.sourceSha());
                    return new PullReqReopenedPayload(s.base(), s.pullReq(), s.targetRef(), s.ref(), s.details());
                });
    }

    /**
     * Details describe the new head; the replaced head and the forced flag go into the
     * update segment.
     */
    public void handlePullReqBranchUpdated(Event<BranchUpdatedPayload> event) {
        BranchUpdatedPayload payload = event.payload();
        WebhookTrigger trigger = WebhookTrigger.PULLREQ_BRANCH_UPDATED;
        orchestrator.trigger(trigger, event.id(), payload.principalId(), payload.pullReqId(),
                (principal, pr, targetRepo, sourceRepo) -> {
                    Segments s = segments(trigger, principal, pr, targetRepo, sourceRepo, payload.newSha());
                    return new PullReqBranchUpdatedPayload(s.base(), s.pullReq(), s.targetRef(), s.ref(), s.details(),
                            new ReferenceUpdateSegment(payload.oldSha(), payload.forced()));
                });
    }

    public void handlePullReqClosed(Event<ClosedPayload> event) {
        ClosedPayload payload = event.payload();
        WebhookTrigger trigger = WebhookTrigger.PULLREQ_CLOSED;
        orchestrator.trigger(trigger, event.id(), payload.principalId(), payload.pullReqId(),
                (principal, pr, targetRepo, sourceRepo) -> {
                    Segments s = segments(trigger, principal, pr, targetRepo, sourceRepo, payload.sourceSha());
                    return new PullReqClosedPayload(s.base(), s.pullReq(), s.targetRef(), s.ref(), s.details());
                });
    }

    public void handlePullReqMerged(Event<MergedPayload> event) {
        MergedPayload payload = event.payload();
        WebhookTrigger trigger = WebhookTrigger.PULLREQ_MERGED;
        orchestrator.trigger(trigger, event.id(), payload.principalId(), payload.pullReqId(),
                (principal, pr, targetRepo, sourceRepo) -> {
                    Segments s = segments(trigger, principal, pr, targetRepo, sourceRepo, payload.sourceSha());
                    return new PullReqMergedPayload(s.base(), s.pullReq(), s.targetRef(), s.ref(), s.details());
                });
    }

    // ── Internal ───────────────────────────────────────────────────

    /**
     * Segments shared by every pull-request payload. Branches and the commit are checked
     * first so a gap in the stored data aborts before anything is projected.
     */
    private Segments segments(WebhookTrigger trigger, Principal principal, PullReq pr,
                              Repository targetRepo, Repository sourceRepo, String sha) {
        requireBranch(pr, pr.sourceBranch(), "source");
        requireBranch(pr, pr.targetBranch(), "target");
        CommitInfo commit = commitInfoFetcher.fetch(sourceRepo.gitUid(), sha);
        RepositoryInfo targetRepoInfo = RepositoryInfo.from(targetRepo, urlProvider);
        RepositoryInfo sourceRepoInfo = RepositoryInfo.from(sourceRepo, urlProvider);

        return new Segments(
                new BaseSegment(trigger, targetRepoInfo, PrincipalInfo.from(principal)),
                new PullReqSegment(PullReqInfo.from(pr)),
                new TargetReferenceSegment(ReferenceInfo.branch(pr.targetBranch(), targetRepoInfo)),
                new ReferenceSegment(ReferenceInfo.branch(pr.sourceBranch(), sourceRepoInfo)),
                new ReferenceDetailsSegment(sha, commit));
    }

    private static void requireBranch(PullReq pr, String branch, String side) {
        if (branch == null || branch.isEmpty()) {
            throw DiscardEventException.of("pull request with id '%d' has no %s branch", pr.id(), side);
        }
    }

    private record Segments(BaseSegment base, PullReqSegment pullReq, TargetReferenceSegment targetRef,
                            ReferenceSegment ref, ReferenceDetailsSegment details) {}
}
