package dev.refhook.domain.event.pullreq;

/**
 * Fields shared by every pull-request lifecycle event.
 */
public sealed interface PullReqEventPayload
        permits CreatedPayload, ReopenedPayload, BranchUpdatedPayload, ClosedPayload, MergedPayload {

    long pullReqId();

    long principalId();
}
