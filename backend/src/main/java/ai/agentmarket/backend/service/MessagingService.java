package ai.agentmarket.backend.service;

import ai.agentmarket.backend.event.MarketplaceEvent;
import ai.agentmarket.backend.event.MarketplaceEventType;
import ai.agentmarket.backend.model.dto.SendMessageRequest;
import ai.agentmarket.backend.model.entity.ChatMessage;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerView;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.store.SequenceGenerator;
import ai.agentmarket.backend.util.Inputs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Job-scoped messages between participants: the client, the assigned agent and every bidder.
 */
@Slf4j
@Service
public class MessagingService {

    static final String MESSAGE_SEQUENCE = "message";
    static final int MAX_CONTENT_LENGTH = 4000;

    private final LedgerStore ledgerStore;
    private final LedgerCommitter committer;
    private final SequenceGenerator sequenceGenerator;
    private final Clock clock;

    public MessagingService(LedgerStore ledgerStore, LedgerCommitter committer, SequenceGenerator sequenceGenerator, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.committer = committer;
        this.sequenceGenerator = sequenceGenerator;
        this.clock = clock;
    }

    /**
     * @return the message id
     */
    public long sendMessage(CallerIdentity caller, long jobId, SendMessageRequest request) {
        String content = Inputs.requireText(request.getContent(), "Content", MAX_CONTENT_LENGTH);
        String recipient = Inputs.requireText(request.getRecipient(), "Recipient");

        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, jobId);
        if (!isParticipant(ledgerStore, job, caller.getId())) {
            throw MarketplaceException.unauthorized("Only participants of job " + jobId + " can send messages");
        }
        if (caller.is(recipient) || !isParticipant(ledgerStore, job, recipient)) {
            throw MarketplaceException.unauthorized("Recipient must be another participant of job " + jobId);
        }

        Instant now = clock.instant();
        long messageId = sequenceGenerator.next(MESSAGE_SEQUENCE);
        ChatMessage message = ChatMessage.builder()
                .id(messageId)
                .jobId(jobId)
                .sender(caller.getId())
                .recipient(recipient)
                .content(content)
                .timestamp(now)
                .read(false)
                .build();

        committer.commit("send_message", new LedgerTransaction()
                .save(message)
                .publish(MarketplaceEvent.of(MarketplaceEventType.MESSAGE_SENT, jobId, caller.getId(), recipient, null, now)));
        log.debug("Message {} sent on job {}", messageId, jobId);
        return messageId;
    }

    /**
     * Marks every unread message addressed to the caller in the job as read, in one commit.
     *
     * @return how many messages were marked
     */
    public int markMessagesRead(CallerIdentity caller, long jobId) {
        JobLedgerServiceImpl.requireJob(ledgerStore, jobId);

        List<ChatMessage> unread = ledgerStore.messages(jobId).stream()
                .filter(m -> caller.is(m.getRecipient()) && !m.isRead())
                .collect(Collectors.toList());
        if (unread.isEmpty()) {
            return 0;
        }

        LedgerTransaction transaction = new LedgerTransaction();
        for (ChatMessage message : unread) {
            message.setRead(true);
            transaction.save(message);
        }
        committer.commit("mark_messages_read", transaction);
        log.debug("Marked {} message(s) read on job {} for {}", unread.size(), jobId, caller.getId());
        return unread.size();
    }

    static boolean isParticipant(LedgerView ledger, Job job, String user) {
        if (user == null) {
            return false;
        }
        return job.isClient(user) || job.isAssignedAgent(user) || ledger.bid(job.getId(), user).isPresent();
    }
}
