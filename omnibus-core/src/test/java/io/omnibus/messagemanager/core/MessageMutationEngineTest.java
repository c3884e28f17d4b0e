package io.omnibus.messagemanager.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.omnibus.messagemanager.api.AmbiguousMessageIdException;
import io.omnibus.messagemanager.api.BrokerIOException;
import io.omnibus.messagemanager.api.BrokerMessage;
import io.omnibus.messagemanager.api.BulkResult;
import io.omnibus.messagemanager.api.BulkResult.FailureReason;
import io.omnibus.messagemanager.api.DataLossRiskException;
import io.omnibus.messagemanager.api.MessageNotFoundException;
import io.omnibus.messagemanager.api.MessageOperationException;
import io.omnibus.messagemanager.api.PurgeResult;
import io.omnibus.messagemanager.core.InMemoryBrokerTransport.Capability;
import io.omnibus.messagemanager.core.InMemoryBrokerTransport.PublishOutcome;

/**
 * Tests the drain, classify and republish protocol against {@link InMemoryBrokerTransport}. Kept messages are
 * republished by a single thread, so that queue order is deterministic.
 */
public class MessageMutationEngineTest {
    private ExecutorService _republisher;

    @Before
    public void createRepublisher() {
        _republisher = Executors.newSingleThreadExecutor();
    }

    @After
    public void shutdownRepublisher() {
        _republisher.shutdownNow();
    }

    private MessageMutationEngine engine(MutationSettings settings) {
        return MessageMutationEngine.create(MessageProjection.create(), new MessageBodyEncoder(new ObjectMapper()),
                settings, _republisher);
    }

    private MessageMutationEngine engine() {
        return engine(MutationSettings.defaults());
    }

    // ===== Delete and move

    @Test
    public void deleteOne_removesOnlyTheTarget() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");

        engine().deleteOne(transport, "orders", "b");

        Assert.assertEquals(Arrays.asList("a", "c"), transport.ids("orders"));
    }

    @Test
    public void deleteOne_unknownId_throwsNotFoundAndLeavesQueueIntact() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");

        try {
            engine().deleteOne(transport, "orders", "zzz");
            Assert.fail("Should have thrown MessageNotFoundException");
        }
        catch (MessageNotFoundException e) {
            Assert.assertEquals("zzz", e.getMessageId());
        }
        Assert.assertEquals(Arrays.asList("a", "b", "c"), transport.ids("orders"));
    }

    @Test
    public void moveOne_putsTargetOnTargetQueue() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");

        engine().moveOne(transport, "orders", "archive", "b");

        Assert.assertEquals(Arrays.asList("a", "c"), transport.ids("orders"));
        Assert.assertEquals(Collections.singletonList("b"), transport.ids("archive"));
        Assert.assertEquals(Collections.singletonList("body of b"), transport.bodies("archive"));
    }

    @Test
    public void moveOne_toSameQueue_isRejected() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a");
        try {
            engine().moveOne(transport, "orders", "orders", "a");
            Assert.fail("Should have thrown IllegalArgumentException");
        }
        catch (IllegalArgumentException e) {
            // expected
        }
        Assert.assertEquals(Collections.singletonList("a"), transport.ids("orders"));
        Assert.assertEquals(0, transport.drainCount());
    }

    @Test
    public void moveMany_reportsMatchedAndMissing() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");
        List<String> settled = new ArrayList<>();

        MutationOutcome outcome = engine().moveMany(transport, "orders", "archive", Arrays.asList("c", "x", "a"),
                settled::add);

        Assert.assertEquals(new HashSet<>(Arrays.asList("a", "c")), new HashSet<>(outcome.getMatchedIds()));
        Assert.assertEquals(Collections.singletonList("x"), outcome.getMissingIds());
        Assert.assertEquals(new HashSet<>(Arrays.asList("a", "c")), new HashSet<>(settled));
        Assert.assertEquals(Collections.singletonList("b"), transport.ids("orders"));
        Assert.assertEquals(Arrays.asList("a", "c"), transport.ids("archive"));
    }

    // ===== Failure handling

    @Test
    public void move_targetPublishFails_targetIsRestoredToSource() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");
        transport.setPublishFault((queueId, messageId, attempt) -> "archive".equals(queueId)
                ? PublishOutcome.FAIL
                : PublishOutcome.OK);

        try {
            engine().moveOne(transport, "orders", "archive", "b");
            Assert.fail("Should have thrown BrokerIOException");
        }
        catch (BrokerIOException e) {
            Assert.assertTrue(e.getMessage().contains("archive"));
        }
        // Keeps first, then the restored target.
        Assert.assertEquals(Arrays.asList("a", "c", "b"), transport.ids("orders"));
        Assert.assertTrue(transport.ids("archive").isEmpty());
    }

    @Test
    public void haltedBeforeRepublishing_everythingIsRestored() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");
        MessageMutationEngine engine = engine();
        List<OperationPhase> phases = new ArrayList<>();
        engine.setPhaseListener((operation, queueId, round, phase) -> {
            phases.add(phase);
            if (phase == OperationPhase.REPUBLISHING) {
                throw new IllegalStateException("Halt!");
            }
        });

        try {
            engine.deleteOne(transport, "orders", "b");
            Assert.fail("Should have thrown");
        }
        catch (IllegalStateException e) {
            Assert.assertEquals("Halt!", e.getMessage());
        }
        Assert.assertEquals(Arrays.asList("a", "b", "c"), transport.ids("orders"));
        Assert.assertEquals(Arrays.asList(OperationPhase.DRAINING, OperationPhase.CLASSIFYING,
                OperationPhase.REPUBLISHING, OperationPhase.ABORTED), phases);
    }

    @Test
    public void keepCannotBePublishedAnywhere_dataLossRiskListsIt() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");
        transport.setPublishFault((queueId, messageId, attempt) -> "a".equals(messageId)
                ? PublishOutcome.FAIL
                : PublishOutcome.OK);

        try {
            engine().deleteOne(transport, "orders", "b");
            Assert.fail("Should have thrown DataLossRiskException");
        }
        catch (DataLossRiskException e) {
            Assert.assertEquals("orders", e.getQueueId());
            Assert.assertEquals(1, e.getAffectedMessages().size());
            Assert.assertEquals("a", e.getAffectedMessages().get(0).getMessageId());
            Assert.assertEquals("orders", e.getAffectedMessages().get(0).getIntendedQueueId());
            Assert.assertEquals("body of a", e.getAffectedMessages().get(0).getBodyAsString());
            Assert.assertFalse(e.getPartialResult().isPresent());
        }
        // c was confirmed as keep, b was restored since the operation failed before deleting it.
        Assert.assertEquals(new HashSet<>(Arrays.asList("b", "c")), new HashSet<>(transport.ids("orders")));
    }

    @Test
    public void missingReceipt_isRetriedWithFreshReceipt() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");
        transport.setPublishFault((queueId, messageId, attempt) -> "a".equals(messageId) && attempt == 1
                ? PublishOutcome.NO_RECEIPT
                : PublishOutcome.OK);

        engine().deleteOne(transport, "orders", "b");

        Assert.assertEquals(Arrays.asList("a", "c"), transport.ids("orders"));
        Assert.assertEquals(2, transport.publishAttempts("orders", "a"));
    }

    @Test
    public void missingReceiptOfAdmittedMessage_givesDuplicateNotLoss() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b");
        transport.setPublishFault((queueId, messageId, attempt) -> "a".equals(messageId) && attempt == 1
                ? PublishOutcome.ADMITTED_NO_RECEIPT
                : PublishOutcome.OK);

        engine().deleteOne(transport, "orders", "b");

        Assert.assertEquals(Arrays.asList("a", "a"), transport.ids("orders"));
    }

    @Test
    public void receiptNeverArrives_operationAbortsAndRestores() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b");
        MutationSettings settings = MutationSettings.builder().receiptRetries(1).build();
        transport.setPublishFault((queueId, messageId, attempt) -> "archive".equals(queueId)
                ? PublishOutcome.NO_RECEIPT
                : PublishOutcome.OK);

        try {
            engine(settings).moveOne(transport, "orders", "archive", "b");
            Assert.fail("Should have thrown");
        }
        catch (BrokerIOException e) {
            // expected: ReceiptTimeoutException after 2 attempts
        }
        Assert.assertEquals(2, transport.publishAttempts("archive", "b"));
        Assert.assertEquals(Arrays.asList("a", "b"), transport.ids("orders"));
    }

    // ===== Duplicate ids

    private InMemoryBrokerTransport withDuplicateB() {
        return InMemoryBrokerTransport.create()
                .addMessage("orders", "a", "A")
                .addMessage("orders", "b", "first B")
                .addMessage("orders", "b", "second B")
                .addMessage("orders", "c", "C");
    }

    @Test
    public void duplicateIds_firstOccurrence() {
        InMemoryBrokerTransport transport = withDuplicateB();

        engine().deleteOne(transport, "orders", "b");

        Assert.assertEquals(Arrays.asList("A", "second B", "C"), transport.bodies("orders"));
    }

    @Test
    public void duplicateIds_lastOccurrence() {
        InMemoryBrokerTransport transport = withDuplicateB();

        engine(MutationSettings.builder().duplicateIdPolicy(DuplicateIdPolicy.LAST_OCCURRENCE).build())
                .deleteOne(transport, "orders", "b");

        Assert.assertEquals(Arrays.asList("A", "first B", "C"), transport.bodies("orders"));
    }

    @Test
    public void duplicateIds_abort() {
        InMemoryBrokerTransport transport = withDuplicateB();

        try {
            engine(MutationSettings.builder().duplicateIdPolicy(DuplicateIdPolicy.ABORT).build())
                    .deleteOne(transport, "orders", "b");
            Assert.fail("Should have thrown AmbiguousMessageIdException");
        }
        catch (AmbiguousMessageIdException e) {
            Assert.assertEquals(2, e.getOccurrences());
        }
        Assert.assertEquals(Arrays.asList("A", "first B", "second B", "C"), transport.bodies("orders"));
    }

    // ===== Deep queues and interrupts

    @Test
    public void targetBeyondFirstBatch_isFoundInLaterRound() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create();
        for (int i = 0; i < 2500; i++) {
            transport.addMessage("orders", "m" + i, "body " + i);
        }

        engine().deleteOne(transport, "orders", "m2200");

        List<String> ids = transport.ids("orders");
        Assert.assertEquals(2499, ids.size());
        Assert.assertFalse(ids.contains("m2200"));
        Assert.assertEquals(2499, new HashSet<>(ids).size());
        Assert.assertEquals(3, transport.drainCount());
    }

    @Test
    public void idOnNoMessage_scansWholeDeepQueueOnceAndStops() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create();
        for (int i = 0; i < 2500; i++) {
            transport.addMessage("orders", "m" + i, "body " + i);
        }

        MutationOutcome outcome = engine().deleteMany(transport, "orders", Collections.singletonList("nope"));

        Assert.assertEquals(Collections.singletonList("nope"), outcome.getMissingIds());
        Assert.assertEquals(2500, transport.ids("orders").size());
        Assert.assertEquals(3, transport.drainCount());
    }

    @Test
    public void maxDrainRounds_boundsTheScan() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create();
        for (int i = 0; i < 50; i++) {
            transport.addMessage("orders", "m" + i, "body " + i);
        }
        MutationSettings settings = MutationSettings.builder().drainBatchSize(10).maxDrainRounds(2).build();

        MutationOutcome outcome = engine(settings).deleteMany(transport, "orders", Collections.singletonList("m45"));

        Assert.assertEquals(Collections.singletonList("m45"), outcome.getMissingIds());
        Assert.assertEquals(2, transport.drainCount());
        Assert.assertEquals(50, transport.ids("orders").size());
    }

    @Test
    public void interruptAfterDrain_isDeferredUntilOperationIsDone() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");
        MessageMutationEngine engine = engine();
        engine.setPhaseListener((operation, queueId, round, phase) -> {
            if (phase == OperationPhase.CLASSIFYING) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            engine.deleteOne(transport, "orders", "b");
            Assert.assertTrue("Interrupt flag should be set again", Thread.currentThread().isInterrupted());
        }
        finally {
            // Clear, so that the flag does not leak into other tests.
            Thread.interrupted();
        }
        Assert.assertEquals(Arrays.asList("a", "c"), transport.ids("orders"));
    }

    @Test
    public void interruptBeforeDrain_drainsNothing() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b");

        Thread.currentThread().interrupt();
        try {
            engine().deleteOne(transport, "orders", "b");
            Assert.fail("Should have thrown MessageOperationException");
        }
        catch (MessageOperationException e) {
            Assert.assertTrue(e.getMessage().contains("Interrupted"));
        }
        finally {
            Thread.interrupted();
        }
        Assert.assertEquals(0, transport.drainCount());
        Assert.assertEquals(Arrays.asList("a", "b"), transport.ids("orders"));
    }

    // ===== Read, purge, import, export

    @Test
    public void readMessages_byDrainAndPublishBack_leavesQueueIntact() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");

        List<BrokerMessage> messages = engine().readMessages(transport, "orders", 2);

        Assert.assertEquals(2, messages.size());
        Assert.assertEquals("a", messages.get(0).getId());
        Assert.assertEquals("b", messages.get(1).getId());
        Assert.assertEquals(new HashSet<>(Arrays.asList("a", "b", "c")), new HashSet<>(transport.ids("orders")));
    }

    @Test
    public void readMessages_byPeek_drainsNothing() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create(Capability.PEEK)
                .addMessages("orders", "a", "b", "c");

        List<BrokerMessage> messages = engine().readMessages(transport, "orders", 10);

        Assert.assertEquals(3, messages.size());
        Assert.assertEquals(0, transport.drainCount());
    }

    @Test
    public void purge_byDrainAndDiscard() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create();
        for (int i = 0; i < 50; i++) {
            transport.addMessage("orders", "m" + i, "body " + i);
        }

        PurgeResult result = engine(MutationSettings.builder().drainBatchSize(20).build()).purge(transport,
                "orders");

        Assert.assertEquals(50, result.getRemovedCount());
        Assert.assertEquals(0, transport.queueDepth("orders"));
        // 20 + 20 + 10, then the empty drain which ends it.
        Assert.assertEquals(4, transport.drainCount());
    }

    @Test
    public void purge_usesNativePurgeWhenPresent() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create(Capability.NATIVE_PURGE);
        for (int i = 0; i < 50; i++) {
            transport.addMessage("orders", "m" + i, "body " + i);
        }

        PurgeResult result = engine().purge(transport, "orders");

        Assert.assertEquals(50, result.getRemovedCount());
        Assert.assertEquals(0, transport.queueDepth("orders"));
        Assert.assertEquals(0, transport.drainCount());
    }

    @Test
    public void purge_stopsAtIterationCap() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create();
        for (int i = 0; i < 50; i++) {
            transport.addMessage("orders", "m" + i, "body " + i);
        }

        PurgeResult result = engine(MutationSettings.builder().drainBatchSize(10).purgeMaxIterations(3).build())
                .purge(transport, "orders");

        Assert.assertEquals(30, result.getRemovedCount());
        Assert.assertEquals(20, transport.queueDepth("orders"));
    }

    @Test
    public void importMessages_badBodyIsRecordedAndRestContinues() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create();
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("orderId", 42);

        BulkResult result = engine().importMessages(transport, "orders",
                Arrays.asList(order, "plain text", new Object(), "{\"x\":1}"));

        Assert.assertEquals(3, result.getSuccessCount());
        Assert.assertEquals(1, result.getFailCount());
        Assert.assertEquals(2, result.getFailures().get(0).getIndex());
        Assert.assertEquals(FailureReason.PUBLISH_FAILED, result.getFailures().get(0).getReason());
        Assert.assertEquals(Arrays.asList("{\"orderId\":42}", "plain text", "{\"x\":1}"), transport.bodies("orders"));
    }

    @Test
    public void exportMessages_byPeek_inQueueOrder() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create(Capability.PEEK)
                .addMessages("orders", "a", "b", "c");

        List<BrokerMessage> exported = engine().exportMessages(transport, "orders", Arrays.asList("c", "a"));

        Assert.assertEquals(2, exported.size());
        Assert.assertEquals("a", exported.get(0).getId());
        Assert.assertEquals("c", exported.get(1).getId());
        Assert.assertEquals(0, transport.drainCount());
    }

    @Test
    public void exportMessages_allWithoutPeek_leavesQueueIntact() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create().addMessages("orders", "a", "b", "c");

        List<BrokerMessage> exported = engine().exportMessages(transport, "orders", Collections.emptyList());

        Assert.assertEquals(3, exported.size());
        Assert.assertEquals(Arrays.asList("a", "b", "c"), transport.ids("orders"));
    }

    @Test
    public void send_nullBody_isRejected() {
        InMemoryBrokerTransport transport = InMemoryBrokerTransport.create();
        try {
            engine().send(transport, "orders", null);
            Assert.fail("Should have thrown IllegalArgumentException");
        }
        catch (IllegalArgumentException e) {
            // expected
        }
        Assert.assertTrue(transport.ids("orders").isEmpty());
    }

    @Test
    public void carriedHeaders_dropReservedOnes() {
        Map<String, Object> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "text/plain");
        headers.put("message-id", "x");
        headers.put("traceId", "abc");

        Assert.assertEquals(Collections.singletonMap("traceId", "abc"),
                MessageMutationEngine.carriedHeaders(headers));
    }
}
